package com.optionanalytics.api.controller;

import com.optionanalytics.api.dto.request.ChainAnalyticsRequest;
import com.optionanalytics.api.dto.request.SurfaceRequest;
import com.optionanalytics.api.dto.response.ContractAnalyticsRow;
import com.optionanalytics.calendar.TimeToExpiryCalculator;
import com.optionanalytics.config.SurfaceConfig;
import com.optionanalytics.core.processor.VolatilitySurfaceAggregator;
import com.optionanalytics.domain.model.ContractAnalytics;
import com.optionanalytics.domain.model.ImpliedVolatilityResult;
import com.optionanalytics.domain.model.SurfaceSeries;
import com.optionanalytics.domain.model.TermStructureAnchor;
import com.optionanalytics.exception.InvalidInputException;
import com.optionanalytics.mapper.ContractAnalyticsMapper;
import com.optionanalytics.mapper.OptionQuoteMapper;
import com.optionanalytics.service.ChainAnalyticsService;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Chain-level endpoints: batch solve into flat rows, and volatility smiles and term
 * structures cut from a solved chain.
 */
@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

    private final ChainAnalyticsService chainAnalyticsService;
    private final VolatilitySurfaceAggregator surfaceAggregator;
    private final TimeToExpiryCalculator timeToExpiryCalculator;
    private final SurfaceConfig surfaceConfig;
    private final OptionQuoteMapper quoteMapper = Mappers.getMapper(OptionQuoteMapper.class);
    private final ContractAnalyticsMapper rowMapper = Mappers.getMapper(ContractAnalyticsMapper.class);

    public AnalyticsController(
            ChainAnalyticsService chainAnalyticsService,
            VolatilitySurfaceAggregator surfaceAggregator,
            TimeToExpiryCalculator timeToExpiryCalculator,
            SurfaceConfig surfaceConfig) {
        this.chainAnalyticsService = chainAnalyticsService;
        this.surfaceAggregator = surfaceAggregator;
        this.timeToExpiryCalculator = timeToExpiryCalculator;
        this.surfaceConfig = surfaceConfig;
    }

    @PostMapping("/chain")
    public ResponseEntity<List<ContractAnalyticsRow>> chain(@Valid @RequestBody ChainAnalyticsRequest request) {
        List<ContractAnalytics> analytics = chainAnalyticsService.analyze(
                quoteMapper.toQuotes(request.getQuotes(), timeToExpiryCalculator),
                request.getModel(),
                request.getSteps());
        return ResponseEntity.ok(rowMapper.toRows(analytics));
    }

    @PostMapping("/smile")
    public ResponseEntity<SurfaceSeries> smile(@Valid @RequestBody SurfaceRequest request) {
        if (request.getExpiry() == null) {
            throw InvalidInputException.forField("expiry", null, "expiry is required for a smile");
        }
        return ResponseEntity.ok(surfaceAggregator.buildSmile(
                solve(request), request.getExpiry(), request.getOptionKind(), includeNonConverged(request)));
    }

    @PostMapping("/smiles")
    public ResponseEntity<List<SurfaceSeries>> smiles(@Valid @RequestBody SurfaceRequest request) {
        return ResponseEntity.ok(
                surfaceAggregator.buildSmiles(solve(request), request.getOptionKind(), includeNonConverged(request)));
    }

    @PostMapping("/term-structure")
    public ResponseEntity<SurfaceSeries> termStructure(@Valid @RequestBody SurfaceRequest request) {
        return ResponseEntity.ok(surfaceAggregator.buildTermStructure(
                solve(request), anchorOf(request), request.getOptionKind(), includeNonConverged(request)));
    }

    private List<ImpliedVolatilityResult> solve(SurfaceRequest request) {
        return chainAnalyticsService
                .analyze(
                        quoteMapper.toQuotes(request.getQuotes(), timeToExpiryCalculator),
                        request.getModel(),
                        request.getSteps())
                .stream()
                .map(ContractAnalytics::getImpliedVolatility)
                .toList();
    }

    private boolean includeNonConverged(SurfaceRequest request) {
        return request.getIncludeNonConverged() != null
                ? request.getIncludeNonConverged()
                : surfaceConfig.isIncludeNonConverged();
    }

    private TermStructureAnchor anchorOf(SurfaceRequest request) {
        if (request.getAnchorStrike() != null && request.getAnchorMoneyness() != null) {
            throw new InvalidInputException("Give either anchorStrike or anchorMoneyness, not both");
        }
        if (request.getAnchorStrike() != null) {
            return TermStructureAnchor.strike(request.getAnchorStrike());
        }
        if (request.getAnchorMoneyness() != null) {
            double halfWidth = request.getMoneynessHalfWidth() != null
                    ? request.getMoneynessHalfWidth()
                    : surfaceConfig.getAtmMoneynessHalfWidth();
            return TermStructureAnchor.moneyness(request.getAnchorMoneyness(), halfWidth);
        }
        throw new InvalidInputException("A term structure needs anchorStrike or anchorMoneyness");
    }
}
