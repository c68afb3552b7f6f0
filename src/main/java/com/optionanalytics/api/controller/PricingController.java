package com.optionanalytics.api.controller;

import com.optionanalytics.api.dto.request.ConvergenceRequest;
import com.optionanalytics.api.dto.request.EarlyExerciseRequest;
import com.optionanalytics.api.dto.request.ImpliedVolatilityRequest;
import com.optionanalytics.api.dto.request.PriceRequest;
import com.optionanalytics.calendar.TimeToExpiryCalculator;
import com.optionanalytics.config.SolverConfig;
import com.optionanalytics.core.pricing.PricingModel;
import com.optionanalytics.core.pricing.PricingModelSelector;
import com.optionanalytics.core.processor.ImpliedVolatilitySolver;
import com.optionanalytics.core.processor.LatticeConvergenceAnalyzer;
import com.optionanalytics.domain.model.ConvergenceReport;
import com.optionanalytics.domain.model.EarlyExerciseComparison;
import com.optionanalytics.domain.model.ImpliedVolatilityResult;
import com.optionanalytics.domain.model.MarketState;
import com.optionanalytics.domain.model.OptionContractSpec;
import com.optionanalytics.domain.model.OptionQuote;
import com.optionanalytics.domain.model.PricingResult;
import com.optionanalytics.mapper.OptionQuoteMapper;
import com.optionanalytics.observability.AnalyticsMetrics;
import jakarta.validation.Valid;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Single-contract pricing endpoints.
 *
 * <ul>
 *   <li>POST /api/pricing/price: price and Greeks at a given volatility
 *   <li>POST /api/pricing/implied-volatility: invert one quote
 *   <li>POST /api/pricing/convergence: lattice vs closed form over a step schedule
 *   <li>POST /api/pricing/early-exercise: American vs European on the lattice
 * </ul>
 *
 * <p>A non-converged solve is a 200 with {@code converged = false}, not an error.
 */
@RestController
@RequestMapping("/api/pricing")
public class PricingController {

    private final PricingModelSelector modelSelector;
    private final ImpliedVolatilitySolver solver;
    private final LatticeConvergenceAnalyzer convergenceAnalyzer;
    private final TimeToExpiryCalculator timeToExpiryCalculator;
    private final SolverConfig solverConfig;
    private final AnalyticsMetrics metrics;
    private final OptionQuoteMapper quoteMapper = Mappers.getMapper(OptionQuoteMapper.class);

    public PricingController(
            PricingModelSelector modelSelector,
            ImpliedVolatilitySolver solver,
            LatticeConvergenceAnalyzer convergenceAnalyzer,
            TimeToExpiryCalculator timeToExpiryCalculator,
            SolverConfig solverConfig,
            AnalyticsMetrics metrics) {
        this.modelSelector = modelSelector;
        this.solver = solver;
        this.convergenceAnalyzer = convergenceAnalyzer;
        this.timeToExpiryCalculator = timeToExpiryCalculator;
        this.solverConfig = solverConfig;
        this.metrics = metrics;
    }

    @PostMapping("/price")
    public ResponseEntity<PricingResult> price(@Valid @RequestBody PriceRequest request) {
        MarketState market = quoteMapper.toMarket(request.getMarket());
        OptionContractSpec contract =
                quoteMapper.toContract(request.getContract(), market.getValuationTime(), timeToExpiryCalculator);
        PricingModel model = modelSelector.select(request.getModel(), request.getSteps(), contract);

        boolean includeGreeks = !Boolean.FALSE.equals(request.getIncludeGreeks());
        return ResponseEntity.ok(model.evaluate(contract, market, request.getVolatility(), includeGreeks));
    }

    @PostMapping("/implied-volatility")
    public ResponseEntity<ImpliedVolatilityResult> impliedVolatility(
            @Valid @RequestBody ImpliedVolatilityRequest request) {
        OptionQuote quote = quoteMapper.toQuote(request.getQuote(), timeToExpiryCalculator);
        PricingModel model = modelSelector.select(request.getModel(), request.getSteps(), quote.getContract());

        ImpliedVolatilityResult result = solver.solve(
                quote,
                model,
                request.getInitialGuess() != null ? request.getInitialGuess() : solverConfig.getInitialGuess(),
                request.getTolerance() != null ? request.getTolerance() : solverConfig.getPriceTolerance(),
                request.getMaxIterations() != null ? request.getMaxIterations() : solverConfig.getMaxIterations());
        metrics.recordSolve(result);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/convergence")
    public ResponseEntity<ConvergenceReport> convergence(@Valid @RequestBody ConvergenceRequest request) {
        MarketState market = quoteMapper.toMarket(request.getMarket());
        OptionContractSpec contract =
                quoteMapper.toContract(request.getContract(), market.getValuationTime(), timeToExpiryCalculator);
        return ResponseEntity.ok(
                convergenceAnalyzer.analyze(contract, market, request.getVolatility(), request.getSteps()));
    }

    @PostMapping("/early-exercise")
    public ResponseEntity<EarlyExerciseComparison> earlyExercise(@Valid @RequestBody EarlyExerciseRequest request) {
        MarketState market = quoteMapper.toMarket(request.getMarket());
        OptionContractSpec contract =
                quoteMapper.toContract(request.getContract(), market.getValuationTime(), timeToExpiryCalculator);
        return ResponseEntity.ok(convergenceAnalyzer.compareEarlyExercise(
                contract, market, request.getVolatility(), request.getSteps()));
    }
}
