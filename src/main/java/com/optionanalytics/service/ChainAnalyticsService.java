package com.optionanalytics.service;

import com.optionanalytics.core.pricing.PricingModel;
import com.optionanalytics.core.pricing.PricingModelSelector;
import com.optionanalytics.core.processor.ImpliedVolatilitySolver;
import com.optionanalytics.domain.InputChecks;
import com.optionanalytics.domain.enums.PricingModelType;
import com.optionanalytics.domain.model.ContractAnalytics;
import com.optionanalytics.domain.model.ImpliedVolatilityResult;
import com.optionanalytics.domain.model.OptionQuote;
import com.optionanalytics.domain.model.PricingResult;
import com.optionanalytics.observability.AnalyticsMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Solves implied volatility for a whole option chain and, for every quote that converged,
 * prices the contract back at its implied volatility with Greeks.
 *
 * <p>Each quote is an independent unit of work on the {@code analyticsExecutor} pool. The
 * engine components are stateless, so units share the solver and model instances freely.
 * Non-convergence stays inside the unit's result; invalid input fails the whole batch.
 *
 * <p>Model selection per quote: an explicit {@link PricingModelType} applies to every quote,
 * otherwise European contracts use the closed form and American contracts the lattice.
 */
@Slf4j
@Service
public class ChainAnalyticsService {

    private final ImpliedVolatilitySolver solver;
    private final PricingModelSelector modelSelector;
    private final AnalyticsMetrics metrics;
    private final Executor executor;

    public ChainAnalyticsService(
            ImpliedVolatilitySolver solver,
            PricingModelSelector modelSelector,
            AnalyticsMetrics metrics,
            @Qualifier("analyticsExecutor") Executor executor) {
        this.solver = solver;
        this.modelSelector = modelSelector;
        this.metrics = metrics;
        this.executor = executor;
    }

    /** Runs the batch and waits for it. Results are in input order. */
    public List<ContractAnalytics> analyze(List<OptionQuote> quotes, PricingModelType modelType, Integer steps) {
        return submit(quotes, modelType, steps).join();
    }

    /**
     * Schedules the batch and returns immediately.
     *
     * @param modelType model for every quote, or null to choose by exercise style
     * @param steps     lattice step count, or null for the configured default
     */
    public ChainAnalyticsJob submit(List<OptionQuote> quotes, PricingModelType modelType, Integer steps) {
        InputChecks.requirePresent("quotes", quotes);
        long start = System.nanoTime();
        List<CompletableFuture<ContractAnalytics>> units = new ArrayList<>(quotes.size());
        for (OptionQuote quote : quotes) {
            InputChecks.requirePresent("quote", quote);
            units.add(CompletableFuture.supplyAsync(() -> analyzeQuote(quote, modelType, steps), executor));
        }
        log.debug("Submitted chain batch of {} quotes (model={}, steps={})", quotes.size(), modelType, steps);
        return new ChainAnalyticsJob(units, metrics, start);
    }

    /** One unit of work: solve, then re-price at the implied volatility when converged. */
    ContractAnalytics analyzeQuote(OptionQuote quote, PricingModelType modelType, Integer steps) {
        PricingModel model = modelSelector.select(modelType, steps, quote.getContract());
        ImpliedVolatilityResult solve = solver.solve(quote, model);
        metrics.recordSolve(solve);

        if (!solve.isConverged()) {
            return ContractAnalytics.builder().impliedVolatility(solve).build();
        }

        PricingResult repriced = model.evaluate(quote.getContract(), quote.getMarket(), solve.getVolatility(), true);
        return ContractAnalytics.builder()
                .impliedVolatility(solve)
                .greeks(repriced.getGreeks())
                .modelPrice(repriced.getPrice())
                .pricingError(repriced.getPrice() - quote.getMarketPrice())
                .build();
    }
}
