package com.optionanalytics.core.processor;

import com.optionanalytics.config.LatticeConfig;
import com.optionanalytics.core.pricing.BinomialLatticeModel;
import com.optionanalytics.core.pricing.PricingModelSelector;
import com.optionanalytics.domain.InputChecks;
import com.optionanalytics.domain.enums.ExerciseStyle;
import com.optionanalytics.domain.model.ConvergenceReport;
import com.optionanalytics.domain.model.ConvergenceStep;
import com.optionanalytics.domain.model.EarlyExerciseComparison;
import com.optionanalytics.domain.model.MarketState;
import com.optionanalytics.domain.model.OptionContractSpec;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Diagnostics for the binomial lattice: how fast European lattice prices approach the closed
 * form as the step count grows, and how much the early-exercise right is worth.
 */
@Slf4j
@Component
public class LatticeConvergenceAnalyzer {

    private final PricingModelSelector modelSelector;
    private final LatticeConfig latticeConfig;

    public LatticeConvergenceAnalyzer(PricingModelSelector modelSelector, LatticeConfig latticeConfig) {
        this.modelSelector = modelSelector;
        this.latticeConfig = latticeConfig;
    }

    /**
     * Prices the European version of {@code contract} on lattices of each requested size.
     *
     * @param stepCounts step counts in report order, or null/empty for the configured schedule
     */
    public ConvergenceReport analyze(
            OptionContractSpec contract, MarketState market, double volatility, List<Integer> stepCounts) {
        InputChecks.requirePresent("contract", contract);
        InputChecks.requirePresent("market", market);
        OptionContractSpec european = contract.toBuilder().exerciseStyle(ExerciseStyle.EUROPEAN).build();
        List<Integer> schedule =
                stepCounts == null || stepCounts.isEmpty() ? latticeConfig.getConvergenceSteps() : stepCounts;

        double reference = modelSelector.closedForm().price(european, market, volatility);
        List<ConvergenceStep> steps = new ArrayList<>(schedule.size());
        for (Integer n : schedule) {
            BinomialLatticeModel lattice = modelSelector.lattice(n);
            long start = System.nanoTime();
            double price = lattice.price(european, market, volatility);
            long elapsedMicros = (System.nanoTime() - start) / 1_000L;
            steps.add(new ConvergenceStep(n, price, price - reference, elapsedMicros));
        }

        log.debug(
                "Convergence for K={}, T={}, sigma={}: reference={}, {} step counts",
                european.getStrike(),
                european.getTimeToExpiry(),
                volatility,
                reference,
                steps.size());
        return ConvergenceReport.builder()
                .contract(european)
                .market(market)
                .volatility(volatility)
                .referencePrice(reference)
                .steps(List.copyOf(steps))
                .build();
    }

    /** Prices the contract as European and as American on the same lattice. */
    public EarlyExerciseComparison compareEarlyExercise(
            OptionContractSpec contract, MarketState market, double volatility, Integer steps) {
        InputChecks.requirePresent("contract", contract);
        InputChecks.requirePresent("market", market);
        OptionContractSpec european = contract.toBuilder().exerciseStyle(ExerciseStyle.EUROPEAN).build();
        OptionContractSpec american = contract.toBuilder().exerciseStyle(ExerciseStyle.AMERICAN).build();
        BinomialLatticeModel lattice = modelSelector.lattice(steps);

        return EarlyExerciseComparison.builder()
                .contract(american)
                .steps(lattice.getSteps())
                .closedFormEuropeanPrice(modelSelector.closedForm().price(european, market, volatility))
                .latticeEuropeanPrice(lattice.price(european, market, volatility))
                .latticeAmericanPrice(lattice.price(american, market, volatility))
                .build();
    }
}
