package com.optionanalytics.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * European lattice prices at increasing step counts against the Black-Scholes-Merton price
 * of the same contract. Steps are listed in the order they were requested.
 */
@Value
@Builder
public class ConvergenceReport {

    OptionContractSpec contract;

    MarketState market;

    double volatility;

    /** Closed-form Black-Scholes-Merton price. */
    double referencePrice;

    List<ConvergenceStep> steps;

    /** Absolute error at the last requested step count. */
    public double getFinalAbsoluteError() {
        return steps.isEmpty() ? Double.NaN : Math.abs(steps.get(steps.size() - 1).getError());
    }
}
