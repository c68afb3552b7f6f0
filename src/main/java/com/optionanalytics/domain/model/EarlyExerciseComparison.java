package com.optionanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Value of the early-exercise right for one contract: the same contract priced as European
 * (closed form and lattice) and as American (lattice) with identical inputs.
 */
@Value
@Builder
public class EarlyExerciseComparison {

    OptionContractSpec contract;

    int steps;

    double closedFormEuropeanPrice;

    double latticeEuropeanPrice;

    double latticeAmericanPrice;

    public double getEarlyExercisePremium() {
        return latticeAmericanPrice - latticeEuropeanPrice;
    }
}
