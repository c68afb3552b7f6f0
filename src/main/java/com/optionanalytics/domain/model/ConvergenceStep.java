package com.optionanalytics.domain.model;

import lombok.Value;

/**
 * Lattice price at one step count compared with the closed-form reference.
 */
@Value
public class ConvergenceStep {

    int steps;

    double latticePrice;

    /** latticePrice - referencePrice. */
    double error;

    long elapsedMicros;
}
