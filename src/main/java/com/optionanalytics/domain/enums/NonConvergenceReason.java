package com.optionanalytics.domain.enums;

/**
 * Why an implied volatility solve did not converge. A non-converged result is still a
 * valid value: it carries the best volatility found and its residual.
 */
public enum NonConvergenceReason {
    /** Iteration budget exhausted before either tolerance was met. */
    ITERATION_LIMIT,

    /** Observed price is below the model price at the minimum volatility (e.g. below intrinsic). */
    PRICE_BELOW_RANGE,

    /** Observed price is above the model price at the maximum volatility. */
    PRICE_ABOVE_RANGE
}
