package com.optionanalytics.domain.enums;

/**
 * Root-finding strategy that produced an implied volatility result.
 */
public enum SolverMethod {
    NEWTON_RAPHSON,
    BISECTION
}
