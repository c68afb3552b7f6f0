package com.optionanalytics.domain.enums;

/**
 * Right conveyed by an option contract. Each kind knows its own payoff so pricing
 * code never branches on call/put to compute intrinsic value.
 */
public enum OptionKind {
    CALL {
        @Override
        public double payoff(double underlyingPrice, double strike) {
            return Math.max(underlyingPrice - strike, 0.0);
        }
    },
    PUT {
        @Override
        public double payoff(double underlyingPrice, double strike) {
            return Math.max(strike - underlyingPrice, 0.0);
        }
    };

    /** Exercise value for the given underlying price: max(S-K, 0) for calls, max(K-S, 0) for puts. */
    public abstract double payoff(double underlyingPrice, double strike);
}
