package com.optionanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-contract analytics of a chain run: the implied volatility solve and, when it converged,
 * the Greeks at the implied volatility and a re-priced model value to check the solve against
 * the market price.
 */
@Value
@Builder
public class ContractAnalytics {

    ImpliedVolatilityResult impliedVolatility;

    /** Null when the solve did not converge. */
    Greeks greeks;

    /** Model price at the implied volatility; null when the solve did not converge. */
    Double modelPrice;

    /** modelPrice - marketPrice; null when the solve did not converge. */
    Double pricingError;

    public OptionQuote getQuote() {
        return impliedVolatility.getQuote();
    }

    public boolean isConverged() {
        return impliedVolatility.isConverged();
    }
}
