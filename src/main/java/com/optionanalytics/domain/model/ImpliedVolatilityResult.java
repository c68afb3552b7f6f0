package com.optionanalytics.domain.model;

import com.optionanalytics.domain.enums.NonConvergenceReason;
import com.optionanalytics.domain.enums.PricingModelType;
import com.optionanalytics.domain.enums.SolverMethod;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of inverting a pricing model against an observed quote.
 *
 * <p>A non-converged result is a valid value, not an error: {@link #getVolatility()} is the
 * best sigma found and {@link #getResidual()} its pricing error (model - market), so a batch
 * can keep going and the caller decides whether to discard the quote.
 */
@Value
@Builder
public class ImpliedVolatilityResult {

    /** Quote the volatility was solved from. */
    OptionQuote quote;

    PricingModelType model;

    /** Recovered sigma, or the best candidate when not converged. */
    double volatility;

    /** Model price evaluations spent in the root-finding loop. */
    int iterations;

    boolean converged;

    /** model.price(volatility) - marketPrice. */
    double residual;

    /** Strategy in effect when the solve finished; null when rejected before iterating. */
    SolverMethod method;

    /** Null when converged. */
    NonConvergenceReason failureReason;
}
