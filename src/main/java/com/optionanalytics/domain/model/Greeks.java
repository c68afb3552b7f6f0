package com.optionanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Price sensitivities of a single contract, in raw annualized units: vega per 1.00 change
 * in sigma, theta per year, rho per 1.00 change in r.
 *
 * <p>Trader-facing units are available through {@link #getVegaPerVolPoint()} and
 * {@link #getThetaPerDay()}.
 */
@Value
@Builder
public class Greeks {

    private static final double DAYS_PER_YEAR = 365.25;

    /** dV/dS. Range: -1 (deep ITM put) to +1 (deep ITM call), scaled by e^(-qT). */
    double delta;

    /** d2V/dS2. Highest near the money; identical for calls and puts. */
    double gamma;

    /** dV/d(sigma). Always >= 0 for vanilla options. */
    double vega;

    /** -dV/dT per year. Negative means the long position loses value as time passes. */
    double theta;

    /** dV/dr. */
    double rho;

    /** Vega for a one vol-point (0.01) move in sigma. */
    public double getVegaPerVolPoint() {
        return vega / 100.0;
    }

    /** Theta per calendar day. */
    public double getThetaPerDay() {
        return theta / DAYS_PER_YEAR;
    }
}
