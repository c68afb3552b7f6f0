package com.optionanalytics.domain.enums;

/**
 * Pricing model variants available behind {@link com.optionanalytics.core.pricing.PricingModel}.
 */
public enum PricingModelType {
    /** Closed-form Black-Scholes-Merton with continuous dividend yield. European only. */
    BLACK_SCHOLES_MERTON,

    /** Cox-Ross-Rubinstein recombining binomial lattice. European and American. */
    CRR_BINOMIAL
}
