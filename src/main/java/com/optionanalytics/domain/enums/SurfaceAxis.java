package com.optionanalytics.domain.enums;

/**
 * X-axis of a {@link com.optionanalytics.domain.model.SurfaceSeries}. A smile is keyed by STRIKE
 * at a fixed expiry; a term structure is keyed by EXPIRY at a fixed strike or moneyness.
 */
public enum SurfaceAxis {
    STRIKE,
    EXPIRY
}
