package com.optionanalytics.domain.model;

import lombok.Value;

/**
 * One (x, implied volatility) pair of a surface series. x is a strike for smiles and a time
 * to expiry in years for term structures.
 */
@Value
public class SurfacePoint {

    double x;

    double impliedVolatility;

    /** Number of solved contracts averaged into this point. */
    int sampleCount;
}
