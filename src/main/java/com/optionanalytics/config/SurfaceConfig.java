package com.optionanalytics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for smile and term-structure aggregation.
 *
 * <p>Binds to the {@code optionanalytics.surface.*} prefix. Non-converged solves are left out
 * of every series unless {@code includeNonConverged} is set (or requested per call), in which
 * case the series is flagged as quality-degraded.
 */
@Configuration
@ConfigurationProperties(prefix = "optionanalytics.surface")
@Getter
@Setter
public class SurfaceConfig {

    private boolean includeNonConverged = false;

    /** Two expiries closer than this (years) are the same expiry. Default: one minute. */
    private double expiryTolerance = 1.0 / 525600.0;

    /** Two strikes closer than this are the same strike. */
    private double strikeTolerance = 1e-9;

    /** Half-width of the at-the-money moneyness bucket (K/S within 1 +/- this). */
    private double atmMoneynessHalfWidth = 0.10;
}
