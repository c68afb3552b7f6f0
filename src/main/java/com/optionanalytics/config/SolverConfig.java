package com.optionanalytics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the implied volatility solver.
 *
 * <p>Binds to the {@code optionanalytics.solver.*} prefix. A solve converges when the pricing
 * error falls below {@code priceTolerance} or the sigma step falls below
 * {@code volatilityTolerance}; either is sufficient. The search never leaves
 * ({@code minVolatility}, {@code maxVolatility}).
 */
@Configuration
@ConfigurationProperties(prefix = "optionanalytics.solver")
@Getter
@Setter
public class SolverConfig {

    /** Starting sigma for Newton-Raphson. */
    private double initialGuess = 0.25;

    /** Price-space tolerance |model - market|. */
    private double priceTolerance = 1e-8;

    /** Parameter-space tolerance |sigma(k+1) - sigma(k)|. */
    private double volatilityTolerance = 1e-10;

    /** Iteration budget shared by the Newton-Raphson and bisection phases. */
    private int maxIterations = 200;

    private double minVolatility = 1e-6;

    private double maxVolatility = 5.0;

    /** Below this vega a Newton step is considered numerically unsafe and bisection takes over. */
    private double minVega = 1e-10;
}
