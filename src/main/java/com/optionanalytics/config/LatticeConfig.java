package com.optionanalytics.config;

import com.optionanalytics.core.pricing.BinomialLatticeModel;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the CRR binomial lattice.
 *
 * <p>Binds to the {@code optionanalytics.lattice.*} prefix. {@code defaultSteps} is used
 * whenever a caller selects the lattice without a step count; {@code convergenceSteps} is the
 * default schedule for convergence reports.
 */
@Configuration
@ConfigurationProperties(prefix = "optionanalytics.lattice")
@Getter
@Setter
public class LatticeConfig {

    private int defaultSteps = 500;

    private List<Integer> convergenceSteps = List.of(25, 50, 100, 250, 500, 1000);

    /** Spot bump for delta/gamma on one-step lattices, as a fraction of spot. */
    private double greekSpotBump = 0.01;

    /** Absolute sigma bump for vega. */
    private double greekVolatilityBump = 0.001;

    /** Time bump in years for theta on one-step lattices. */
    private double greekTimeBump = 1.0 / 365.0;

    /** Absolute rate bump for rho. */
    private double greekRateBump = 1e-4;

    public BinomialLatticeModel.Bumps getBumps() {
        return new BinomialLatticeModel.Bumps(greekSpotBump, greekVolatilityBump, greekTimeBump, greekRateBump);
    }
}
