package com.optionanalytics.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.optionanalytics.domain.enums.NonConvergenceReason;
import com.optionanalytics.domain.enums.SolverMethod;
import com.optionanalytics.domain.model.ImpliedVolatilityResult;
import com.optionanalytics.observability.AnalyticsMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnalyticsMetricsTest {

    private MeterRegistry meterRegistry;
    private AnalyticsMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new AnalyticsMetrics(meterRegistry);
    }

    private static ImpliedVolatilityResult result(boolean converged, SolverMethod method) {
        return ImpliedVolatilityResult.builder()
                .volatility(0.2)
                .converged(converged)
                .method(method)
                .failureReason(converged ? null : NonConvergenceReason.ITERATION_LIMIT)
                .build();
    }

    private double count(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    @DisplayName("All meters are registered at construction")
    void metersRegistered() {
        assertThat(meterRegistry.find("iv.solves.converged").counter()).isNotNull();
        assertThat(meterRegistry.find("iv.solves.non_converged").counter()).isNotNull();
        assertThat(meterRegistry.find("iv.solves.bisection_fallback").counter()).isNotNull();
        assertThat(meterRegistry.find("chain.analytics.duration").timer()).isNotNull();
    }

    @Test
    @DisplayName("Solves are counted by outcome and bisection fallbacks separately")
    void countsSolves() {
        metrics.recordSolve(result(true, SolverMethod.NEWTON_RAPHSON));
        metrics.recordSolve(result(true, SolverMethod.BISECTION));
        metrics.recordSolve(result(false, SolverMethod.NEWTON_RAPHSON));
        metrics.recordSolve(result(false, null));

        assertThat(count("iv.solves.converged")).isEqualTo(2.0);
        assertThat(count("iv.solves.non_converged")).isEqualTo(2.0);
        assertThat(count("iv.solves.bisection_fallback")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Chain timer records one sample per batch")
    void recordsChainDuration() {
        metrics.recordChain(System.nanoTime() - 5_000_000L);

        assertThat(meterRegistry.get("chain.analytics.duration").timer().count()).isEqualTo(1);
    }
}
