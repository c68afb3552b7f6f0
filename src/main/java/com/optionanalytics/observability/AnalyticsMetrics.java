package com.optionanalytics.observability;

import com.optionanalytics.domain.enums.SolverMethod;
import com.optionanalytics.domain.model.ImpliedVolatilityResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the analytics pipeline:
 * <ul>
 *   <li><b>iv.solves.converged</b> (counter): solves that met a tolerance
 *   <li><b>iv.solves.non_converged</b> (counter): solves reported as non-converged, any reason
 *   <li><b>iv.solves.bisection_fallback</b> (counter): solves that finished in bisection
 *   <li><b>chain.analytics.duration</b> (timer): wall time of one chain batch
 * </ul>
 */
@Service
public class AnalyticsMetrics {

    private final Counter convergedCounter;
    private final Counter nonConvergedCounter;
    private final Counter bisectionFallbackCounter;
    private final Timer chainTimer;

    public AnalyticsMetrics(MeterRegistry meterRegistry) {
        this.convergedCounter = Counter.builder("iv.solves.converged")
                .description("Implied volatility solves that converged")
                .register(meterRegistry);

        this.nonConvergedCounter = Counter.builder("iv.solves.non_converged")
                .description("Implied volatility solves reported as non-converged")
                .register(meterRegistry);

        this.bisectionFallbackCounter = Counter.builder("iv.solves.bisection_fallback")
                .description("Implied volatility solves that fell back from Newton-Raphson to bisection")
                .register(meterRegistry);

        this.chainTimer = Timer.builder("chain.analytics.duration")
                .description("Wall time to solve and price one option chain")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofMinutes(1))
                .register(meterRegistry);
    }

    public void recordSolve(ImpliedVolatilityResult result) {
        if (result.isConverged()) {
            convergedCounter.increment();
        } else {
            nonConvergedCounter.increment();
        }
        if (result.getMethod() == SolverMethod.BISECTION) {
            bisectionFallbackCounter.increment();
        }
    }

    public void recordChain(long startNanos) {
        chainTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    // Expose for testing
    Counter getConvergedCounter() {
        return convergedCounter;
    }

    Counter getNonConvergedCounter() {
        return nonConvergedCounter;
    }

    Counter getBisectionFallbackCounter() {
        return bisectionFallbackCounter;
    }

    Timer getChainTimer() {
        return chainTimer;
    }
}
