package com.optionanalytics.service;

import com.optionanalytics.domain.model.ContractAnalytics;
import com.optionanalytics.observability.AnalyticsMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Handle on a chain batch running on the analytics executor. One future per quote, in input
 * order.
 *
 * <p>{@link #cancel()} stops units that have not started; units already running finish and
 * their results stay available through {@link #completedResults()}.
 */
@Slf4j
public class ChainAnalyticsJob {

    private final List<CompletableFuture<ContractAnalytics>> units;
    private final AnalyticsMetrics metrics;
    private final long startNanos;

    ChainAnalyticsJob(List<CompletableFuture<ContractAnalytics>> units, AnalyticsMetrics metrics, long startNanos) {
        this.units = List.copyOf(units);
        this.metrics = metrics;
        this.startNanos = startNanos;
    }

    public int size() {
        return units.size();
    }

    public boolean isDone() {
        return units.stream().allMatch(CompletableFuture::isDone);
    }

    public boolean isCancelled() {
        return units.stream().anyMatch(CompletableFuture::isCancelled);
    }

    /**
     * Cancels every unit not yet finished.
     *
     * @return number of units cancelled
     */
    public int cancel() {
        int cancelled = 0;
        for (CompletableFuture<ContractAnalytics> unit : units) {
            if (unit.cancel(false)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.warn("Chain batch cancelled with {} of {} units pending", cancelled, units.size());
        }
        return cancelled;
    }

    /** Results of the units that finished normally so far, in input order. */
    public List<ContractAnalytics> completedResults() {
        List<ContractAnalytics> completed = new ArrayList<>();
        for (CompletableFuture<ContractAnalytics> unit : units) {
            if (unit.isDone() && !unit.isCompletedExceptionally()) {
                completed.add(unit.join());
            }
        }
        return completed;
    }

    /**
     * Waits for every unit and returns the results in input order.
     *
     * <p>An invalid input in any unit cancels the rest of the batch and is rethrown as is.
     *
     * @throws CancellationException if the batch was cancelled
     */
    public List<ContractAnalytics> join() {
        List<ContractAnalytics> results = new ArrayList<>(units.size());
        try {
            for (CompletableFuture<ContractAnalytics> unit : units) {
                results.add(unit.join());
            }
        } catch (CompletionException ex) {
            cancel();
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        } finally {
            metrics.recordChain(startNanos);
        }

        long converged = results.stream().filter(ContractAnalytics::isConverged).count();
        log.info(
                "Chain batch finished: {} contracts, {} converged, {} non-converged in {} ms",
                results.size(),
                converged,
                results.size() - converged,
                (System.nanoTime() - startNanos) / 1_000_000L);
        return results;
    }
}
