package com.rollup.coordinator.metrics;

import com.rollup.coordinator.cancel.CancellationReason;
import com.rollup.coordinator.pool.PoolStats;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Interface for recording prover pool metrics.
 * The default {@link NoOpProverPoolMetrics} does nothing, so the pool works without any
 * metrics backend configured.
 */
public interface ProverPoolMetrics {

    /**
     * Called once per pool at construction so gauge-style backends can sample its stats.
     */
    void registerPool(String pool, Supplier<PoolStats> stats);

    void recordAcquireWait(String pool, Duration waited);

    void incrementAdded(String pool);

    void incrementReleased(String pool);

    void incrementDiscarded(String pool);

    void incrementCancelled(String pool, String operation, CancellationReason reason);
}
