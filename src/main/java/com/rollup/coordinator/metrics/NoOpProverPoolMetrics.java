package com.rollup.coordinator.metrics;

import com.rollup.coordinator.cancel.CancellationReason;
import com.rollup.coordinator.pool.PoolStats;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * No-op implementation of {@link ProverPoolMetrics}.
 */
public class NoOpProverPoolMetrics implements ProverPoolMetrics {

    @Override
    public void registerPool(String pool, Supplier<PoolStats> stats) {
    }

    @Override
    public void recordAcquireWait(String pool, Duration waited) {
    }

    @Override
    public void incrementAdded(String pool) {
    }

    @Override
    public void incrementReleased(String pool) {
    }

    @Override
    public void incrementDiscarded(String pool) {
    }

    @Override
    public void incrementCancelled(String pool, String operation, CancellationReason reason) {
    }
}
