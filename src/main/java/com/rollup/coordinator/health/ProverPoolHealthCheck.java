package com.rollup.coordinator.health;

import com.rollup.coordinator.pool.PoolStats;
import com.rollup.coordinator.pool.ProverPool;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check for a {@link ProverPool}. Reports DOWN when the pool is closed or exhausted
 * with callers waiting, DEGRADED at high utilization, UP otherwise.
 */
public class ProverPoolHealthCheck implements HealthCheck {

    private final String name;
    private final ProverPool pool;
    private final HealthThresholds thresholds;

    public ProverPoolHealthCheck(String name, ProverPool pool) {
        this(name, pool, HealthThresholds.defaults());
    }

    public ProverPoolHealthCheck(String name, ProverPool pool, HealthThresholds thresholds) {
        this.name = name;
        this.pool = pool;
        this.thresholds = thresholds;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public HealthStatus check() {
        PoolStats stats;
        try {
            stats = pool.getStats();
        } catch (RuntimeException e) {
            return HealthStatus.down("Prover pool check failed: " + e.getMessage());
        }

        double utilization = stats.utilization();
        HealthStatus base;
        if (stats.closed()) {
            base = HealthStatus.down("Prover pool closed");
        } else if (stats.resident() == 0) {
            base = HealthStatus.down("No provers in pool");
        } else if (utilization >= thresholds.downUtilization() && stats.waitingAcquirers() > 0) {
            base = HealthStatus.down("Prover pool exhausted: " + stats.waitingAcquirers() + " callers waiting");
        } else if (utilization >= thresholds.degradedUtilization()) {
            base = HealthStatus.degraded("Prover pool usage high: " +
                    String.format("%.0f%%", utilization * 100));
        } else {
            base = HealthStatus.up();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("capacity", stats.capacity());
        details.put("available", stats.available());
        details.put("checkedOut", stats.checkedOut());
        details.put("waitingAcquirers", stats.waitingAcquirers());
        details.put("totalAcquired", stats.totalAcquired());
        details.put("totalDiscarded", stats.totalDiscarded());
        details.put("totalCancelled", stats.totalCancelled());
        return base.withDetails(details);
    }
}
