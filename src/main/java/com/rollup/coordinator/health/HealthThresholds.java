package com.rollup.coordinator.health;

/**
 * Utilization thresholds for {@link ProverPoolHealthCheck}.
 *
 * @param degradedUtilization checked-out fraction at or above which the pool is DEGRADED
 * @param downUtilization     checked-out fraction at or above which the pool is DOWN, provided
 *                            callers are also waiting for a prover
 */
public record HealthThresholds(double degradedUtilization, double downUtilization) {

    public HealthThresholds {
        if (degradedUtilization <= 0.0 || degradedUtilization > 1.0) {
            throw new IllegalArgumentException("degradedUtilization must be in (0, 1]");
        }
        if (downUtilization < degradedUtilization || downUtilization > 1.0) {
            throw new IllegalArgumentException("downUtilization must be in [degradedUtilization, 1]");
        }
    }

    /**
     * Default thresholds: DEGRADED at 80% utilization, DOWN when exhausted with waiters.
     */
    public static HealthThresholds defaults() {
        return new HealthThresholds(0.80, 1.0);
    }
}
