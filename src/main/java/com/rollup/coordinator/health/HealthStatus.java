package com.rollup.coordinator.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of a component: a status, a human-readable message and diagnostic details.
 * Statuses are ordered from best to worst.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    /**
     * Returns a copy with {@code extra} merged into the details, later keys winning.
     */
    public HealthStatus withDetails(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.putAll(extra);
        return new HealthStatus(status, message, merged);
    }

    public boolean isWorseThan(HealthStatus other) {
        return status.ordinal() > other.status.ordinal();
    }
}
