package com.rollup.coordinator.health;

/**
 * A named check reporting the current {@link HealthStatus} of one component.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
