package com.rollup.coordinator.health;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of health checks combined into one aggregate status: the worst individual status
 * wins, and each check's result is reported under its name in the details.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        HealthStatus aggregate = HealthStatus.up();
        String worstName = null;
        HealthStatus worst = aggregate;

        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            aggregate = aggregate.withDetails(Map.of(check.getName(), result));
            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }

        if (worstName == null) {
            return aggregate;
        }
        return new HealthStatus(worst.status(), worstName + ": " + worst.message(), aggregate.details());
    }

    public int size() {
        return checks.size();
    }
}
