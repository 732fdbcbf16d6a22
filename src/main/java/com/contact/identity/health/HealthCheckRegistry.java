package com.contact.identity.health;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the registered checks and folds them into one status: the worst
 * individual status wins, and each check's result is attached as a detail
 * under its name.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public HealthCheckRegistry register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
        return this;
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus.Status worst = HealthStatus.Status.UP;
        String message = "OK";
        HealthStatus aggregate = HealthStatus.up();

        for (HealthCheck check : checks) {
            HealthStatus result = runSafely(check);
            aggregate = aggregate.withDetail(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (worst.worse(result.status()) != worst) {
                worst = result.status();
                message = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, message, aggregate.details());
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus runSafely(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down("Health check threw " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
