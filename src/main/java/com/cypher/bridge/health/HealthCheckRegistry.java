package com.cypher.bridge.health;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs registered checks and reports the worst status among them
 * (DOWN over DEGRADED over UP). Each check's result is kept as a detail under its name.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new ArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus.Status worst = HealthStatus.Status.UP;
        String worstMessage = "OK";

        for (HealthCheck check : checks) {
            HealthStatus result = runSafely(check);
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (result.status().ordinal() > worst.ordinal()) {
                worst = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, worstMessage, results);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus runSafely(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down("Health check threw: " + e.getClass().getSimpleName());
        }
    }
}
