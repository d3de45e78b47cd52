package com.profile.matching.health;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Readiness of the matching service as the worst status among its registered checks.
 * The aggregate message names the check that produced the worst status; per-check
 * status and message are listed in the details under each check's name.
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

        Map<String, Object> perCheck = new LinkedHashMap<>();
        HealthStatus.Status aggregate = HealthStatus.Status.UP;
        String culprit = null;

        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            perCheck.put(check.getName(), Map.of("status", result.status().name(), "message", result.message()));
            HealthStatus.Status worse = aggregate.worse(result.status());
            if (worse != aggregate) {
                aggregate = worse;
                culprit = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(aggregate, culprit, perCheck);
    }

    public int size() {
        return checks.size();
    }
}
