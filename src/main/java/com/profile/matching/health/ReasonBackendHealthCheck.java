package com.profile.matching.health;

import com.profile.matching.llm.ReasonBackend;

import java.util.Objects;

/**
 * Reports whether a reason backend is reachable. An unreachable backend only degrades
 * the service: reasons still come from the deterministic fallback.
 */
public class ReasonBackendHealthCheck implements HealthCheck {

    private final ReasonBackend backend;

    public ReasonBackendHealthCheck(ReasonBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend is required");
    }

    @Override
    public String getName() {
        return "reason-backend:" + backend.getBackendName();
    }

    @Override
    public HealthStatus check() {
        long startMs = System.currentTimeMillis();
        boolean available = backend.isAvailable();
        long latencyMs = System.currentTimeMillis() - startMs;
        if (available) {
            return HealthStatus.up().withDetail("latencyMs", latencyMs);
        }
        return HealthStatus.degraded(backend.getBackendName() + " unavailable, fallback reasons in use")
                .withDetail("latencyMs", latencyMs);
    }
}
