package com.profile.matching.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one health check, or the aggregate of several.
 *
 * <p>DEGRADED still serves requests: a missing reason backend only means fallback reasons.
 * DOWN means matching requests cannot be served as configured.</p>
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status {
        UP,
        DEGRADED,
        DOWN;

        /**
         * The more severe of two statuses.
         */
        public Status worse(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    private static final String OK = "OK";

    public HealthStatus {
        message = message != null ? message : OK;
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return up(OK);
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, null);
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, null);
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, null);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put(key, value);
        return new HealthStatus(status, message, copy);
    }

    /**
     * True unless the status is DOWN.
     */
    public boolean canServe() {
        return status != Status.DOWN;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
