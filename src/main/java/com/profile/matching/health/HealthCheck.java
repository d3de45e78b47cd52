package com.profile.matching.health;

/**
 * Probe for one collaborator the matching service depends on.
 */
public interface HealthCheck {

    /**
     * Name under which the result appears in the aggregate details.
     */
    String getName();

    HealthStatus check();
}
