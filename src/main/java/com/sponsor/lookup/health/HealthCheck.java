package com.sponsor.lookup.health;

/**
 * A check of one component, reported through {@link HealthStatus}.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
