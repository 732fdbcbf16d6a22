package com.contact.identity.health;

/**
 * A single component probe reported by {@code GET /}.
 */
public interface HealthCheck {

    String getName();

    /**
     * Probes the component. Implementations report failures as {@link HealthStatus.Status#DOWN}
     * rather than throwing.
     */
    HealthStatus check();
}
