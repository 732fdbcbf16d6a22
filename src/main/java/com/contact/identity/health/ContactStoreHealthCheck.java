package com.contact.identity.health;

import com.contact.identity.store.ContactStore;

/**
 * Pings the contact store and reports the round-trip latency.
 * A reachable but slow store is reported as DEGRADED.
 */
public class ContactStoreHealthCheck implements HealthCheck {

    private static final long DEFAULT_SLOW_THRESHOLD_MS = 1000;

    private final ContactStore store;
    private final long slowThresholdMs;

    public ContactStoreHealthCheck(ContactStore store) {
        this(store, DEFAULT_SLOW_THRESHOLD_MS);
    }

    public ContactStoreHealthCheck(ContactStore store, long slowThresholdMs) {
        this.store = store;
        this.slowThresholdMs = slowThresholdMs;
    }

    @Override
    public String getName() {
        return "contactStore";
    }

    @Override
    public HealthStatus check() {
        try {
            long startNanos = System.nanoTime();
            store.ping();
            long latencyMs = (System.nanoTime() - startNanos) / 1_000_000;

            HealthStatus base = latencyMs > slowThresholdMs
                    ? HealthStatus.degraded("Contact store responding slowly: " + latencyMs + "ms")
                    : HealthStatus.up();
            return base
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("engine", store.getName());
        } catch (RuntimeException e) {
            return HealthStatus.down("Contact store unreachable: " + e.getMessage())
                    .withDetail("engine", store.getName())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
