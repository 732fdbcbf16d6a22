package com.contact.identity.health;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;

/**
 * Reports JVM heap utilization: DEGRADED from 80% of max heap, DOWN from 95%.
 */
public class MemoryHealthCheck implements HealthCheck {

    private final double degradedThreshold;
    private final double downThreshold;

    public MemoryHealthCheck() {
        this(0.80, 0.95);
    }

    public MemoryHealthCheck(double degradedThreshold, double downThreshold) {
        if (degradedThreshold <= 0 || downThreshold > 1 || degradedThreshold >= downThreshold) {
            throw new IllegalArgumentException("Require 0 < degradedThreshold < downThreshold <= 1");
        }
        this.degradedThreshold = degradedThreshold;
        this.downThreshold = downThreshold;
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public HealthStatus check() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long usedMB = heap.getUsed() / (1024 * 1024);
        long maxMB = heap.getMax() / (1024 * 1024);
        double usage = maxMB > 0 ? (double) usedMB / maxMB : 0.0;
        String percent = String.format("%.1f%%", usage * 100);

        HealthStatus base;
        if (usage >= downThreshold) {
            base = HealthStatus.down("Heap usage critical: " + percent);
        } else if (usage >= degradedThreshold) {
            base = HealthStatus.degraded("Heap usage high: " + percent);
        } else {
            base = HealthStatus.up();
        }
        return base
                .withDetail("heapUsedMB", usedMB)
                .withDetail("heapMaxMB", maxMB);
    }
}
