package com.contact.identity.rest.dto;

import com.contact.identity.health.HealthStatus;

import java.util.Map;

/**
 * Body of {@code GET /}. {@code status} is {@code ok}, {@code degraded} or {@code down}.
 */
public record HealthResponse(String status, String message, Map<String, Object> checks) {

    public static HealthResponse from(HealthStatus health) {
        String status = switch (health.status()) {
            case UP -> "ok";
            case DEGRADED -> "degraded";
            case DOWN -> "down";
        };
        String message = health.isUp() ? "Contact Identity Service is running" : health.message();
        return new HealthResponse(status, message, health.details());
    }
}
