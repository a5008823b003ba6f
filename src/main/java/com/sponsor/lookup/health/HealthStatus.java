package com.sponsor.lookup.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of a component, with a message and arbitrary details.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up(String message, Map<String, Object> details) {
        return new HealthStatus(Status.UP, message, details);
    }

    public static HealthStatus degraded(String reason, Map<String, Object> details) {
        return new HealthStatus(Status.DEGRADED, reason, details);
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
