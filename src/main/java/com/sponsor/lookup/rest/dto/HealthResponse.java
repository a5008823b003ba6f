package com.sponsor.lookup.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sponsor.lookup.health.HealthStatus;

import java.util.Locale;
import java.util.Map;

/**
 * Response DTO for the health endpoint.
 */
public record HealthResponse(
        String status,
        @JsonProperty("sponsors_loaded") int sponsorsLoaded,
        String message,
        Map<String, Object> details
) {
    public static HealthResponse from(HealthStatus health, int sponsorsLoaded) {
        return new HealthResponse(health.status().name().toLowerCase(Locale.ROOT), sponsorsLoaded,
                health.message(), health.details());
    }
}
