package com.sponsor.lookup.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sponsor.lookup.api.RegistryStatistics;

import java.util.Map;

/**
 * Response DTO for registry statistics.
 */
public record StatsResponse(
        @JsonProperty("total_sponsors") int totalSponsors,
        @JsonProperty("unique_companies") int uniqueCompanies,
        @JsonProperty("top_routes") Map<String, Long> topRoutes,
        Map<String, Long> ratings,
        @JsonProperty("total_searches") long totalSearches
) {
    public static StatsResponse from(RegistryStatistics statistics, long totalSearches) {
        return new StatsResponse(statistics.totalSponsors(), statistics.uniqueCompanies(),
                statistics.topRoutes(), statistics.ratings(), totalSearches);
    }
}
