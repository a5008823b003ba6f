package com.sponsor.lookup.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sponsor.lookup.core.model.MatchResult;

import java.util.Map;

/**
 * Response DTO for a quick sponsor check. Only the fields relevant to the
 * outcome are serialized.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckResponse(
        @JsonProperty("is_sponsor") boolean sponsor,
        String company,
        String city,
        String county,
        String rating,
        String route,
        @JsonProperty("match_score") Double matchScore,
        Map<String, String> links,
        String message
) {
    public static final String NOT_FOUND_MESSAGE = "Company not found in sponsor registry";

    public static CheckResponse found(MatchResult match) {
        SponsorMatchResponse details = SponsorMatchResponse.from(match);
        return new CheckResponse(true, details.name(), details.city(), details.county(),
                details.rating(), details.route(), details.matchScore(), details.links(), null);
    }

    public static CheckResponse notFound() {
        return new CheckResponse(false, null, null, null, null, null, null, null, NOT_FOUND_MESSAGE);
    }
}
