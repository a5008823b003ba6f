package com.sponsor.lookup.rest.dto;

import com.sponsor.lookup.core.model.MatchResult;

import java.util.List;

/**
 * Response DTO for a sponsor search.
 */
public record SearchResponse(
        String query,
        int count,
        List<SponsorMatchResponse> results
) {
    public static SearchResponse from(String query, List<MatchResult> matches) {
        List<SponsorMatchResponse> results = matches.stream()
                .map(SponsorMatchResponse::from)
                .toList();
        return new SearchResponse(query, results.size(), results);
    }
}
