package com.sponsor.lookup.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sponsor.lookup.core.model.MatchResult;
import com.sponsor.lookup.core.model.SponsorRecord;
import com.sponsor.lookup.format.ExternalLinks;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * One matched sponsor with its score and search links.
 */
public record SponsorMatchResponse(
        String name,
        String city,
        String county,
        String rating,
        String route,
        @JsonProperty("match_score") double matchScore,
        @JsonProperty("is_confirmed") boolean confirmed,
        String band,
        Map<String, String> links
) {
    public static SponsorMatchResponse from(MatchResult match) {
        SponsorRecord record = match.record();
        return new SponsorMatchResponse(
                record.name(),
                record.city(),
                record.county(),
                record.rating(),
                record.route(),
                round(match.score()),
                match.isConfirmed(),
                match.band().label(),
                ExternalLinks.forSponsor(record.name(), record.city(), record.county())
        );
    }

    static double round(double score) {
        return BigDecimal.valueOf(score).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }
}
