package com.sponsor.lookup.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sponsor.lookup.api.UrlCheckResult;

/**
 * Response DTO for a URL check. {@code sponsor_details} is null when the
 * extracted company is not a sponsor; {@code message} is set when no company
 * could be extracted.
 */
public record UrlCheckResponse(
        String url,
        @JsonProperty("extracted_company") String extractedCompany,
        @JsonProperty("extraction_source") String extractionSource,
        @JsonProperty("is_sponsor") boolean sponsor,
        @JsonProperty("sponsor_details") SponsorMatchResponse sponsorDetails,
        String message
) {
    public static final String NOT_EXTRACTED_MESSAGE = "Could not extract company from URL";

    public static UrlCheckResponse from(UrlCheckResult result) {
        return new UrlCheckResponse(
                result.url(),
                result.extractedCompany(),
                result.source().name(),
                result.isSponsor(),
                result.sponsor().map(SponsorMatchResponse::from).orElse(null),
                result.company().isEmpty() ? NOT_EXTRACTED_MESSAGE : null
        );
    }
}
