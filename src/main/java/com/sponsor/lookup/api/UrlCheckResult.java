package com.sponsor.lookup.api;

import com.sponsor.lookup.core.model.MatchResult;
import com.sponsor.lookup.url.ExtractionSource;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of checking a job posting URL: the company extracted from it, if any,
 * and the sponsor that company resolved to, if any.
 */
public record UrlCheckResult(String url, String extractedCompany, ExtractionSource source, MatchResult match) {

    public UrlCheckResult {
        Objects.requireNonNull(source, "source is required");
    }

    public Optional<String> company() {
        return Optional.ofNullable(extractedCompany);
    }

    public Optional<MatchResult> sponsor() {
        return Optional.ofNullable(match);
    }

    public boolean isSponsor() {
        return match != null;
    }
}
