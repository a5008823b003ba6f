package com.sponsor.lookup.url;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of company extraction for one URL.
 *
 * @param companyName extracted name, null when nothing was extracted
 * @param source      step that decided the outcome
 * @param rule        name of the matching rule or domain, null for {@link ExtractionSource#NONE}
 */
public record UrlExtraction(String companyName, ExtractionSource source, String rule) {

    public UrlExtraction {
        Objects.requireNonNull(source, "source is required");
    }

    public static UrlExtraction found(String companyName, ExtractionSource source, String rule) {
        return new UrlExtraction(Objects.requireNonNull(companyName, "companyName"), source, rule);
    }

    public static UrlExtraction refused(String rule) {
        return new UrlExtraction(null, ExtractionSource.REFUSED, rule);
    }

    public static UrlExtraction none() {
        return new UrlExtraction(null, ExtractionSource.NONE, null);
    }

    public Optional<String> company() {
        return Optional.ofNullable(companyName);
    }

    public boolean isFound() {
        return companyName != null;
    }
}
