package com.sponsor.lookup.url;

/**
 * Which extraction step decided the outcome for a URL.
 */
public enum ExtractionSource {
    /**
     * Host contains a known careers domain.
     */
    KNOWN_DOMAIN,

    /**
     * A company page path pattern matched.
     */
    PATH_PATTERN,

    /**
     * Host is {@code <company>.careers.*}, {@code <company>.jobs.*} and similar.
     */
    CAREER_SUBDOMAIN,

    /**
     * URL is a job detail view that never carries the company name.
     */
    REFUSED,

    /**
     * No rule applied.
     */
    NONE
}
