package com.sponsor.lookup.metrics;

/**
 * Caller-facing operation a query was made through.
 */
public enum QueryOperation {
    SEARCH,
    CHECK,
    URL
}
