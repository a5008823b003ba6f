package com.sponsor.lookup.core.model;

/**
 * Display classification of a match score.
 * The band boundaries are fixed and independent of any request threshold.
 */
public enum ConfidenceBand {
    CONFIRMED("confirmed"),
    POSSIBLE_MATCH("possible match"),
    NOT_FOUND("not found");

    public static final double CONFIRMED_THRESHOLD = 0.8;
    public static final double POSSIBLE_THRESHOLD = 0.5;

    private final String label;

    ConfidenceBand(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ConfidenceBand fromScore(double score) {
        if (score >= CONFIRMED_THRESHOLD) {
            return CONFIRMED;
        }
        if (score >= POSSIBLE_THRESHOLD) {
            return POSSIBLE_MATCH;
        }
        return NOT_FOUND;
    }
}
