package com.sponsor.lookup.core.model;

import java.util.Objects;

/**
 * A registry record paired with the score it achieved for one query.
 * Produced per search and never persisted.
 */
public record MatchResult(
        SponsorRecord record,
        double score,
        MatchStage stage
) {
    public MatchResult {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(stage, "stage is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
    }

    public String name() {
        return record.name();
    }

    public ConfidenceBand band() {
        return ConfidenceBand.fromScore(score);
    }

    /**
     * Returns true if the score reaches the confirmed band.
     */
    public boolean isConfirmed() {
        return band() == ConfidenceBand.CONFIRMED;
    }
}
