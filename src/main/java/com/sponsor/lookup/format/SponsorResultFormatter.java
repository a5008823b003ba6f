package com.sponsor.lookup.format;

import com.sponsor.lookup.core.model.ConfidenceBand;
import com.sponsor.lookup.core.model.MatchResult;
import com.sponsor.lookup.core.model.SponsorRecord;

import java.util.Locale;

/**
 * Plain-text rendering of matches for terminals and logs.
 */
public final class SponsorResultFormatter {

    public static final String RULE = "-".repeat(50);

    private SponsorResultFormatter() {
        // Utility class
    }

    /**
     * Renders one match as a multi-line block:
     * <pre>
     * CONFIRMED (Match: 90%)
     *    Company: Barclays Bank PLC
     *    Location: London
     *    Rating: Worker (A rating)
     *    Route: Skilled Worker
     * </pre>
     * Scores below the confirmed band are shown as a possible match.
     */
    public static String format(MatchResult match) {
        SponsorRecord record = match.record();
        String status = match.isConfirmed() ? "CONFIRMED" : "POSSIBLE MATCH";
        return status + " (Match: " + percent(match.score()) + ")" + System.lineSeparator()
                + "   Company: " + record.name() + System.lineSeparator()
                + "   Location: " + record.location() + System.lineSeparator()
                + "   Rating: " + record.rating() + System.lineSeparator()
                + "   Route: " + record.route();
    }

    /**
     * One-line verdict for the best score of a query.
     */
    public static String verdict(double bestScore) {
        return switch (ConfidenceBand.fromScore(bestScore)) {
            case CONFIRMED -> "CONFIRMED: This is a registered UK visa sponsor";
            case POSSIBLE_MATCH -> "POSSIBLE MATCH: Review results above";
            case NOT_FOUND -> "NOT FOUND: Not a registered sponsor";
        };
    }

    static String percent(double score) {
        return String.format(Locale.ROOT, "%.0f%%", score * 100);
    }
}
