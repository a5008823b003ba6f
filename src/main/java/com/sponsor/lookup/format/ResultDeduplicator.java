package com.sponsor.lookup.format;

import com.sponsor.lookup.core.model.MatchResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses results that name the same company (e.g. one sponsor licensed at
 * several branches) to the single best-scoring entry.
 */
public final class ResultDeduplicator {

    private ResultDeduplicator() {
        // Utility class
    }

    /**
     * Keeps, per company name, the highest-scoring result (the first one on a tie),
     * then sorts by score descending. Scores are never changed.
     */
    public static List<MatchResult> deduplicate(List<MatchResult> results) {
        Map<String, MatchResult> best = new LinkedHashMap<>();
        for (MatchResult result : results) {
            best.merge(result.name(), result,
                    (current, candidate) -> candidate.score() > current.score() ? candidate : current);
        }
        List<MatchResult> deduplicated = new ArrayList<>(best.values());
        deduplicated.sort(Comparator.comparingDouble(MatchResult::score).reversed());
        return List.copyOf(deduplicated);
    }
}
