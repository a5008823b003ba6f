package com.sponsor.lookup.matching;

import com.sponsor.lookup.core.model.MatchResult;
import com.sponsor.lookup.core.model.MatchStage;
import com.sponsor.lookup.core.model.SponsorRecord;
import com.sponsor.lookup.registry.SponsorRegistry;
import com.sponsor.lookup.similarity.SimilarityAlgorithm;
import com.sponsor.lookup.similarity.TokenBoostScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Multi-stage fuzzy search over a {@link SponsorRegistry}.
 *
 * <p>A query is normalized and run through four stages. A normalized name resolved
 * by an earlier stage is not scored again by a later one.</p>
 * <ol>
 *   <li><b>Exact</b>: the normalized query is an indexed name, score {@value #EXACT_SCORE}.</li>
 *   <li><b>Substring</b>: the query is part of an indexed name, score {@value #SUBSTRING_SCORE};
 *       otherwise, for queries longer than {@value #CONTAINED_MIN_QUERY_LENGTH} characters,
 *       an indexed name inside the query scores {@value #CONTAINED_SCORE}.</li>
 *   <li><b>Candidates</b>: names sharing an indexed word with the query.</li>
 *   <li><b>Scoring</b>: each candidate is scored by the token scorer and kept if it
 *       meets the caller's threshold.</li>
 * </ol>
 *
 * <p>The first two stages do not consult the threshold. Each call works on its own
 * local state, so one matcher can serve concurrent searches.</p>
 */
public class SponsorMatcher {
    private static final Logger log = LoggerFactory.getLogger(SponsorMatcher.class);

    public static final double EXACT_SCORE = 1.0;
    public static final double SUBSTRING_SCORE = 0.9;
    public static final double CONTAINED_SCORE = 0.85;
    public static final int CONTAINED_MIN_QUERY_LENGTH = 5;
    public static final double DEFAULT_CHECK_THRESHOLD = 0.8;

    private static final Comparator<MatchResult> BY_SCORE_DESC =
            Comparator.comparingDouble(MatchResult::score).reversed();

    private final SponsorRegistry registry;
    private final SimilarityAlgorithm scorer;

    public SponsorMatcher(SponsorRegistry registry) {
        this(registry, new TokenBoostScorer());
    }

    public SponsorMatcher(SponsorRegistry registry, SimilarityAlgorithm scorer) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    /**
     * Searches the registry.
     *
     * @param query      free-text company name
     * @param threshold  minimum score for word-index candidates, in [0, 1]
     * @param maxResults maximum number of results
     * @return matches sorted by score descending; ties keep discovery order
     */
    public List<MatchResult> search(String query, double threshold, int maxResults) {
        String normalized = registry.normalize(query);
        if (normalized.isEmpty() || maxResults <= 0) {
            return List.of();
        }

        List<MatchResult> results = new ArrayList<>();
        Set<String> resolved = new HashSet<>();

        // 1. Exact
        if (registry.containsName(normalized)) {
            collect(results, normalized, EXACT_SCORE, MatchStage.EXACT);
            resolved.add(normalized);
        }

        // 2. Substring in either direction
        boolean longQuery = normalized.length() > CONTAINED_MIN_QUERY_LENGTH;
        for (String name : registry.normalizedNames()) {
            if (name.isEmpty() || resolved.contains(name)) {
                continue;
            }
            if (name.contains(normalized)) {
                collect(results, name, SUBSTRING_SCORE, MatchStage.SUBSTRING);
                resolved.add(name);
            } else if (longQuery && normalized.contains(name)) {
                collect(results, name, CONTAINED_SCORE, MatchStage.CONTAINED);
                resolved.add(name);
            }
        }

        // 3. Word-index candidates
        Set<String> candidates = new LinkedHashSet<>();
        for (String word : registry.indexKeys(normalized)) {
            candidates.addAll(registry.namesContaining(word));
        }

        // 4. Token scoring
        int scored = 0;
        for (String name : candidates) {
            if (resolved.contains(name)) {
                continue;
            }
            scored++;
            double score = scorer.compute(normalized, name);
            if (score >= threshold) {
                collect(results, name, score, MatchStage.TOKEN);
                resolved.add(name);
            }
        }

        results.sort(BY_SCORE_DESC);
        List<MatchResult> top = results.size() > maxResults ? results.subList(0, maxResults) : results;

        log.debug("search.completed query='{}' normalized='{}' candidates={} scored={} matches={} returned={}",
                query, normalized, candidates.size(), scored, results.size(), top.size());
        return List.copyOf(top);
    }

    /**
     * Returns the best match if it reaches the threshold. Absence is not an error.
     */
    public Optional<MatchResult> bestMatch(String name, double threshold) {
        List<MatchResult> results = search(name, threshold, 1);
        if (!results.isEmpty() && results.get(0).score() >= threshold) {
            return Optional.of(results.get(0));
        }
        return Optional.empty();
    }

    /**
     * Returns the sponsor record the name most plausibly refers to, if its score
     * reaches the threshold.
     */
    public Optional<SponsorRecord> isSponsor(String name, double threshold) {
        return bestMatch(name, threshold).map(MatchResult::record);
    }

    /**
     * {@link #isSponsor(String, double)} at the confirmed threshold of {@value #DEFAULT_CHECK_THRESHOLD}.
     */
    public Optional<SponsorRecord> isSponsor(String name) {
        return isSponsor(name, DEFAULT_CHECK_THRESHOLD);
    }

    public SponsorRegistry getRegistry() {
        return registry;
    }

    private void collect(List<MatchResult> results, String normalizedName, double score, MatchStage stage) {
        for (SponsorRecord record : registry.recordsFor(normalizedName)) {
            results.add(new MatchResult(record, score, stage));
        }
    }
}
