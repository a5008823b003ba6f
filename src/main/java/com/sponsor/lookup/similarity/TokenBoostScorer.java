package com.sponsor.lookup.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Scores a word-index candidate against a query.
 *
 * <p>The base score is the Jaccard index of the two token sets. Two boosts can
 * lift it, and the highest value wins:</p>
 * <ul>
 *   <li>{@value #PREFIX_BOOST} when a query token is a prefix of a candidate token or vice versa</li>
 *   <li>{@value #SUBSTRING_BOOST} when a query token of at least {@value #MIN_SUBSTRING_LENGTH}
 *       characters occurs inside a candidate token (abbreviations such as "hsbc")</li>
 * </ul>
 */
public class TokenBoostScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(TokenBoostScorer.class);

    public static final double PREFIX_BOOST = 0.7;
    public static final double SUBSTRING_BOOST = 0.75;
    public static final int MIN_SUBSTRING_LENGTH = 3;

    private final JaccardSimilarity jaccard;

    public TokenBoostScorer() {
        this.jaccard = new JaccardSimilarity();
    }

    @Override
    public double compute(String query, String candidate) {
        if (query == null || candidate == null) {
            return 0.0;
        }
        return computeWithBreakdown(query, candidate).finalScore();
    }

    @Override
    public String getName() {
        return "TokenBoost";
    }

    /**
     * Computes the score together with the components that produced it.
     */
    public ScoreBreakdown computeWithBreakdown(String query, String candidate) {
        Set<String> queryTokens = JaccardSimilarity.tokenize(query);
        Set<String> candidateTokens = JaccardSimilarity.tokenize(candidate);

        double base = jaccard.compute(queryTokens, candidateTokens);
        boolean prefix = false;
        boolean substring = false;
        for (String qt : queryTokens) {
            for (String nt : candidateTokens) {
                if (nt.startsWith(qt) || qt.startsWith(nt)) {
                    prefix = true;
                }
                if (qt.length() >= MIN_SUBSTRING_LENGTH && nt.contains(qt)) {
                    substring = true;
                }
            }
            if (prefix && substring) {
                break;
            }
        }

        double score = base;
        if (prefix) {
            score = Math.max(score, PREFIX_BOOST);
        }
        if (substring) {
            score = Math.max(score, SUBSTRING_BOOST);
        }

        log.trace("Token scores for '{}' vs '{}': jaccard={}, prefix={}, substring={}, final={}",
                query, candidate, base, prefix, substring, score);

        return new ScoreBreakdown(base, prefix, substring, score);
    }

    /**
     * Detailed breakdown of a candidate score.
     */
    public record ScoreBreakdown(
            double jaccardScore,
            boolean prefixBoosted,
            boolean substringBoosted,
            double finalScore
    ) {
        @Override
        public String toString() {
            return String.format(
                    "ScoreBreakdown{jaccard=%.4f, prefixBoost=%s, substringBoost=%s, final=%.4f}",
                    jaccardScore, prefixBoosted, substringBoosted, finalScore);
        }
    }
}
