package com.sponsor.lookup.similarity;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity (token overlap).
 * Computes similarity as |intersection| / |union| of word tokens,
 * and 0.0 when either side has no tokens.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return compute(tokenize(s1), tokenize(s2));
    }

    /**
     * Computes the index over pre-tokenized sets.
     */
    public double compute(Set<String> tokens1, Set<String> tokens2) {
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = tokens1.size() + tokens2.size() - intersectionSize;

        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    /**
     * Splits a normalized name on whitespace into an ordered set of tokens.
     */
    public static Set<String> tokenize(String s) {
        Set<String> tokenSet = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(s)) {
            if (!token.isEmpty()) {
                tokenSet.add(token);
            }
        }
        return tokenSet;
    }
}
