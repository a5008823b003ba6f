package com.sponsor.lookup.similarity;

/**
 * Scores a normalized query against a normalized registry name.
 * Scores lie in [0, 1]; 1.0 means the names are interchangeable.
 */
public interface SimilarityAlgorithm {

    double compute(String query, String candidate);

    /**
     * Short label used in logs and metrics tags.
     */
    String getName();
}
