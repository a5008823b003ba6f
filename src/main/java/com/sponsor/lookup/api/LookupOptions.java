package com.sponsor.lookup.api;

import com.sponsor.lookup.cache.CacheConfig;
import com.sponsor.lookup.core.model.ConfidenceBand;

/**
 * Default parameters for lookup operations.
 */
public class LookupOptions {

    private static final double DEFAULT_SEARCH_THRESHOLD = 0.5;
    private static final int DEFAULT_MAX_RESULTS = 10;
    private static final double DEFAULT_CHECK_THRESHOLD = ConfidenceBand.CONFIRMED_THRESHOLD;
    private static final int DEFAULT_CANDIDATE_POOL_SIZE = 50;

    private final double searchThreshold;
    private final int maxResults;
    private final double checkThreshold;
    private final int candidatePoolSize;
    private final CacheConfig cacheConfig;

    private LookupOptions(Builder builder) {
        this.searchThreshold = builder.searchThreshold;
        this.maxResults = builder.maxResults;
        this.checkThreshold = builder.checkThreshold;
        this.candidatePoolSize = builder.candidatePoolSize;
        this.cacheConfig = builder.cacheConfig;
    }

    /**
     * Minimum score for word-index candidates in a search.
     */
    public double getSearchThreshold() {
        return searchThreshold;
    }

    public int getMaxResults() {
        return maxResults;
    }

    /**
     * Minimum score for a sponsor check to report a sponsor.
     */
    public double getCheckThreshold() {
        return checkThreshold;
    }

    /**
     * Number of raw matches fetched before deduplication by company name.
     */
    public int getCandidatePoolSize() {
        return candidatePoolSize;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static LookupOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double searchThreshold = DEFAULT_SEARCH_THRESHOLD;
        private int maxResults = DEFAULT_MAX_RESULTS;
        private double checkThreshold = DEFAULT_CHECK_THRESHOLD;
        private int candidatePoolSize = DEFAULT_CANDIDATE_POOL_SIZE;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder searchThreshold(double searchThreshold) {
            validateThreshold(searchThreshold, "searchThreshold");
            this.searchThreshold = searchThreshold;
            return this;
        }

        public Builder maxResults(int maxResults) {
            validatePositive(maxResults, "maxResults");
            this.maxResults = maxResults;
            return this;
        }

        public Builder checkThreshold(double checkThreshold) {
            validateThreshold(checkThreshold, "checkThreshold");
            this.checkThreshold = checkThreshold;
            return this;
        }

        public Builder candidatePoolSize(int candidatePoolSize) {
            validatePositive(candidatePoolSize, "candidatePoolSize");
            this.candidatePoolSize = candidatePoolSize;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig != null ? cacheConfig : CacheConfig.disabled();
            return this;
        }

        public Builder cachingEnabled(boolean enabled) {
            this.cacheConfig = cacheConfig.withEnabled(enabled);
            return this;
        }

        public LookupOptions build() {
            return new LookupOptions(this);
        }

        static void validateThreshold(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
            }
        }

        static void validatePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0, got " + value);
            }
        }
    }
}
