package com.sponsor.lookup.cache;

import com.sponsor.lookup.core.model.MatchResult;

import java.util.List;
import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpSearchCache implements SearchCache {

    @Override
    public Optional<List<MatchResult>> get(SearchKey key) {
        return Optional.empty();
    }

    @Override
    public void put(SearchKey key, List<MatchResult> results) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
