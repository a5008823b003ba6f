package com.sponsor.lookup.cache;

import com.sponsor.lookup.core.model.MatchResult;

import java.util.List;
import java.util.Optional;

/**
 * Cache of search results. The registry never changes after load, so entries
 * only leave the cache through size or age eviction.
 */
public interface SearchCache {

    /**
     * Gets cached results for a search.
     */
    Optional<List<MatchResult>> get(SearchKey key);

    /**
     * Caches the results of a search.
     */
    void put(SearchKey key, List<MatchResult> results);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Identifies a search by its normalized query and parameters.
     */
    record SearchKey(String normalizedQuery, double threshold, int maxResults) {}
}
