package com.sponsor.lookup.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sponsor.lookup.core.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed search cache.
 */
public class CaffeineSearchCache implements SearchCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineSearchCache.class);

    private final Cache<SearchKey, List<MatchResult>> cache;

    public CaffeineSearchCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttl={}", config.maxSize(), config.ttl());
    }

    @Override
    public Optional<List<MatchResult>> get(SearchKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(SearchKey key, List<MatchResult> results) {
        cache.put(key, List.copyOf(results));
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated");
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.from(cache.stats(), cache.estimatedSize());
    }
}
