package com.sponsor.lookup.cache;

/**
 * Snapshot of search cache counters.
 *
 * @param hitCount      searches answered from the cache
 * @param missCount     searches that ran the matcher
 * @param evictionCount entries dropped for size or age
 * @param size          entries currently held (estimate)
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    static CacheStats from(com.github.benmanes.caffeine.cache.stats.CacheStats stats, long size) {
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), size);
    }

    public long requestCount() {
        return hitCount + missCount;
    }

    public double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) hitCount / requests;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
