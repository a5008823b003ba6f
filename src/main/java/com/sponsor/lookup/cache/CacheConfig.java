package com.sponsor.lookup.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing of the search result cache. Entries expire {@code ttl} after they were written.
 */
public record CacheConfig(boolean enabled, long maxSize, Duration ttl) {

    public static final long DEFAULT_MAX_SIZE = 10_000;
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0, got " + maxSize);
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
    }

    public static CacheConfig of(long maxSize, long ttlSeconds) {
        return new CacheConfig(true, maxSize, Duration.ofSeconds(ttlSeconds));
    }

    public static CacheConfig defaults() {
        return new CacheConfig(true, DEFAULT_MAX_SIZE, DEFAULT_TTL);
    }

    public static CacheConfig disabled() {
        return defaults().withEnabled(false);
    }

    public CacheConfig withEnabled(boolean enabled) {
        return new CacheConfig(enabled, maxSize, ttl);
    }
}
