package com.sponsor.lookup.metrics;

import com.sponsor.lookup.url.ExtractionSource;

import java.time.Duration;

/**
 * Interface for recording lookup metrics.
 * The default {@link NoOpMetricsService} records nothing.
 */
public interface MetricsService {

    void recordQuery(QueryOperation operation, Duration duration, int resultCount);

    void recordTopScore(double score);

    void recordUrlExtraction(ExtractionSource source);

    void recordRegistrySize(int records);

    void recordCacheHit();

    void recordCacheMiss();

    /**
     * Total number of queries recorded across all operations.
     */
    long queryCount();
}
