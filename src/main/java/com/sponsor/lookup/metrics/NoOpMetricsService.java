package com.sponsor.lookup.metrics;

import com.sponsor.lookup.url.ExtractionSource;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordQuery(QueryOperation operation, Duration duration, int resultCount) {
    }

    @Override
    public void recordTopScore(double score) {
    }

    @Override
    public void recordUrlExtraction(ExtractionSource source) {
    }

    @Override
    public void recordRegistrySize(int records) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public long queryCount() {
        return 0;
    }
}
