package com.sponsor.lookup.metrics;

import com.sponsor.lookup.url.ExtractionSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordQuery(QueryOperation.SEARCH, Duration.ofMillis(3), 5);
                noOp.recordTopScore(0.9);
                noOp.recordUrlExtraction(ExtractionSource.REFUSED);
                noOp.recordRegistrySize(100);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
            assertEquals(0, noOp.queryCount());
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count and time queries per operation")
        void recordQuery() {
            metrics.recordQuery(QueryOperation.SEARCH, Duration.ofMillis(4), 3);
            metrics.recordQuery(QueryOperation.SEARCH, Duration.ofMillis(6), 0);
            metrics.recordQuery(QueryOperation.CHECK, Duration.ofMillis(2), 1);

            Counter search = registry.find("sponsor.query.count").tag("operation", "search").counter();
            Timer searchTimer = registry.find("sponsor.query.duration").tag("operation", "search").timer();
            Counter url = registry.find("sponsor.query.count").tag("operation", "url").counter();

            assertNotNull(search);
            assertEquals(2.0, search.count());
            assertNotNull(searchTimer);
            assertEquals(2, searchTimer.count());
            assertNotNull(url);
            assertEquals(0.0, url.count());
            assertEquals(3, metrics.queryCount());
        }

        @Test
        @DisplayName("Should summarize result counts and top scores")
        void recordDistributions() {
            metrics.recordQuery(QueryOperation.SEARCH, Duration.ofMillis(1), 4);
            metrics.recordTopScore(0.9);
            metrics.recordTopScore(0.7);

            DistributionSummary results = registry.find("sponsor.query.results").summary();
            DistributionSummary scores = registry.find("sponsor.query.top.score").summary();

            assertNotNull(results);
            assertEquals(4.0, results.totalAmount());
            assertNotNull(scores);
            assertEquals(2, scores.count());
            assertEquals(0.9, scores.max(), 1e-9);
        }

        @Test
        @DisplayName("Should count URL extraction outcomes by source")
        void recordUrlExtraction() {
            metrics.recordUrlExtraction(ExtractionSource.PATH_PATTERN);
            metrics.recordUrlExtraction(ExtractionSource.REFUSED);
            metrics.recordUrlExtraction(ExtractionSource.REFUSED);

            Counter refused = registry.find("sponsor.url.extraction").tag("source", "refused").counter();
            Counter path = registry.find("sponsor.url.extraction").tag("source", "path_pattern").counter();

            assertNotNull(refused);
            assertEquals(2.0, refused.count());
            assertNotNull(path);
            assertEquals(1.0, path.count());
        }

        @Test
        @DisplayName("Should expose the registry size as a gauge")
        void recordRegistrySize() {
            metrics.recordRegistrySize(125_000);

            Gauge gauge = registry.find("sponsor.registry.records").gauge();
            assertNotNull(gauge);
            assertEquals(125_000.0, gauge.value());
        }

        @Test
        @DisplayName("Should count cache hits and misses")
        void recordCache() {
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.find("sponsor.cache.hit").counter().count());
            assertEquals(2.0, registry.find("sponsor.cache.miss").counter().count());
        }
    }
}
