package com.sponsor.lookup.metrics;

import com.sponsor.lookup.url.ExtractionSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code sponsor.query.count}: Counter (tag: operation)</li>
 *   <li>{@code sponsor.query.duration}: Timer (tag: operation)</li>
 *   <li>{@code sponsor.query.results}: DistributionSummary of result counts</li>
 *   <li>{@code sponsor.query.top.score}: DistributionSummary of best scores</li>
 *   <li>{@code sponsor.url.extraction}: Counter (tag: source)</li>
 *   <li>{@code sponsor.registry.records}: Gauge</li>
 *   <li>{@code sponsor.cache.hit} / {@code sponsor.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Map<QueryOperation, Counter> queryCounters = new EnumMap<>(QueryOperation.class);
    private final Map<QueryOperation, Timer> queryTimers = new EnumMap<>(QueryOperation.class);
    private final Map<ExtractionSource, Counter> extractionCounters = new EnumMap<>(ExtractionSource.class);
    private final DistributionSummary resultCountSummary;
    private final DistributionSummary topScoreSummary;
    private final AtomicInteger registryRecords;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        for (QueryOperation operation : QueryOperation.values()) {
            String tag = operation.name().toLowerCase(Locale.ROOT);
            queryCounters.put(operation, Counter.builder("sponsor.query.count")
                    .description("Number of lookup queries")
                    .tag("operation", tag)
                    .register(registry));
            queryTimers.put(operation, Timer.builder("sponsor.query.duration")
                    .description("Duration of lookup queries")
                    .tag("operation", tag)
                    .register(registry));
        }
        for (ExtractionSource source : ExtractionSource.values()) {
            extractionCounters.put(source, Counter.builder("sponsor.url.extraction")
                    .description("URL company extraction outcomes")
                    .tag("source", source.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
        this.resultCountSummary = DistributionSummary.builder("sponsor.query.results")
                .description("Number of matches returned per query")
                .register(registry);
        this.topScoreSummary = DistributionSummary.builder("sponsor.query.top.score")
                .description("Best match score per query")
                .register(registry);
        this.registryRecords = registry.gauge("sponsor.registry.records", new AtomicInteger());
        this.cacheHitCounter = Counter.builder("sponsor.cache.hit")
                .description("Number of search cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("sponsor.cache.miss")
                .description("Number of search cache misses")
                .register(registry);
    }

    @Override
    public void recordQuery(QueryOperation operation, Duration duration, int resultCount) {
        queryCounters.get(operation).increment();
        queryTimers.get(operation).record(duration);
        resultCountSummary.record(resultCount);
    }

    @Override
    public void recordTopScore(double score) {
        topScoreSummary.record(score);
    }

    @Override
    public void recordUrlExtraction(ExtractionSource source) {
        extractionCounters.get(source).increment();
    }

    @Override
    public void recordRegistrySize(int records) {
        registryRecords.set(records);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public long queryCount() {
        double total = 0;
        for (Counter counter : queryCounters.values()) {
            total += counter.count();
        }
        return (long) total;
    }
}
