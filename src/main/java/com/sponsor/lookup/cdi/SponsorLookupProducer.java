package com.sponsor.lookup.cdi;

import com.sponsor.lookup.api.LookupOptions;
import com.sponsor.lookup.api.SponsorLookup;
import com.sponsor.lookup.cache.CacheConfig;
import com.sponsor.lookup.metrics.MetricsService;
import com.sponsor.lookup.metrics.MicrometerMetricsService;
import com.sponsor.lookup.metrics.NoOpMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * CDI producer that wires the sponsor lookup from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus),
 * it reads configuration and produces a ready {@link SponsorLookup}. The register
 * CSV is loaded once when the bean is first used.</p>
 *
 * <pre>
 * sponsor-lookup.csv-path=/data/uk_sponsors.csv
 * sponsor-lookup.search.threshold=0.5
 * sponsor-lookup.check.threshold=0.8
 * </pre>
 *
 * <p>If the container provides a Micrometer {@link MeterRegistry}, query metrics
 * are recorded to it.</p>
 */
@ApplicationScoped
public class SponsorLookupProducer {

    private static final Logger log = LoggerFactory.getLogger(SponsorLookupProducer.class);

    // ── Register ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sponsor-lookup.csv-path", defaultValue = "uk_sponsors.csv")
    String csvPath;

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sponsor-lookup.search.threshold", defaultValue = "0.5")
    double searchThreshold;

    @Inject
    @ConfigProperty(name = "sponsor-lookup.search.max-results", defaultValue = "10")
    int maxResults;

    @Inject
    @ConfigProperty(name = "sponsor-lookup.search.candidate-pool", defaultValue = "50")
    int candidatePoolSize;

    @Inject
    @ConfigProperty(name = "sponsor-lookup.check.threshold", defaultValue = "0.8")
    double checkThreshold;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sponsor-lookup.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "sponsor-lookup.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "sponsor-lookup.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    @Inject
    Instance<MeterRegistry> meterRegistries;

    @Produces
    @ApplicationScoped
    public SponsorLookup sponsorLookup() {
        log.info("Producing SponsorLookup: csv={}", csvPath);

        LookupOptions options = LookupOptions.builder()
                .searchThreshold(searchThreshold)
                .maxResults(maxResults)
                .candidatePoolSize(candidatePoolSize)
                .checkThreshold(checkThreshold)
                .cacheConfig(CacheConfig.of(cacheMaxSize, cacheTtlSeconds).withEnabled(cacheEnabled))
                .build();

        return SponsorLookup.builder()
                .csvPath(Path.of(csvPath))
                .options(options)
                .metricsService(createMetricsService())
                .build();
    }

    private MetricsService createMetricsService() {
        if (meterRegistries != null && meterRegistries.isResolvable()) {
            log.info("Micrometer metrics enabled");
            return new MicrometerMetricsService(meterRegistries.get());
        }
        log.info("No MeterRegistry available, metrics disabled");
        return new NoOpMetricsService();
    }
}
