package com.sponsor.lookup.api;

import com.sponsor.lookup.cache.CacheStats;
import com.sponsor.lookup.cache.CaffeineSearchCache;
import com.sponsor.lookup.cache.NoOpSearchCache;
import com.sponsor.lookup.cache.SearchCache;
import com.sponsor.lookup.core.model.MatchResult;
import com.sponsor.lookup.core.model.SponsorRecord;
import com.sponsor.lookup.format.ResultDeduplicator;
import com.sponsor.lookup.health.HealthStatus;
import com.sponsor.lookup.health.RegistryHealthCheck;
import com.sponsor.lookup.logging.LogContext;
import com.sponsor.lookup.matching.SponsorMatcher;
import com.sponsor.lookup.metrics.MetricsService;
import com.sponsor.lookup.metrics.NoOpMetricsService;
import com.sponsor.lookup.metrics.QueryOperation;
import com.sponsor.lookup.registry.CsvRegistryLoader;
import com.sponsor.lookup.registry.RegistryLoader;
import com.sponsor.lookup.registry.SponsorRegistry;
import com.sponsor.lookup.similarity.SimilarityAlgorithm;
import com.sponsor.lookup.similarity.TokenBoostScorer;
import com.sponsor.lookup.url.CompanyUrlExtractor;
import com.sponsor.lookup.url.UrlExtraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point: the operations the REST resource and the CLI call.
 *
 * <p>The registry is loaded, or supplied, when {@link Builder#build()} runs, so
 * a constructed instance is always ready to answer queries. Instances are
 * thread-safe.</p>
 *
 * <pre>
 * SponsorLookup lookup = SponsorLookup.builder()
 *     .csvPath(Path.of("uk_sponsors.csv"))
 *     .build();
 *
 * List&lt;MatchResult&gt; matches = lookup.search("Barclays");
 * Optional&lt;SponsorRecord&gt; sponsor = lookup.isSponsor("HSBC UK Bank");
 * Optional&lt;String&gt; company = lookup.extractCompany("https://www.linkedin.com/company/monzo-bank");
 * </pre>
 */
public class SponsorLookup {
    private static final Logger log = LoggerFactory.getLogger(SponsorLookup.class);

    private final SponsorRegistry registry;
    private final SponsorMatcher matcher;
    private final CompanyUrlExtractor urlExtractor;
    private final LookupOptions options;
    private final SearchCache cache;
    private final MetricsService metricsService;
    private final RegistryHealthCheck healthCheck;

    private SponsorLookup(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        if (builder.registry != null) {
            this.registry = builder.registry;
        } else {
            RegistryLoader loader = builder.loader != null ? builder.loader : new CsvRegistryLoader();
            try (LogContext ignored = LogContext.forLoad(String.valueOf(builder.csvPath))) {
                long start = System.nanoTime();
                this.registry = loader.load(builder.csvPath);
                log.info("SponsorLookup registry ready in {} ms",
                        Duration.ofNanos(System.nanoTime() - start).toMillis());
            }
        }

        SimilarityAlgorithm scorer = builder.scorer != null ? builder.scorer : new TokenBoostScorer();
        this.matcher = new SponsorMatcher(registry, scorer);
        this.urlExtractor = builder.urlExtractor != null ? builder.urlExtractor : new CompanyUrlExtractor();

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (options.getCacheConfig().enabled()) {
            this.cache = new CaffeineSearchCache(options.getCacheConfig());
        } else {
            this.cache = new NoOpSearchCache();
        }

        this.healthCheck = new RegistryHealthCheck(registry);
        metricsService.recordRegistrySize(registry.size());

        log.info("SponsorLookup initialized: sponsors={} names={} searchThreshold={} checkThreshold={}",
                registry.size(), registry.distinctNameCount(),
                options.getSearchThreshold(), options.getCheckThreshold());
    }

    // ========== Search ==========

    /**
     * Searches with the configured threshold and result limit.
     */
    public List<MatchResult> search(String query) {
        return search(query, options.getSearchThreshold(), options.getMaxResults());
    }

    /**
     * Ranked matches for a free-text company name, best first.
     */
    public List<MatchResult> search(String query, double threshold, int maxResults) {
        try (LogContext ignored = LogContext.forQuery(LogContext.generateCorrelationId(), "search")) {
            long start = System.nanoTime();
            List<MatchResult> results = cachedSearch(query, threshold, maxResults);
            record(QueryOperation.SEARCH, start, results);
            log.debug("search.completed query='{}' threshold={} results={}", query, threshold, results.size());
            return results;
        }
    }

    /**
     * Searches a pool of {@link LookupOptions#getCandidatePoolSize()} matches, keeps the
     * best entry per company name and returns at most {@code limit} of them.
     */
    public List<MatchResult> searchDeduplicated(String query, double threshold, int limit) {
        List<MatchResult> pool = search(query, threshold, Math.max(limit, options.getCandidatePoolSize()));
        List<MatchResult> deduplicated = ResultDeduplicator.deduplicate(pool);
        return deduplicated.size() > limit ? deduplicated.subList(0, limit) : deduplicated;
    }

    // ========== Sponsor check ==========

    /**
     * The sponsor a name refers to, at the configured check threshold.
     */
    public Optional<SponsorRecord> isSponsor(String name) {
        return isSponsor(name, options.getCheckThreshold());
    }

    public Optional<SponsorRecord> isSponsor(String name, double threshold) {
        return check(name, threshold).map(MatchResult::record);
    }

    /**
     * Best match for a name if it reaches the threshold; empty means "not a sponsor".
     */
    public Optional<MatchResult> check(String name, double threshold) {
        try (LogContext ignored = LogContext.forQuery(LogContext.generateCorrelationId(), "check")) {
            long start = System.nanoTime();
            Optional<MatchResult> best = bestMatch(name, threshold);
            record(QueryOperation.CHECK, start, best.map(List::of).orElse(List.of()));
            log.debug("check.completed name='{}' threshold={} sponsor={}",
                    name, threshold, best.map(MatchResult::name).orElse(null));
            return best;
        }
    }

    // ========== URL ==========

    public Optional<String> extractCompany(String url) {
        return urlExtractor.extractCompany(url);
    }

    /**
     * Extracts the company from a job posting URL and checks it at the configured
     * check threshold.
     */
    public UrlCheckResult checkUrl(String url) {
        try (LogContext ignored = LogContext.forUrl(LogContext.generateCorrelationId(), url)) {
            long start = System.nanoTime();
            UrlExtraction extraction = urlExtractor.explain(url);
            metricsService.recordUrlExtraction(extraction.source());

            MatchResult match = extraction.company()
                    .flatMap(company -> bestMatch(company, options.getCheckThreshold()))
                    .orElse(null);
            record(QueryOperation.URL, start, match != null ? List.of(match) : List.of());
            log.debug("url.checked url={} source={} company='{}' sponsor={}", url, extraction.source(),
                    extraction.companyName(), match != null ? match.name() : null);
            return new UrlCheckResult(url, extraction.companyName(), extraction.source(), match);
        }
    }

    // ========== Introspection ==========

    public RegistryStatistics statistics() {
        return RegistryStatistics.from(registry);
    }

    public HealthStatus health() {
        return healthCheck.check();
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public SponsorRegistry getRegistry() {
        return registry;
    }

    public LookupOptions getOptions() {
        return options;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    // ========== Internal ==========

    private Optional<MatchResult> bestMatch(String name, double threshold) {
        List<MatchResult> results = cachedSearch(name, threshold, 1);
        if (!results.isEmpty() && results.get(0).score() >= threshold) {
            return Optional.of(results.get(0));
        }
        return Optional.empty();
    }

    private List<MatchResult> cachedSearch(String query, double threshold, int maxResults) {
        String normalized = registry.normalize(query);
        if (normalized.isEmpty()) {
            return List.of();
        }
        SearchCache.SearchKey key = new SearchCache.SearchKey(normalized, threshold, maxResults);
        Optional<List<MatchResult>> cached = cache.get(key);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();
        List<MatchResult> results = matcher.search(query, threshold, maxResults);
        cache.put(key, results);
        return results;
    }

    private void record(QueryOperation operation, long startNanos, List<MatchResult> results) {
        metricsService.recordQuery(operation, Duration.ofNanos(System.nanoTime() - startNanos), results.size());
        if (!results.isEmpty()) {
            metricsService.recordTopScore(results.get(0).score());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SponsorRegistry registry;
        private Path csvPath;
        private RegistryLoader loader;
        private LookupOptions options = LookupOptions.defaults();
        private MetricsService metricsService;
        private SearchCache cache;
        private CompanyUrlExtractor urlExtractor;
        private SimilarityAlgorithm scorer;

        /**
         * Uses an already built registry instead of loading one.
         */
        public Builder registry(SponsorRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder csvPath(Path csvPath) {
            this.csvPath = csvPath;
            return this;
        }

        public Builder loader(RegistryLoader loader) {
            this.loader = loader;
            return this;
        }

        public Builder options(LookupOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder searchCache(SearchCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder urlExtractor(CompanyUrlExtractor urlExtractor) {
            this.urlExtractor = urlExtractor;
            return this;
        }

        public Builder scorer(SimilarityAlgorithm scorer) {
            this.scorer = scorer;
            return this;
        }

        /**
         * Builds the lookup, loading the registry from {@link #csvPath(Path)} if none was supplied.
         *
         * @throws com.sponsor.lookup.registry.DataSourceException if the CSV cannot be loaded
         */
        public SponsorLookup build() {
            if (registry == null && csvPath == null) {
                throw new IllegalStateException("Either registry or csvPath is required");
            }
            return new SponsorLookup(this);
        }
    }
}
