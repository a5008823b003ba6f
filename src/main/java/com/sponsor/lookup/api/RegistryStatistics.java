package com.sponsor.lookup.api;

import com.sponsor.lookup.core.model.SponsorRecord;
import com.sponsor.lookup.registry.SponsorRegistry;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Aggregate counts over a loaded registry.
 *
 * @param totalSponsors   number of records
 * @param uniqueCompanies number of distinct organisation names
 * @param topRoutes       the {@value #TOP_ROUTES} most common routes, most common first
 * @param ratings         record count per rating, in first-seen order
 */
public record RegistryStatistics(
        int totalSponsors,
        int uniqueCompanies,
        Map<String, Long> topRoutes,
        Map<String, Long> ratings
) {
    public static final int TOP_ROUTES = 10;

    public RegistryStatistics {
        topRoutes = Collections.unmodifiableMap(new LinkedHashMap<>(topRoutes));
        ratings = Collections.unmodifiableMap(new LinkedHashMap<>(ratings));
    }

    public static RegistryStatistics from(SponsorRegistry registry) {
        Set<String> names = new HashSet<>();
        for (SponsorRecord record : registry.sponsors()) {
            names.add(record.name());
        }

        Map<String, Long> routes = countBy(registry, SponsorRecord::route);
        Map<String, Long> topRoutes = routes.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(TOP_ROUTES)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (a, b) -> a, LinkedHashMap::new));

        return new RegistryStatistics(registry.size(), names.size(), topRoutes,
                countBy(registry, SponsorRecord::rating));
    }

    private static Map<String, Long> countBy(SponsorRegistry registry, Function<SponsorRecord, String> field) {
        return registry.sponsors().stream()
                .collect(Collectors.groupingBy(field, LinkedHashMap::new, Collectors.counting()));
    }
}
