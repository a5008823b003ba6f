package com.sponsor.lookup.health;

import com.sponsor.lookup.registry.SponsorRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports whether a registry is loaded and how large it is.
 * An empty registry answers every query with "not found", so it is reported as degraded.
 */
public class RegistryHealthCheck implements HealthCheck {

    private final SponsorRegistry registry;

    public RegistryHealthCheck(SponsorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String getName() {
        return "registry";
    }

    @Override
    public HealthStatus check() {
        if (registry == null) {
            return HealthStatus.down("Registry not loaded");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sponsorsLoaded", registry.size());
        details.put("distinctNames", registry.distinctNameCount());
        details.put("indexedWords", registry.indexedWordCount());
        details.put("source", registry.getLoadResult().source());
        if (registry.isEmpty()) {
            return HealthStatus.degraded("Registry contains no sponsors", details);
        }
        return HealthStatus.up("OK", details);
    }
}
