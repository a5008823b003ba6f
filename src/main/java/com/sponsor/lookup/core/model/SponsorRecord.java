package com.sponsor.lookup.core.model;

import java.util.Objects;

/**
 * One row of the register of licensed sponsors.
 * Optional fields are never null; a missing column is stored as an empty string.
 */
public record SponsorRecord(
        String name,
        String city,
        String county,
        String rating,
        String route
) {
    public SponsorRecord {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        city = city != null ? city : "";
        county = county != null ? county : "";
        rating = rating != null ? rating : "";
        route = route != null ? route : "";
    }

    /**
     * Returns "city, county", or just the city when no county is recorded.
     */
    public String location() {
        if (county.isEmpty()) {
            return city;
        }
        if (city.isEmpty()) {
            return county;
        }
        return city + ", " + county;
    }
}
