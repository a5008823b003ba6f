package com.sponsor.lookup.format;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * UK-focused search links for a sponsor, built from its name and location.
 * Links are search URLs only; nothing is fetched.
 */
public final class ExternalLinks {

    public static final String DEFAULT_LOCATION = "United Kingdom";

    private ExternalLinks() {
        // Utility class
    }

    /**
     * Builds the link map. Keys are stable identifiers; {@code source} and
     * {@code location_used} describe how the links were built.
     *
     * @param companyName sponsor name
     * @param city        optional town or city
     * @param county      optional county
     */
    public static Map<String, String> forSponsor(String companyName, String city, String county) {
        List<String> locationParts = new ArrayList<>();
        if (city != null && !city.isBlank()) {
            locationParts.add(city.strip());
        }
        if (county != null && !county.isBlank()) {
            locationParts.add(county.strip());
        }
        String location = String.join(", ", locationParts);
        boolean hasLocation = !location.isEmpty();

        String company = quote(companyName);
        String companyWithLocation = hasLocation ? quote(companyName + " " + location + " UK") : company;
        String jobsLocation = hasLocation ? quote(location) : "United+Kingdom";
        String mapsQuery = hasLocation ? quote(companyName + " " + location) : company;

        Map<String, String> links = new LinkedHashMap<>();
        links.put("linkedin_search", "https://www.linkedin.com/search/results/companies/?keywords=" + company
                + "&location=United%20Kingdom");
        links.put("linkedin_jobs", "https://www.linkedin.com/jobs/search?keywords=" + company
                + "&location=United%20Kingdom");
        links.put("indeed_jobs", "https://uk.indeed.com/jobs?q=" + company + "&l=" + jobsLocation);
        links.put("indeed_company", "https://uk.indeed.com/cmp/" + company);
        links.put("glassdoor_overview", "https://www.glassdoor.co.uk/Overview/Working-at-" + company + "-EI_IE.htm");
        links.put("glassdoor_jobs", "https://www.glassdoor.co.uk/Search/results.htm?keyword=" + company);
        links.put("companies_house", "https://find-and-update.company-information.service.gov.uk/search?q=" + company);
        links.put("google", "https://www.google.com/search?q=" + companyWithLocation);
        links.put("google_maps", "https://www.google.com/maps/search/" + mapsQuery);
        links.put("reed", "https://www.reed.co.uk/jobs/" + company + "-jobs");
        links.put("totaljobs", "https://www.totaljobs.com/jobs/" + company);
        links.put("cwjobs", "https://www.cwjobs.co.uk/jobs/" + company);
        links.put("source", "uk_specific");
        links.put("location_used", hasLocation ? location : DEFAULT_LOCATION);
        return Collections.unmodifiableMap(links);
    }

    /**
     * Percent-encodes for a URL path or query value; spaces become %20 and '/' is kept.
     */
    static String quote(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%2F", "/");
    }
}
