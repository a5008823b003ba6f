package com.sponsor.lookup.url;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Built-in tables used by {@link CompanyUrlExtractor}. Every list is ordered;
 * the first entry that applies wins.
 */
public final class DefaultUrlRules {

    private DefaultUrlRules() {
        // Utility class
    }

    /**
     * Careers hosts whose company is known outright, matched as a substring of the host.
     */
    public static Map<String, String> knownCompanyDomains() {
        Map<String, String> domains = new LinkedHashMap<>();
        domains.put("careers.google.com", "Google");
        domains.put("jobs.apple.com", "Apple");
        domains.put("careers.microsoft.com", "Microsoft");
        domains.put("amazon.jobs", "Amazon");
        domains.put("careers.barclays.co.uk", "Barclays");
        domains.put("jobs.hsbc.co.uk", "HSBC");
        domains.put("careers.nhs.uk", "NHS");
        domains.put("jobs.tesco.com", "Tesco");
        domains.put("careers.sainsburys.co.uk", "Sainsburys");
        return domains;
    }

    /**
     * Job-board company pages that carry the company slug in the path.
     */
    public static List<UrlPatternRule> companyPathRules() {
        return List.of(
                UrlPatternRule.of("linkedin", "linkedin\\.com/company/([^/]+)/?(?:jobs|about)?$"),
                UrlPatternRule.of("indeed", "indeed\\.(?:com|co\\.uk)/cmp/([^/]+)"),
                UrlPatternRule.of("glassdoor", "glassdoor\\.(?:com|co\\.uk)/overview/working-at-([^-]+)-"),
                UrlPatternRule.of("reed", "reed\\.co\\.uk/company/([^/]+)"),
                UrlPatternRule.of("totaljobs", "totaljobs\\.com/company/([^/]+)")
        );
    }

    /**
     * Host shape {@code <company>.careers.}, {@code .career.}, {@code .jobs.}, {@code .apply.}
     * or {@code .workday.}; group 1 is the company label.
     */
    public static Pattern careerSubdomainPattern() {
        return Pattern.compile("^([^.]+)\\.(?:careers?|jobs|apply|workday)\\.");
    }

    /**
     * Job detail views that never encode the company; extraction is refused for these.
     */
    public static List<String> unreliableUrlFragments() {
        return List.of(
                "indeed.com/viewjob",
                "indeed.co.uk/viewjob",
                "linkedin.com/jobs/view",
                "glassdoor.com/job",
                "reed.co.uk/jobs/"
        );
    }
}
