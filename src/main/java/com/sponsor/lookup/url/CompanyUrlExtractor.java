package com.sponsor.lookup.url;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a company name from a job posting URL without fetching it.
 *
 * <p>Steps, first success wins:</p>
 * <ol>
 *   <li>known careers domain in the host</li>
 *   <li>company page path patterns of the major job boards</li>
 *   <li>career subdomain ({@code acme.careers.example.com})</li>
 *   <li>refusal for job detail views that never name the company</li>
 * </ol>
 *
 * <p>Returning nothing is the expected outcome for most job board URLs. A guessed
 * name would silently produce a wrong sponsor answer downstream.</p>
 */
public class CompanyUrlExtractor {
    private static final Logger log = LoggerFactory.getLogger(CompanyUrlExtractor.class);
    private static final Pattern AUTHORITY = Pattern.compile("^[a-z][a-z0-9+.\\-]*://([^/?#]*)");
    private static final String WWW = "www";

    private final Map<String, String> knownDomains;
    private final List<UrlPatternRule> pathRules;
    private final Pattern careerSubdomain;
    private final List<String> unreliableFragments;
    private final CompanyNameCleaner cleaner;

    public CompanyUrlExtractor() {
        this(DefaultUrlRules.knownCompanyDomains(),
                DefaultUrlRules.companyPathRules(),
                DefaultUrlRules.careerSubdomainPattern(),
                DefaultUrlRules.unreliableUrlFragments(),
                new CompanyNameCleaner());
    }

    public CompanyUrlExtractor(Map<String, String> knownDomains,
                               List<UrlPatternRule> pathRules,
                               Pattern careerSubdomain,
                               List<String> unreliableFragments,
                               CompanyNameCleaner cleaner) {
        this.knownDomains = new LinkedHashMap<>(knownDomains);
        this.pathRules = List.copyOf(pathRules);
        this.careerSubdomain = careerSubdomain;
        this.unreliableFragments = List.copyOf(unreliableFragments);
        this.cleaner = cleaner;
    }

    /**
     * Returns the company name if it can be determined with confidence.
     */
    public Optional<String> extractCompany(String url) {
        return explain(url).company();
    }

    /**
     * Runs the extraction and reports which step decided the outcome.
     */
    public UrlExtraction explain(String url) {
        if (url == null || url.isBlank()) {
            return UrlExtraction.none();
        }
        String lowerUrl = url.strip().toLowerCase(Locale.ROOT);
        String host = host(lowerUrl);

        for (Map.Entry<String, String> known : knownDomains.entrySet()) {
            if (host.contains(known.getKey())) {
                log.debug("url.extracted source=known-domain domain={} company='{}'", known.getKey(), known.getValue());
                return UrlExtraction.found(known.getValue(), ExtractionSource.KNOWN_DOMAIN, known.getKey());
            }
        }

        for (UrlPatternRule rule : pathRules) {
            Optional<String> slug = rule.capture(lowerUrl);
            if (slug.isPresent()) {
                Optional<String> company = cleaner.fromSlug(slug.get());
                if (company.isPresent()) {
                    log.debug("url.extracted source=path rule={} company='{}'", rule.name(), company.get());
                    return UrlExtraction.found(company.get(), ExtractionSource.PATH_PATTERN, rule.name());
                }
            }
        }

        Matcher subdomain = careerSubdomain.matcher(host);
        if (subdomain.find() && !WWW.equals(subdomain.group(1))) {
            Optional<String> company = cleaner.fromSlug(subdomain.group(1));
            if (company.isPresent()) {
                log.debug("url.extracted source=subdomain host={} company='{}'", host, company.get());
                return UrlExtraction.found(company.get(), ExtractionSource.CAREER_SUBDOMAIN, host);
            }
        }

        for (String fragment : unreliableFragments) {
            if (lowerUrl.contains(fragment)) {
                log.debug("url.refused fragment={} url={}", fragment, url);
                return UrlExtraction.refused(fragment);
            }
        }

        log.debug("url.unrecognized url={}", url);
        return UrlExtraction.none();
    }

    /**
     * Authority part of the URL (host, plus any port or user info); empty without a scheme.
     */
    static String host(String lowerCaseUrl) {
        Matcher matcher = AUTHORITY.matcher(lowerCaseUrl);
        return matcher.find() ? matcher.group(1) : "";
    }
}
