package com.sponsor.lookup.url;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named pattern whose first capture group is the company slug of a URL path.
 * Patterns are written in lower case and matched against the lower-cased URL.
 */
public record UrlPatternRule(String name, Pattern pattern) {

    public UrlPatternRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        if (pattern.matcher("").groupCount() < 1) {
            throw new IllegalArgumentException("Pattern for rule '" + name + "' needs a capture group");
        }
    }

    public static UrlPatternRule of(String name, String regex) {
        return new UrlPatternRule(name, Pattern.compile(regex));
    }

    /**
     * Returns the captured slug if the pattern occurs anywhere in the URL.
     */
    public Optional<String> capture(String lowerCaseUrl) {
        Matcher matcher = pattern.matcher(lowerCaseUrl);
        if (matcher.find()) {
            return Optional.ofNullable(matcher.group(1));
        }
        return Optional.empty();
    }
}
