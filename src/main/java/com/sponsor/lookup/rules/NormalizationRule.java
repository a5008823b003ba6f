package com.sponsor.lookup.rules;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A regex replacement applied to company names. Lower priorities run first.
 * Patterns are case-insensitive and use Unicode character classes, so {@code \w}
 * and {@code \b} behave the same for accented names as for ASCII ones.
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE
            | Pattern.UNICODE_CASE
            | Pattern.UNICODE_CHARACTER_CLASS;

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    public static NormalizationRule of(String name, String regex, String replacement, int priority) {
        Objects.requireNonNull(regex, "pattern is required");
        return new NormalizationRule(name, Pattern.compile(regex, FLAGS), replacement, priority);
    }

    /**
     * Removes every whole-word occurrence of {@code word}, ignoring case.
     */
    public static NormalizationRule removeWord(String word, int priority) {
        return of("remove-" + word.toLowerCase(Locale.ROOT),
                "\\b" + Pattern.quote(word) + "\\b", "", priority);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }
}
