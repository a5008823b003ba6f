package com.sponsor.lookup.url;

import com.sponsor.lookup.rules.DefaultNormalizationRules;
import com.sponsor.lookup.rules.NormalizationEngine;

import java.util.Optional;

/**
 * Turns a URL slug into a presentable company name and rejects implausible ones.
 */
public class CompanyNameCleaner {

    private static final int MIN_LENGTH = 2;

    private final NormalizationEngine noiseWordCleaner;

    public CompanyNameCleaner() {
        this(DefaultNormalizationRules.createNoiseWordCleaner());
    }

    public CompanyNameCleaner(NormalizationEngine noiseWordCleaner) {
        this.noiseWordCleaner = noiseWordCleaner;
    }

    /**
     * Removes noise words (Jobs, Careers, Ltd, ...) as whole words, ignoring case.
     *
     * @return the cleaned name, or empty if fewer than two characters or no letter remain
     */
    public Optional<String> clean(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String cleaned = noiseWordCleaner.clean(name);
        if (cleaned.length() < MIN_LENGTH || cleaned.chars().noneMatch(Character::isLetter)) {
            return Optional.empty();
        }
        return Optional.of(cleaned);
    }

    /**
     * Replaces hyphens with spaces, title-cases the slug and cleans it.
     */
    public Optional<String> fromSlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        return clean(titleCase(slug.replace('-', ' ')));
    }

    /**
     * Upper-cases the first letter of every run of letters and lower-cases the rest,
     * so "o'neil-3m" becomes "O'Neil-3M".
     */
    public static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean previousLetter = false;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            boolean letter = Character.isLetter(cp);
            if (letter) {
                sb.appendCodePoint(previousLetter ? Character.toLowerCase(cp) : Character.toTitleCase(cp));
            } else {
                sb.appendCodePoint(cp);
            }
            previousLetter = letter;
            i += Character.charCount(cp);
        }
        return sb.toString();
    }
}
