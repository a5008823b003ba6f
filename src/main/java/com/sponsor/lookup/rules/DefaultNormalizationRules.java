package com.sponsor.lookup.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rule sets for sponsor names.
 */
public final class DefaultNormalizationRules {

    /**
     * Words stripped from company names extracted out of URLs.
     */
    public static final List<String> NOISE_WORDS = List.of(
            "Jobs", "Careers", "Ltd", "Limited", "Inc", "Corp", "Corporation", "PLC", "LLC");

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates the engine that produces registry index keys.
     */
    public static NormalizationEngine createNameNormalizer() {
        return new NormalizationEngine(getNameRules());
    }

    /**
     * Creates the engine that removes job-board noise words from extracted names.
     */
    public static NormalizationEngine createNoiseWordCleaner() {
        return new NormalizationEngine(getNoiseWordRules());
    }

    /**
     * Rules applied to every indexed name and every query.
     */
    public static List<NormalizationRule> getNameRules() {
        return List.of(
                // Anything that is neither a word character nor whitespace
                NormalizationRule.of("strip-punctuation", "[^\\w\\s]", "", 10)
        );
    }

    /**
     * Whole-word removal of {@link #NOISE_WORDS}, in list order.
     */
    public static List<NormalizationRule> getNoiseWordRules() {
        List<NormalizationRule> rules = new ArrayList<>();
        int priority = 10;
        for (String word : NOISE_WORDS) {
            rules.add(NormalizationRule.removeWord(word, priority++));
        }
        return List.copyOf(rules);
    }
}
