package com.sponsor.lookup.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Applies an ordered list of {@link NormalizationRule}s to company names.
 * Rules run in priority order (lower number first).
 *
 * <p>Instances are immutable once constructed and may be shared between threads.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Gets all rules in application order.
     */
    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Produces the canonical index key for a name: lowercased, rules applied,
     * whitespace collapsed and trimmed. Idempotent.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        return collapse(applyRules(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Applies the rules without changing case, then collapses whitespace.
     * Used where the result is shown to a user.
     */
    public String clean(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        return collapse(applyRules(name));
    }

    private String applyRules(String input) {
        String result = input;
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }
        return result;
    }

    private static String collapse(String input) {
        return WHITESPACE.matcher(input).replaceAll(" ").trim();
    }
}
