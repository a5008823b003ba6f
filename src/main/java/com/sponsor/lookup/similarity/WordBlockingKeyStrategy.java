package com.sponsor.lookup.similarity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Uses every whitespace-separated word longer than {@value #MIN_EXCLUSIVE_LENGTH}
 * characters as a blocking key, so "a", "of" and "uk" are never keys.
 */
public class WordBlockingKeyStrategy implements BlockingKeyStrategy {

    public static final int MIN_EXCLUSIVE_LENGTH = 2;

    @Override
    public Set<String> generateKeys(String normalizedName) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedName == null || normalizedName.isBlank()) {
            return keys;
        }
        for (String word : JaccardSimilarity.tokenize(normalizedName)) {
            if (word.length() > MIN_EXCLUSIVE_LENGTH) {
                keys.add(word);
            }
        }
        return keys;
    }
}
