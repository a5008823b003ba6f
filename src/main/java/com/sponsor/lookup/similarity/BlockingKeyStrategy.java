package com.sponsor.lookup.similarity;

import java.util.Set;

/**
 * Strategy interface for generating blocking keys from normalized names.
 * Blocking keys are used to narrow the candidate set for fuzzy matching,
 * avoiding a scoring pass over every registry name.
 *
 * <p>The same strategy must be applied when indexing registry names and when
 * looking up query candidates.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * Generates a set of blocking keys for a normalized name.
     *
     * @param normalizedName the normalized name
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(String normalizedName);
}
