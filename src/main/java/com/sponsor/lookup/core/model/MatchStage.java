package com.sponsor.lookup.core.model;

/**
 * Stage of the search pipeline that produced a match.
 */
public enum MatchStage {
    /**
     * Normalized query equals the normalized registry name.
     */
    EXACT,

    /**
     * Normalized query is a fragment of a longer registry name.
     */
    SUBSTRING,

    /**
     * Registry name is contained in a longer query (legal-suffix noise in the query).
     */
    CONTAINED,

    /**
     * Word-index candidate scored by token overlap and prefix/abbreviation boosts.
     */
    TOKEN
}
