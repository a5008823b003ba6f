package com.sponsor.lookup.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TokenBoostScorerTest {

    @Nested
    @DisplayName("Jaccard")
    class Jaccard {

        private final JaccardSimilarity jaccard = new JaccardSimilarity();

        @Test
        @DisplayName("Should compute token overlap")
        void testOverlap() {
            assertEquals(1.0, jaccard.compute("barclays bank", "bank barclays"), 1e-9);
            assertEquals(0.25, jaccard.compute("barclays bnk", "barclays bank plc"), 1e-9);
            assertEquals(0.0, jaccard.compute("tesco", "sainsburys"), 1e-9);
        }

        @Test
        @DisplayName("Should return 0 for empty token sets")
        void testEmpty() {
            assertEquals(0.0, jaccard.compute("", "barclays"));
            assertEquals(0.0, jaccard.compute(Set.of(), Set.of()));
            assertEquals(0.0, jaccard.compute(null, "barclays"));
        }

        @Test
        @DisplayName("Tokenize should drop empty tokens and duplicates")
        void testTokenize() {
            assertEquals(Set.of("a", "b"), JaccardSimilarity.tokenize("  a  b a "));
        }
    }

    @Nested
    @DisplayName("Boosts")
    class Boosts {

        private final TokenBoostScorer scorer = new TokenBoostScorer();

        @Test
        @DisplayName("Substring boost should apply to abbreviations inside a token")
        void testSubstringBoost() {
            TokenBoostScorer.ScoreBreakdown breakdown = scorer.computeWithBreakdown("hsbc", "hsbcnet services");

            assertTrue(breakdown.substringBoosted());
            assertEquals(TokenBoostScorer.SUBSTRING_BOOST, breakdown.finalScore(), 1e-9);
        }

        @Test
        @DisplayName("Prefix boost should apply in either direction")
        void testPrefixBoost() {
            TokenBoostScorer.ScoreBreakdown forward = scorer.computeWithBreakdown("ba", "barclays plc");
            TokenBoostScorer.ScoreBreakdown backward = scorer.computeWithBreakdown("barclaysuk", "barclays plc");

            assertTrue(forward.prefixBoosted());
            assertFalse(forward.substringBoosted());
            assertEquals(TokenBoostScorer.PREFIX_BOOST, forward.finalScore(), 1e-9);
            assertTrue(backward.prefixBoosted());
            assertEquals(TokenBoostScorer.PREFIX_BOOST, backward.finalScore(), 1e-9);
        }

        @Test
        @DisplayName("Short query tokens should not earn the substring boost")
        void testShortTokenNoSubstringBoost() {
            TokenBoostScorer.ScoreBreakdown breakdown = scorer.computeWithBreakdown("nh", "anhx");

            assertFalse(breakdown.substringBoosted());
            assertFalse(breakdown.prefixBoosted());
            assertEquals(0.0, breakdown.finalScore(), 1e-9);
        }

        @Test
        @DisplayName("A boost should never lower a higher Jaccard score")
        void testBoostIsFloor() {
            assertEquals(1.0, scorer.compute("monzo bank", "monzo bank"), 1e-9);
        }

        @Test
        @DisplayName("Misspelt word sharing a full word scores the substring boost")
        void testMisspelling() {
            assertEquals(0.75, scorer.compute("barclays bnk", "barclays bank plc"), 1e-9);
        }
    }

    @Test
    @DisplayName("Word blocking keys should skip words of two characters or fewer")
    void testWordBlockingKeys() {
        WordBlockingKeyStrategy strategy = new WordBlockingKeyStrategy();

        assertEquals(Set.of("hsbc", "bank", "plc"), strategy.generateKeys("hsbc uk bank plc"));
        assertTrue(strategy.generateKeys("uk of a").isEmpty());
        assertTrue(strategy.generateKeys(null).isEmpty());
    }
}
