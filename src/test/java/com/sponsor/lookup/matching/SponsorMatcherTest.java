package com.sponsor.lookup.matching;

import com.sponsor.lookup.SampleRegistry;
import com.sponsor.lookup.core.model.ConfidenceBand;
import com.sponsor.lookup.core.model.MatchResult;
import com.sponsor.lookup.core.model.MatchStage;
import com.sponsor.lookup.core.model.SponsorRecord;
import com.sponsor.lookup.registry.SponsorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SponsorMatcherTest {

    private SponsorMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new SponsorMatcher(SampleRegistry.load());
    }

    @Nested
    @DisplayName("Stages")
    class Stages {

        @Test
        @DisplayName("Exact match should return every record of the name once at 1.0")
        void testExactMatch() {
            List<MatchResult> results = matcher.search("barclays bank plc", 0.9, 10);

            assertEquals(2, results.size());
            assertTrue(results.stream().allMatch(r -> r.score() == SponsorMatcher.EXACT_SCORE));
            assertTrue(results.stream().allMatch(r -> r.stage() == MatchStage.EXACT));
            assertEquals("London", results.get(0).record().city());
            assertEquals("Northampton", results.get(1).record().city());
        }

        @Test
        @DisplayName("Exact match should ignore case and punctuation")
        void testExactMatchNormalized() {
            List<MatchResult> results = matcher.search("AMAZON UK SERVICES LTD", 0.5, 10);

            assertEquals("Amazon UK Services Ltd.", results.get(0).name());
            assertEquals(1.0, results.get(0).score());
        }

        @Test
        @DisplayName("Query contained in a name should score 0.9")
        void testSubstringMatch() {
            List<MatchResult> results = matcher.search("Barclays", 0.5, 10);

            assertEquals(2, results.size());
            assertEquals(SponsorMatcher.SUBSTRING_SCORE, results.get(0).score());
            assertEquals(MatchStage.SUBSTRING, results.get(0).stage());
        }

        @Test
        @DisplayName("Abbreviation should match the registered name as a substring")
        void testAbbreviation() {
            Optional<MatchResult> best = matcher.bestMatch("HSBC", 0.8);

            assertTrue(best.isPresent());
            assertEquals("HSBC UK Bank PLC", best.get().name());
            assertEquals(0.9, best.get().score());
        }

        @Test
        @DisplayName("Name contained in a longer query should score 0.85")
        void testContainedMatch() {
            List<MatchResult> results = matcher.search("Barclays Bank PLC London Branch", 0.5, 10);

            assertEquals(SponsorMatcher.CONTAINED_SCORE, results.get(0).score());
            assertEquals(MatchStage.CONTAINED, results.get(0).stage());
            assertEquals("Barclays Bank PLC", results.get(0).name());
        }

        @Test
        @DisplayName("Containment needs a query longer than five characters")
        void testContainedMinimumLength() {
            SponsorMatcher small = new SponsorMatcher(SampleRegistry.of("Abc"));

            MatchResult five = small.search("abc x", 0.0, 10).get(0);
            MatchResult six = small.search("abc xy", 0.0, 10).get(0);

            assertEquals(MatchStage.TOKEN, five.stage());
            assertEquals(0.75, five.score(), 1e-9);
            assertEquals(MatchStage.CONTAINED, six.stage());
            assertEquals(0.85, six.score(), 1e-9);
        }

        @Test
        @DisplayName("Word candidates should be scored and filtered by threshold")
        void testTokenStage() {
            List<MatchResult> results = matcher.search("Barclays Bank PLC", 0.5, 10);

            assertEquals(4, results.size());
            assertEquals("HSBC UK Bank PLC", results.get(2).name());
            assertEquals("Monzo Bank Ltd", results.get(3).name());
            assertEquals(MatchStage.TOKEN, results.get(2).stage());
            assertEquals(0.75, results.get(2).score(), 1e-9);

            assertEquals(2, matcher.search("Barclays Bank PLC", 0.8, 10).size());
        }
    }

    @Nested
    @DisplayName("Misspelt queries")
    class Misspellings {

        @Test
        @DisplayName("A misspelling is a possible match, not a confirmed one")
        void testMisspelling() {
            List<MatchResult> lenient = matcher.search("Barclays Bnk", 0.3, 10);

            assertEquals(2, lenient.size());
            assertEquals("Barclays Bank PLC", lenient.get(0).name());
            assertEquals(ConfidenceBand.POSSIBLE_MATCH, lenient.get(0).band());
            assertTrue(matcher.search("Barclays Bnk", 0.8, 10).isEmpty());
            assertTrue(matcher.isSponsor("Barclays Bnk").isEmpty());
        }

        @Test
        @DisplayName("A query sharing no indexed word has no candidates")
        void testNoSharedWord() {
            assertTrue(matcher.search("Barkleys Bnk", 0.0, 10).isEmpty());
        }
    }

    @Nested
    @DisplayName("Result shape")
    class ResultShape {

        @ParameterizedTest
        @DisplayName("Queries that normalize to nothing should return no results")
        @ValueSource(strings = {"", "   ", "!!!", "&-."})
        void testEmptyQuery(String query) {
            assertTrue(matcher.search(query, 0.0, 10).isEmpty());
        }

        @Test
        @DisplayName("Null query should return no results")
        void testNullQuery() {
            assertTrue(matcher.search(null, 0.5, 10).isEmpty());
        }

        @Test
        @DisplayName("Non-positive result limit should return no results")
        void testZeroLimit() {
            assertTrue(matcher.search("Barclays", 0.5, 0).isEmpty());
        }

        @Test
        @DisplayName("Results should be sorted descending and truncated")
        void testSortedAndTruncated() {
            List<MatchResult> results = matcher.search("Barclays Bank PLC", 0.5, 3);

            assertEquals(3, results.size());
            for (int i = 1; i < results.size(); i++) {
                assertTrue(results.get(i - 1).score() >= results.get(i).score());
            }
        }

        @Test
        @DisplayName("Raising the threshold should never add results")
        void testThresholdMonotonic() {
            for (String query : List.of("Barclays Bnk", "Bank", "Monzo", "Tesco Stores", "London Bank Services")) {
                List<MatchResult> low = matcher.search(query, 0.3, 100);
                List<MatchResult> high = matcher.search(query, 0.8, 100);
                assertTrue(low.containsAll(high), "threshold monotonicity for " + query);
            }
        }

        @Test
        @DisplayName("Names normalizing to empty should never match")
        void testEmptyNormalizedNameIgnored() {
            SponsorMatcher withEmpty = new SponsorMatcher(SampleRegistry.of("!!!", "Acme"));

            assertTrue(withEmpty.search("zzz", 0.0, 10).isEmpty());
            assertEquals(1, withEmpty.search("acme", 0.0, 10).size());
        }

        @Test
        @DisplayName("Returned list should be immutable")
        void testImmutableResults() {
            List<MatchResult> results = matcher.search("Monzo", 0.5, 10);

            assertThrows(UnsupportedOperationException.class, results::clear);
        }
    }

    @Nested
    @DisplayName("Sponsor check")
    class SponsorCheck {

        @Test
        @DisplayName("isSponsor should return the best record at the confirmed threshold")
        void testIsSponsor() {
            Optional<SponsorRecord> sponsor = matcher.isSponsor("Monzo Bank");

            assertTrue(sponsor.isPresent());
            assertEquals("Monzo Bank Ltd", sponsor.get().name());
        }

        @Test
        @DisplayName("isSponsor should be empty for unknown companies")
        void testNotSponsor() {
            assertTrue(matcher.isSponsor("Initech").isEmpty());
        }

        @Test
        @DisplayName("Explicit threshold should be honoured")
        void testCustomThreshold() {
            assertTrue(matcher.isSponsor("Barclays Bnk", 0.7).isPresent());
            assertTrue(matcher.isSponsor("Barclays Bnk", 0.76).isEmpty());
        }
    }

    @Test
    @DisplayName("Empty registry should never match")
    void testEmptyRegistry() {
        SponsorMatcher empty = new SponsorMatcher(SponsorRegistry.builder().build());

        assertTrue(empty.search("Barclays", 0.0, 10).isEmpty());
        assertTrue(empty.isSponsor("Barclays").isEmpty());
    }
}
