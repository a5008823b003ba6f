package com.sponsor.lookup.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class MatchResultTest {

    private static final SponsorRecord RECORD =
            new SponsorRecord("Monzo Bank Ltd", "London", null, "Worker (A rating)", "Skilled Worker");

    @ParameterizedTest
    @DisplayName("Band should follow fixed score boundaries")
    @CsvSource({
            "1.0,CONFIRMED",
            "0.8,CONFIRMED",
            "0.79,POSSIBLE_MATCH",
            "0.5,POSSIBLE_MATCH",
            "0.49,NOT_FOUND",
            "0.0,NOT_FOUND"
    })
    void testBand(double score, ConfidenceBand expected) {
        assertEquals(expected, ConfidenceBand.fromScore(score));
        assertEquals(expected, new MatchResult(RECORD, score, MatchStage.TOKEN).band());
    }

    @Test
    @DisplayName("Band labels should be human readable")
    void testLabels() {
        assertEquals("confirmed", ConfidenceBand.CONFIRMED.label());
        assertEquals("possible match", ConfidenceBand.POSSIBLE_MATCH.label());
        assertEquals("not found", ConfidenceBand.NOT_FOUND.label());
    }

    @Test
    @DisplayName("Score must be within [0, 1]")
    void testScoreRange() {
        assertThrows(IllegalArgumentException.class, () -> new MatchResult(RECORD, 1.01, MatchStage.EXACT));
        assertThrows(IllegalArgumentException.class, () -> new MatchResult(RECORD, -0.1, MatchStage.EXACT));
        assertThrows(NullPointerException.class, () -> new MatchResult(null, 0.5, MatchStage.EXACT));
    }

    @Test
    @DisplayName("Record should require a name and default missing fields to empty")
    void testRecordValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SponsorRecord(" ", null, null, null, null));
        assertThrows(NullPointerException.class, () -> new SponsorRecord(null, null, null, null, null));
        assertEquals("", RECORD.county());
        assertTrue(new MatchResult(RECORD, 0.8, MatchStage.EXACT).isConfirmed());
    }

    @ParameterizedTest
    @DisplayName("Location should join city and county when present")
    @CsvSource(value = {
            "London,,London",
            "Leeds,West Yorkshire,'Leeds, West Yorkshire'",
            ",Kent,Kent",
            ",,''"
    })
    void testLocation(String city, String county, String expected) {
        assertEquals(expected, new SponsorRecord("Acme", city, county, null, null).location());
    }
}
