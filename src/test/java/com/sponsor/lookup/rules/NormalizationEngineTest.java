package com.sponsor.lookup.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    @Nested
    @DisplayName("Name normalizer")
    class NameNormalizer {

        private NormalizationEngine engine;

        @BeforeEach
        void setUp() {
            engine = DefaultNormalizationRules.createNameNormalizer();
        }

        @Test
        @DisplayName("Should handle null and blank inputs")
        void testNullAndBlankInputs() {
            assertEquals("", engine.normalize(null));
            assertEquals("", engine.normalize(""));
            assertEquals("", engine.normalize("   "));
        }

        @ParameterizedTest
        @DisplayName("Should lowercase and strip punctuation")
        @CsvSource(delimiter = '|', value = {
                "Barclays Bank PLC|barclays bank plc",
                "Amazon UK Services Ltd.|amazon uk services ltd",
                "Smith, Jones & Partners LLP|smith jones partners llp",
                "O'Neill (UK) Limited|oneill uk limited",
                "  HSBC   UK  |hsbc uk",
                "3M United Kingdom P.L.C.|3m united kingdom plc"
        })
        void testNormalization(String input, String expected) {
            assertEquals(expected, engine.normalize(input));
        }

        @Test
        @DisplayName("Should keep underscores and accented letters")
        void testWordCharactersKept() {
            assertEquals("café_nero", engine.normalize("Café_Nero"));
            assertEquals("nestlé uk", engine.normalize("Nestlé UK"));
        }

        @Test
        @DisplayName("Should reduce punctuation-only names to empty")
        void testPunctuationOnly() {
            assertEquals("", engine.normalize("!!! ---"));
        }

        @ParameterizedTest
        @DisplayName("Should be idempotent")
        @ValueSource(strings = {"Barclays Bank PLC", "Smith, Jones & Partners LLP", "Nestlé  UK.", "!!!"})
        void testIdempotent(String input) {
            String once = engine.normalize(input);
            assertEquals(once, engine.normalize(once));
        }
    }

    @Nested
    @DisplayName("Noise word cleaner")
    class NoiseWordCleaner {

        private final NormalizationEngine cleaner = DefaultNormalizationRules.createNoiseWordCleaner();

        @ParameterizedTest
        @DisplayName("Should remove noise words as whole words, keeping case")
        @CsvSource(delimiter = '|', value = {
                "Acme Ltd|Acme",
                "Monzo Careers|Monzo",
                "Deliveroo jobs|Deliveroo",
                "Google LLC|Google",
                "Initech Corporation|Initech",
                "Incite Media|Incite Media",
                "Limitless Ltd|Limitless"
        })
        void testNoiseWords(String input, String expected) {
            assertEquals(expected, cleaner.clean(input));
        }

        @Test
        @DisplayName("Should leave nothing when the name is only noise")
        void testOnlyNoise() {
            assertEquals("", cleaner.clean("Jobs Careers Ltd"));
        }
    }

    @Test
    @DisplayName("Should apply rules in priority order")
    void testPriorityOrder() {
        NormalizationRule second = NormalizationRule.of("b-to-c", "b", "c", 20);
        NormalizationRule first = NormalizationRule.of("a-to-b", "a", "b", 10);

        NormalizationEngine engine = new NormalizationEngine(List.of(second, first));

        assertEquals("a-to-b", engine.getRules().get(0).name());
        assertEquals("ccc", engine.normalize("abc"));
    }

    @Test
    @DisplayName("Rule should require a pattern")
    void testRuleRequiresPattern() {
        assertThrows(NullPointerException.class, () -> NormalizationRule.of("broken", null, "", 10));
    }
}
