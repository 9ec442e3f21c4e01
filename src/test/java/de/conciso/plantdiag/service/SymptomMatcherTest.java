package de.conciso.plantdiag.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SymptomMatcherTest {

    private final SymptomMatcher matcher = new SymptomMatcher();

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        void trimsPunctuationCollapsesWhitespaceAndLowercases() {
            assertThat(matcher.normalize("  Yellowing   Leaves!? ")).isEqualTo("yellowing leaves");
            assertThat(matcher.normalize("...brown\tspots;")).isEqualTo("brown spots");
        }

        @Test
        void emptyAndNullBecomeEmpty() {
            assertThat(matcher.normalize("")).isEmpty();
            assertThat(matcher.normalize(null)).isEmpty();
            assertThat(matcher.normalize(" ,.; ")).isEmpty();
        }
    }

    @Nested
    @DisplayName("matches")
    class Matches {

        @Test
        void exactAfterNormalization() {
            assertThat(matcher.matches("Brown Spots.", "brown spots")).isTrue();
        }

        @Test
        void substringInEitherDirection() {
            assertThat(matcher.matches("yellowing", "yellowing leaves")).isTrue();
            assertThat(matcher.matches("severe leaf drop observed", "leaf drop")).isTrue();
        }

        @Test
        void wordOverlapMustExceedHalf() {
            // {dark, spots, leaves} vs {spots, leaves}: 2/3
            assertThat(matcher.matches("dark spots on the leaves", "spots leaves")).isTrue();
            // {leaf, curl} vs {leaf, drop}: 1/3
            assertThat(matcher.matches("leaf curl", "leaf drop")).isFalse();
        }

        @Test
        void jaccardOfExactlyHalfIsNoMatch() {
            // {leaf, margin} vs {leaf, margin, burn, scorch}: 2/4
            assertThat(matcher.wordOverlap("leaf margin", "leaf margin burn scorch")).isFalse();
            // {red, leaf, margin} vs {leaf, margin}: 2/3
            assertThat(matcher.wordOverlap("red leaf margin", "leaf margin")).isTrue();
        }

        @Test
        void stopWordsOnlyNeverOverlap() {
            assertThat(matcher.wordOverlap("on the", "of the")).isFalse();
        }

        @Test
        void keywordSynonyms() {
            assertThat(matcher.matches("chlorosis", "yellowing leaves")).isTrue();
            assertThat(matcher.matches("dark lesions", "brown spots")).isTrue();
            assertThat(matcher.matches("plant drooping", "wilting")).isTrue();
            assertThat(matcher.matches("dwarf plants", "stunted growth")).isTrue();
        }

        @Test
        void unrelatedSymptomsDoNotMatch() {
            assertThat(matcher.matches("white powdery coating", "yellowing leaves")).isFalse();
            assertThat(matcher.matches("leaf drop", "brown spots")).isFalse();
        }

        @Test
        void emptySideNeverMatches() {
            assertThat(matcher.matches("", "brown spots")).isFalse();
            assertThat(matcher.matches("brown spots", "  ")).isFalse();
            assertThat(matcher.matches(null, null)).isFalse();
        }

        @ParameterizedTest
        @CsvSource({
                "chlorosis, yellowing leaves",
                "dark lesions, brown spots",
                "leaf curl, leaf drop",
                "yellowing, yellowing leaves",
                "white powdery coating, stunted growth",
                "root decay, rotting stem",
                "dried tips, dry soil",
                "patches, lesions"
        })
        void isSymmetric(String a, String b) {
            assertThat(matcher.matches(a, b)).isEqualTo(matcher.matches(b, a));
        }

        @Test
        void matchesAnyChecksWholePool() {
            assertThat(matcher.matchesAny("yellowing leaves", List.of("leaf drop", "chlorosis"))).isTrue();
            assertThat(matcher.matchesAny("yellowing leaves", List.of("leaf drop"))).isFalse();
            assertThat(matcher.matchesAny("yellowing leaves", List.of())).isFalse();
        }
    }
}
