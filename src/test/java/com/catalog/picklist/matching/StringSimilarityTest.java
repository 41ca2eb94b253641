package com.catalog.picklist.matching;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StringSimilarityTest {

    @Test
    void identicalIgnoringCaseAndOuterWhitespaceIsOne() {
        assertThat(StringSimilarity.similarity("  Kohler ", "KOHLER")).isEqualTo(1.0);
    }

    @Test
    void containmentScoresPointNine() {
        assertThat(StringSimilarity.similarity("GE", "GE APPLIANCES")).isEqualTo(0.9);
        assertThat(StringSimilarity.similarity("kitchen sinks", "sinks")).isEqualTo(0.9);
    }

    @Test
    void editDistanceIsNormalizedByLongerString() {
        // one substitution over six characters
        assertThat(StringSimilarity.similarity("KOHLER", "KOHLAR")).isCloseTo(5.0 / 6.0, within(1e-12));
        assertThat(StringSimilarity.similarity("abc", "xyz")).isEqualTo(0.0);
    }

    @Test
    void similarityIsSymmetricAndBounded() {
        String[][] pairs = {{"Moen", "Mone"}, {"Drain Placement", "Drain Position"}, {"a", "abcdef"}, {"", "x"}};
        for (String[] pair : pairs) {
            double forward = StringSimilarity.similarity(pair[0], pair[1]);
            assertThat(forward).isBetween(0.0, 1.0);
            assertThat(StringSimilarity.similarity(pair[1], pair[0])).isEqualTo(forward);
        }
    }

    @Test
    void emptyStringsAreIdentical() {
        assertThat(StringSimilarity.similarity("", "")).isEqualTo(1.0);
        assertThat(StringSimilarity.similarity(null, "  ")).isEqualTo(1.0);
    }

    @Test
    void levenshteinCountsInsertionsDeletionsAndSubstitutions() {
        assertThat(StringSimilarity.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(StringSimilarity.levenshtein("", "abc")).isEqualTo(3);
        assertThat(StringSimilarity.levenshtein("abc", "")).isEqualTo(3);
    }

    @Test
    void stripAccentsRemovesCombiningMarks() {
        assertThat(StringSimilarity.stripAccents("CAFÉ NOËL")).isEqualTo("CAFE NOEL");
    }
}
