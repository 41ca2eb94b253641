package com.catalog.picklist.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MismatchKeyTest {

    @Test
    void normalizesCaseAndWhitespace() {
        assertThat(MismatchKey.normalizeValue("  Random   CATEGORY\t")).isEqualTo("random category");
    }

    @Test
    void stripsPunctuationButKeepsHyphensAndUnderscores() {
        assertThat(MismatchKey.normalizeValue("Stainless-Steel (304)!")).isEqualTo("stainless-steel 304");
        assertThat(MismatchKey.normalizeValue("drain_placement")).isEqualTo("drain_placement");
    }

    @Test
    void accentedLettersStayDistinctFromPlainOnes() {
        assertThat(MismatchKey.normalizeValue("Café")).isEqualTo("café");
        assertThat(MismatchKey.of(PicklistType.STYLE, "Café", "enrichment"))
                .isNotEqualTo(MismatchKey.of(PicklistType.STYLE, "Cafe", "enrichment"));
    }

    @Test
    void missingValueNormalizesToEmpty() {
        assertThat(MismatchKey.normalizeValue(null)).isEmpty();
    }

    @Test
    void keysWithSameNormalizedValueAreEqual() {
        assertThat(MismatchKey.of(PicklistType.BRAND, "KOHLER ", "enrichment"))
                .isEqualTo(MismatchKey.of(PicklistType.BRAND, "kohler", "enrichment"));
    }
}
