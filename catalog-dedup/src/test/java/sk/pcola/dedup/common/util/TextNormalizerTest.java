package sk.pcola.dedup.common.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    @Test
    void shouldStripSeparatorsFromArticle() {
        assertEquals("x100b", TextNormalizer.normalizeArticle(" X-100/B "));
        assertEquals("ab12cd34", TextNormalizer.normalizeArticle("AB_12.CD+34"));
        assertEquals("12345", TextNormalizer.normalizeArticle("1 2,3-4.5"));
    }

    @Test
    void shouldKeepOtherPunctuationInArticle() {
        // # a * nie sú v zozname oddeľovačov
        assertEquals("x#100*", TextNormalizer.normalizeArticle("X#100*"));
    }

    @Test
    void shouldOnlyTrimAndLowercaseBrand() {
        assertEquals("acme-tools.", TextNormalizer.normalizeBrand("  ACME-Tools. "));
    }

    @Test
    void shouldOnlyTrimName() {
        assertEquals("Widget Deluxe, 10 PCS.", TextNormalizer.normalizeName("  Widget Deluxe, 10 PCS.\t"));
    }

    @Test
    void shouldDeepCleanToLowercaseAlphanumerics() {
        assertEquals("abc123", TextNormalizer.deepClean(" A b\tC\n1-2_3\r "));
        assertEquals("acme", TextNormalizer.deepClean("ACME®"));
    }

    @Test
    void shouldDropNonAsciiLettersInDeepClean() {
        assertEquals("krcher", TextNormalizer.deepClean("Kärcher"));
    }

    @Test
    void shouldHandleNullAndEmpty() {
        assertEquals("", TextNormalizer.normalizeArticle(null));
        assertEquals("", TextNormalizer.normalizeBrand(null));
        assertEquals("", TextNormalizer.normalizeName(null));
        assertEquals("", TextNormalizer.deepClean(null));
        assertEquals("", TextNormalizer.deepClean(" -_/. "));
    }
}
