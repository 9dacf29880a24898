package ai.patchkit.util;

import static org.junit.jupiter.api.Assertions.*;

import ai.patchkit.EditBlock.Span;
import org.junit.jupiter.api.Test;

class NormalizedTextTest {
    @Test
    void testNormalizationRules() {
        var normalized = NormalizedText.of("  foo   bar  \n\tbaz\r\n");
        assertEquals("foo bar\nbaz\n", normalized.text());
    }

    @Test
    void testNormalizeSearchDropsEdgeBlankLines() {
        assertEquals("foo", NormalizedText.normalizeSearch("\n\n  foo\n\n"));
        assertEquals("a\n\nb", NormalizedText.normalizeSearch("a\n   \nb"));
    }

    @Test
    void testWholeLineMatchMapsToWholeOriginalLine() {
        var original = "class A {\n    int x;\n}\n";
        var normalized = NormalizedText.of(original);
        int at = normalized.text().indexOf("int x;");
        assertEquals(10, at);

        var span = normalized.toOriginal(at, at + "int x;".length());
        assertEquals(new Span(10, 20), span);
        assertEquals("    int x;", original.substring(span.start(), span.end()));
    }

    @Test
    void testTrailingWhitespaceIsCoveredAtLineEnd() {
        var original = "a = 1;   \nb";
        var normalized = NormalizedText.of(original);
        var span = normalized.toOriginal(0, "a = 1;".length());
        assertEquals("a = 1;   ", original.substring(span.start(), span.end()));
    }

    @Test
    void testMidLineMatchIsNotWidened() {
        var original = "x  =  compute( a );";
        var normalized = NormalizedText.of(original);
        assertEquals("x = compute( a );", normalized.text());
        int at = normalized.text().indexOf("compute(");
        var span = normalized.toOriginal(at, at + "compute(".length());
        assertEquals("compute(", original.substring(span.start(), span.end()));
    }

    @Test
    void testIndexAtOrAfter() {
        var normalized = NormalizedText.of("a  b");
        assertEquals("a b", normalized.text());
        assertEquals(0, normalized.indexAtOrAfter(0));
        assertEquals(2, normalized.indexAtOrAfter(2));
        assertEquals(3, normalized.indexAtOrAfter(4));
    }

    @Test
    void testInvalidRange() {
        var normalized = NormalizedText.of("abc");
        assertThrows(IllegalArgumentException.class, () -> normalized.toOriginal(2, 2));
        assertThrows(IllegalArgumentException.class, () -> normalized.toOriginal(0, 4));
    }
}
