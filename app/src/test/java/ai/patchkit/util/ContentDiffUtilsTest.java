package ai.patchkit.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ContentDiffUtilsTest {
    @Test
    void testIdenticalContentHasNoDiff() {
        var result = ContentDiffUtils.computeDiffResult("a\nb\n", "a\nb\n", "old", "new", 3);
        assertEquals("", result.diff());
        assertEquals(0, result.added());
        assertEquals(0, result.deleted());
    }

    @Test
    void testCountsAndLabels() {
        var result = ContentDiffUtils.computeDiffResult("a\nb\nc\n", "a\nB\nc\nd\n", "left", "right", 0);
        assertEquals(2, result.added());
        assertEquals(1, result.deleted());
        assertTrue(result.diff().startsWith("--- left\n+++ right\n"), result.diff());
        assertTrue(result.diff().contains("-b\n+B"), result.diff());
    }
}
