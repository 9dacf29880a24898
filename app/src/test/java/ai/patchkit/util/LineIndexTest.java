package ai.patchkit.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LineIndexTest {
    @Test
    void testTrailingNewlineDoesNotOpenALine() {
        var index = new LineIndex("a\nb\n");
        assertEquals(2, index.lineCount());
        assertEquals("b", index.line(1));
        assertEquals(2, index.start(1));
        assertEquals(3, index.contentEnd(1));
        assertEquals("a", index.line(0));
    }

    @Test
    void testEmptyTextHasOneEmptyLine() {
        var index = new LineIndex("");
        assertEquals(1, index.lineCount());
        assertEquals("", index.line(0));
        assertTrue(index.isLineStart(0));
    }

    @Test
    void testCrlfAndLoneCr() {
        var crlf = new LineIndex("a\r\nb");
        assertEquals(2, crlf.lineCount());
        assertEquals("a", crlf.line(0));
        assertEquals(1, crlf.contentEnd(0));
        assertEquals(3, crlf.start(1));
        assertFalse(crlf.isLineStart(2));
        assertTrue(crlf.isLineStart(3));

        assertEquals(2, new LineIndex("a\rb").lineCount());
    }

    @Test
    void testLineOf() {
        var index = new LineIndex("ab\ncd");
        assertEquals(0, index.lineOf(0));
        assertEquals(0, index.lineOf(2));
        assertEquals(1, index.lineOf(3));
        assertEquals(1, index.lineOf(5));
    }

    @Test
    void testStaticHelpers() {
        assertEquals(2, LineIndex.countLines("x\ny\n"));
        assertEquals(3, LineIndex.countLines("x\n\ny"));
        assertEquals("\t  ", LineIndex.indentation("\t  x = 1;"));
        assertEquals("", LineIndex.indentation("x"));
    }
}
