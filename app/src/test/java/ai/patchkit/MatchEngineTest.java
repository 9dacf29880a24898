package ai.patchkit;

import static org.junit.jupiter.api.Assertions.*;

import ai.patchkit.EditBlock.EditInstruction;
import ai.patchkit.EditBlock.FailureReason;
import ai.patchkit.EditBlock.LineHint;
import ai.patchkit.EditBlock.MatchStatus;
import ai.patchkit.EditBlock.Span;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class MatchEngineTest {
    private final MatchEngine engine = new MatchEngine();

    private static final String TOTAL =
            """
            public int total(List<Item> items) {
                int sum = 0;
                for (Item i : items) sum += i.price();
                return sum;
            }
            """;

    @Test
    void testExactMatch() {
        var outcome = engine.locate("a\nb\nc\n", new EditInstruction("b", "B", 0));
        assertEquals(MatchStatus.EXACT, outcome.status());
        assertEquals(new Span(2, 3), outcome.span());
        assertEquals(1.0, outcome.confidence());
        assertEquals("B", outcome.replacement());
    }

    @Test
    void testExactPrefersOccurrenceAfterAnchor() {
        var target = new MatchEngine.Target("x = 1;\ny = 2;\nx = 1;\n");
        assertEquals(new Span(0, 6), MatchEngine.exact(target, "x = 1;", 0));
        assertEquals(new Span(14, 20), MatchEngine.exact(target, "x = 1;", 7));
        assertEquals(new Span(0, 6), MatchEngine.exact(target, "x = 1;", 100));
        assertNull(MatchEngine.exact(target, "z = 3;", 0));
    }

    @Test
    void testNormalizedMatchReindentsReplacement() {
        var original = "if (a) {\n    return  b;\n}\n";
        var outcome = engine.locate(original, new EditInstruction("return b;", "return c;", 0));
        assertEquals(MatchStatus.NORMALIZED, outcome.status());
        assertEquals(new Span(9, 23), outcome.span());
        assertEquals("    return c;", outcome.replacement());
        assertEquals(1.0, outcome.confidence());
    }

    @Test
    void testNormalizedMatchAcrossLineEndings() {
        var outcome = engine.locate("a\r\nb\r\n", new EditInstruction("a\nb", "x\ny", 0));
        assertEquals(MatchStatus.NORMALIZED, outcome.status());
        assertEquals(new Span(0, 4), outcome.span());
        assertEquals("x\r\ny", outcome.replacement());
    }

    @Test
    void testFuzzyMatchToleratesSmallDifferences() {
        var search =
                """
                public int total(List<Item> items) {
                    int sum = 0;
                    for (Item it : items) sum += it.price();
                    return sum;
                }""";
        var outcome = engine.locate(TOTAL, new EditInstruction(search, "// replaced", 0));
        assertEquals(MatchStatus.FUZZY, outcome.status());
        assertEquals(new Span(0, TOTAL.length() - 1), outcome.span());
        assertTrue(outcome.confidence() >= 0.80 && outcome.confidence() < 1.0, "score " + outcome.confidence());
    }

    @Test
    void testFuzzyWindowSkipsBlankLineAboveTarget() {
        var original = "class A {\n\n    void f() {\n        int x = 1;\n        return;\n    }\n}\n";
        var search = "    void f() {\n        int x = 2;\n        return;\n    }";
        var replace = "    void f() {\n        int x = 3;\n        return;\n    }";
        var outcome = engine.locate(original, new EditInstruction(search, replace, 0));
        assertEquals(MatchStatus.FUZZY, outcome.status());
        assertEquals(new Span(11, 66), outcome.span());
        assertEquals(replace, outcome.replacement());

        var result = new PatchApplier().apply(original, List.of(new EditInstruction(search, replace, 0)));
        assertEquals(
                "class A {\n\n    void f() {\n        int x = 3;\n        return;\n    }\n}\n", result.newContent());
    }

    @Test
    void testFuzzyTieGoesToSmallestStart() {
        var original = "alpha();\nbeta();\ngamma();\n// sep\nalpha();\nbeta();\ngamma();\n";
        var outcome = engine.locate(original, new EditInstruction("alpha();\nbeta();\ngamma(1);", "x", 0));
        assertEquals(MatchStatus.FUZZY, outcome.status());
        assertEquals(new Span(0, 25), outcome.span());
    }

    @Test
    void testFuzzyWindowsWithinLineTolerance() {
        var shorter = "public int total(List<Item> items) {\n"
                + "    for (Item i : items) sum += i.price();\n"
                + "    return sum;\n"
                + "}";
        var outcome = engine.locate(TOTAL, new EditInstruction(shorter, "x", 0));
        assertEquals(MatchStatus.FUZZY, outcome.status());
        assertEquals(new Span(0, TOTAL.length() - 1), outcome.span());

        var exactSize = new MatchEngine(MatchSettings.DEFAULTS.withWindowTolerance(0));
        var fourLines = exactSize.locate(TOTAL, new EditInstruction(shorter, "x", 0));
        assertEquals(MatchStatus.FUZZY, fourLines.status());
        assertEquals(new Span(0, TOTAL.indexOf("return sum;") + "return sum;".length()), fourLines.span());

        var longer = "public int total(List<Item> items) {\n"
                + "    int sum = 0;\n"
                + "    for (Item i : items) sum += i.price();\n"
                + "    log(sum);\n"
                + "    return sum;\n"
                + "}";
        assertEquals(new Span(0, TOTAL.length() - 1), engine.locate(TOTAL, new EditInstruction(longer, "x", 0)).span());
        assertEquals(
                MatchStatus.NOT_FOUND,
                exactSize.locate(TOTAL, new EditInstruction(longer, "x", 0)).status());
    }

    @Test
    void testFuzzyMatchInLargeFileIsFast() {
        var text = new StringBuilder();
        var search = new StringBuilder();
        int start = 0;
        int end = 0;
        for (int i = 0; i < 4000; i++) {
            var line = "    int value%d = compute(%d, \"item-%d\");".formatted(i, i, i);
            if (i == 2000) {
                start = text.length();
            }
            if (i >= 2000 && i < 2040) {
                search.append(i % 10 == 5 ? line.replace("compute", "evaluate") : line).append('\n');
            }
            text.append(line);
            if (i == 2039) {
                end = text.length();
            }
            text.append('\n');
        }
        var original = text.toString();
        var instruction = new EditInstruction(search.toString(), "    // gone\n", 0);

        var outcome = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> engine.locate(original, instruction));
        assertEquals(MatchStatus.FUZZY, outcome.status());
        assertEquals(new Span(start, end), outcome.span());
    }

    @Test
    void testFuzzyThresholdIsConfigurable() {
        var strict = new MatchEngine(MatchSettings.DEFAULTS.withFuzzyThreshold(0.999));
        var search = "public int total(List<Item> items) {\n"
                + "    int sum = 0;\n"
                + "    for (Item it : items) sum += it.price();";
        var outcome = strict.locate(TOTAL, new EditInstruction(search, "x", 0));
        assertEquals(MatchStatus.NOT_FOUND, outcome.status());
    }

    @Test
    void testNothingSimilarIsNotFound() {
        var outcome = engine.locate(TOTAL, new EditInstruction("nonexistent_token", "x", 0));
        assertEquals(MatchStatus.NOT_FOUND, outcome.status());
        assertEquals(FailureReason.NO_MATCH, outcome.failure());
        assertNull(outcome.span());
        assertEquals(0.0, outcome.confidence());
    }

    @Test
    void testLineRangeFromHint() {
        var original = "l1\nl2\nl3\nl4\n";
        var outcome = engine.locate(original, new EditInstruction("zzz\nyyy", "X", 0, new LineHint(2, 3)));
        assertEquals(MatchStatus.LINE_RANGE, outcome.status());
        assertEquals(new Span(3, 8), outcome.span());
        assertEquals(0.0, outcome.confidence());

        var single = engine.locate(original, new EditInstruction("zzz\nyyy", "X", 0, LineHint.at(2)));
        assertEquals(new Span(3, 8), single.span());
    }

    @Test
    void testLineRangeHintIsClampedToFile() {
        var original = "l1\nl2\nl3\n";
        var clamped = engine.locate(original, new EditInstruction("zzz\nyyy", "X", 0, new LineHint(3, 9)));
        assertEquals(MatchStatus.LINE_RANGE, clamped.status());
        assertEquals(new Span(6, 8), clamped.span());

        var beyond = engine.locate(original, new EditInstruction("zzz\nyyy", "X", 0, LineHint.at(10)));
        assertEquals(MatchStatus.NOT_FOUND, beyond.status());
    }

    @Test
    void testInferredLineRangeFromKeyLines() {
        var original = "a();\nstart();\nb();\nmiddle();\nc();\nend();\nz();\n";
        var search = "start();\nsomethingTotallyDifferentHere();\nmiddle();\n"
                + "anotherCompletelyNewCallWithArgs(1, 2, 3);\nend();";
        var outcome = engine.locate(original, new EditInstruction(search, "replaced();", 0));
        assertEquals(MatchStatus.LINE_RANGE, outcome.status());
        int start = original.indexOf("start();");
        int end = original.indexOf("end();") + "end();".length();
        assertEquals(new Span(start, end), outcome.span());

        var noInference = new MatchEngine(MatchSettings.DEFAULTS.withInferLineRange(false));
        assertEquals(
                MatchStatus.NOT_FOUND,
                noInference.locate(original, new EditInstruction(search, "replaced();", 0)).status());
    }

    @Test
    void testInsertionAppendsAtEndOfFile() {
        var unterminated = engine.locate("a\nb", new EditInstruction("", "c", 0));
        assertEquals(MatchStatus.EXACT, unterminated.status());
        assertEquals(new Span(3, 3), unterminated.span());
        assertEquals("\nc", unterminated.replacement());

        var terminated = engine.locate("a\nb\n", new EditInstruction("", "c", 0));
        assertEquals(new Span(4, 4), terminated.span());
        assertEquals("c\n", terminated.replacement());

        var empty = engine.locate("", new EditInstruction("", "c", 0));
        assertEquals(new Span(0, 0), empty.span());
        assertEquals("c", empty.replacement());
    }

    @Test
    void testInsertionBeforeHintedLine() {
        var outcome = engine.locate("a\nb\n", new EditInstruction("", "c", 0, LineHint.at(2)));
        assertEquals(MatchStatus.LINE_RANGE, outcome.status());
        assertEquals(new Span(2, 2), outcome.span());
        assertEquals("c\n", outcome.replacement());
    }

    @Test
    void testCrlfFileGetsCrlfReplacement() {
        var outcome = engine.locate("a\r\nb\r\n", new EditInstruction("a", "x\ny", 0));
        assertEquals(MatchStatus.EXACT, outcome.status());
        assertEquals("x\r\ny", outcome.replacement());
    }

    @Test
    void testReindent() {
        assertEquals(
                "    if (x) {\n      y();\n    }",
                MatchEngine.reindent("if (x) {\n  y();\n}", "", "    "));
        assertEquals("  a\n\n  b", MatchEngine.reindent("\ta\n\n\tb", "\t", "  "));
    }
}
