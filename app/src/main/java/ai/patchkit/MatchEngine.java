package ai.patchkit;

import ai.patchkit.EditBlock.EditInstruction;
import ai.patchkit.EditBlock.LineHint;
import ai.patchkit.EditBlock.MatchOutcome;
import ai.patchkit.EditBlock.Span;
import ai.patchkit.util.LineIndex;
import ai.patchkit.util.NormalizedText;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Locates the span of the original text an instruction refers to. Tiers are tried from most to least precise and the
 * first success wins: exact, whitespace-normalized, fuzzy (line windows scored by edit distance), line range.
 *
 * <p>Stateless; one instance can serve any number of threads.
 */
public final class MatchEngine {
    private static final Logger logger = LogManager.getLogger(MatchEngine.class);

    // absorbs rounding in score/threshold comparisons
    private static final double EPSILON = 1e-9;

    private final MatchSettings settings;

    public MatchEngine(MatchSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public MatchEngine() {
        this(MatchSettings.DEFAULTS);
    }

    /**
     * The original text with the indexes every tier needs, built once per run and shared across instructions.
     */
    public static final class Target {
        private final String text;
        private final LineIndex lines;
        private final NormalizedText normalized;
        private final List<String> normalizedLines;
        private final boolean crlf;

        public Target(String text) {
            this.text = text;
            this.lines = new LineIndex(text);
            this.normalized = NormalizedText.of(text);
            var perLine = new ArrayList<String>(lines.lineCount());
            for (int i = 0; i < lines.lineCount(); i++) {
                perLine.add(NormalizedText.normalizeSearch(lines.line(i)));
            }
            this.normalizedLines = perLine;
            this.crlf = text.contains("\r\n") && text.replace("\r\n", "").indexOf('\n') < 0;
        }
    }

    public MatchOutcome locate(String originalText, EditInstruction instruction) {
        return locate(new Target(originalText), instruction, 0);
    }

    /**
     * @param anchor end offset of the span most recently accepted for an earlier instruction; exact and normalized
     *     matches prefer occurrences starting at or after it
     */
    public MatchOutcome locate(Target target, EditInstruction instruction, int anchor) {
        if (instruction.isInsertion()) {
            return insertion(target, instruction);
        }

        var search = instruction.search();
        var exact = exact(target, search, anchor);
        if (exact != null) {
            logger.debug("Block #{}: exact match at {}", instruction.number(), exact);
            return MatchOutcome.exact(exact, lineEndings(target, instruction.replace()));
        }

        var normalized = normalized(target, search, anchor);
        if (normalized != null) {
            logger.debug("Block #{}: normalized match at {}", instruction.number(), normalized);
            return MatchOutcome.normalized(normalized, replacementFor(target, normalized, instruction));
        }

        var fuzzy = fuzzy(target, search);
        if (fuzzy != null) {
            logger.debug(
                    "Block #{}: fuzzy match at {} (score {})",
                    instruction.number(),
                    fuzzy.span(),
                    "%.3f".formatted(fuzzy.score()));
            return MatchOutcome.fuzzy(fuzzy.span(), replacementFor(target, fuzzy.span(), instruction), fuzzy.score());
        }

        var range = lineRange(target, instruction);
        if (range != null) {
            logger.debug("Block #{}: line-range match at {}", instruction.number(), range);
            return MatchOutcome.lineRange(range, lineEndings(target, instruction.replace()));
        }

        logger.debug("Block #{}: not found", instruction.number());
        return MatchOutcome.notFound();
    }

    /** First occurrence at or after {@code anchor}, else the first occurrence overall. */
    static @Nullable Span exact(Target target, String search, int anchor) {
        var text = target.text;
        int at = text.indexOf(search, anchor);
        if (at < 0) {
            at = text.indexOf(search);
        }
        return at < 0 ? null : new Span(at, at + search.length());
    }

    static @Nullable Span normalized(Target target, String search, int anchor) {
        var needle = NormalizedText.normalizeSearch(search);
        if (needle.isEmpty()) {
            return null;
        }
        var haystack = target.normalized.text();
        int at = haystack.indexOf(needle, target.normalized.indexAtOrAfter(anchor));
        if (at < 0) {
            at = haystack.indexOf(needle);
        }
        return at < 0 ? null : target.normalized.toOriginal(at, at + needle.length());
    }

    record Scored(Span span, double score) {}

    private record Window(int first, int size, int length, int shared) {
        boolean precedes(Window other) {
            return first < other.first || (first == other.first && size < other.size);
        }
    }

    /**
     * Scores windows of whole lines whose count is within the configured tolerance of the search's line count. A window
     * never starts or ends on a blank line. Windows sharing the most lines with the search are scored first, so the
     * best score so far tightens the edit-distance bound for the rest; a character-count bound rejects most windows
     * before any edit distance is computed. Ties go to the smallest start offset, then to the shorter window.
     */
    @Nullable
    Scored fuzzy(Target target, String search) {
        var needle = NormalizedText.normalizeSearch(search);
        if (needle.isEmpty()) {
            return null;
        }
        var needleLines = Arrays.asList(needle.split("\n", -1));
        var lines = target.normalizedLines;
        int lineCount = lines.size();
        double threshold = settings.fuzzyThreshold();

        var needleSet = new HashSet<>(needleLines);
        var lengthBefore = new int[lineCount + 1];
        var sharedBefore = new int[lineCount + 1];
        for (int i = 0; i < lineCount; i++) {
            var line = lines.get(i);
            lengthBefore[i + 1] = lengthBefore[i] + line.length();
            sharedBefore[i + 1] = sharedBefore[i] + (!line.isEmpty() && needleSet.contains(line) ? 1 : 0);
        }

        var candidates = new ArrayList<Window>();
        int minSize = Math.max(1, needleLines.size() - settings.windowTolerance());
        int maxSize = Math.min(lineCount, needleLines.size() + settings.windowTolerance());
        for (int size = minSize; size <= maxSize; size++) {
            for (int first = 0; first + size <= lineCount; first++) {
                int end = first + size;
                if (lines.get(first).isEmpty() || lines.get(end - 1).isEmpty()) {
                    continue;
                }
                int length = lengthBefore[end] - lengthBefore[first] + size - 1;
                if (Math.abs(length - needle.length()) > limit(threshold, Math.max(length, needle.length()))) {
                    continue;
                }
                candidates.add(new Window(first, size, length, sharedBefore[end] - sharedBefore[first]));
            }
        }
        candidates.sort(Comparator.comparingInt(Window::shared)
                .reversed()
                .thenComparingInt(Window::first)
                .thenComparingInt(Window::size));

        var histogram = new CharHistogram(needle);
        var distances = new HashMap<Integer, LevenshteinDistance>();
        @Nullable Window best = null;
        double bestScore = -1.0;
        for (var window : candidates) {
            int maxLen = Math.max(window.length(), needle.length());
            int limit = limit(Math.max(threshold, bestScore), maxLen);
            if (Math.abs(window.length() - needle.length()) > limit) {
                continue;
            }
            var text = String.join("\n", lines.subList(window.first(), window.first() + window.size()));
            if (histogram.lowerBound(text) > limit) {
                continue;
            }
            int distance = distances.computeIfAbsent(limit, LevenshteinDistance::new).apply(text, needle);
            if (distance < 0) {
                continue;
            }
            double score = 1.0 - (double) distance / maxLen;
            if (best == null
                    || score > bestScore + EPSILON
                    || (score > bestScore - EPSILON && window.precedes(best))) {
                best = window;
                bestScore = score;
            }
        }
        if (best == null) {
            return null;
        }
        var span = new Span(target.lines.start(best.first()), target.lines.contentEnd(best.first() + best.size() - 1));
        return new Scored(span, bestScore);
    }

    /** Largest edit distance that still scores at least {@code minScore} against {@code maxLen} characters. */
    private static int limit(double minScore, int maxLen) {
        return (int) Math.floor((1.0 - minScore) * maxLen + EPSILON);
    }

    /**
     * Character counts of a search text. Characters a window has in surplus, or lacks, each need at least one edit, so
     * the larger of the two counts bounds the edit distance from below.
     */
    private static final class CharHistogram {
        private final int[] balance = new int[Character.MAX_VALUE + 1];
        private final int length;

        CharHistogram(String needle) {
            this.length = needle.length();
            for (int i = 0; i < needle.length(); i++) {
                balance[needle.charAt(i)]--;
            }
        }

        int lowerBound(String window) {
            int surplus = 0;
            int missing = length;
            for (int i = 0; i < window.length(); i++) {
                char c = window.charAt(i);
                if (balance[c] < 0) {
                    missing--;
                } else {
                    surplus++;
                }
                balance[c]++;
            }
            for (int i = 0; i < window.length(); i++) {
                balance[window.charAt(i)]--;
            }
            return Math.max(surplus, missing);
        }
    }

    /**
     * The hint's lines when the instruction has one; otherwise, if enabled, the range spanned by the first, middle and
     * last significant search lines found in order, provided it is at most twice as long as the search.
     */
    @Nullable
    Span lineRange(Target target, EditInstruction instruction) {
        var lines = target.lines;
        var hint = instruction.lineHint();
        if (hint != null) {
            int first = hint.startLine() - 1;
            if (first >= lines.lineCount() || target.text.isEmpty()) {
                return null;
            }
            int size = hint.isSingleLine()
                    ? Math.max(1, LineIndex.countLines(instruction.search()))
                    : hint.endLine() - hint.startLine() + 1;
            int last = Math.min(lines.lineCount() - 1, first + size - 1);
            return new Span(lines.start(first), lines.contentEnd(last));
        }
        if (!settings.inferLineRange()) {
            return null;
        }

        var significant = instruction.search().lines()
                .filter(l -> !l.isBlank())
                .map(String::trim)
                .toList();
        if (significant.size() < 3) {
            return null;
        }
        var keys = List.of(
                significant.get(0), significant.get(significant.size() / 2), significant.get(significant.size() - 1));
        int from = 0;
        int firstFound = -1;
        int lastFound = -1;
        for (var key : keys) {
            int found = -1;
            for (int i = from; i < lines.lineCount(); i++) {
                if (lines.line(i).trim().equals(key)) {
                    found = i;
                    break;
                }
            }
            if (found < 0) {
                return null;
            }
            if (firstFound < 0) {
                firstFound = found;
            }
            lastFound = found;
            from = found + 1;
        }
        if (lastFound - firstFound + 1 > significant.size() * 2) {
            return null;
        }
        return new Span(lines.start(firstFound), lines.contentEnd(lastFound));
    }

    /**
     * An empty search inserts. With a hint the text goes in front of the hinted line (reported as a line-range match);
     * without one it is appended to the end of the file.
     */
    private MatchOutcome insertion(Target target, EditInstruction instruction) {
        var text = target.text;
        var lines = target.lines;
        var body = lineEndings(target, instruction.replace());
        var newline = target.crlf ? "\r\n" : "\n";
        LineHint hint = instruction.lineHint();

        if (hint != null && !text.isEmpty() && hint.startLine() - 1 < lines.lineCount()) {
            int at = lines.start(hint.startLine() - 1);
            logger.debug("Block #{}: insertion before line {}", instruction.number(), hint.startLine());
            return MatchOutcome.lineRange(new Span(at, at), body.isEmpty() ? body : body + newline);
        }

        // appended text is separated from the last line, and keeps a trailing newline if the file had one
        int end = text.length();
        boolean terminated = text.endsWith("\n") || text.endsWith("\r");
        var appended = body;
        if (!body.isEmpty() && !text.isEmpty()) {
            if (!terminated) {
                appended = newline + body;
            } else if (!body.endsWith("\n")) {
                appended = body + newline;
            }
        }
        logger.debug("Block #{}: append at end of file", instruction.number());
        var span = new Span(end, end);
        return hint != null ? MatchOutcome.lineRange(span, appended) : MatchOutcome.exact(span, appended);
    }

    /**
     * Replacement text for a normalized or fuzzy match. When the span starts a line whose indentation differs from the
     * search's first line, the search's indentation is swapped for the original's on every replacement line that
     * carries it.
     */
    private static String replacementFor(Target target, Span span, EditInstruction instruction) {
        var replace = lineEndings(target, instruction.replace());
        if (!target.lines.isLineStart(span.start())) {
            return replace;
        }
        var originalIndent = LineIndex.indentation(target.lines.line(target.lines.lineOf(span.start())));
        var searchIndent = instruction.search().lines()
                .filter(l -> !l.isBlank())
                .findFirst()
                .map(LineIndex::indentation)
                .orElse("");
        if (originalIndent.equals(searchIndent)) {
            return replace;
        }
        return reindent(replace, searchIndent, originalIndent);
    }

    static String reindent(String text, String from, String to) {
        var lines = text.split("\n", -1);
        var sb = new StringBuilder(text.length() + lines.length * Math.max(0, to.length() - from.length()));
        for (int i = 0; i < lines.length; i++) {
            var line = lines[i];
            if (!line.isBlank() && line.startsWith(from)) {
                sb.append(to).append(line, from.length(), line.length());
            } else {
                sb.append(line);
            }
            if (i < lines.length - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /** Files that consistently use CRLF get CRLF in the replacement too. */
    private static String lineEndings(Target target, String replacement) {
        if (!target.crlf || replacement.indexOf('\n') < 0) {
            return replacement;
        }
        return replacement.replace("\r\n", "\n").replace("\n", "\r\n");
    }
}
