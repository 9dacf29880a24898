package ai.patchkit.util;

import ai.patchkit.EditBlock.Span;
import java.util.Arrays;

/**
 * Whitespace-normalized view of a text that remembers where every normalized character came from.
 *
 * <p>Normalization unifies {@code \r\n} and {@code \r} to {@code \n}, drops each line's indentation and trailing
 * whitespace, and collapses the remaining runs of horizontal whitespace to a single space. For every character of
 * {@link #text()} the original range it was produced from is recorded, so a match in the normalized text can be mapped
 * back to the exact original characters.
 */
public final class NormalizedText {
    private final String original;
    private final String text;
    private final int[] starts;
    private final int[] ends;

    private NormalizedText(String original, String text, int[] starts, int[] ends) {
        this.original = original;
        this.text = text;
        this.starts = starts;
        this.ends = ends;
    }

    public static NormalizedText of(String original) {
        int n = original.length();
        var sb = new StringBuilder(n);
        var starts = new int[n + 1];
        var ends = new int[n + 1];

        int i = 0;
        while (i < n) {
            // indentation
            while (i < n && isHorizontalSpace(original.charAt(i))) {
                i++;
            }
            int lineEnd = i;
            while (lineEnd < n && !isLineBreak(original.charAt(lineEnd))) {
                lineEnd++;
            }
            int contentEnd = lineEnd;
            while (contentEnd > i && isHorizontalSpace(original.charAt(contentEnd - 1))) {
                contentEnd--;
            }

            while (i < contentEnd) {
                char c = original.charAt(i);
                if (isHorizontalSpace(c)) {
                    int runStart = i;
                    while (i < contentEnd && isHorizontalSpace(original.charAt(i))) {
                        i++;
                    }
                    append(sb, starts, ends, ' ', runStart, i);
                } else {
                    append(sb, starts, ends, c, i, i + 1);
                    i++;
                }
            }

            i = lineEnd;
            if (i < n) {
                int breakLen = original.charAt(i) == '\r' && i + 1 < n && original.charAt(i + 1) == '\n' ? 2 : 1;
                append(sb, starts, ends, '\n', i, i + breakLen);
                i += breakLen;
            }
        }
        int len = sb.length();
        return new NormalizedText(
                original, sb.toString(), Arrays.copyOf(starts, len), Arrays.copyOf(ends, len));
    }

    /** Normalized form of a search text: as {@link #of(String)}, without leading or trailing line breaks. */
    public static String normalizeSearch(String search) {
        var normalized = of(search).text();
        int from = 0;
        int to = normalized.length();
        while (from < to && normalized.charAt(from) == '\n') from++;
        while (to > from && normalized.charAt(to - 1) == '\n') to--;
        return normalized.substring(from, to);
    }

    private static void append(StringBuilder sb, int[] starts, int[] ends, char c, int from, int to) {
        starts[sb.length()] = from;
        ends[sb.length()] = to;
        sb.append(c);
    }

    /** @return the first normalized index produced from an original offset at or after {@code originalOffset} */
    public int indexAtOrAfter(int originalOffset) {
        int lo = 0;
        int hi = starts.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (starts[mid] < originalOffset) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    public String text() {
        return text;
    }

    /**
     * Maps the normalized range {@code [from, to)} back to the original text. A range that begins at the start of a
     * normalized line is widened to the start of the original line, and one that ends at the end of a normalized line
     * is widened over the original's trailing whitespace, so whole-line matches cover whole original lines.
     */
    public Span toOriginal(int from, int to) {
        if (from < 0 || to > text.length() || from >= to) {
            throw new IllegalArgumentException("Invalid normalized range [%d, %d)".formatted(from, to));
        }
        int start = starts[from];
        int end = ends[to - 1];

        if (from == 0 || text.charAt(from - 1) == '\n') {
            while (start > 0 && isHorizontalSpace(original.charAt(start - 1))) {
                start--;
            }
        }
        if (to == text.length() || text.charAt(to) == '\n') {
            while (end < original.length() && isHorizontalSpace(original.charAt(end))) {
                end++;
            }
        }
        return new Span(start, end);
    }

    public static boolean isHorizontalSpace(char c) {
        return c != '\n' && c != '\r' && Character.isWhitespace(c);
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }
}
