package ai.patchkit.util;

import java.util.ArrayList;

/** Line boundaries of a text; lines end at {@code \n}, {@code \r\n} or {@code \r}. Line indices are 0-based. */
public final class LineIndex {
    private final String text;
    private final int[] starts;
    private final int[] contentEnds;

    public LineIndex(String text) {
        this.text = text;
        var s = new ArrayList<Integer>();
        var e = new ArrayList<Integer>();
        int lineStart = 0;
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                s.add(lineStart);
                e.add(i);
                i += (c == '\r' && i + 1 < n && text.charAt(i + 1) == '\n') ? 2 : 1;
                lineStart = i;
            } else {
                i++;
            }
        }
        // a trailing terminator does not open another line
        if (lineStart < n || s.isEmpty()) {
            s.add(lineStart);
            e.add(n);
        }
        this.starts = s.stream().mapToInt(Integer::intValue).toArray();
        this.contentEnds = e.stream().mapToInt(Integer::intValue).toArray();
    }

    public int lineCount() {
        return starts.length;
    }

    public int start(int line) {
        return starts[line];
    }

    /** Offset just before the line terminator. */
    public int contentEnd(int line) {
        return contentEnds[line];
    }

    public String line(int line) {
        return text.substring(starts[line], contentEnds[line]);
    }

    /** @return the 0-based line containing {@code offset}; offsets on a terminator belong to the line it ends */
    public int lineOf(int offset) {
        int lo = 0;
        int hi = starts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (starts[mid] <= offset) lo = mid;
            else hi = mid - 1;
        }
        return lo;
    }

    public boolean isLineStart(int offset) {
        if (offset == 0) return true;
        char prev = text.charAt(offset - 1);
        if (prev == '\n') return true;
        return prev == '\r' && (offset == text.length() || text.charAt(offset) != '\n');
    }

    /** Number of lines in {@code text}; a trailing terminator does not count as an extra empty line. */
    public static int countLines(String text) {
        return new LineIndex(text).lineCount();
    }

    /** Leading horizontal whitespace of a line. */
    public static String indentation(String line) {
        int i = 0;
        while (i < line.length() && NormalizedText.isHorizontalSpace(line.charAt(i))) {
            i++;
        }
        return line.substring(0, i);
    }
}
