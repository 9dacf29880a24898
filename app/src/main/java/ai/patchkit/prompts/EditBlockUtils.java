package ai.patchkit.prompts;

import ai.patchkit.EditBlock.LineHint;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/** Markers and small text helpers shared by the parser and the prompt builder. */
public final class EditBlockUtils {

    public static final String SEARCH = "<<<SEARCH>>>";
    public static final String REPLACE = "<<<REPLACE>>>";
    public static final String END = "<<<END>>>";

    // Git-style conflict markers, also accepted on input
    public static final Pattern CONFLICT_SEARCH = Pattern.compile("^ {0,3}<{5,9}\\s+SEARCH\\s*$");
    public static final Pattern CONFLICT_DIVIDER = Pattern.compile("^ {0,3}={5,9}\\s*$");
    public static final Pattern CONFLICT_REPLACE = Pattern.compile("^ {0,3}>{5,9}\\s+REPLACE\\s*$");

    // "# near line 42", "// near lines 40-45"
    public static final Pattern LINE_HINT = Pattern.compile(
            "^\\s*(?:#|//|--)\\s*near\\s+lines?\\s+(\\d{1,7})(?:\\s*(?:-|\\.\\.|to)\\s*(\\d{1,7}))?\\s*:?\\s*$",
            Pattern.CASE_INSENSITIVE);

    // "42| code", the prefix the prompt builder puts in front of every line of large files
    public static final Pattern LINE_NUMBER_PREFIX = Pattern.compile("^(\\d{1,5})\\| ?");

    public static final String FENCE = "```";

    private EditBlockUtils() {}

    public static boolean isSearch(String line) {
        var t = line.trim();
        return t.equalsIgnoreCase(SEARCH) || CONFLICT_SEARCH.matcher(line).matches();
    }

    public static boolean isReplace(String line, boolean conflictStyle) {
        return conflictStyle
                ? CONFLICT_DIVIDER.matcher(line).matches()
                : line.trim().equalsIgnoreCase(REPLACE);
    }

    public static boolean isEnd(String line, boolean conflictStyle) {
        return conflictStyle
                ? CONFLICT_REPLACE.matcher(line).matches()
                : line.trim().equalsIgnoreCase(END);
    }

    public static boolean isConflictStyle(String searchLine) {
        return CONFLICT_SEARCH.matcher(searchLine).matches();
    }

    /** Only a bare triple-backtick line, optionally with a language tag, counts as a fence. */
    public static boolean isFence(String line) {
        var t = line.trim();
        return t.startsWith(FENCE) && !t.substring(FENCE.length()).contains("`") && !t.contains(" ");
    }

    /** @return the hint carried by a {@code # near line N} comment line, or null if the line is not one */
    public static @Nullable LineHint parseLineHint(String line) {
        var m = LINE_HINT.matcher(line);
        if (!m.matches()) {
            return null;
        }
        int start;
        int end;
        try {
            start = Integer.parseInt(m.group(1));
            end = m.group(2) == null ? start : Integer.parseInt(m.group(2));
        } catch (NumberFormatException e) {
            return null;
        }
        if (start < 1) {
            return null;
        }
        return new LineHint(start, Math.max(start, end));
    }

    /** Payload with line-number prefixes removed, and the line range those prefixes named. */
    public record StrippedPayload(String text, @Nullable LineHint inferredHint) {}

    /**
     * Removes {@code N| } prefixes when more than half of the lines carry one; the model copies them from numbered
     * file listings. The first and last stripped numbers become the inferred hint.
     */
    public static StrippedPayload stripLineNumbers(String text) {
        if (text.isBlank()) {
            return new StrippedPayload(text, null);
        }
        var lines = text.split("\n", -1);
        int prefixed = 0;
        for (var line : lines) {
            if (LINE_NUMBER_PREFIX.matcher(line).find()) {
                prefixed++;
            }
        }
        if (prefixed <= lines.length / 2) {
            return new StrippedPayload(text, null);
        }

        var out = new ArrayList<String>(lines.length);
        int first = -1;
        int last = -1;
        for (var line : lines) {
            var m = LINE_NUMBER_PREFIX.matcher(line);
            if (m.find()) {
                int n = Integer.parseInt(m.group(1));
                if (first < 0) {
                    first = n;
                }
                last = n;
                out.add(line.substring(m.end()));
            } else {
                out.add(line);
            }
        }
        LineHint hint = first >= 1 && last >= first ? new LineHint(first, last) : null;
        return new StrippedPayload(String.join("\n", out), hint);
    }

    /**
     * Heuristic to detect unified diff-like input: at least one line starting with "@@" and at least one other line
     * starting with "+" or "-" (but not the "+++ " / "--- " file headers).
     */
    public static boolean looksLikeUnifiedDiff(String content) {
        boolean hasAtAt = false;
        boolean hasPlusMinus = false;
        for (var l : content.split("\n", -1)) {
            if (l.startsWith("@@")) {
                hasAtAt = true;
            } else if ((l.startsWith("+") || l.startsWith("-")) && !l.startsWith("+++ ") && !l.startsWith("--- ")) {
                hasPlusMinus = true;
            }
            if (hasAtAt && hasPlusMinus) return true;
        }
        return false;
    }

    /** Removes one leading and one trailing newline, the framing the XML form leaves around payloads. */
    @VisibleForTesting
    static String trimFramingNewlines(String text) {
        var result = text;
        if (result.startsWith("\r\n")) result = result.substring(2);
        else if (result.startsWith("\n")) result = result.substring(1);
        if (result.endsWith("\r\n")) result = result.substring(0, result.length() - 2);
        else if (result.endsWith("\n")) result = result.substring(0, result.length() - 1);
        return result;
    }
}
