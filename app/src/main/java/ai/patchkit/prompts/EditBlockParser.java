package ai.patchkit.prompts;

import static ai.patchkit.prompts.EditBlockUtils.*;

import ai.patchkit.EditBlock.EditInstruction;
import ai.patchkit.EditBlock.LineHint;
import ai.patchkit.EditBlock.ParseResult;
import ai.patchkit.EditBlock.SkippedBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Parses edit blocks out of a model reply.
 *
 * <p>Three spellings are accepted and may be mixed; blocks keep the order in which they appear in the reply:
 *
 * <ul>
 *   <li>{@code <<<SEARCH>>>} / {@code <<<REPLACE>>>} / {@code <<<END>>>}
 *   <li>{@code <<<<<<< SEARCH} / {@code =======} / {@code >>>>>>> REPLACE}; nested conflict markers inside the payload
 *       are tracked by depth and kept verbatim
 *   <li>{@code <block><search>...</search><replace>...</replace></block>}
 * </ul>
 *
 * <p>A comment line such as {@code # near line 42} right before a block becomes its line hint. Malformed blocks are
 * reported as {@link SkippedBlock}s and parsing resumes after them; text outside of blocks is ignored.
 */
public class EditBlockParser {
    private static final Logger logger = LogManager.getLogger(EditBlockParser.class);

    public static final EditBlockParser instance = new EditBlockParser();

    // payloads stop at block and search/replace tags
    private static final Pattern XML_BLOCK = Pattern.compile(
            "<block>\\s*<search>((?:(?!</?block>|</?search>).)*?)</search>"
                    + "\\s*<replace>((?:(?!</?block>|</?replace>).)*?)</replace>\\s*</block>",
            Pattern.DOTALL);
    private static final Pattern XML_SUMMARY = Pattern.compile("<summary>\\s*(.*?)\\s*</summary>", Pattern.DOTALL);
    private static final String XML_OPEN = "<block>";

    protected EditBlockParser() {}

    public ParseResult parse(String reply) {
        var content = reply.replace("\r\n", "\n");
        var lines = content.split("\n", -1);
        var lineStarts = lineStarts(lines);

        var drafts = new ArrayList<Draft>();
        var skipped = new ArrayList<SkippedBlock>();

        // 1) XML blocks, located by offset so the line scan can step over them
        var xmlRanges = new ArrayList<int[]>();
        var xml = XML_BLOCK.matcher(content);
        while (xml.find()) {
            int line = lineOf(lineStarts, xml.start());
            xmlRanges.add(new int[] {xml.start(), xml.end()});
            drafts.add(new Draft(
                    xml.start(),
                    trimFramingNewlines(xml.group(1)),
                    trimFramingNewlines(xml.group(2)),
                    hintBefore(lines, line)));
        }
        for (int at = content.indexOf(XML_OPEN); at >= 0; at = content.indexOf(XML_OPEN, at + 1)) {
            if (!covered(xmlRanges, at)) {
                skipped.add(new SkippedBlock(
                        lineOf(lineStarts, at) + 1,
                        "Malformed <block>: expected <search>...</search><replace>...</replace></block>"));
            }
        }

        // 2) marker blocks
        int i = 0;
        while (i < lines.length) {
            if (covered(xmlRanges, lineStarts[i]) || !isSearch(lines[i])) {
                i++;
                continue;
            }
            var scan = isConflictStyle(lines[i]) ? scanConflictBody(lines, i + 1) : scanMarkerBody(lines, i + 1);
            if (scan.error != null) {
                skipped.add(new SkippedBlock(i + 1, scan.error));
            } else {
                drafts.add(new Draft(
                        lineStarts[i],
                        String.join("\n", scan.before),
                        String.join("\n", scan.after),
                        hintBefore(lines, i)));
            }
            i = scan.nextIndex;
        }

        drafts.sort((a, b) -> Integer.compare(a.offset, b.offset));
        var instructions = new ArrayList<EditInstruction>(drafts.size());
        for (var draft : drafts) {
            instructions.add(draft.toInstruction(instructions.size()));
        }

        if (instructions.isEmpty() && skipped.isEmpty() && looksLikeUnifiedDiff(content)) {
            skipped.add(new SkippedBlock(
                    1, "The reply looks like a unified diff; edits must be given as " + SEARCH + " blocks"));
        }
        for (var s : skipped) {
            logger.warn("Skipped edit block at reply line {}: {}", s.line(), s.reason());
        }
        logger.debug("Parsed {} edit block(s), skipped {}", instructions.size(), skipped.size());

        return new ParseResult(instructions, skipped, summaryOf(content, instructions.size()));
    }

    private static String summaryOf(String content, int blockCount) {
        var m = XML_SUMMARY.matcher(content);
        if (m.find() && !m.group(1).isBlank()) {
            return m.group(1).trim();
        }
        return blockCount == 0 ? "No edit blocks" : "%d edit block(s)".formatted(blockCount);
    }

    /**
     * Scans the body of a {@code <<<SEARCH>>>} block, starting at the line after the marker. A second opening marker
     * before {@code <<<END>>>} means the current block was never closed; it is dropped and the scan resumes at the new
     * marker.
     */
    private static ScanResult scanMarkerBody(String[] lines, int startIndex) {
        var before = new ArrayList<String>();
        var after = new ArrayList<String>();
        boolean inAfter = false;

        for (int i = startIndex; i < lines.length; i++) {
            var line = lines[i];
            if (isSearch(line)) {
                return ScanResult.error(i, "Block was not closed with " + END + " before the next " + SEARCH);
            }
            if (isReplace(line, false)) {
                if (inAfter) {
                    return ScanResult.error(skipToEnd(lines, i + 1, false), "Duplicate " + REPLACE + " marker");
                }
                inAfter = true;
                continue;
            }
            if (isEnd(line, false)) {
                if (!inAfter) {
                    return ScanResult.error(i + 1, "Expected " + REPLACE + " before " + END);
                }
                return new ScanResult(i + 1, stripFencing(before), stripFencing(after), null);
            }
            (inAfter ? after : before).add(line);
        }
        return ScanResult.error(lines.length, "Unterminated block: expected " + END);
    }

    /**
     * Scans a git-style block. "=======" splits search from replace only at depth 0; nested SEARCH/REPLACE or generic
     * conflict markers inside the payload adjust the depth so they stay part of the text.
     */
    private static ScanResult scanConflictBody(String[] lines, int startIndex) {
        var before = new ArrayList<String>();
        var after = new ArrayList<String>();
        boolean inAfter = false;
        int depth = 0;

        for (int i = startIndex; i < lines.length; i++) {
            var raw = lines[i];
            if (depth == 0 && isEnd(raw, true)) {
                if (!inAfter) {
                    return ScanResult.error(i + 1, "Expected ======= divider after <<<<<<< SEARCH");
                }
                return new ScanResult(i + 1, stripFencing(before), stripFencing(after), null);
            }
            if (depth == 0 && !inAfter && isReplace(raw, true)) {
                inAfter = true;
                continue;
            }

            var t = raw.trim();
            if (CONFLICT_SEARCH.matcher(raw).matches() || t.startsWith("<<<<<<< ")) {
                depth++;
            } else if ((CONFLICT_REPLACE.matcher(raw).matches() || t.startsWith(">>>>>>> ")) && depth > 0) {
                depth--;
            }
            (inAfter ? after : before).add(raw);
        }
        return ScanResult.error(lines.length, "Expected >>>>>>> REPLACE");
    }

    private static int skipToEnd(String[] lines, int from, boolean conflictStyle) {
        for (int i = from; i < lines.length; i++) {
            if (isEnd(lines[i], conflictStyle)) {
                return i + 1;
            }
            if (isSearch(lines[i])) {
                return i;
            }
        }
        return lines.length;
    }

    /** Drops a fence pair that wraps the whole payload. */
    private static List<String> stripFencing(List<String> payload) {
        if (payload.size() >= 2 && isFence(payload.get(0)) && payload.get(payload.size() - 1).trim().equals(FENCE)) {
            return payload.subList(1, payload.size() - 1);
        }
        return payload;
    }

    /** Looks for a hint comment on the nearest line above {@code headIndex}, stepping over blanks and fences. */
    private static @Nullable LineHint hintBefore(String[] lines, int headIndex) {
        for (int i = headIndex - 1, seen = 0; i >= 0 && seen < 3; i--, seen++) {
            var line = lines[i];
            if (line.isBlank() || isFence(line)) {
                continue;
            }
            return parseLineHint(line);
        }
        return null;
    }

    private static int[] lineStarts(String[] lines) {
        var starts = new int[lines.length];
        int offset = 0;
        for (int i = 0; i < lines.length; i++) {
            starts[i] = offset;
            offset += lines[i].length() + 1;
        }
        return starts;
    }

    /** @return 0-based line containing {@code offset} */
    private static int lineOf(int[] lineStarts, int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) lo = mid;
            else hi = mid - 1;
        }
        return lo;
    }

    private static boolean covered(List<int[]> ranges, int offset) {
        for (var r : ranges) {
            if (offset >= r[0] && offset < r[1]) {
                return true;
            }
        }
        return false;
    }

    private record Draft(int offset, String search, String replace, @Nullable LineHint explicitHint) {
        EditInstruction toInstruction(int orderIndex) {
            var strippedSearch = stripLineNumbers(search);
            var strippedReplace = stripLineNumbers(replace);
            var hint = explicitHint != null ? explicitHint : strippedSearch.inferredHint();
            return new EditInstruction(strippedSearch.text(), strippedReplace.text(), orderIndex, hint);
        }
    }

    /** Internal scan result. */
    private static final class ScanResult {
        final int nextIndex; // index to continue from
        final List<String> before;
        final List<String> after;
        final @Nullable String error; // null if ok

        ScanResult(int nextIndex, List<String> before, List<String> after, @Nullable String error) {
            this.nextIndex = nextIndex;
            this.before = before;
            this.after = after;
            this.error = error;
        }

        static ScanResult error(int nextIndex, String message) {
            return new ScanResult(nextIndex, List.of(), List.of(), message);
        }
    }
}
