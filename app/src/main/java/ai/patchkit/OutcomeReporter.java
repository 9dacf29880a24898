package ai.patchkit;

import ai.patchkit.EditBlock.AppliedBlock;
import ai.patchkit.EditBlock.FailureReason;
import ai.patchkit.EditBlock.MatchStatus;
import ai.patchkit.EditBlock.Span;
import ai.patchkit.util.ContentDiffUtils;
import ai.patchkit.util.LineIndex;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/** Human- and machine-readable views of a {@link PatchResult}. Pure formatting. */
public final class OutcomeReporter {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private OutcomeReporter() {}

    public static String badge(MatchStatus status) {
        return switch (status) {
            case EXACT -> "EXACT";
            case NORMALIZED -> "NORM";
            case FUZZY -> "FUZZY";
            case LINE_RANGE -> "RANGE";
            case NOT_FOUND -> "NOT FOUND";
            case PENDING -> "PENDING";
        };
    }

    /**
     * One line describing a whole run, e.g. {@code 2/3 edits applied, 1 not found (#3) (1 fuzzy)}. Applied blocks that
     * were located by the fuzzy or line-range tier are counted in a trailing note so they get a second look.
     */
    public static String summaryLine(List<AppliedBlock> blocks) {
        if (blocks.isEmpty()) {
            return "No changes";
        }
        int total = blocks.size();
        var failed = blocks.stream()
                .filter(b -> !b.isApplied())
                .map(b -> "#" + b.instruction().number())
                .toList();
        int applied = total - failed.size();

        String line;
        if (failed.isEmpty()) {
            line = "All %d %s applied".formatted(total, plural(total, "edit"));
        } else {
            var numbers = String.join(", ", failed);
            line = applied == 0
                    ? "No edits applied, %d not found (%s)".formatted(failed.size(), numbers)
                    : "%d/%d edits applied, %d not found (%s)".formatted(applied, total, failed.size(), numbers);
        }
        return line + lowConfidenceNote(blocks);
    }

    private static String lowConfidenceNote(List<AppliedBlock> blocks) {
        long fuzzy = blocks.stream().filter(b -> b.status() == MatchStatus.FUZZY).count();
        long range = blocks.stream().filter(b -> b.status() == MatchStatus.LINE_RANGE).count();
        var parts = new ArrayList<String>(2);
        if (fuzzy > 0) {
            parts.add(fuzzy + " fuzzy");
        }
        if (range > 0) {
            parts.add(range + " by line range");
        }
        return parts.isEmpty() ? "" : " (" + String.join(", ", parts) + ")";
    }

    private static String plural(long n, String word) {
        return n == 1 ? word : word + "s";
    }

    /** Describes a block without location, as shown before a run. */
    public static String describe(AppliedBlock block) {
        return describeAt(null, block);
    }

    /** Describes a block of {@code result}, including the original lines it was matched to. */
    public static String describe(PatchResult result, AppliedBlock block) {
        return describeAt(result.originalContent(), block);
    }

    private static String describeAt(@Nullable String original, AppliedBlock block) {
        var outcome = block.outcome();
        var sb = new StringBuilder("#")
                .append(block.instruction().number())
                .append(" [")
                .append(badge(outcome.status()));
        if (outcome.status() == MatchStatus.FUZZY) {
            sb.append(String.format(Locale.ROOT, " %.2f", outcome.confidence()));
        }
        sb.append(']');

        var span = outcome.span();
        if (span != null && original != null) {
            sb.append(' ').append(location(original, span));
        } else if (outcome.failure() == FailureReason.OVERLAP_CONFLICT) {
            sb.append(" overlaps #").append(outcome.conflictsWith() + 1);
        } else if (outcome.failure() == FailureReason.NO_MATCH) {
            sb.append(" no match");
        }
        return sb.toString();
    }

    private static String location(String original, Span span) {
        if (span.start() == original.length() && span.isEmpty()) {
            return "at end of file";
        }
        var lines = new LineIndex(original);
        int first = lines.lineOf(span.start()) + 1;
        if (span.isEmpty()) {
            return "before line " + first;
        }
        int last = lines.lineOf(span.end() - 1) + 1;
        return first == last ? "line " + first : "lines %d-%d".formatted(first, last);
    }

    /** Multi-line report: the summary line followed by one line per block. */
    public static String render(PatchResult result) {
        var blocks = result.appliedBlocks().stream()
                .map(b -> "  " + describe(result, b))
                .collect(Collectors.joining("\n"));
        return blocks.isEmpty() ? result.statusMessage() : result.statusMessage() + "\n" + blocks;
    }

    /**
     * Unified diff of the original lines touched by {@code block} against the same lines after its replacement.
     * Empty for blocks that were not applied.
     */
    public static String preview(PatchResult result, AppliedBlock block) {
        var span = block.outcome().span();
        var replacement = block.outcome().replacement();
        if (span == null || replacement == null) {
            return "";
        }
        var original = result.originalContent();
        var lines = new LineIndex(original);
        int from = lines.start(lines.lineOf(span.start()));
        int to = Math.max(span.end(), lines.contentEnd(lines.lineOf(Math.max(span.start(), span.end() - 1))));
        var before = original.substring(from, to);
        var after = original.substring(from, span.start()) + replacement + original.substring(span.end(), to);
        var label = "#" + block.instruction().number();
        return ContentDiffUtils.computeDiffResult(before, after, label + " original", label + " patched", 1)
                .diff();
    }

    /** Unified diff of the whole file, labelled the way git labels it. */
    public static String diff(PatchResult result, String fileName) {
        return ContentDiffUtils.computeDiffResult(
                        result.originalContent(),
                        result.newContent(),
                        "a/" + fileName,
                        "b/" + fileName,
                        ContentDiffUtils.DEFAULT_CONTEXT)
                .diff();
    }

    public static String toJson(PatchResult result) {
        var root = MAPPER.createObjectNode();
        root.put("status", result.statusMessage());
        root.put("totalApplied", result.totalApplied());
        root.put("totalFailed", result.totalFailed());
        root.put("fullyApplied", result.isFullyApplied());
        root.put("changed", result.isChanged());
        var failed = root.putArray("failedBlocks");
        result.failedBlockNumbers().forEach(failed::add);

        var blocks = root.putArray("blocks");
        for (var block : result.appliedBlocks()) {
            blocks.add(blockNode(result, block));
        }
        root.put("newContent", result.newContent());
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize patch result", e);
        }
    }

    private static ObjectNode blockNode(PatchResult result, AppliedBlock block) {
        var outcome = block.outcome();
        var node = MAPPER.createObjectNode();
        node.put("number", block.instruction().number());
        node.put("status", outcome.status().name());
        node.put("badge", badge(outcome.status()));
        node.put("confidence", outcome.confidence());
        var span = outcome.span();
        if (span != null) {
            var spanNode = node.putObject("span");
            spanNode.put("start", span.start());
            spanNode.put("end", span.end());
        }
        if (outcome.failure() != null) {
            node.put("failure", outcome.failure().name());
        }
        if (outcome.failure() == FailureReason.OVERLAP_CONFLICT) {
            node.put("conflictsWith", outcome.conflictsWith() + 1);
        }
        node.put("description", describe(result, block));
        return node;
    }
}
