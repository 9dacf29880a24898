package ai.patchkit;

import static ai.patchkit.prompts.EditBlockUtils.END;
import static ai.patchkit.prompts.EditBlockUtils.REPLACE;
import static ai.patchkit.prompts.EditBlockUtils.SEARCH;

import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** Value types shared by the parser, the match engine, the applier and the reporter. */
public final class EditBlock {

    private EditBlock() {
        // holder for records
    }

    /**
     * How confidently an instruction's search text was located. The order of the constants is the order of the tiers,
     * from most to least precise.
     */
    public enum MatchStatus {
        PENDING,
        EXACT,
        NORMALIZED,
        FUZZY,
        LINE_RANGE,
        NOT_FOUND;

        /** @return true for the statuses that carry a span */
        public boolean isApplied() {
            return switch (this) {
                case EXACT, NORMALIZED, FUZZY, LINE_RANGE -> true;
                case PENDING, NOT_FOUND -> false;
            };
        }
    }

    public enum FailureReason {
        /** No tier located the search text (or its line hint). */
        NO_MATCH,
        /** The located span collided with the span of an earlier, already accepted block. */
        OVERLAP_CONFLICT
    }

    /** Approximate 1-based, inclusive line range the model pointed at. */
    public record LineHint(int startLine, int endLine) {
        public LineHint {
            if (startLine < 1 || endLine < startLine) {
                throw new IllegalArgumentException("Invalid line hint %d-%d".formatted(startLine, endLine));
            }
        }

        public static LineHint at(int line) {
            return new LineHint(line, line);
        }

        public boolean isSingleLine() {
            return startLine == endLine;
        }
    }

    /**
     * One search/replace pair proposed by the model. An empty {@code search} is a pure insertion, an empty
     * {@code replace} a deletion.
     */
    public record EditInstruction(String search, String replace, int orderIndex, @Nullable LineHint lineHint) {
        public EditInstruction {
            Objects.requireNonNull(search, "search");
            Objects.requireNonNull(replace, "replace");
            if (orderIndex < 0) {
                throw new IllegalArgumentException("orderIndex must be >= 0: " + orderIndex);
            }
        }

        public EditInstruction(String search, String replace, int orderIndex) {
            this(search, replace, orderIndex, null);
        }

        public boolean isInsertion() {
            return search.isEmpty();
        }

        /** 1-based number used in user-facing messages. */
        public int number() {
            return orderIndex + 1;
        }

        /** Renders the block back in the marker grammar the parser reads. */
        public String repr() {
            var hint = lineHint == null
                    ? ""
                    : lineHint.isSingleLine()
                            ? "# near line %d\n".formatted(lineHint.startLine())
                            : "# near lines %d-%d\n".formatted(lineHint.startLine(), lineHint.endLine());
            return """
                   %s%s
                   %s%s%s
                   %s%s
                   """
                    .formatted(
                            hint,
                            SEARCH,
                            search,
                            search.isEmpty() ? "" : "\n",
                            REPLACE,
                            replace.isEmpty() ? "" : replace + "\n",
                            END);
        }
    }

    /** Half-open range {@code [start, end)} in the original text. */
    public record Span(int start, int end) {
        public Span {
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid span [%d, %d)".formatted(start, end));
            }
        }

        public boolean isEmpty() {
            return start == end;
        }

        /** Zero-width spans never overlap anything; insertions at a shared offset are ordered instead. */
        public boolean overlaps(Span other) {
            return start < other.end && other.start < end;
        }
    }

    /**
     * Result of locating one instruction. {@code span} is present exactly when the status is applied;
     * {@code failure} exactly when the status is NOT_FOUND. {@code replacement} is the text that will be written over
     * the span, which can differ from the instruction's replace text when indentation was carried over.
     */
    public record MatchOutcome(
            MatchStatus status,
            @Nullable Span span,
            double confidence,
            @Nullable String replacement,
            @Nullable FailureReason failure,
            int conflictsWith) {
        public MatchOutcome {
            Objects.requireNonNull(status, "status");
            assert (span != null) == status.isApplied() : "span must be present iff status is applied";
            assert (replacement != null) == status.isApplied() : "replacement must be present iff status is applied";
            assert (failure != null) == (status == MatchStatus.NOT_FOUND) : "failure must be present iff NOT_FOUND";
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("confidence out of range: " + confidence);
            }
        }

        public static MatchOutcome pending() {
            return new MatchOutcome(MatchStatus.PENDING, null, 0.0, null, null, -1);
        }

        public static MatchOutcome exact(Span span, String replacement) {
            return new MatchOutcome(MatchStatus.EXACT, span, 1.0, replacement, null, -1);
        }

        public static MatchOutcome normalized(Span span, String replacement) {
            return new MatchOutcome(MatchStatus.NORMALIZED, span, 1.0, replacement, null, -1);
        }

        public static MatchOutcome fuzzy(Span span, String replacement, double score) {
            return new MatchOutcome(MatchStatus.FUZZY, span, score, replacement, null, -1);
        }

        public static MatchOutcome lineRange(Span span, String replacement) {
            return new MatchOutcome(MatchStatus.LINE_RANGE, span, 0.0, replacement, null, -1);
        }

        public static MatchOutcome notFound() {
            return new MatchOutcome(MatchStatus.NOT_FOUND, null, 0.0, null, FailureReason.NO_MATCH, -1);
        }

        /** @param earlierOrderIndex order index of the accepted block this one collided with */
        public static MatchOutcome overlapConflict(int earlierOrderIndex) {
            return new MatchOutcome(
                    MatchStatus.NOT_FOUND, null, 0.0, null, FailureReason.OVERLAP_CONFLICT, earlierOrderIndex);
        }

        public boolean isApplied() {
            return status.isApplied();
        }
    }

    /** An instruction paired with its final outcome. */
    public record AppliedBlock(EditInstruction instruction, MatchOutcome outcome) {
        public static AppliedBlock pending(EditInstruction instruction) {
            return new AppliedBlock(instruction, MatchOutcome.pending());
        }

        public MatchStatus status() {
            return outcome.status();
        }

        public boolean isApplied() {
            return outcome.isApplied();
        }
    }

    /** A block the parser had to drop. {@code line} is the 1-based line of the reply where the block started. */
    public record SkippedBlock(int line, String reason) {}

    /**
     * @param instructions parsed instructions in reply order
     * @param skipped malformed blocks that were dropped
     * @param summary the model's own summary if it gave one, otherwise a generated description
     */
    public record ParseResult(List<EditInstruction> instructions, List<SkippedBlock> skipped, String summary) {
        public ParseResult {
            instructions = List.copyOf(instructions);
            skipped = List.copyOf(skipped);
        }

        public boolean isEmpty() {
            return instructions.isEmpty();
        }
    }
}
