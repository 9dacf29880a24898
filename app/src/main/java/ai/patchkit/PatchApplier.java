package ai.patchkit;

import ai.patchkit.EditBlock.AppliedBlock;
import ai.patchkit.EditBlock.EditInstruction;
import ai.patchkit.EditBlock.MatchOutcome;
import ai.patchkit.EditBlock.Span;
import ai.patchkit.util.FList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Applies a sequence of edit instructions to one text.
 *
 * <p>Instructions are located one after another in {@code orderIndex} order because each lookup is anchored after the
 * span accepted for the previous one. A span that overlaps an already accepted span is rejected (first writer wins).
 * The accepted replacements are then performed from the end of the text toward its start, so every span still
 * refers to the original offsets when its turn comes.
 *
 * <p>Never throws for blocks that cannot be applied; they are reported in the result instead.
 */
public final class PatchApplier {
    private static final Logger logger = LogManager.getLogger(PatchApplier.class);

    private final MatchEngine engine;

    public PatchApplier(MatchEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public PatchApplier(MatchSettings settings) {
        this(new MatchEngine(settings));
    }

    public PatchApplier() {
        this(new MatchEngine());
    }

    /** A located replacement that survived overlap arbitration. */
    private record Accepted(int orderIndex, Span span, String replacement) {}

    /**
     * State threaded through the instructions: where the last accepted span ended, the spans accepted so far, and the
     * outcome of every instruction seen.
     */
    private record Fold(int anchor, FList<Accepted> accepted, FList<AppliedBlock> blocks) {
        static Fold initial() {
            return new Fold(0, FList.emptyList(), FList.emptyList());
        }

        Fold next(EditInstruction instruction, MatchOutcome located) {
            if (!located.isApplied()) {
                return new Fold(anchor, accepted, blocks.prepend(new AppliedBlock(instruction, located)));
            }
            var span = Objects.requireNonNull(located.span());
            var conflict = firstOverlap(span);
            if (conflict != null) {
                logger.debug(
                        "Block #{} at {} overlaps block #{} at {}; rejected",
                        instruction.number(),
                        span,
                        conflict.orderIndex() + 1,
                        conflict.span());
                var rejected = MatchOutcome.overlapConflict(conflict.orderIndex());
                return new Fold(anchor, accepted, blocks.prepend(new AppliedBlock(instruction, rejected)));
            }
            var replacement = Objects.requireNonNull(located.replacement());
            return new Fold(
                    span.end(),
                    accepted.prepend(new Accepted(instruction.orderIndex(), span, replacement)),
                    blocks.prepend(new AppliedBlock(instruction, located)));
        }

        private @Nullable Accepted firstOverlap(Span span) {
            for (var a : accepted.reversed()) {
                if (a.span().overlaps(span)) {
                    return a;
                }
            }
            return null;
        }
    }

    // descending start; for equal starts the longer span first, then the later instruction first, so that insertions
    // sharing an offset come out in instruction order ahead of a replacement starting there
    private static final Comparator<Accepted> APPLICATION_ORDER = Comparator.comparingInt(
                    (Accepted a) -> a.span().start())
            .thenComparingInt(a -> a.span().end())
            .thenComparingInt(Accepted::orderIndex)
            .reversed();

    public PatchResult apply(String originalText, List<EditInstruction> instructions) {
        Objects.requireNonNull(originalText, "originalText");
        Objects.requireNonNull(instructions, "instructions");

        if (instructions.isEmpty()) {
            logger.debug("No edit blocks to apply");
            return new PatchResult(originalText, originalText, List.of(), 0, 0, OutcomeReporter.summaryLine(List.of()));
        }

        var matchOrder = new ArrayList<>(instructions);
        matchOrder.sort(Comparator.comparingInt(EditInstruction::orderIndex));

        var target = new MatchEngine.Target(originalText);
        var fold = Fold.initial();
        for (var instruction : matchOrder) {
            fold = fold.next(instruction, engine.locate(target, instruction, fold.anchor()));
        }

        var sorted = new ArrayList<>(fold.accepted());
        sorted.sort(APPLICATION_ORDER);
        var sb = new StringBuilder(originalText);
        for (var a : sorted) {
            sb.replace(a.span().start(), a.span().end(), a.replacement());
        }

        var blocks = inInputOrder(instructions, matchOrder, fold.blocks().reversed());
        int applied = (int) blocks.stream().filter(AppliedBlock::isApplied).count();
        int failed = blocks.size() - applied;
        var message = OutcomeReporter.summaryLine(blocks);
        if (failed == 0) {
            logger.info("{}", message);
        } else {
            logger.warn("{}", message);
        }
        return new PatchResult(originalText, sb.toString(), blocks, applied, failed, message);
    }

    /** Puts the outcomes, produced in match order, back into the order the caller passed the instructions in. */
    private static List<AppliedBlock> inInputOrder(
            List<EditInstruction> input, List<EditInstruction> matchOrder, List<AppliedBlock> outcomes) {
        var out = new AppliedBlock[input.size()];
        var used = new boolean[input.size()];
        for (int i = 0; i < matchOrder.size(); i++) {
            var instruction = matchOrder.get(i);
            for (int j = 0; j < input.size(); j++) {
                if (!used[j] && input.get(j) == instruction) {
                    out[j] = outcomes.get(i);
                    used[j] = true;
                    break;
                }
            }
        }
        return Arrays.asList(out);
    }
}
