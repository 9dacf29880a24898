package ai.patchkit;

import ai.patchkit.EditBlock.AppliedBlock;
import java.util.List;

/**
 * Output of one run of {@link PatchApplier#apply}. {@code appliedBlocks} has one entry per input instruction, in input
 * order, whatever order the replacements were performed in.
 */
public record PatchResult(
        String originalContent,
        String newContent,
        List<AppliedBlock> appliedBlocks,
        int totalApplied,
        int totalFailed,
        String statusMessage) {

    public PatchResult {
        appliedBlocks = List.copyOf(appliedBlocks);
        if (totalApplied + totalFailed != appliedBlocks.size()) {
            throw new IllegalArgumentException("counts %d + %d do not add up to %d blocks"
                    .formatted(totalApplied, totalFailed, appliedBlocks.size()));
        }
    }

    public boolean isFullyApplied() {
        return totalFailed == 0;
    }

    /** True when there was nothing to apply at all. */
    public boolean isNoOp() {
        return appliedBlocks.isEmpty();
    }

    public boolean isChanged() {
        return !newContent.equals(originalContent);
    }

    /** 1-based numbers of the blocks that were not applied. */
    public List<Integer> failedBlockNumbers() {
        return appliedBlocks.stream()
                .filter(b -> !b.isApplied())
                .map(b -> b.instruction().number())
                .toList();
    }
}
