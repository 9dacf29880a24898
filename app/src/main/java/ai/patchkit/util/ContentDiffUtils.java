package ai.patchkit.util;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.ChangeDelta;
import com.github.difflib.patch.DeleteDelta;
import com.github.difflib.patch.InsertDelta;
import com.github.difflib.patch.Patch;
import java.util.Arrays;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Unified diffs between two versions of a text, for review of a patch before it is written out. */
public final class ContentDiffUtils {
    private static final Logger logger = LogManager.getLogger(ContentDiffUtils.class);

    public static final int DEFAULT_CONTEXT = 3;

    private ContentDiffUtils() {}

    public record DiffComputationResult(String diff, int added, int deleted) {}

    /**
     * Compute a unified diff and added/deleted line counts between two strings.
     *
     * @param oldName label for the "---" header
     * @param newName label for the "+++" header
     * @param contextLines unchanged lines shown around each hunk
     */
    public static DiffComputationResult computeDiffResult(
            String oldContent, String newContent, String oldName, String newName, int contextLines) {
        var oldLines = toLines(oldContent);
        var newLines = toLines(newContent);

        Patch<String> patch = DiffUtils.diff(oldLines, newLines);
        if (patch.getDeltas().isEmpty()) {
            logger.trace("computeDiffResult: {} -> {} | no changes", oldName, newName);
            return new DiffComputationResult("", 0, 0);
        }

        int added = 0;
        int deleted = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            if (delta instanceof InsertDelta<String> id) {
                added += id.getTarget().size();
            } else if (delta instanceof DeleteDelta<String> dd) {
                deleted += dd.getSource().size();
            } else if (delta instanceof ChangeDelta<String> cd) {
                added += cd.getTarget().size();
                deleted += cd.getSource().size();
            }
        }
        logger.trace(
                "computeDiffResult: {} -> {} | deltas={} added={} deleted={}",
                oldName,
                newName,
                patch.getDeltas().size(),
                added,
                deleted);

        var diffLines = UnifiedDiffUtils.generateUnifiedDiff(oldName, newName, oldLines, patch, contextLines);
        return new DiffComputationResult(String.join("\n", diffLines), added, deleted);
    }

    // any line break; a trailing empty string marks a final newline
    private static List<String> toLines(String content) {
        return Arrays.asList(content.split("\\R", -1));
    }
}
