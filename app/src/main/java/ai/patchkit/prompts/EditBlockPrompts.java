package ai.patchkit.prompts;

import static ai.patchkit.prompts.EditBlockUtils.END;
import static ai.patchkit.prompts.EditBlockUtils.FENCE;
import static ai.patchkit.prompts.EditBlockUtils.REPLACE;
import static ai.patchkit.prompts.EditBlockUtils.SEARCH;

import ai.patchkit.MatchSettings;
import com.google.common.base.Splitter;
import java.util.List;

/**
 * Builds the messages that ask a model for edit blocks on one file. The reply is expected in the grammar
 * {@link EditBlockParser} reads. Sending the messages is up to the caller.
 */
public class EditBlockPrompts {
    public static final EditBlockPrompts instance = new EditBlockPrompts();

    private static final Splitter LINES = Splitter.on('\n');

    protected EditBlockPrompts() {}

    /** Files longer than the configured threshold are shown with {@code N| } prefixes so the model can cite lines. */
    public boolean useLineNumbers(String fileContent, MatchSettings settings) {
        return lines(fileContent).size() > settings.lineNumberThreshold();
    }

    public String systemPrompt(boolean lineNumbers) {
        var prompt = """
                You are a precision code editor. Your only job is to produce exact search/replace blocks for one source file.

                %s

                # Rules

                1. Exact copy. The text between %s and %s must be a character-for-character copy of the original file:
                   every space, tab, blank line, comma and bracket. Do not fix typos or reformat anything in it.
                2. Unique context. Each search text must match exactly one location. Include a few surrounding lines
                   when a line such as "}" or "return null;" occurs more than once.
                3. Minimal changes. Change only what was asked for. Do not touch imports, comments or formatting
                   outside the requested scope.
                4. Several blocks. Use a separate block for each part of the file, ordered from the top of the file
                   to the bottom. Blocks must not share lines.
                5. Special operations. To delete code, leave the replacement empty. To insert code, put the line it
                   goes after in the search text and that line plus the new code in the replacement. An empty search
                   appends the replacement to the end of the file.
                6. Indentation. Match the indentation style of the surrounding code, tabs or spaces.
                7. Output discipline. Output only the blocks. Never output the whole file. If nothing needs to change,
                   output no blocks and say why in one line.
                """.stripIndent().formatted(formatInstructions(), SEARCH, REPLACE);
        return lineNumbers ? prompt + "\n" + lineNumberInstructions() : prompt;
    }

    public String formatInstructions() {
        return """
                # Block format

                Every edit block uses this format:
                1. Optionally, a comment naming the approximate lines, alone on a line: # near lines 40-45
                2. The start marker alone on a line: %s
                3. The lines to search for in the existing file
                4. The divider alone on a line: %s
                5. The lines to put in their place
                6. The end marker alone on a line: %s

                Example:

                # near line 12
                %s
                    val oldName = repository.getData()
                    processResult(oldName)
                %s
                    val newName = repository.getData()
                    processResult(newName)
                %s
                """.stripIndent().formatted(SEARCH, REPLACE, END, SEARCH, REPLACE, END);
    }

    private String lineNumberInstructions() {
        return """
                # Line numbers

                The file is shown with a "N| " prefix on every line, e.g. "42| int x = 1;".
                The prefixes are for reference only. Never copy them into the search or replacement text;
                cite the line in a "# near line N" comment instead.
                """.stripIndent();
    }

    /** The user message: the file (numbered when {@code lineNumbers}) followed by the requested change. */
    public String userMessage(String fileContent, String fileName, String instructions, boolean lineNumbers) {
        var sb = new StringBuilder();
        sb.append("File: `").append(fileName).append("`\n\n");
        sb.append(FENCE).append('\n');
        if (lineNumbers) {
            var lines = lines(fileContent);
            for (int i = 0; i < lines.size(); i++) {
                sb.append(i + 1).append("| ").append(lines.get(i)).append('\n');
            }
        } else {
            sb.append(fileContent);
            if (!fileContent.endsWith("\n")) {
                sb.append('\n');
            }
        }
        sb.append(FENCE).append("\n\n");
        sb.append("# Instructions\n");
        sb.append(instructions.strip()).append('\n');
        return sb.toString();
    }

    public String userMessage(String fileContent, String fileName, String instructions, MatchSettings settings) {
        return userMessage(fileContent, fileName, instructions, useLineNumbers(fileContent, settings));
    }

    // a trailing newline does not open another line
    private static List<String> lines(String content) {
        var normalized = content.replace("\r\n", "\n");
        if (normalized.endsWith("\n")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return LINES.splitToList(normalized);
    }
}
