package ai.patchkit.cli;

import static java.util.Objects.requireNonNull;

import ai.patchkit.MatchSettings;
import ai.patchkit.OutcomeReporter;
import ai.patchkit.PatchApplier;
import ai.patchkit.PatchResult;
import ai.patchkit.prompts.EditBlockParser;
import ai.patchkit.prompts.EditBlockPrompts;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

/**
 * Applies the edit blocks of a saved model reply to one file and reports how each block was matched.
 *
 * <p>Exit codes: 0 when every block applied (or there was nothing to apply), 1 when some block did not apply, 2 on
 * I/O or usage errors.
 */
@CommandLine.Command(
        name = "patchkit",
        mixinStandardHelpOptions = true,
        version = "patchkit 0.1.0",
        description = "Apply search/replace edit blocks from a model reply to a file.")
public final class PatchCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(PatchCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PARTIAL = 1;
    static final int EXIT_ERROR = 2;

    @CommandLine.Spec
    @Nullable
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--file", required = true, description = "The file the edits refer to.")
    @Nullable
    private Path file;

    @CommandLine.Option(names = "--reply", description = "The model reply holding the edit blocks, or - for stdin.")
    @Nullable
    private String reply;

    @CommandLine.Option(names = "--output", description = "Write the patched content to this path.")
    @Nullable
    private Path output;

    @CommandLine.Option(names = "--write", description = "Overwrite --file with the patched content.")
    private boolean write = false;

    @CommandLine.Option(names = "--json", description = "Print the report as JSON.")
    private boolean json = false;

    @CommandLine.Option(names = "--diff", description = "Print a unified diff of the patched file.")
    private boolean diff = false;

    @CommandLine.Option(names = "--config", description = "Properties file with matching settings.")
    @Nullable
    private Path config;

    @CommandLine.Option(
            names = "--prompt",
            description = "Print the system prompt and user message asking for these changes, then exit.")
    @Nullable
    private String prompt;

    private final InputStream stdin;

    public PatchCli() {
        this(System.in);
    }

    PatchCli(InputStream stdin) {
        this.stdin = stdin;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PatchCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var commandLine = requireNonNull(spec).commandLine();
        var out = commandLine.getOut();
        var err = commandLine.getErr();
        var filePath = requireNonNull(file);

        if (write && output != null) {
            err.println("Error: --write and --output cannot be used together.");
            return EXIT_ERROR;
        }
        if (prompt == null && reply == null) {
            err.println("Error: --reply is required unless --prompt is given.");
            return EXIT_ERROR;
        }

        MatchSettings settings;
        try {
            settings = MatchSettings.load(config);
        } catch (IOException e) {
            logger.error("Failed to read config {}", config, e);
            err.println("Error reading config file: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_ERROR;
        }

        String original;
        try {
            original = Files.readString(filePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.error("Failed to read {}", filePath, e);
            err.println("Error reading file: " + e.getMessage());
            return EXIT_ERROR;
        }

        if (prompt != null) {
            printPrompt(out, original, filePath, prompt, settings);
            return EXIT_OK;
        }

        String replyText;
        try {
            replyText = readReply(requireNonNull(reply));
        } catch (IOException e) {
            logger.error("Failed to read reply {}", reply, e);
            err.println("Error reading reply: " + e.getMessage());
            return EXIT_ERROR;
        }

        var parsed = EditBlockParser.instance.parse(replyText);
        for (var skipped : parsed.skipped()) {
            err.printf("Warning: skipped block at reply line %d: %s%n", skipped.line(), skipped.reason());
        }
        logger.debug("Reply summary: {}", parsed.summary());

        var result = new PatchApplier(settings).apply(original, parsed.instructions());
        if (json) {
            out.println(OutcomeReporter.toJson(result));
        } else {
            out.println(OutcomeReporter.render(result));
        }
        if (diff && result.isChanged()) {
            out.println(OutcomeReporter.diff(result, filePath.getFileName().toString()));
        }

        try {
            writeResult(result, filePath);
        } catch (IOException e) {
            logger.error("Failed to write patched content", e);
            err.println("Error writing output: " + e.getMessage());
            return EXIT_ERROR;
        }
        out.flush();
        return result.isFullyApplied() ? EXIT_OK : EXIT_PARTIAL;
    }

    private void printPrompt(
            PrintWriter out, String original, Path filePath, String instructions, MatchSettings settings) {
        var prompts = EditBlockPrompts.instance;
        boolean lineNumbers = prompts.useLineNumbers(original, settings);
        out.println(prompts.systemPrompt(lineNumbers));
        out.println(prompts.userMessage(original, filePath.getFileName().toString(), instructions, lineNumbers));
        out.flush();
    }

    private String readReply(String source) throws IOException {
        if ("-".equals(source)) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(source), StandardCharsets.UTF_8);
    }

    private void writeResult(PatchResult result, Path filePath) throws IOException {
        if (output != null) {
            Files.writeString(output, result.newContent(), StandardCharsets.UTF_8);
            logger.info("Wrote patched content to {}", output);
        } else if (write && result.isChanged()) {
            Files.writeString(filePath, result.newContent(), StandardCharsets.UTF_8);
            logger.info("Updated {}", filePath);
        }
    }
}
