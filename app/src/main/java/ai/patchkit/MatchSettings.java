package ai.patchkit;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Tunables for matching and prompting.
 *
 * <p>Values come from, in increasing priority: the built-in defaults, the classpath resource
 * {@code patchkit.properties}, the user file {@code patchkit.properties} in {@link #getConfigDir()}, and an explicit
 * file handed to {@link #load(Path)}. Keys:
 *
 * <ul>
 *   <li>{@code match.fuzzy.threshold}: minimum similarity in [0,1] for a fuzzy match (0.80)
 *   <li>{@code match.fuzzy.windowTolerance}: how many lines a fuzzy window may differ from the search (1)
 *   <li>{@code match.lineRange.inferred}: locate blocks without a line hint by their first/middle/last lines (true)
 *   <li>{@code prompt.lineNumberThreshold}: files with more lines than this are sent with line numbers (300)
 * </ul>
 */
public record MatchSettings(
        double fuzzyThreshold, int windowTolerance, boolean inferLineRange, int lineNumberThreshold) {
    private static final Logger logger = LogManager.getLogger(MatchSettings.class);

    public static final String KEY_FUZZY_THRESHOLD = "match.fuzzy.threshold";
    public static final String KEY_WINDOW_TOLERANCE = "match.fuzzy.windowTolerance";
    public static final String KEY_INFER_LINE_RANGE = "match.lineRange.inferred";
    public static final String KEY_LINE_NUMBER_THRESHOLD = "prompt.lineNumberThreshold";

    public static final String RESOURCE = "patchkit.properties";

    public static final MatchSettings DEFAULTS = new MatchSettings(0.80, 1, true, 300);

    public MatchSettings {
        if (Double.isNaN(fuzzyThreshold) || fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0) {
            throw new IllegalArgumentException(KEY_FUZZY_THRESHOLD + " must be within [0, 1]: " + fuzzyThreshold);
        }
        if (windowTolerance < 0) {
            throw new IllegalArgumentException(KEY_WINDOW_TOLERANCE + " must be >= 0: " + windowTolerance);
        }
        if (lineNumberThreshold < 0) {
            throw new IllegalArgumentException(KEY_LINE_NUMBER_THRESHOLD + " must be >= 0: " + lineNumberThreshold);
        }
    }

    public MatchSettings withFuzzyThreshold(double threshold) {
        return new MatchSettings(threshold, windowTolerance, inferLineRange, lineNumberThreshold);
    }

    public MatchSettings withWindowTolerance(int tolerance) {
        return new MatchSettings(fuzzyThreshold, tolerance, inferLineRange, lineNumberThreshold);
    }

    public MatchSettings withInferLineRange(boolean infer) {
        return new MatchSettings(fuzzyThreshold, windowTolerance, infer, lineNumberThreshold);
    }

    /** Layers the keys present in {@code props} over this instance; absent keys keep their current value. */
    public MatchSettings overlay(Properties props) {
        return new MatchSettings(
                parseDouble(props, KEY_FUZZY_THRESHOLD, fuzzyThreshold),
                parseInt(props, KEY_WINDOW_TOLERANCE, windowTolerance),
                parseBoolean(props, KEY_INFER_LINE_RANGE, inferLineRange),
                parseInt(props, KEY_LINE_NUMBER_THRESHOLD, lineNumberThreshold));
    }

    /** Defaults, then the classpath resource, then the user config file. */
    public static MatchSettings load() {
        var settings = DEFAULTS;
        try (InputStream in = MatchSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                var props = new Properties();
                props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
                settings = settings.overlay(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to read classpath {}: {}", RESOURCE, e.getMessage());
        }

        var userFile = getConfigDir().resolve(RESOURCE);
        if (Files.isRegularFile(userFile)) {
            try {
                settings = settings.overlay(readProperties(userFile));
                logger.debug("Loaded user settings from {}", userFile);
            } catch (IOException e) {
                logger.warn("Failed to read user settings {}: {}", userFile, e.getMessage());
            }
        }
        return settings;
    }

    /** Like {@link #load()}, with {@code explicitFile} layered on top. A missing explicit file is an error. */
    public static MatchSettings load(@Nullable Path explicitFile) throws IOException {
        var settings = load();
        if (explicitFile == null) {
            return settings;
        }
        return settings.overlay(readProperties(explicitFile));
    }

    static Properties readProperties(Path file) throws IOException {
        var props = new Properties();
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        return props;
    }

    public static Path getConfigDir() {
        var os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            var appData = System.getenv("APPDATA");
            Path base = (appData != null && !appData.isBlank())
                    ? Path.of(appData)
                    : Path.of(System.getProperty("user.home"), "AppData", "Roaming");
            return base.resolve("patchkit");
        } else if (os.contains("mac")) {
            return Path.of(System.getProperty("user.home"), "Library", "Application Support", "patchkit");
        } else {
            var xdg = System.getenv("XDG_CONFIG_HOME");
            Path base = (xdg != null && !xdg.isBlank())
                    ? Path.of(xdg)
                    : Path.of(System.getProperty("user.home"), ".config");
            return base.resolve("patchkit");
        }
    }

    private static double parseDouble(Properties props, String key, double fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + raw, e);
        }
    }

    private static int parseInt(Properties props, String key, int fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static boolean parseBoolean(Properties props, String key, boolean fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        var v = raw.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean for " + key + ": " + raw);
        };
    }
}
