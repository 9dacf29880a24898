package ai.patchkit;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MatchSettingsTest {
    @Test
    void testDefaults() {
        var defaults = MatchSettings.DEFAULTS;
        assertEquals(0.80, defaults.fuzzyThreshold());
        assertEquals(1, defaults.windowTolerance());
        assertTrue(defaults.inferLineRange());
        assertEquals(300, defaults.lineNumberThreshold());
    }

    @Test
    void testOverlayKeepsAbsentKeys() {
        var props = new Properties();
        props.setProperty(MatchSettings.KEY_FUZZY_THRESHOLD, " 0.9 ");
        props.setProperty(MatchSettings.KEY_INFER_LINE_RANGE, "off");

        var settings = MatchSettings.DEFAULTS.overlay(props);
        assertEquals(0.9, settings.fuzzyThreshold());
        assertFalse(settings.inferLineRange());
        assertEquals(1, settings.windowTolerance());
        assertEquals(300, settings.lineNumberThreshold());
    }

    @Test
    void testInvalidValuesNameTheKey() {
        var props = new Properties();
        props.setProperty(MatchSettings.KEY_WINDOW_TOLERANCE, "two");
        var e = assertThrows(IllegalArgumentException.class, () -> MatchSettings.DEFAULTS.overlay(props));
        assertTrue(e.getMessage().contains(MatchSettings.KEY_WINDOW_TOLERANCE));

        var outOfRange =
                assertThrows(IllegalArgumentException.class, () -> MatchSettings.DEFAULTS.withFuzzyThreshold(1.5));
        assertTrue(outOfRange.getMessage().contains(MatchSettings.KEY_FUZZY_THRESHOLD));

        var badBoolean = new Properties();
        badBoolean.setProperty(MatchSettings.KEY_INFER_LINE_RANGE, "maybe");
        assertThrows(IllegalArgumentException.class, () -> MatchSettings.DEFAULTS.overlay(badBoolean));
    }

    @Test
    void testLoadExplicitFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("custom.properties");
        Files.writeString(file, "match.fuzzy.windowTolerance=3\nprompt.lineNumberThreshold=50\n");

        var settings = MatchSettings.load(file);
        assertEquals(3, settings.windowTolerance());
        assertEquals(50, settings.lineNumberThreshold());
    }

    @Test
    void testLoadMissingExplicitFileFails(@TempDir Path dir) {
        assertThrows(IOException.class, () -> MatchSettings.load(dir.resolve("missing.properties")));
    }

    @Test
    void testClasspathDefaultsMatchBuiltIns() throws IOException {
        var props = new Properties();
        try (var in = MatchSettings.class.getClassLoader().getResourceAsStream(MatchSettings.RESOURCE)) {
            assertNotNull(in);
            props.load(in);
        }
        assertEquals(MatchSettings.DEFAULTS, MatchSettings.DEFAULTS.overlay(props));
    }
}
