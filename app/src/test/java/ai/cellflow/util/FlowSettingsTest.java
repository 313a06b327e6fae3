package ai.cellflow.util;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class FlowSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        var settings = FlowSettings.defaults();
        assertTrue(settings.ignoreBuiltinReads());
        assertTrue(settings.warnOnUnknownSyntax());
    }

    @Test
    void testFromProperties() {
        var props = new Properties();
        props.setProperty(FlowSettings.KEY_IGNORE_BUILTIN_READS, "no");
        props.setProperty(FlowSettings.KEY_WARN_ON_UNKNOWN_SYNTAX, " OFF ");
        var settings = FlowSettings.fromProperties(props);
        assertFalse(settings.ignoreBuiltinReads());
        assertFalse(settings.warnOnUnknownSyntax());
    }

    @Test
    void testInvalidValueFallsBackToDefault() {
        var props = new Properties();
        props.setProperty(FlowSettings.KEY_IGNORE_BUILTIN_READS, "maybe");
        assertTrue(FlowSettings.fromProperties(props).ignoreBuiltinReads());
    }

    @Test
    void testLoadFromFileOverridesClasspath() throws IOException {
        var file = tempDir.resolve("cellflow.properties");
        Files.writeString(file, FlowSettings.KEY_IGNORE_BUILTIN_READS + "=false\n");
        var settings = FlowSettings.load(file);
        assertFalse(settings.ignoreBuiltinReads());
        assertTrue(settings.warnOnUnknownSyntax());
    }

    @Test
    void testMissingFileIsNotFatal() {
        var settings = FlowSettings.load(tempDir.resolve("does-not-exist.properties"));
        assertEquals(FlowSettings.defaults(), settings);
    }

    @Test
    void testSystemPropertyWins() throws IOException {
        var file = tempDir.resolve("cellflow.properties");
        Files.writeString(file, FlowSettings.KEY_WARN_ON_UNKNOWN_SYNTAX + "=true\n");
        System.setProperty(FlowSettings.KEY_WARN_ON_UNKNOWN_SYNTAX, "false");
        try {
            assertFalse(FlowSettings.load(file).warnOnUnknownSyntax());
        } finally {
            System.clearProperty(FlowSettings.KEY_WARN_ON_UNKNOWN_SYNTAX);
        }
    }

    @Test
    void testWithers() {
        var settings = FlowSettings.defaults().withIgnoreBuiltinReads(false).withWarnOnUnknownSyntax(false);
        assertEquals(new FlowSettings(false, false), settings);
        assertTrue(FlowSettings.defaults().ignoreBuiltinReads());
    }
}
