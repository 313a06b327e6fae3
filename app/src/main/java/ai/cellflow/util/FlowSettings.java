package ai.cellflow.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Analysis settings. Values come from {@code cellflow.properties} on the classpath, an optional properties file, and
 * finally {@code -Dcellflow.*} system properties, later sources winning.
 *
 * @param ignoreBuiltinReads drop reads of Python builtins ({@code print}, {@code len}, ...) from fragment read sets
 * @param warnOnUnknownSyntax log a warning the first time a run meets a node kind it has no scope rule for
 */
public record FlowSettings(boolean ignoreBuiltinReads, boolean warnOnUnknownSyntax) {
    private static final Logger logger = LogManager.getLogger(FlowSettings.class);

    public static final String RESOURCE_NAME = "cellflow.properties";
    public static final String KEY_IGNORE_BUILTIN_READS = "cellflow.ignoreBuiltinReads";
    public static final String KEY_WARN_ON_UNKNOWN_SYNTAX = "cellflow.warnOnUnknownSyntax";

    private static final FlowSettings DEFAULTS = new FlowSettings(true, true);

    private static volatile @Nullable FlowSettings cachedSettings;

    public static FlowSettings defaults() {
        return DEFAULTS;
    }

    /** Settings from the classpath resource plus system property overrides, loaded once per JVM. */
    public static FlowSettings load() {
        var settings = cachedSettings;
        if (settings == null) {
            synchronized (FlowSettings.class) {
                settings = cachedSettings;
                if (settings == null) {
                    settings = load(null);
                    cachedSettings = settings;
                }
            }
        }
        return settings;
    }

    /** Settings from the classpath resource, then {@code file} when given, then system properties. */
    public static FlowSettings load(@Nullable Path file) {
        var props = new Properties();
        try (InputStream in = FlowSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Failed to load {} from classpath: {}", RESOURCE_NAME, e.getMessage());
        }
        if (file != null) {
            try (var reader = Files.newBufferedReader(file)) {
                props.load(reader);
            } catch (IOException e) {
                logger.warn("Failed to load settings from {}: {}", file, e.getMessage());
            }
        }
        for (var key : new String[] {KEY_IGNORE_BUILTIN_READS, KEY_WARN_ON_UNKNOWN_SYNTAX}) {
            var override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    public static FlowSettings fromProperties(Properties props) {
        var settings = new FlowSettings(
                parseBoolean(props, KEY_IGNORE_BUILTIN_READS, DEFAULTS.ignoreBuiltinReads()),
                parseBoolean(props, KEY_WARN_ON_UNKNOWN_SYNTAX, DEFAULTS.warnOnUnknownSyntax()));
        logger.debug("Loaded {}", settings);
        return settings;
    }

    public FlowSettings withIgnoreBuiltinReads(boolean value) {
        return new FlowSettings(value, warnOnUnknownSyntax);
    }

    public FlowSettings withWarnOnUnknownSyntax(boolean value) {
        return new FlowSettings(ignoreBuiltinReads, value);
    }

    private static boolean parseBoolean(Properties props, String key, boolean fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0" -> false;
            default -> {
                logger.warn("Ignoring invalid boolean '{}' for {}, using {}", raw, key, fallback);
                yield fallback;
            }
        };
    }
}
