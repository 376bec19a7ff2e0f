package sh.harold.agentlog.core.config;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import sh.harold.agentlog.core.rolling.RotationPolicy;
import sh.harold.agentlog.core.sweep.SweepTarget;
import sh.harold.agentlog.core.writer.DiagnosticLevel;

/**
 * Loads {@link DiagnosticsConfig} from a properties file, writing defaults when it is missing.
 *
 * <p>Each key is validated on its own; an invalid value is logged and replaced by its default.
 * Relative paths resolve against the directory holding the file.
 */
public final class DiagnosticsConfigLoader {
    static final String LOG_FOLDER = "log.folder";
    static final String LOG_PREFIX = "log.prefix";
    static final String LOG_LEVEL = "log.level";
    static final String LOG_MAX_LINES = "log.maxLinesPerFile";
    static final String LOG_FILES_TO_KEEP = "log.filesToKeep";
    static final String LOG_CONSOLE = "log.console";
    static final String SWEEP_ENABLED = "sweep.enabled";
    static final String SWEEP_PATH = "sweep.path";
    static final String SWEEP_EXTENSION = "sweep.extension";
    static final String SWEEP_MAX_AGE_SECONDS = "sweep.maxAgeSeconds";
    static final String SWEEP_INTERVAL_SECONDS = "sweep.intervalSeconds";

    private static final String DEFAULT_LOG_FOLDER = "logs";
    private static final String DEFAULT_LOG_PREFIX = "agent";
    private static final DiagnosticLevel DEFAULT_LEVEL = DiagnosticLevel.INFO;
    private static final int DEFAULT_MAX_LINES = 10_000;
    private static final int DEFAULT_FILES_TO_KEEP = 5;
    private static final boolean DEFAULT_CONSOLE = false;
    private static final boolean DEFAULT_SWEEP_ENABLED = true;
    private static final String DEFAULT_SWEEP_EXTENSION = "log";
    private static final long DEFAULT_SWEEP_MAX_AGE_SECONDS = Duration.ofDays(7).toSeconds();
    private static final long DEFAULT_SWEEP_INTERVAL_SECONDS = Duration.ofHours(1).toSeconds();
    // Intervals are scheduled in milliseconds.
    static final long MAX_INTERVAL_SECONDS = Long.MAX_VALUE / 1000L;

    private DiagnosticsConfigLoader() {
    }

    public static DiagnosticsConfig loadOrCreate(Path configPath, System.Logger logger) {
        Objects.requireNonNull(configPath, "configPath");
        Objects.requireNonNull(logger, "logger");

        Properties properties = new Properties();
        if (Files.exists(configPath)) {
            try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IOException | IllegalArgumentException e) {
                logger.log(
                    System.Logger.Level.WARNING,
                    "Failed to load diagnostics config from " + configPath + "; using defaults.",
                    e
                );
                properties = new Properties();
            }
        } else {
            writeDefaults(configPath, logger);
        }

        Path baseDir = configPath.toAbsolutePath().getParent();
        return parse(properties, baseDir, logger);
    }

    static DiagnosticsConfig parse(Properties properties, Path baseDir, System.Logger logger) {
        Path logFolder = resolve(baseDir, nonBlankString(properties, LOG_FOLDER, DEFAULT_LOG_FOLDER, logger));
        String prefix = nonBlankString(properties, LOG_PREFIX, DEFAULT_LOG_PREFIX, logger);
        DiagnosticLevel level = level(properties, logger);
        int maxLines = positiveInt(properties, LOG_MAX_LINES, DEFAULT_MAX_LINES, logger);
        int filesToKeep = positiveInt(properties, LOG_FILES_TO_KEEP, DEFAULT_FILES_TO_KEEP, logger);
        boolean console = bool(properties, LOG_CONSOLE, DEFAULT_CONSOLE, logger);

        boolean sweepEnabled = bool(properties, SWEEP_ENABLED, DEFAULT_SWEEP_ENABLED, logger);
        String rawSweepPath = properties.getProperty(SWEEP_PATH);
        Path sweepPath = rawSweepPath == null || rawSweepPath.isBlank()
            ? logFolder
            : resolve(baseDir, rawSweepPath.trim());
        String extension = nonBlankString(properties, SWEEP_EXTENSION, DEFAULT_SWEEP_EXTENSION, logger);
        if (extension.equals(".")) {
            logger.log(
                System.Logger.Level.WARNING,
                "Config " + SWEEP_EXTENSION + " must name an extension; using default " + DEFAULT_SWEEP_EXTENSION + "."
            );
            extension = DEFAULT_SWEEP_EXTENSION;
        }
        long maxAgeSeconds = nonNegativeLong(properties, SWEEP_MAX_AGE_SECONDS, DEFAULT_SWEEP_MAX_AGE_SECONDS, logger);
        long intervalSeconds = positiveLong(properties, SWEEP_INTERVAL_SECONDS, DEFAULT_SWEEP_INTERVAL_SECONDS, logger);
        if (intervalSeconds > MAX_INTERVAL_SECONDS) {
            logger.log(
                System.Logger.Level.WARNING,
                "Config " + SWEEP_INTERVAL_SECONDS + " must be <= " + MAX_INTERVAL_SECONDS + "; using default "
                    + DEFAULT_SWEEP_INTERVAL_SECONDS + "."
            );
            intervalSeconds = DEFAULT_SWEEP_INTERVAL_SECONDS;
        }

        return new DiagnosticsConfig(
            logFolder,
            prefix,
            level,
            new RotationPolicy(maxLines, filesToKeep),
            console,
            sweepEnabled,
            SweepTarget.ofSeconds(sweepPath, extension, maxAgeSeconds, intervalSeconds)
        );
    }

    private static void writeDefaults(Path configPath, System.Logger logger) {
        Properties defaults = new Properties();
        defaults.setProperty(LOG_FOLDER, DEFAULT_LOG_FOLDER);
        defaults.setProperty(LOG_PREFIX, DEFAULT_LOG_PREFIX);
        defaults.setProperty(LOG_LEVEL, DEFAULT_LEVEL.name());
        defaults.setProperty(LOG_MAX_LINES, Integer.toString(DEFAULT_MAX_LINES));
        defaults.setProperty(LOG_FILES_TO_KEEP, Integer.toString(DEFAULT_FILES_TO_KEEP));
        defaults.setProperty(LOG_CONSOLE, Boolean.toString(DEFAULT_CONSOLE));
        defaults.setProperty(SWEEP_ENABLED, Boolean.toString(DEFAULT_SWEEP_ENABLED));
        defaults.setProperty(SWEEP_EXTENSION, DEFAULT_SWEEP_EXTENSION);
        defaults.setProperty(SWEEP_MAX_AGE_SECONDS, Long.toString(DEFAULT_SWEEP_MAX_AGE_SECONDS));
        defaults.setProperty(SWEEP_INTERVAL_SECONDS, Long.toString(DEFAULT_SWEEP_INTERVAL_SECONDS));
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(configPath, StandardCharsets.UTF_8)) {
                defaults.store(writer, "Agent diagnostics");
            }
            logger.log(System.Logger.Level.INFO, "Wrote default config: " + configPath);
        } catch (IOException e) {
            logger.log(System.Logger.Level.WARNING, "Failed to write default diagnostics config to " + configPath, e);
        }
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value);
        if (path.isAbsolute() || baseDir == null) {
            return path;
        }
        return baseDir.resolve(path);
    }

    private static DiagnosticLevel level(Properties properties, System.Logger logger) {
        String value = properties.getProperty(LOG_LEVEL);
        if (value == null) {
            return DEFAULT_LEVEL;
        }
        try {
            return DiagnosticLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.log(
                System.Logger.Level.WARNING,
                "Config " + LOG_LEVEL + " is not a known level (" + value + "); using default " + DEFAULT_LEVEL + "."
            );
            return DEFAULT_LEVEL;
        }
    }

    private static String nonBlankString(Properties properties, String key, String defaultValue, System.Logger logger) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        if (value.isBlank()) {
            logger.log(System.Logger.Level.WARNING, "Config " + key + " must be non-blank; using default " + defaultValue + ".");
            return defaultValue;
        }
        return value.trim();
    }

    private static boolean bool(Properties properties, String key, boolean defaultValue, System.Logger logger) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) {
            return true;
        }
        if (normalized.equals("false")) {
            return false;
        }
        logger.log(System.Logger.Level.WARNING, "Config " + key + " must be true or false; using default " + defaultValue + ".");
        return defaultValue;
    }

    private static int positiveInt(Properties properties, String key, int defaultValue, System.Logger logger) {
        long value = positiveLong(properties, key, defaultValue, logger);
        if (value > Integer.MAX_VALUE) {
            logger.log(System.Logger.Level.WARNING, "Config " + key + " is too large; using default " + defaultValue + ".");
            return defaultValue;
        }
        return (int) value;
    }

    private static long positiveLong(Properties properties, String key, long defaultValue, System.Logger logger) {
        Long value = parseLong(properties, key, logger);
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0L) {
            logger.log(System.Logger.Level.WARNING, "Config " + key + " must be > 0; using default " + defaultValue + ".");
            return defaultValue;
        }
        return value;
    }

    private static long nonNegativeLong(Properties properties, String key, long defaultValue, System.Logger logger) {
        Long value = parseLong(properties, key, logger);
        if (value == null) {
            return defaultValue;
        }
        if (value < 0L) {
            logger.log(System.Logger.Level.WARNING, "Config " + key + " must be >= 0; using default " + defaultValue + ".");
            return defaultValue;
        }
        return value;
    }

    private static Long parseLong(Properties properties, String key, System.Logger logger) {
        String value = properties.getProperty(key);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.log(System.Logger.Level.WARNING, "Config " + key + " is not a number (" + value + "); using default.");
            return null;
        }
    }
}
