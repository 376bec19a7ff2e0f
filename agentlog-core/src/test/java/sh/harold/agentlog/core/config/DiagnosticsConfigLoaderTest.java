package sh.harold.agentlog.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sh.harold.agentlog.core.writer.DiagnosticLevel;

class DiagnosticsConfigLoaderTest {
    private static final System.Logger LOGGER = System.getLogger("config-test");

    @Test
    void missingFileIsCreatedWithDefaults(@TempDir Path dir) {
        Path configPath = dir.resolve("conf").resolve("agentlog.properties");

        DiagnosticsConfig config = DiagnosticsConfigLoader.loadOrCreate(configPath, LOGGER);

        assertTrue(Files.exists(configPath));
        assertEquals(dir.resolve("conf").resolve("logs").toAbsolutePath(), config.logFolder());
        assertEquals("agent", config.logPrefix());
        assertEquals(DiagnosticLevel.INFO, config.level());
        assertEquals(10_000, config.rotation().maxLinesPerFile());
        assertEquals(5, config.rotation().filesToKeep());
        assertFalse(config.consoleEnabled());
        assertTrue(config.sweepEnabled());
        assertEquals(config.logFolder(), config.sweep().root());
        assertEquals("log", config.sweep().extension());
        assertEquals(Duration.ofDays(7), config.sweep().maxAge());
        assertEquals(Duration.ofHours(1), config.sweep().interval());

        DiagnosticsConfig reloaded = DiagnosticsConfigLoader.loadOrCreate(configPath, LOGGER);
        assertEquals(config, reloaded);
    }

    @Test
    void readsConfiguredValues(@TempDir Path dir) throws Exception {
        Path configPath = dir.resolve("agentlog.properties");
        Files.writeString(configPath, String.join("\n",
            "log.folder=" + dir.resolve("diag").toAbsolutePath().toString().replace("\\", "\\\\"),
            "log.prefix=worker",
            "log.level=verbose",
            "log.maxLinesPerFile=250",
            "log.filesToKeep=3",
            "log.console=true",
            "sweep.enabled=false",
            "sweep.path=_diag",
            "sweep.extension=*",
            "sweep.maxAgeSeconds=0",
            "sweep.intervalSeconds=30",
            ""
        ));

        DiagnosticsConfig config = DiagnosticsConfigLoader.loadOrCreate(configPath, LOGGER);

        assertEquals(dir.resolve("diag").toAbsolutePath(), config.logFolder());
        assertEquals("worker", config.logPrefix());
        assertEquals(DiagnosticLevel.VERBOSE, config.level());
        assertEquals(250, config.rotation().maxLinesPerFile());
        assertEquals(3, config.rotation().filesToKeep());
        assertTrue(config.consoleEnabled());
        assertFalse(config.sweepEnabled());
        assertEquals(dir.toAbsolutePath().resolve("_diag"), config.sweep().root());
        assertEquals("*", config.sweep().extension());
        assertEquals(Duration.ZERO, config.sweep().maxAge());
        assertEquals(Duration.ofSeconds(30), config.sweep().interval());
    }

    @Test
    void invalidValuesFallBackToDefaults(@TempDir Path dir) throws Exception {
        Path configPath = dir.resolve("agentlog.properties");
        Files.writeString(configPath, String.join("\n",
            "log.prefix=   ",
            "log.level=LOUD",
            "log.maxLinesPerFile=-4",
            "log.filesToKeep=many",
            "log.console=maybe",
            "sweep.extension=.",
            "sweep.maxAgeSeconds=-1",
            "sweep.intervalSeconds=0",
            ""
        ));

        DiagnosticsConfig config = DiagnosticsConfigLoader.loadOrCreate(configPath, LOGGER);

        assertEquals("agent", config.logPrefix());
        assertEquals(DiagnosticLevel.INFO, config.level());
        assertEquals(10_000, config.rotation().maxLinesPerFile());
        assertEquals(5, config.rotation().filesToKeep());
        assertFalse(config.consoleEnabled());
        assertEquals("log", config.sweep().extension());
        assertEquals(Duration.ofDays(7), config.sweep().maxAge());
        assertEquals(Duration.ofHours(1), config.sweep().interval());
    }

    @Test
    void intervalTooLargeToScheduleFallsBackToDefault(@TempDir Path dir) throws Exception {
        Path configPath = dir.resolve("agentlog.properties");
        Files.writeString(configPath, "sweep.intervalSeconds=" + Long.MAX_VALUE + "\n");

        DiagnosticsConfig config = DiagnosticsConfigLoader.loadOrCreate(configPath, LOGGER);

        assertEquals(Duration.ofHours(1), config.sweep().interval());
    }

    @Test
    void largestSchedulableIntervalIsAccepted(@TempDir Path dir) throws Exception {
        Path configPath = dir.resolve("agentlog.properties");
        Files.writeString(configPath,
            "sweep.intervalSeconds=" + DiagnosticsConfigLoader.MAX_INTERVAL_SECONDS + "\n");

        DiagnosticsConfig config = DiagnosticsConfigLoader.loadOrCreate(configPath, LOGGER);

        assertEquals(Duration.ofSeconds(DiagnosticsConfigLoader.MAX_INTERVAL_SECONDS), config.sweep().interval());
    }
}
