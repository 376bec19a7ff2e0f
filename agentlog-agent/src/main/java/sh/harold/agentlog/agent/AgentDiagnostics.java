package sh.harold.agentlog.agent;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import sh.harold.agentlog.core.config.DiagnosticsConfig;
import sh.harold.agentlog.core.rolling.LogFileNamer;
import sh.harold.agentlog.core.rolling.RollingDiagnosticWriter;
import sh.harold.agentlog.core.sweep.DiagnosticSweeper;
import sh.harold.agentlog.core.sweep.FileDeleter;
import sh.harold.agentlog.core.sweep.SweepListener;
import sh.harold.agentlog.core.sweep.SweepResult;
import sh.harold.agentlog.core.writer.ConsoleDiagnosticWriter;
import sh.harold.agentlog.core.writer.DiagnosticLog;
import sh.harold.agentlog.core.writer.DiagnosticWriter;

/**
 * Wires the rolling log, optional console output and the retention sweeper for one agent process.
 */
final class AgentDiagnostics implements AutoCloseable {
    private static final long SHUTDOWN_WAIT_MS = 2_000L;

    private final System.Logger logger;
    private final DiagnosticsConfig config;
    private final Path configPath;
    private final ScheduledExecutorService scheduler;
    private final DiagnosticLog log;
    private final DiagnosticSweeper sweeper;

    static AgentDiagnostics start(DiagnosticsConfig config, Path configPath) {
        System.Logger logger = System.getLogger(AgentDiagnostics.class.getName());
        return start(config, configPath, Clock.systemUTC(), LogFileNamer.systemDefault(), logger);
    }

    static AgentDiagnostics start(
        DiagnosticsConfig config,
        Path configPath,
        Clock clock,
        LogFileNamer namer,
        System.Logger logger
    ) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(namer, "namer");
        Objects.requireNonNull(logger, "logger");

        RollingDiagnosticWriter rollingWriter = new RollingDiagnosticWriter(
            config.level(),
            config.logFolder(),
            config.logPrefix(),
            config.rotation(),
            namer,
            logger
        );

        ScheduledExecutorService scheduler = null;
        try {
            List<DiagnosticWriter> writers = new ArrayList<>();
            writers.add(rollingWriter);
            if (config.consoleEnabled()) {
                writers.add(new ConsoleDiagnosticWriter(config.level()));
            }
            DiagnosticLog log = new DiagnosticLog(writers, logger);

            scheduler = newScheduler();
            DiagnosticSweeper sweeper = newSweeper(config, clock, scheduler, logger);
            if (config.sweepEnabled()) {
                sweeper.start();
            }
            logger.log(System.Logger.Level.INFO, "Diagnostics started in " + config.logFolder());
            return new AgentDiagnostics(logger, config, configPath, scheduler, log, sweeper);
        } catch (RuntimeException e) {
            if (scheduler != null) {
                scheduler.shutdownNow();
            }
            rollingWriter.end();
            throw e;
        }
    }

    /**
     * Runs one sweep without opening the log or arming the periodic schedule.
     */
    static SweepResult sweepOnce(DiagnosticsConfig config, Clock clock, System.Logger logger) {
        Objects.requireNonNull(config, "config");
        ScheduledExecutorService scheduler = newScheduler();
        try (DiagnosticSweeper sweeper = newSweeper(config, clock, scheduler, logger)) {
            return sweeper.runNow().orElse(SweepResult.empty());
        } finally {
            scheduler.shutdownNow();
        }
    }

    /**
     * Lists the retained log files for {@code config} without touching them.
     */
    static List<Path> logFiles(DiagnosticsConfig config) throws IOException {
        Objects.requireNonNull(config, "config");
        if (!Files.isDirectory(config.logFolder())) {
            return List.of();
        }
        return RollingDiagnosticWriter.existingFiles(config.logFolder(), config.logPrefix());
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("agentlog-sweeper"));
    }

    private static DiagnosticSweeper newSweeper(
        DiagnosticsConfig config,
        Clock clock,
        ScheduledExecutorService scheduler,
        System.Logger logger
    ) {
        return new DiagnosticSweeper(
            config.sweep(),
            clock,
            FileDeleter.defaultDeleter(),
            SweepListener.logging(logger),
            scheduler,
            logger
        );
    }

    private AgentDiagnostics(
        System.Logger logger,
        DiagnosticsConfig config,
        Path configPath,
        ScheduledExecutorService scheduler,
        DiagnosticLog log,
        DiagnosticSweeper sweeper
    ) {
        this.logger = logger;
        this.config = config;
        this.configPath = configPath;
        this.scheduler = scheduler;
        this.log = log;
        this.sweeper = sweeper;
    }

    DiagnosticLog log() {
        return log;
    }

    DiagnosticsConfig config() {
        return config;
    }

    Path configPath() {
        return configPath;
    }

    @Override
    public void close() {
        sweeper.close();
        try {
            scheduler.shutdownNow();
            scheduler.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.log(System.Logger.Level.WARNING, "Scheduler shutdown failed.", e);
        }

        try {
            log.end();
        } catch (Exception e) {
            logger.log(System.Logger.Level.WARNING, "Failed to close diagnostic writers.", e);
        }
    }
}
