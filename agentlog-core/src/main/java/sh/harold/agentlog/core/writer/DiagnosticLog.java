package sh.harold.agentlog.core.writer;

import java.util.List;
import java.util.Objects;

/**
 * Routes leveled messages to every writer whose level accepts them.
 */
public final class DiagnosticLog {
    private final List<DiagnosticWriter> writers;
    private final System.Logger logger;

    public DiagnosticLog(List<? extends DiagnosticWriter> writers, System.Logger logger) {
        this.writers = List.copyOf(Objects.requireNonNull(writers, "writers"));
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public void error(String message) {
        log(DiagnosticLevel.ERROR, message);
    }

    public void warning(String message) {
        log(DiagnosticLevel.WARNING, message);
    }

    public void status(String message) {
        log(DiagnosticLevel.STATUS, message);
    }

    public void info(String message) {
        log(DiagnosticLevel.INFO, message);
    }

    public void verbose(String message) {
        log(DiagnosticLevel.VERBOSE, message);
    }

    public void log(DiagnosticLevel level, String message) {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(message, "message");
        String line = message + "\n";
        boolean error = level == DiagnosticLevel.ERROR || level == DiagnosticLevel.WARNING;
        for (DiagnosticWriter writer : writers) {
            if (!writer.level().accepts(level)) {
                continue;
            }
            if (error) {
                writer.writeError(line);
            } else {
                writer.write(line);
            }
        }
    }

    public List<DiagnosticWriter> writers() {
        return writers;
    }

    public void end() {
        for (DiagnosticWriter writer : writers) {
            try {
                writer.end();
            } catch (RuntimeException e) {
                logger.log(System.Logger.Level.WARNING, "Failed to end diagnostic writer " + writer, e);
            }
        }
    }
}
