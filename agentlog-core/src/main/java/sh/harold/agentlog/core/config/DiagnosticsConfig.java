package sh.harold.agentlog.core.config;

import java.nio.file.Path;
import java.util.Objects;
import sh.harold.agentlog.core.rolling.RotationPolicy;
import sh.harold.agentlog.core.sweep.SweepTarget;
import sh.harold.agentlog.core.writer.DiagnosticLevel;

/**
 * Parsed configuration for agent diagnostics.
 */
public record DiagnosticsConfig(
    Path logFolder,
    String logPrefix,
    DiagnosticLevel level,
    RotationPolicy rotation,
    boolean consoleEnabled,
    boolean sweepEnabled,
    SweepTarget sweep
) {
    public DiagnosticsConfig {
        Objects.requireNonNull(logFolder, "logFolder");
        Objects.requireNonNull(logPrefix, "logPrefix");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(rotation, "rotation");
        Objects.requireNonNull(sweep, "sweep");
        if (logPrefix.isBlank()) {
            throw new IllegalArgumentException("logPrefix must be non-blank.");
        }
    }
}
