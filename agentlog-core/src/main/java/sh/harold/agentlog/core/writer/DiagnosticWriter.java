package sh.harold.agentlog.core.writer;

/**
 * Sink for diagnostic output.
 *
 * <p>Messages are written verbatim; separators are the caller's responsibility.
 */
public interface DiagnosticWriter {
    DiagnosticLevel level();

    void write(String message);

    void writeError(String message);

    void end();
}
