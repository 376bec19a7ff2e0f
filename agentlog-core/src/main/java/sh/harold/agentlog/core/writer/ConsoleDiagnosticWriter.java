package sh.harold.agentlog.core.writer;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes messages to standard output and errors to standard error.
 */
public final class ConsoleDiagnosticWriter implements DiagnosticWriter {
    private final DiagnosticLevel level;
    private final PrintStream out;
    private final PrintStream err;

    public ConsoleDiagnosticWriter(DiagnosticLevel level) {
        this(level, System.out, System.err);
    }

    public ConsoleDiagnosticWriter(DiagnosticLevel level, PrintStream out, PrintStream err) {
        this.level = Objects.requireNonNull(level, "level");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    @Override
    public DiagnosticLevel level() {
        return level;
    }

    @Override
    public void write(String message) {
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        out.write(bytes, 0, bytes.length);
    }

    @Override
    public void writeError(String message) {
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        err.write(bytes, 0, bytes.length);
    }

    @Override
    public void end() {
        out.flush();
        err.flush();
    }
}
