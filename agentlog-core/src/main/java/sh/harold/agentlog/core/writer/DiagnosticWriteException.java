package sh.harold.agentlog.core.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Raised when a diagnostic writer cannot open, append to, or prune its files.
 */
public final class DiagnosticWriteException extends UncheckedIOException {
    private static final long serialVersionUID = 1L;

    public enum Failure {
        INITIALIZATION,
        ROTATION,
        RETENTION_DELETE,
        WRITE
    }

    private final Failure failure;

    public DiagnosticWriteException(Failure failure, String message, IOException cause) {
        super(message, Objects.requireNonNull(cause, "cause"));
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public Failure failure() {
        return failure;
    }
}
