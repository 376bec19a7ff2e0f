package sh.harold.agentlog.core.writer;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Appends every message to one fixed file.
 */
public final class FileDiagnosticWriter implements DiagnosticWriter, AutoCloseable {
    private static final String DIVIDER = "-".repeat(40);

    private final DiagnosticLevel level;
    private final Path file;
    private OutputStream out;

    public FileDiagnosticWriter(DiagnosticLevel level, Path folder, String fileName) {
        this.level = Objects.requireNonNull(level, "level");
        Objects.requireNonNull(folder, "folder");
        Objects.requireNonNull(fileName, "fileName");
        if (fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must be non-blank.");
        }
        this.file = folder.resolve(fileName);
        try {
            Directories.ensureFolder(folder);
            this.out = Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new DiagnosticWriteException(
                DiagnosticWriteException.Failure.INITIALIZATION,
                "Failed to open diagnostic file " + file,
                e
            );
        }
    }

    @Override
    public DiagnosticLevel level() {
        return level;
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void write(String message) {
        Objects.requireNonNull(message, "message");
        if (out == null) {
            throw new IllegalStateException("Writer for " + file + " has ended.");
        }
        try {
            out.write(message.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DiagnosticWriteException(
                DiagnosticWriteException.Failure.WRITE,
                "Failed to append to " + file,
                e
            );
        }
    }

    @Override
    public void writeError(String message) {
        write(message);
    }

    public void divider() {
        write(DIVIDER);
    }

    @Override
    public synchronized void end() {
        if (out == null) {
            return;
        }
        try {
            out.close();
        } catch (IOException e) {
            throw new DiagnosticWriteException(
                DiagnosticWriteException.Failure.WRITE,
                "Failed to close " + file,
                e
            );
        } finally {
            out = null;
        }
    }

    @Override
    public void close() {
        end();
    }
}
