package sh.harold.agentlog.core.rolling;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import sh.harold.agentlog.core.writer.DiagnosticLevel;
import sh.harold.agentlog.core.writer.DiagnosticWriteException;
import sh.harold.agentlog.core.writer.DiagnosticWriter;
import sh.harold.agentlog.core.writer.Directories;

/**
 * Appends to one active file per prefix, rotating after a fixed number of writes and keeping a
 * bounded number of files on disk.
 *
 * <p>On construction the writer adopts existing files that share its prefix, oldest first, deletes
 * the oldest ones beyond the retention limit, and resumes the newest one when it still has room. Only one writer per folder and prefix is
 * supported.
 */
public final class RollingDiagnosticWriter implements DiagnosticWriter, AutoCloseable {
    private final DiagnosticLevel level;
    private final Path folder;
    private final String prefix;
    private final RotationPolicy policy;
    private final LogFileNamer namer;
    private final System.Logger logger;
    private final Deque<Path> fileQueue;

    private OutputStream out;
    private Path activeFile;
    private int lineCount;
    private boolean openedAny;

    public RollingDiagnosticWriter(
        DiagnosticLevel level,
        Path folder,
        String prefix,
        RotationPolicy policy,
        LogFileNamer namer,
        System.Logger logger
    ) {
        this.level = Objects.requireNonNull(level, "level");
        this.folder = Objects.requireNonNull(folder, "folder");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.namer = Objects.requireNonNull(namer, "namer");
        this.logger = Objects.requireNonNull(logger, "logger");
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must be non-blank.");
        }

        try {
            Directories.ensureFolder(folder);
            this.fileQueue = new ArrayDeque<>(existingFiles(folder, prefix));
            pruneOverflow();
            resumeNewest();
        } catch (IOException e) {
            throw new DiagnosticWriteException(
                DiagnosticWriteException.Failure.INITIALIZATION,
                "Failed to initialize rolling log in " + folder,
                e
            );
        }
    }

    @Override
    public DiagnosticLevel level() {
        return level;
    }

    @Override
    public synchronized void write(String message) {
        Objects.requireNonNull(message, "message");
        OutputStream stream = activeStream();
        try {
            stream.write(message.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DiagnosticWriteException(
                DiagnosticWriteException.Failure.WRITE,
                "Failed to append to " + activeFile,
                e
            );
        }
        lineCount++;
    }

    @Override
    public void writeError(String message) {
        write(message);
    }

    @Override
    public synchronized void end() {
        if (out == null) {
            return;
        }
        try {
            out.close();
        } catch (IOException e) {
            logger.log(System.Logger.Level.WARNING, "Failed to close " + activeFile, e);
        } finally {
            out = null;
            activeFile = null;
        }
    }

    @Override
    public void close() {
        end();
    }

    public synchronized Path activeFile() {
        return activeFile;
    }

    public synchronized int activeLineCount() {
        return out == null ? 0 : lineCount;
    }

    /**
     * Retained files, oldest first. The last entry is the active file while one is open.
     */
    public synchronized List<Path> files() {
        return List.copyOf(fileQueue);
    }

    private OutputStream activeStream() {
        if (out != null && lineCount >= policy.maxLinesPerFile()) {
            logger.log(System.Logger.Level.DEBUG, "Rotating " + activeFile + " after " + lineCount + " writes.");
            end();
        }
        if (out != null) {
            return out;
        }

        Path next = folder.resolve(namer.nextName(prefix));
        try {
            out = Files.newOutputStream(next, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            DiagnosticWriteException.Failure failure = openedAny || !fileQueue.isEmpty()
                ? DiagnosticWriteException.Failure.ROTATION
                : DiagnosticWriteException.Failure.INITIALIZATION;
            throw new DiagnosticWriteException(failure, "Failed to open log file " + next, e);
        }
        openedAny = true;
        activeFile = next;
        lineCount = 0;

        // Same-second rotations reuse the name; keep one queue entry per path.
        if (!next.equals(fileQueue.peekLast())) {
            fileQueue.remove(next);
            fileQueue.addLast(next);
        }
        pruneOverflow();
        return out;
    }

    private void pruneOverflow() {
        while (fileQueue.size() > policy.filesToKeep()) {
            Path oldest = fileQueue.removeFirst();
            try {
                Files.deleteIfExists(oldest);
            } catch (IOException e) {
                throw new DiagnosticWriteException(
                    DiagnosticWriteException.Failure.RETENTION_DELETE,
                    "Failed to delete old log file " + oldest,
                    e
                );
            }
            logger.log(System.Logger.Level.DEBUG, "Deleted old log file " + oldest);
        }
    }

    private void resumeNewest() throws IOException {
        Path newest = fileQueue.peekLast();
        if (newest == null) {
            return;
        }
        int existingLines = countLines(Files.readAllBytes(newest));
        if (existingLines >= policy.maxLinesPerFile()) {
            return;
        }
        out = Files.newOutputStream(newest, StandardOpenOption.APPEND);
        activeFile = newest;
        lineCount = existingLines;
        openedAny = true;
        logger.log(System.Logger.Level.DEBUG, "Resuming " + newest + " at " + existingLines + " lines.");
    }

    // Counted on raw bytes: a crash mid-write can leave a truncated multibyte character.
    static int countLines(byte[] content) {
        if (content.length == 0) {
            return 0;
        }
        int lines = 0;
        for (byte b : content) {
            if (b == '\n') {
                lines++;
            }
        }
        if (content[content.length - 1] != '\n') {
            lines++;
        }
        return lines;
    }

    /**
     * Regular files in {@code folder} whose names start with {@code prefix}, oldest modification first.
     */
    public static List<Path> existingFiles(Path folder, String prefix) throws IOException {
        List<Path> candidates;
        try (Stream<Path> stream = Files.list(folder)) {
            candidates = stream
                .filter(path -> path.getFileName().toString().startsWith(prefix))
                .filter(path -> Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS))
                .toList();
        }
        List<LogFileEntry> entries = new ArrayList<>(candidates.size());
        for (Path path : candidates) {
            entries.add(new LogFileEntry(path, Files.getLastModifiedTime(path, LinkOption.NOFOLLOW_LINKS)));
        }
        entries.sort(Comparator.comparing(LogFileEntry::lastModified)
            .thenComparing(entry -> entry.path().getFileName().toString()));
        List<Path> paths = new ArrayList<>(entries.size());
        for (LogFileEntry entry : entries) {
            paths.add(entry.path());
        }
        return paths;
    }

    private record LogFileEntry(Path path, FileTime lastModified) {
    }
}
