package sh.harold.agentlog.core.sweep;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Periodically deletes files under a directory tree that are older than a configured age.
 *
 * <p>Cleanup is best-effort: files that cannot be read or deleted are skipped and reported to the
 * listener, and a run never fails because of filesystem state.
 */
public final class DiagnosticSweeper extends PeriodicWorker<SweepResult> {
    private final SweepTarget target;
    private final Clock clock;
    private final FileDeleter deleter;
    private final SweepListener listener;
    private final System.Logger logger;

    public DiagnosticSweeper(
        SweepTarget target,
        Clock clock,
        FileDeleter deleter,
        SweepListener listener,
        ScheduledExecutorService scheduler,
        System.Logger logger
    ) {
        super(Objects.requireNonNull(target, "target").interval(), scheduler, logger);
        this.target = target;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.deleter = Objects.requireNonNull(deleter, "deleter");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public SweepTarget target() {
        return target;
    }

    @Override
    protected SweepResult doWork() {
        Path root = target.root();
        info("Cleaning files: " + root);
        if (!Files.isDirectory(root)) {
            return SweepResult.empty();
        }

        List<Path> candidates = collectCandidates(root);
        int deleted = 0;
        int skipped = 0;
        boolean stopped = false;
        for (Path candidate : candidates) {
            if (isCancelled()) {
                stopped = true;
                break;
            }

            BasicFileAttributes attributes;
            try {
                attributes = Files.readAttributes(candidate, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            } catch (IOException e) {
                skipped++;
                skipped(candidate, e);
                continue;
            }
            if (attributes.isDirectory()) {
                continue;
            }

            Instant modified = attributes.lastModifiedTime().toInstant();
            Duration age = Duration.between(modified, clock.instant());
            if (age.compareTo(target.maxAge()) <= 0) {
                continue;
            }

            try {
                deleter.delete(candidate);
            } catch (IOException e) {
                skipped++;
                skipped(candidate, e);
                continue;
            }
            deleted++;
            deleted(candidate);
        }

        info("deleted file count: " + deleted);
        return new SweepResult(candidates.size(), deleted, skipped, stopped);
    }

    private List<Path> collectCandidates(Path root) {
        List<Path> candidates = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (isCancelled()) {
                        return FileVisitResult.TERMINATE;
                    }
                    add(dir);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    add(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.log(System.Logger.Level.DEBUG, "Cannot visit " + file + ": " + exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }

                private void add(Path path) {
                    if (target.matches(path)) {
                        candidates.add(path);
                    }
                }
            });
        } catch (IOException e) {
            logger.log(System.Logger.Level.WARNING, "Failed to scan " + root, e);
        }
        return candidates;
    }

    private void info(String message) {
        try {
            listener.onInfo(message);
        } catch (RuntimeException e) {
            logger.log(System.Logger.Level.WARNING, "Sweep listener failed.", e);
        }
    }

    private void deleted(Path path) {
        try {
            listener.onDeleted(path);
        } catch (RuntimeException e) {
            logger.log(System.Logger.Level.WARNING, "Sweep listener failed.", e);
        }
    }

    private void skipped(Path path, IOException cause) {
        try {
            listener.onSkipped(path, cause);
        } catch (RuntimeException e) {
            logger.log(System.Logger.Level.WARNING, "Sweep listener failed.", e);
        }
    }
}
