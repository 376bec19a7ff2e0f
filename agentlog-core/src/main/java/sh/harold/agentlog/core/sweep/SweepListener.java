package sh.harold.agentlog.core.sweep;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Receives progress notifications from a sweep run.
 */
public interface SweepListener {
    default void onInfo(String message) {
    }

    default void onDeleted(Path path) {
    }

    default void onSkipped(Path path, IOException cause) {
    }

    static SweepListener noop() {
        return new SweepListener() {
        };
    }

    static SweepListener logging(System.Logger logger) {
        Objects.requireNonNull(logger, "logger");
        return new SweepListener() {
            @Override
            public void onInfo(String message) {
                logger.log(System.Logger.Level.INFO, message);
            }

            @Override
            public void onDeleted(Path path) {
                logger.log(System.Logger.Level.DEBUG, "Deleted " + path);
            }

            @Override
            public void onSkipped(Path path, IOException cause) {
                logger.log(System.Logger.Level.WARNING, "Skipped " + path, cause);
            }
        };
    }
}
