package sh.harold.agentlog.core.sweep;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Directory tree to sweep, which files qualify, how old they may get, and how often to look.
 *
 * <p>An extension of {@code *} matches every file. A leading dot on the extension is optional.
 */
public record SweepTarget(
    Path root,
    String extension,
    Duration maxAge,
    Duration interval
) {
    public static final String ANY_EXTENSION = "*";

    public SweepTarget {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(extension, "extension");
        Objects.requireNonNull(maxAge, "maxAge");
        Objects.requireNonNull(interval, "interval");
        extension = extension.trim();
        if (extension.startsWith(".")) {
            extension = extension.substring(1);
        }
        if (extension.isEmpty()) {
            throw new IllegalArgumentException("extension must be non-blank.");
        }
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be non-negative.");
        }
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0.");
        }
    }

    public static SweepTarget ofSeconds(Path root, String extension, long maxAgeSeconds, long intervalSeconds) {
        return new SweepTarget(root, extension, Duration.ofSeconds(maxAgeSeconds), Duration.ofSeconds(intervalSeconds));
    }

    public boolean matches(Path path) {
        if (ANY_EXTENSION.equals(extension)) {
            return true;
        }
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().endsWith("." + extension);
    }
}
