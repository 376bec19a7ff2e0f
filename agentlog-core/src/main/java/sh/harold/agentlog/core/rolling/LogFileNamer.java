package sh.harold.agentlog.core.rolling;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Produces file names for newly rotated log files.
 */
@FunctionalInterface
public interface LogFileNamer {
    String nextName(String prefix);

    /**
     * Names files {@code prefix_pid_timestamp_.log} with a second-granularity UTC timestamp.
     *
     * <p>Two rotations by the same process within the same second produce the same name, so the
     * second rotation appends to the first file.
     */
    static LogFileNamer timestamped(Clock clock, LongSupplier processId) {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(processId, "processId");
        return prefix -> {
            Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            String timestamp = DateTimeFormatter.ISO_INSTANT.format(now).replace(':', '_');
            return prefix + "_" + processId.getAsLong() + "_" + timestamp + "_.log";
        };
    }

    static LogFileNamer systemDefault() {
        return timestamped(Clock.systemUTC(), () -> ProcessHandle.current().pid());
    }
}
