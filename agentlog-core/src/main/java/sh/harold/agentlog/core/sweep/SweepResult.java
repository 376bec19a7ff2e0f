package sh.harold.agentlog.core.sweep;

/**
 * Outcome of one sweep run.
 */
public record SweepResult(
    int scanned,
    int deleted,
    int skipped,
    boolean cancelled
) {
    public static SweepResult empty() {
        return new SweepResult(0, 0, 0, false);
    }
}
