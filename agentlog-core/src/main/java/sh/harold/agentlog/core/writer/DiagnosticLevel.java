package sh.harold.agentlog.core.writer;

/**
 * Verbosity levels, ordered from most to least severe.
 */
public enum DiagnosticLevel {
    ERROR(1),
    WARNING(2),
    STATUS(3),
    INFO(4),
    VERBOSE(5);

    private final int value;

    DiagnosticLevel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Returns true when a writer configured at this level should receive a message at {@code messageLevel}.
     */
    public boolean accepts(DiagnosticLevel messageLevel) {
        return messageLevel.value <= value;
    }
}
