package sh.harold.agentlog.core.rolling;

/**
 * Defines when a rolling log rotates and how many files it keeps.
 */
public record RotationPolicy(int maxLinesPerFile, int filesToKeep) {
    public RotationPolicy {
        if (maxLinesPerFile <= 0) {
            throw new IllegalArgumentException("maxLinesPerFile must be > 0.");
        }
        if (filesToKeep <= 0) {
            throw new IllegalArgumentException("filesToKeep must be > 0.");
        }
    }
}
