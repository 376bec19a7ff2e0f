package sh.harold.agentlog.core.writer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Set;

/**
 * Creates log folders with group-writable permissions.
 */
public final class Directories {
    private static final Set<PosixFilePermission> FOLDER_PERMISSIONS = PosixFilePermissions.fromString("rwxrwxr-x");

    private Directories() {
    }

    /**
     * Creates {@code folder} and its parents when absent, applying mode 775 where the file store is POSIX.
     * An existing folder is left as is.
     */
    public static Path ensureFolder(Path folder) throws IOException {
        Objects.requireNonNull(folder, "folder");
        if (Files.isDirectory(folder)) {
            return folder;
        }
        Files.createDirectories(folder);
        if (Files.getFileAttributeView(folder, PosixFileAttributeView.class) != null) {
            Files.setPosixFilePermissions(folder, FOLDER_PERMISSIONS);
        }
        return folder;
    }
}
