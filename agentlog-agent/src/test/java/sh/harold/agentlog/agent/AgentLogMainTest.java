package sh.harold.agentlog.agent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AgentLogMainTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void wrongArgumentCountPrintsUsage() {
        int exit = run("", "only-config");

        assertEquals(AgentLogMain.EXIT_USAGE, exit);
        assertTrue(err().startsWith("Usage:"));
    }

    @Test
    void unknownCommandPrintsUsage(@TempDir Path dir) {
        int exit = run("", dir.resolve("agentlog.properties").toString(), "explode");

        assertEquals(AgentLogMain.EXIT_USAGE, exit);
        assertTrue(Files.notExists(dir.resolve("agentlog.properties")));
    }

    @Test
    void runCopiesInputIntoRollingLog(@TempDir Path dir) throws Exception {
        Path config = writeConfig(dir, "log.folder=diag", "sweep.enabled=false");

        int exit = run("alpha\nbeta\n", config.toString(), "run");

        assertEquals(AgentLogMain.EXIT_OK, exit);
        List<Path> logs = list(dir.resolve("diag"));
        assertEquals(1, logs.size());
        assertTrue(logs.get(0).getFileName().toString().startsWith("agent_" + ProcessHandle.current().pid() + "_"));
        assertEquals("alpha\nbeta\n", Files.readString(logs.get(0), StandardCharsets.UTF_8));
    }

    @Test
    void sweepReportsDeletedCount(@TempDir Path dir) throws Exception {
        Path target = Files.createDirectories(dir.resolve("old-logs"));
        Path stale = Files.writeString(target.resolve("stale.log"), "x");
        Files.setLastModifiedTime(stale, FileTime.from(Instant.now().minus(Duration.ofDays(2))));
        Path fresh = Files.writeString(target.resolve("fresh.log"), "y");
        Path config = writeConfig(dir, "sweep.path=old-logs", "sweep.maxAgeSeconds=3600");

        int exit = run("", config.toString(), "sweep");

        assertEquals(AgentLogMain.EXIT_OK, exit);
        assertEquals("deleted=1", out().trim());
        assertTrue(Files.notExists(stale));
        assertTrue(Files.exists(fresh));
    }

    @Test
    void statusDescribesConfiguration(@TempDir Path dir) throws Exception {
        Path config = writeConfig(dir, "log.prefix=worker", "log.filesToKeep=2");

        int exit = run("", config.toString(), "status");

        assertEquals(AgentLogMain.EXIT_OK, exit);
        String status = out();
        assertTrue(status.contains("prefix worker"));
        assertTrue(status.contains("filesToKeep=2"));
        assertTrue(status.contains("Retained files: 0"));
        assertTrue(status.contains("Sweep: enabled"));
    }

    @Test
    void statusListsExistingFilesWithoutOpeningLog(@TempDir Path dir) throws Exception {
        Path logs = Files.createDirectories(dir.resolve("diag"));
        Files.writeString(logs.resolve("agent_1_a_.log"), "old\n");
        Files.writeString(logs.resolve("agent_2_b_.log"), "older\n");
        Files.writeString(logs.resolve("other.txt"), "ignored");
        Path config = writeConfig(dir, "log.folder=diag", "log.filesToKeep=1");

        int exit = run("", config.toString(), "status");

        assertEquals(AgentLogMain.EXIT_OK, exit);
        assertTrue(out().contains("Retained files: 2"));
        assertEquals(3, list(logs).size());
    }

    @Test
    void statusDoesNotCreateLogFolder(@TempDir Path dir) throws Exception {
        Path config = writeConfig(dir, "log.folder=diag");

        int exit = run("", config.toString(), "status");

        assertEquals(AgentLogMain.EXIT_OK, exit);
        assertTrue(Files.notExists(dir.resolve("diag")));
    }

    @Test
    void sweepDoesNotOpenLog(@TempDir Path dir) throws Exception {
        Files.createDirectories(dir.resolve("old-logs"));
        Path config = writeConfig(dir, "log.folder=diag", "sweep.path=old-logs");

        int exit = run("", config.toString(), "sweep");

        assertEquals(AgentLogMain.EXIT_OK, exit);
        assertEquals("deleted=0", out().trim());
        assertTrue(Files.notExists(dir.resolve("diag")));
    }

    @Test
    void startupFailureExitsWithError(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("occupied"), "not a folder");
        Path config = writeConfig(dir, "log.folder=occupied");

        int exit = run("", config.toString(), "run");

        assertEquals(AgentLogMain.EXIT_FAILURE, exit);
        assertTrue(err().startsWith("Diagnostics failed to start"));
    }

    private int run(String input, String... args) {
        InputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        return AgentLogMain.run(
            args,
            in,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8)
        );
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static Path writeConfig(Path dir, String... lines) throws IOException {
        return Files.writeString(dir.resolve("agentlog.properties"), String.join("\n", lines) + "\n");
    }

    private static List<Path> list(Path dir) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.sorted().toList();
        }
    }
}
