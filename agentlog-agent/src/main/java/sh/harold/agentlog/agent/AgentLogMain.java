package sh.harold.agentlog.agent;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import sh.harold.agentlog.core.config.DiagnosticsConfig;
import sh.harold.agentlog.core.config.DiagnosticsConfigLoader;
import sh.harold.agentlog.core.sweep.SweepResult;
import sh.harold.agentlog.core.sweep.SweepTarget;

/**
 * Command-line entry point: {@code agentlog <config> run|sweep|status}.
 */
public final class AgentLogMain {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: agentlog <config.properties> run|sweep|status";

    private AgentLogMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Objects.requireNonNull(args, "args");
        if (args.length != 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String command = args[1];
        if (!command.equals("run") && !command.equals("sweep") && !command.equals("status")) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        Path configPath = Path.of(args[0]);
        System.Logger logger = System.getLogger(AgentLogMain.class.getName());
        DiagnosticsConfig config = DiagnosticsConfigLoader.loadOrCreate(configPath, logger);
        switch (command) {
            case "run":
                return runLog(config, configPath, in, err);
            case "sweep":
                SweepResult result = AgentDiagnostics.sweepOnce(config, Clock.systemUTC(), logger);
                out.println("deleted=" + result.deleted());
                return EXIT_OK;
            default:
                return printStatus(config, configPath, out, err);
        }
    }

    private static int runLog(DiagnosticsConfig config, Path configPath, InputStream in, PrintStream err) {
        AgentDiagnostics runtime;
        try {
            runtime = AgentDiagnostics.start(config, configPath);
        } catch (RuntimeException e) {
            err.println("Diagnostics failed to start: " + e.getMessage());
            return EXIT_FAILURE;
        }
        try (runtime) {
            return pipe(runtime, in, err);
        }
    }

    private static int pipe(AgentDiagnostics runtime, InputStream in, PrintStream err) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                runtime.log().info(line);
            }
            return EXIT_OK;
        } catch (IOException e) {
            err.println("Failed to read input: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int printStatus(DiagnosticsConfig config, Path configPath, PrintStream out, PrintStream err) {
        List<Path> files;
        try {
            files = AgentDiagnostics.logFiles(config);
        } catch (IOException e) {
            err.println("Failed to list " + config.logFolder() + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        SweepTarget sweep = config.sweep();
        out.println("Config: " + configPath);
        out.println("Log folder: " + config.logFolder() + " (prefix " + config.logPrefix() + ")");
        out.println("Rotation: maxLinesPerFile=" + config.rotation().maxLinesPerFile()
            + ", filesToKeep=" + config.rotation().filesToKeep());
        out.println("Retained files: " + files.size());
        for (Path file : files) {
            out.println("  " + file.getFileName());
        }
        out.println("Sweep: " + (config.sweepEnabled() ? "enabled" : "disabled")
            + " path=" + sweep.root()
            + ", extension=" + sweep.extension()
            + ", maxAge=" + sweep.maxAge()
            + ", interval=" + sweep.interval());
        return EXIT_OK;
    }
}
