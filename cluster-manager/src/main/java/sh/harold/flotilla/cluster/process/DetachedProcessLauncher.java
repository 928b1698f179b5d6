package sh.harold.flotilla.cluster.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.process.LaunchRequest;
import sh.harold.flotilla.api.process.ProcessLauncher;
import sh.harold.flotilla.api.process.SpawnException;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Starts instance processes which outlive the manager: output is discarded and the process is
 * never waited on.
 */
public class DetachedProcessLauncher implements ProcessLauncher {
    private static final Logger LOGGER = LoggerFactory.getLogger(DetachedProcessLauncher.class);

    private final boolean windows;

    public DetachedProcessLauncher() {
        this(System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"));
    }

    DetachedProcessLauncher(boolean windows) {
        this.windows = windows;
    }

    @Override
    public long launchDetached(LaunchRequest request) throws SpawnException {
        List<String> command = command(request);
        LOGGER.debug("Command: {}", String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(request.workingDirectory().toFile());
        builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        builder.redirectError(ProcessBuilder.Redirect.DISCARD);
        builder.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));

        try {
            Process process = builder.start();
            LOGGER.debug("Detached process started with PID {}", process.pid());
            return process.pid();
        } catch (IOException | SecurityException e) {
            throw new SpawnException("Unable to start process " + command.get(0) + ": " + e.getMessage(), e);
        }
    }

    List<String> command(LaunchRequest request) {
        if (!windows || !request.newConsole()) {
            return request.command();
        }
        List<String> command = new ArrayList<>(List.of("cmd", "/c", "start", "\"\""));
        command.addAll(request.command());
        return command;
    }

    private File nullDevice() {
        return new File(windows ? "NUL" : "/dev/null");
    }
}
