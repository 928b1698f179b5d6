package sh.harold.flotilla.api.process;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Description of a detached process to start.
 *
 * @param command          Executable followed by its arguments
 * @param workingDirectory Directory the process starts in
 * @param newConsole       Whether the process should get its own console window when supported
 */
public record LaunchRequest(List<String> command, Path workingDirectory, boolean newConsole) {

    public LaunchRequest {
        command = List.copyOf(command);
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
    }
}
