package sh.harold.flotilla.cluster.process;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Command line of the running autohost, used to start instances when no worker command is
 * configured.
 */
public final class CurrentProcessCommand {
    private static final Pattern MACRO_ARGUMENT = Pattern.compile("^[\\w:]+=.*");

    private CurrentProcessCommand() {
    }

    /**
     * @return Executable and arguments of the current process, configuration macro arguments
     * excluded; empty if the platform does not expose them
     */
    public static List<String> resolve() {
        ProcessHandle.Info info = ProcessHandle.current().info();
        Optional<String> executable = info.command();
        if (executable.isEmpty()) {
            return List.of();
        }
        List<String> command = new ArrayList<>();
        command.add(executable.get());
        command.addAll(withoutMacros(info.arguments().map(List::of).orElse(List.of())));
        return command;
    }

    static List<String> withoutMacros(List<String> arguments) {
        List<String> kept = new ArrayList<>();
        for (String argument : arguments) {
            if (!MACRO_ARGUMENT.matcher(argument).matches()) {
                kept.add(argument);
            }
        }
        return kept;
    }
}
