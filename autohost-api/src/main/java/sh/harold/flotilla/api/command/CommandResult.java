package sh.harold.flotilla.api.command;

import java.util.List;

/**
 * Output of a chat command.
 *
 * @param success Whether the command was accepted
 * @param lines   Lines to answer the issuing user with
 */
public record CommandResult(boolean success, List<String> lines) {

    public CommandResult {
        lines = List.copyOf(lines);
    }

    public static CommandResult ok(List<String> lines) {
        return new CommandResult(true, lines);
    }

    public static CommandResult ok(String line) {
        return new CommandResult(true, List.of(line));
    }

    public static CommandResult failure(String line) {
        return new CommandResult(false, List.of(line));
    }
}
