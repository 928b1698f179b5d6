package sh.harold.flotilla.cluster.command;

import java.util.Objects;
import java.util.Optional;

/**
 * A chat command issued by a lobby user.
 *
 * @param user Issuing lobby user
 * @param args Command arguments, the first element being the command name itself
 */
public record CommandInvocation(String user, String[] args) {

    public CommandInvocation {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(args, "args");
        if (args.length == 0) {
            throw new IllegalArgumentException("args must contain the command name");
        }
    }

    /**
     * @return Number of parameters, command name excluded
     */
    public int parameterCount() {
        return args.length - 1;
    }

    /**
     * @param index Zero-based parameter index, command name excluded
     */
    public Optional<String> parameter(int index) {
        return index + 1 < args.length ? Optional.of(args[index + 1]) : Optional.empty();
    }
}
