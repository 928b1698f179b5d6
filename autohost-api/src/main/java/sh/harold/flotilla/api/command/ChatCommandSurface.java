package sh.harold.flotilla.api.command;

import java.util.Set;

/**
 * Chat commands a plugin contributes to the autohost command dispatcher.
 */
public interface ChatCommandSurface {

    /**
     * @return Lower-case names of the commands handled by this surface
     */
    Set<String> commandNames();

    /**
     * Executes a command issued by a lobby user.
     *
     * @param user        Issuing lobby user
     * @param commandLine Command name followed by its space separated parameters
     * @return Result whose lines are answered privately to the user
     */
    CommandResult execute(String user, String commandLine);
}
