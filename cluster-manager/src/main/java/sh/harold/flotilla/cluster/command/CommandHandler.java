package sh.harold.flotilla.cluster.command;

import sh.harold.flotilla.api.command.CommandResult;

/**
 * Interface for handling chat commands
 */
public interface CommandHandler {
    /**
     * Execute the command
     *
     * @param invocation Issuing user and command arguments
     * @return Lines answered to the user
     */
    CommandResult execute(CommandInvocation invocation);

    /**
     * Get the command name
     *
     * @return The primary command name
     */
    String getName();

    /**
     * Get command aliases
     *
     * @return Array of alternative command names
     */
    String[] getAliases();

    /**
     * Get command description
     *
     * @return Description of what the command does
     */
    String getDescription();

    /**
     * Get command usage
     *
     * @return Usage syntax for the command
     */
    String getUsage();
}
