package sh.harold.flotilla.cluster.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.command.ChatCommandSurface;
import sh.harold.flotilla.api.command.CommandResult;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for managing chat commands
 */
public class CommandRegistry implements ChatCommandSurface {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, CommandHandler> commands = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    /**
     * Register a command handler
     *
     * @param handler The command handler to register
     */
    public void registerCommand(CommandHandler handler) {
        String name = handler.getName().toLowerCase(Locale.ROOT);
        commands.put(name, handler);

        for (String alias : handler.getAliases()) {
            aliases.put(alias.toLowerCase(Locale.ROOT), name);
        }

        LOGGER.debug("Registered command: {} with {} aliases", name, handler.getAliases().length);
    }

    /**
     * Execute a command
     *
     * @param user  Issuing lobby user
     * @param input The full command input
     * @return Lines answered to the user
     */
    public CommandResult executeCommand(String user, String input) {
        if (input == null || input.trim().isEmpty()) {
            return CommandResult.failure("Empty command");
        }

        String[] parts = input.trim().split("\\s+");
        CommandHandler handler = getCommand(parts[0]);
        if (handler == null) {
            return CommandResult.failure("Unknown command: " + parts[0] + " (use !clusterHelp to list cluster commands)");
        }

        try {
            return handler.execute(new CommandInvocation(user, parts));
        } catch (RuntimeException e) {
            LOGGER.error("Error executing command: " + handler.getName(), e);
            return CommandResult.failure("Error executing command: " + e.getMessage());
        }
    }

    @Override
    public Set<String> commandNames() {
        Set<String> names = new HashSet<>(commands.keySet());
        names.addAll(aliases.keySet());
        return Collections.unmodifiableSet(names);
    }

    @Override
    public CommandResult execute(String user, String commandLine) {
        return executeCommand(user, commandLine);
    }

    /**
     * Get all registered commands
     *
     * @return Collection of all command handlers
     */
    public Collection<CommandHandler> getAllCommands() {
        return commands.values();
    }

    /**
     * Get a specific command handler
     *
     * @param name The command name or alias
     * @return The command handler, or null if not found
     */
    public CommandHandler getCommand(String name) {
        name = name.toLowerCase(Locale.ROOT);
        if (aliases.containsKey(name)) {
            name = aliases.get(name);
        }
        return commands.get(name);
    }

    /**
     * Answer for a command called with wrong parameters
     */
    public static CommandResult invalidSyntax(CommandHandler handler) {
        return CommandResult.failure("Invalid " + handler.getName() + " command usage. Usage: !" + handler.getUsage());
    }
}
