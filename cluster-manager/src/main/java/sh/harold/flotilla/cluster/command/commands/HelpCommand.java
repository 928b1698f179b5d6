package sh.harold.flotilla.cluster.command.commands;

import sh.harold.flotilla.api.command.CommandResult;
import sh.harold.flotilla.cluster.command.CommandHandler;
import sh.harold.flotilla.cluster.command.CommandInvocation;
import sh.harold.flotilla.cluster.command.CommandRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Help command to list all cluster commands
 */
public record HelpCommand(CommandRegistry registry) implements CommandHandler {

    public HelpCommand {
        Objects.requireNonNull(registry, "registry");
    }

    @Override
    public CommandResult execute(CommandInvocation invocation) {
        if (invocation.parameterCount() > 1) {
            return CommandRegistry.invalidSyntax(this);
        }
        if (invocation.parameterCount() == 1) {
            String name = invocation.parameter(0).orElseThrow();
            CommandHandler handler = registry.getCommand(name);
            if (handler == null) {
                return CommandResult.failure("Unknown command: " + name);
            }
            List<String> lines = new ArrayList<>();
            lines.add("Command: " + handler.getName());
            lines.add("Description: " + handler.getDescription());
            lines.add("Usage: !" + handler.getUsage());
            if (handler.getAliases().length > 0) {
                lines.add("Aliases: " + String.join(", ", handler.getAliases()));
            }
            return CommandResult.ok(lines);
        }

        List<String> lines = new ArrayList<>();
        lines.add("********** Cluster commands **********");
        registry.getAllCommands().stream()
                .sorted(Comparator.comparing(CommandHandler::getName))
                .forEach(handler -> lines.add(String.format("  !%-16s %s", handler.getUsage(), handler.getDescription())));
        return CommandResult.ok(lines);
    }

    @Override
    public String getName() {
        return "clusterHelp";
    }

    @Override
    public String[] getAliases() {
        return new String[0];
    }

    @Override
    public String getDescription() {
        return "Show available cluster commands";
    }

    @Override
    public String getUsage() {
        return "clusterHelp [command]";
    }
}
