package sh.harold.flotilla.cluster.command.commands;

import sh.harold.flotilla.api.command.CommandResult;
import sh.harold.flotilla.cluster.command.CommandHandler;
import sh.harold.flotilla.cluster.command.CommandInvocation;
import sh.harold.flotilla.cluster.command.CommandRegistry;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Lists configured clusters, marking the default one
 */
public record ListClustersCommand(Supplier<ClusterManagerConfig> config) implements CommandHandler {

    public ListClustersCommand {
        Objects.requireNonNull(config, "config");
    }

    @Override
    public CommandResult execute(CommandInvocation invocation) {
        if (invocation.parameterCount() > 0) {
            return CommandRegistry.invalidSyntax(this);
        }
        ClusterManagerConfig current = config.get();
        String defaultCluster = current.defaultCluster();

        List<String> lines = new ArrayList<>();
        lines.add("********** AutoHost clusters **********");
        current.configuredClusters().stream().sorted().forEach(cluster -> {
            StringBuilder line = new StringBuilder("  ").append(cluster);
            current.cluster(cluster).description().ifPresent(description -> line.append(" (").append(description).append(')'));
            if (cluster.equals(defaultCluster)) {
                line.append(" *** DEFAULT ***");
            }
            lines.add(line.toString());
        });
        return CommandResult.ok(lines);
    }

    @Override
    public String getName() {
        return "listClusters";
    }

    @Override
    public String[] getAliases() {
        return new String[0];
    }

    @Override
    public String getDescription() {
        return "List available clusters";
    }

    @Override
    public String getUsage() {
        return "listClusters";
    }
}
