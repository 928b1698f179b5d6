package sh.harold.flotilla.cluster.command.commands;

import sh.harold.flotilla.api.command.CommandResult;
import sh.harold.flotilla.cluster.command.CommandHandler;
import sh.harold.flotilla.cluster.command.CommandInvocation;
import sh.harold.flotilla.cluster.command.CommandRegistry;
import sh.harold.flotilla.cluster.command.TableFormatter;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Shows global settings, or the settings of one cluster
 */
public record ClusterConfigCommand(Supplier<ClusterManagerConfig> config) implements CommandHandler {

    public ClusterConfigCommand {
        Objects.requireNonNull(config, "config");
    }

    @Override
    public CommandResult execute(CommandInvocation invocation) {
        if (invocation.parameterCount() > 1) {
            return CommandRegistry.invalidSyntax(this);
        }
        ClusterManagerConfig current = config.get();
        Optional<String> cluster = invocation.parameter(0);
        if (cluster.isPresent() && !current.isConfigured(cluster.get())) {
            return ClusterCommands.invalidCluster(cluster.get());
        }

        Map<String, String> settings = cluster.isPresent()
                ? current.cluster(cluster.get()).publicSettings()
                : current.settings().publicSettings();
        String title = cluster.map(name -> name + " cluster configuration").orElse("ClusterManager configuration");

        TableFormatter table = new TableFormatter().addHeaders("Setting", "Value");
        settings.forEach((key, value) -> table.addRow(key, value));
        return CommandResult.ok(table.build(title));
    }

    @Override
    public String getName() {
        return "clusterConfig";
    }

    @Override
    public String[] getAliases() {
        return new String[0];
    }

    @Override
    public String getDescription() {
        return "Show cluster manager configuration, or the configuration of a cluster";
    }

    @Override
    public String getUsage() {
        return "clusterConfig [cluster]";
    }
}
