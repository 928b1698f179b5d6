package sh.harold.flotilla.cluster.command.commands;

import sh.harold.flotilla.api.command.CommandResult;
import sh.harold.flotilla.cluster.command.CommandHandler;
import sh.harold.flotilla.cluster.command.CommandInvocation;
import sh.harold.flotilla.cluster.command.CommandRegistry;
import sh.harold.flotilla.cluster.command.TableFormatter;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.config.ClusterManagerSettings;
import sh.harold.flotilla.cluster.config.ClusterSettings;
import sh.harold.flotilla.cluster.instance.FleetIndex;

import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Counts public and private instances per cluster, including clusters no longer configured
 * which still have instances
 */
public class ClusterStatsCommand implements CommandHandler {
    private final FleetIndex fleet;
    private final Supplier<ClusterManagerConfig> config;

    public ClusterStatsCommand(FleetIndex fleet, Supplier<ClusterManagerConfig> config) {
        this.fleet = Objects.requireNonNull(fleet, "fleet");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public CommandResult execute(CommandInvocation invocation) {
        if (invocation.parameterCount() > 0) {
            return CommandRegistry.invalidSyntax(this);
        }
        ClusterManagerConfig current = config.get();
        SortedSet<String> clusters = new TreeSet<>(current.configuredClusters());
        clusters.addAll(fleet.clusters());

        TableFormatter table = new TableFormatter().addHeaders("cluster", "public", "private", "total");
        for (String cluster : clusters) {
            ClusterSettings settings = current.cluster(cluster);
            table.addRow(cluster,
                    ClusterCommands.withLimit(fleet.countInCluster(cluster, true), settings.maxInstancesInClusterPublic()),
                    ClusterCommands.withLimit(fleet.countInCluster(cluster, false), settings.maxInstancesInClusterPrivate()),
                    ClusterCommands.withLimit(fleet.countInCluster(cluster), settings.maxInstancesInCluster()));
        }
        ClusterManagerSettings settings = current.settings();
        table.addRow("-total-",
                ClusterCommands.withLimit(fleet.publicCount(), settings.maxInstancesPublic()),
                ClusterCommands.withLimit(fleet.privateCount(), settings.maxInstancesPrivate()),
                ClusterCommands.withLimit(fleet.size(), settings.maxInstances()));
        return CommandResult.ok(table.build("Cluster statistics"));
    }

    @Override
    public String getName() {
        return "clusterStats";
    }

    @Override
    public String[] getAliases() {
        return new String[0];
    }

    @Override
    public String getDescription() {
        return "Show instance counts per cluster";
    }

    @Override
    public String getUsage() {
        return "clusterStats";
    }
}
