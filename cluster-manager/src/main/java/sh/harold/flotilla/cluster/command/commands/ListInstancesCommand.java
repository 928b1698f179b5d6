package sh.harold.flotilla.cluster.command.commands;

import sh.harold.flotilla.api.command.CommandResult;
import sh.harold.flotilla.cluster.command.CommandHandler;
import sh.harold.flotilla.cluster.command.CommandInvocation;
import sh.harold.flotilla.cluster.command.CommandRegistry;
import sh.harold.flotilla.cluster.command.TableFormatter;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.Instance;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Lists tracked instances, fleet-wide or for one cluster
 */
public class ListInstancesCommand implements CommandHandler {
    private final FleetIndex fleet;
    private final Supplier<ClusterManagerConfig> config;

    public ListInstancesCommand(FleetIndex fleet, Supplier<ClusterManagerConfig> config) {
        this.fleet = Objects.requireNonNull(fleet, "fleet");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public CommandResult execute(CommandInvocation invocation) {
        if (invocation.parameterCount() > 1) {
            return CommandRegistry.invalidSyntax(this);
        }
        Optional<String> cluster = invocation.parameter(0);
        if (cluster.isPresent()) {
            if (!config.get().isConfigured(cluster.get())) {
                return ClusterCommands.invalidCluster(cluster.get());
            }
            Collection<Instance> instances = fleet.byCluster(cluster.get());
            if (instances.isEmpty()) {
                return CommandResult.ok("No instance found for cluster: " + cluster.get());
            }
            TableFormatter table = new TableFormatter()
                    .addHeaders("clustInstNb", "instName", "instNb", "owner", "hostState", "instState", "PID");
            for (Instance instance : instances) {
                table.addRow(String.valueOf(instance.clusterInstanceNumber()), instance.name(),
                        String.valueOf(instance.instanceNumber()), instance.owner(), instance.presenceState().label(),
                        ClusterCommands.lifecycle(instance), ClusterCommands.processId(instance));
            }
            return CommandResult.ok(table.build("Instances list for cluster: " + cluster.get()));
        }

        Collection<Instance> instances = fleet.all();
        if (instances.isEmpty()) {
            return CommandResult.ok("No instance found.");
        }
        TableFormatter table = new TableFormatter()
                .addHeaders("instNb", "instName", "cluster", "clustInstNb", "owner", "hostState", "instState", "PID");
        for (Instance instance : instances) {
            table.addRow(String.valueOf(instance.instanceNumber()), instance.name(), instance.cluster(),
                    String.valueOf(instance.clusterInstanceNumber()), instance.owner(), instance.presenceState().label(),
                    ClusterCommands.lifecycle(instance), ClusterCommands.processId(instance));
        }
        return CommandResult.ok(table.build("Global cluster instances list"));
    }

    @Override
    public String getName() {
        return "listInstances";
    }

    @Override
    public String[] getAliases() {
        return new String[0];
    }

    @Override
    public String getDescription() {
        return "List instances, globally or for a cluster";
    }

    @Override
    public String getUsage() {
        return "listInstances [cluster]";
    }
}
