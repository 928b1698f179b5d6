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
import sh.harold.flotilla.cluster.instance.Instance;
import sh.harold.flotilla.cluster.instance.PresenceState;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Counts instances by type and presence, fleet-wide or for one cluster
 */
public class ClusterStatusCommand implements CommandHandler {
    private final FleetIndex fleet;
    private final Supplier<ClusterManagerConfig> config;

    public ClusterStatusCommand(FleetIndex fleet, Supplier<ClusterManagerConfig> config) {
        this.fleet = Objects.requireNonNull(fleet, "fleet");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public CommandResult execute(CommandInvocation invocation) {
        if (invocation.parameterCount() > 1) {
            return CommandRegistry.invalidSyntax(this);
        }
        ClusterManagerConfig current = config.get();
        Optional<String> cluster = invocation.parameter(0);

        Collection<Instance> instances;
        int[] limits;
        String title;
        if (cluster.isPresent()) {
            if (!current.isConfigured(cluster.get())) {
                return ClusterCommands.invalidCluster(cluster.get());
            }
            instances = fleet.byCluster(cluster.get());
            ClusterSettings settings = current.cluster(cluster.get());
            limits = new int[]{settings.maxInstancesInClusterPublic(), settings.maxInstancesInClusterPrivate(), settings.maxInstancesInCluster()};
            title = "Status for cluster: " + cluster.get();
        } else {
            instances = fleet.all();
            ClusterManagerSettings settings = current.settings();
            limits = new int[]{settings.maxInstancesPublic(), settings.maxInstancesPrivate(), settings.maxInstances()};
            title = "Global cluster status";
        }

        StatusCounts publicCounts = new StatusCounts();
        StatusCounts privateCounts = new StatusCounts();
        StatusCounts totalCounts = new StatusCounts();
        for (Instance instance : instances) {
            (instance.isPublic() ? publicCounts : privateCounts).add(instance.presenceState());
            totalCounts.add(instance.presenceState());
        }

        TableFormatter table = new TableFormatter().addHeaders("type", "inUse", "idle", "offline", "error", "total");
        publicCounts.addTo(table, "public", limits[0]);
        privateCounts.addTo(table, "private", limits[1]);
        totalCounts.addTo(table, "-total-", limits[2]);
        return CommandResult.ok(table.build(title));
    }

    @Override
    public String getName() {
        return "clusterStatus";
    }

    @Override
    public String[] getAliases() {
        return new String[0];
    }

    @Override
    public String getDescription() {
        return "Show instance counts by state, globally or for a cluster";
    }

    @Override
    public String getUsage() {
        return "clusterStatus [cluster]";
    }

    private static final class StatusCounts {
        private final Map<PresenceState, Integer> counts = new EnumMap<>(PresenceState.class);
        private int total;

        void add(PresenceState state) {
            counts.merge(state, 1, Integer::sum);
            total++;
        }

        void addTo(TableFormatter table, String type, int limit) {
            table.addRow(type,
                    String.valueOf(counts.getOrDefault(PresenceState.IN_USE, 0)),
                    String.valueOf(counts.getOrDefault(PresenceState.SPARE, 0)),
                    String.valueOf(counts.getOrDefault(PresenceState.OFFLINE, 0)),
                    String.valueOf(counts.getOrDefault(PresenceState.STUCK, 0)),
                    ClusterCommands.withLimit(total, limit));
        }
    }
}
