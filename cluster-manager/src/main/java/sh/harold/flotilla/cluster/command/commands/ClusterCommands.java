package sh.harold.flotilla.cluster.command.commands;

import sh.harold.flotilla.api.command.CommandResult;
import sh.harold.flotilla.cluster.instance.Instance;

import java.util.Locale;

/**
 * Answers shared by the cluster commands.
 */
final class ClusterCommands {

    private ClusterCommands() {
    }

    static CommandResult invalidCluster(String cluster) {
        return CommandResult.failure("Invalid cluster \"" + cluster + "\" (use !listClusters to list available clusters)");
    }

    /**
     * @return Count, followed by the limit when there is one
     */
    static String withLimit(int count, int limit) {
        return limit == 0 ? String.valueOf(count) : count + "/" + limit;
    }

    static String processId(Instance instance) {
        return instance.processId().isPresent() ? String.valueOf(instance.processId().getAsLong()) : "?";
    }

    static String lifecycle(Instance instance) {
        return instance.lifecycleState().name().toLowerCase(Locale.ROOT);
    }
}
