package sh.harold.flotilla.cluster.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.config.ClusterManagerSettings;
import sh.harold.flotilla.cluster.config.ClusterSettings;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.Instance;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Enforces instance quotas before delegating the creation of an instance to the
 * {@link InstanceLauncher}.
 */
public class AdmissionController {
    private static final Logger LOGGER = LoggerFactory.getLogger(AdmissionController.class);

    private final FleetIndex fleet;
    private final InstanceLauncher launcher;
    private final Supplier<ClusterManagerConfig> config;

    public AdmissionController(FleetIndex fleet, InstanceLauncher launcher, Supplier<ClusterManagerConfig> config) {
        this.fleet = Objects.requireNonNull(fleet, "fleet");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Starts a private instance owned by a lobby user.
     *
     * <p>Checks, in order: cluster is configured, owner has no instance yet, cluster instance
     * cap, cluster private instance cap, fleet instance cap, fleet private instance cap.</p>
     *
     * @param cluster  Target cluster
     * @param owner    Lobby user requesting the instance
     * @param password Battle password, generated when empty
     */
    public AdmissionResult admitPrivate(String cluster, String owner, Optional<String> password) {
        ClusterManagerConfig currentConfig = config.get();
        if (!currentConfig.isConfigured(cluster)) {
            return AdmissionResult.rejected(AdmissionRejection.INVALID_CLUSTER,
                    "Invalid cluster \"" + cluster + "\" (use !listClusters to list available clusters)");
        }

        Optional<Instance> existing = fleet.byOwner(owner);
        if (existing.isPresent()) {
            return AdmissionResult.rejected(AdmissionRejection.OWNER_ALREADY_HOSTING,
                    "There is already a private host created for you: " + existing.get().name()
                            + " (only one private host is allowed by user)");
        }

        ClusterSettings clusterSettings = currentConfig.cluster(cluster);
        if (reached(fleet.countInCluster(cluster), clusterSettings.maxInstancesInCluster())) {
            return AdmissionResult.rejected(AdmissionRejection.CLUSTER_FULL,
                    "Unable to create a new host in " + cluster + " cluster: the maximum number of instances is reached for this cluster");
        }
        if (reached(fleet.countInCluster(cluster, false), clusterSettings.maxInstancesInClusterPrivate())) {
            return AdmissionResult.rejected(AdmissionRejection.CLUSTER_PRIVATE_FULL,
                    "Unable to create a new private host in " + cluster + " cluster: the maximum number of private instances is reached for this cluster");
        }

        ClusterManagerSettings settings = currentConfig.settings();
        if (fleet.size() >= settings.maxInstances()) {
            return AdmissionResult.rejected(AdmissionRejection.FLEET_FULL,
                    "Unable to create a new host: the maximum number of instances is reached");
        }
        if (reached(fleet.privateCount(), settings.maxInstancesPrivate())) {
            return AdmissionResult.rejected(AdmissionRejection.FLEET_PRIVATE_FULL,
                    "Unable to create a new private host: the maximum number of private instances is reached");
        }

        Optional<LaunchedInstance> launched = launcher.launch(cluster, Optional.of(owner), password);
        if (launched.isEmpty()) {
            LOGGER.error("Failed to start a new private instance in cluster {} (user \"{}\")", cluster, owner);
            return AdmissionResult.rejected(AdmissionRejection.LAUNCH_FAILED,
                    "Failed to start a new private instance in cluster " + cluster + " (internal error)");
        }
        Instance instance = launched.get().instance();
        String instancePassword = launched.get().password().orElse("");
        LOGGER.info("Started a new private instance (#{} - {}) in cluster \"{}\" (owner \"{}\", password={})",
                instance.instanceNumber(), instance.name(), cluster, owner, instancePassword);
        return AdmissionResult.admitted(launched.get(),
                "Starting a new private instance in " + cluster + " cluster (name=" + instance.name()
                        + ", password=" + instancePassword + ")");
    }

    /**
     * Starts a public instance.
     *
     * <p>Checks, in order: cluster is configured, cluster instance cap, cluster public instance
     * cap, fleet instance cap, fleet public instance cap.</p>
     */
    public AdmissionResult admitPublic(String cluster) {
        ClusterManagerConfig currentConfig = config.get();
        if (!currentConfig.isConfigured(cluster)) {
            return AdmissionResult.rejected(AdmissionRejection.INVALID_CLUSTER, "Cluster \"" + cluster + "\" is not configured");
        }
        ClusterSettings clusterSettings = currentConfig.cluster(cluster);
        if (reached(fleet.countInCluster(cluster), clusterSettings.maxInstancesInCluster())) {
            return AdmissionResult.rejected(AdmissionRejection.CLUSTER_FULL,
                    "Maximum number of instances reached for cluster " + cluster);
        }
        if (reached(fleet.countInCluster(cluster, true), clusterSettings.maxInstancesInClusterPublic())) {
            return AdmissionResult.rejected(AdmissionRejection.CLUSTER_PUBLIC_FULL,
                    "Maximum number of public instances reached for cluster " + cluster);
        }
        ClusterManagerSettings settings = currentConfig.settings();
        if (fleet.size() >= settings.maxInstances()) {
            return AdmissionResult.rejected(AdmissionRejection.FLEET_FULL, "Maximum number of instances reached");
        }
        if (reached(fleet.publicCount(), settings.maxInstancesPublic())) {
            return AdmissionResult.rejected(AdmissionRejection.FLEET_PUBLIC_FULL, "Maximum number of public instances reached");
        }

        Optional<LaunchedInstance> launched = launcher.launch(cluster, Optional.empty(), Optional.empty());
        if (launched.isEmpty()) {
            return AdmissionResult.rejected(AdmissionRejection.LAUNCH_FAILED,
                    "Failed to start a new public instance in cluster " + cluster);
        }
        Instance instance = launched.get().instance();
        LOGGER.info("Started a new public instance (#{} - {}) in cluster \"{}\"", instance.instanceNumber(), instance.name(), cluster);
        return AdmissionResult.admitted(launched.get(), "Started a new public instance " + instance.name());
    }

    private static boolean reached(int count, int limit) {
        return limit != 0 && count >= limit;
    }
}
