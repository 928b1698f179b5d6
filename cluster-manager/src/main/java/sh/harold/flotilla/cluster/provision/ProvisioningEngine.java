package sh.harold.flotilla.cluster.provision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.cluster.admission.AdmissionController;
import sh.harold.flotilla.cluster.admission.AdmissionRejection;
import sh.harold.flotilla.cluster.admission.AdmissionResult;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.Instance;
import sh.harold.flotilla.cluster.instance.PresenceState;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Starts public instances until each configured cluster has its target number of spare (or
 * starting) instances, within the instance caps.
 */
public class ProvisioningEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProvisioningEngine.class);

    private final FleetIndex fleet;
    private final AdmissionController admission;
    private final Supplier<ClusterManagerConfig> config;

    public ProvisioningEngine(FleetIndex fleet, AdmissionController admission, Supplier<ClusterManagerConfig> config) {
        this.fleet = Objects.requireNonNull(fleet, "fleet");
        this.admission = Objects.requireNonNull(admission, "admission");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Provisions every configured cluster.
     */
    public void provisionAll() {
        provision(config.get().configuredClusters());
    }

    public void provision(Collection<String> clusters) {
        for (String cluster : clusters) {
            provision(cluster);
        }
    }

    /**
     * Provisions one cluster; clusters which are no longer configured are ignored.
     *
     * @return Number of instances started
     */
    public int provision(String cluster) {
        ClusterManagerConfig currentConfig = config.get();
        if (!currentConfig.isConfigured(cluster)) {
            return 0;
        }
        int targetSpares = currentConfig.cluster(cluster).targetSpares();
        Map<PresenceState, Integer> counts = publicCounts(cluster);
        LOGGER.debug("Cluster {} public instance counts before start instance loop: {}", cluster, counts);

        int started = 0;
        while (counts.get(PresenceState.SPARE) + counts.get(PresenceState.OFFLINE) < targetSpares) {
            AdmissionResult result = admission.admitPublic(cluster);
            if (!result.isAdmitted()) {
                if (result.rejection().orElseThrow() == AdmissionRejection.LAUNCH_FAILED) {
                    LOGGER.error("Failed to start a new public instance in cluster {}", cluster);
                } else {
                    LOGGER.debug("Stopping provisioning of cluster {}: {}", cluster, result.message());
                }
                break;
            }
            counts.merge(PresenceState.OFFLINE, 1, Integer::sum);
            started++;
        }

        LOGGER.debug("Cluster {} public instance counts after start instance loop: {}", cluster, counts);
        return started;
    }

    private Map<PresenceState, Integer> publicCounts(String cluster) {
        Map<PresenceState, Integer> counts = new EnumMap<>(PresenceState.class);
        for (PresenceState state : PresenceState.values()) {
            counts.put(state, 0);
        }
        for (Instance instance : fleet.byCluster(cluster)) {
            if (instance.isPublic()) {
                counts.merge(instance.presenceState(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
