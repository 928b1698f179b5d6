package sh.harold.flotilla.cluster.provision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.lobby.LobbyGateway;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.Instance;
import sh.harold.flotilla.cluster.instance.PresenceState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Asks surplus spare instances to exit once idle.
 *
 * <p>Instances are never removed directly: the request is a private lobby message and the
 * instance quits by itself if it is still idle when receiving it.</p>
 */
public class PruningEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(PruningEngine.class);

    public static final String QUIT_IF_IDLE_REQUEST = "!#quitIfIdle";

    static final Duration PRUNE_INTERVAL = Duration.ofSeconds(5);

    private final FleetIndex fleet;
    private final LobbyGateway lobby;
    private final Clock clock;
    private final Supplier<ClusterManagerConfig> config;
    private final Map<String, Instant> lastPrunes = new HashMap<>();

    public PruningEngine(FleetIndex fleet, LobbyGateway lobby, Clock clock, Supplier<ClusterManagerConfig> config) {
        this.fleet = Objects.requireNonNull(fleet, "fleet");
        this.lobby = Objects.requireNonNull(lobby, "lobby");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @return Names of the instances asked to exit
     */
    public List<String> prune() {
        ClusterManagerConfig currentConfig = config.get();
        Instant now = clock.instant();
        List<String> requested = new ArrayList<>();
        for (String cluster : List.copyOf(fleet.clusters())) {
            Instant lastPrune = lastPrunes.get(cluster);
            if (lastPrune != null && now.isBefore(lastPrune.plus(PRUNE_INTERVAL))) {
                continue;
            }
            List<Instance> toRemove = currentConfig.isConfigured(cluster)
                    ? surplusSpares(cluster, currentConfig, now)
                    : obsoleteSpares(cluster);
            if (toRemove.isEmpty()) {
                continue;
            }
            lastPrunes.put(cluster, now);
            boolean obsolete = !currentConfig.isConfigured(cluster);
            for (Instance instance : toRemove) {
                if (obsolete) {
                    LOGGER.warn("Instance removal for obsolete cluster \"{}\" (removing instance \"{}\")", cluster, instance.name());
                } else {
                    LOGGER.debug("Spare instance pruning for cluster \"{}\" (removing instance \"{}\")", cluster, instance.name());
                }
                lobby.sayPrivate(instance.name(), QUIT_IF_IDLE_REQUEST);
                requested.add(instance.name());
            }
        }
        return requested;
    }

    private List<Instance> surplusSpares(String cluster, ClusterManagerConfig currentConfig, Instant now) {
        Duration delay = currentConfig.settings().removeSpareInstanceDelay();
        if (delay.isZero()) {
            return List.of();
        }
        List<Instance> oldSpares = new ArrayList<>();
        for (Instance instance : fleet.byCluster(cluster)) {
            if (instance.isPublic()
                    && instance.presenceState() == PresenceState.SPARE
                    && !now.isBefore(instance.presenceSince().plus(delay))) {
                oldSpares.add(instance);
            }
        }
        int excess = oldSpares.size() - currentConfig.cluster(cluster).targetSpares();
        if (excess <= 0) {
            return List.of();
        }
        oldSpares.sort(Comparator.comparingInt(Instance::clusterInstanceNumber).reversed());
        return oldSpares.subList(0, excess);
    }

    private List<Instance> obsoleteSpares(String cluster) {
        List<Instance> spares = new ArrayList<>();
        for (Instance instance : fleet.byCluster(cluster)) {
            if (instance.presenceState() == PresenceState.SPARE) {
                spares.add(instance);
            }
        }
        return spares;
    }
}
