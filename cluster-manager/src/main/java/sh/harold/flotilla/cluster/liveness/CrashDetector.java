package sh.harold.flotilla.cluster.liveness;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.process.ProcessProbe;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.config.ClusterManagerSettings;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.Instance;
import sh.harold.flotilla.cluster.instance.PresenceState;
import sh.harold.flotilla.cluster.pid.PidRecordStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Classifies every tracked instance once per reconciliation tick:
 * <ol>
 *     <li>clean exit marker present: instance removed</li>
 *     <li>starting for longer than the starting timeout: record re-read, removed if still starting</li>
 *     <li>offline with a dead process: record re-read, removed if the process is really gone</li>
 *     <li>offline for longer than the offline timeout: flagged stuck</li>
 * </ol>
 */
public class CrashDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrashDetector.class);

    private final FleetIndex fleet;
    private final PidRecordStore store;
    private final InstanceRefresher refresher;
    private final ProcessProbe processProbe;
    private final Clock clock;
    private final Supplier<ClusterManagerConfig> config;

    public CrashDetector(FleetIndex fleet,
                         PidRecordStore store,
                         InstanceRefresher refresher,
                         ProcessProbe processProbe,
                         Clock clock,
                         Supplier<ClusterManagerConfig> config) {
        this.fleet = Objects.requireNonNull(fleet, "fleet");
        this.store = Objects.requireNonNull(store, "store");
        this.refresher = Objects.requireNonNull(refresher, "refresher");
        this.processProbe = Objects.requireNonNull(processProbe, "processProbe");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @return Clusters which lost a public instance or saw one get stuck, to be provisioned again
     */
    public Set<String> sweep() {
        ClusterManagerSettings settings = config.get().settings();
        Set<String> impactedClusters = new LinkedHashSet<>();
        for (Instance instance : fleet.snapshot()) {
            if (fleet.byInstanceNumber(instance.instanceNumber()).orElse(null) != instance) {
                continue;
            }
            Instant now = clock.instant();
            boolean impacted = false;
            if (store.exitMarkerExists(instance.instanceNumber())) {
                impacted = refresher.refresh(instance).isRemoval();
            } else if (instance.lifecycleState().isStarting()) {
                if (elapsed(instance.lifecycleSince(), now, settings.startingInstanceTimeout())) {
                    RefreshOutcome outcome = refresher.refresh(instance);
                    if (outcome == RefreshOutcome.CRASHED) {
                        LOGGER.error("Instance {} failed to start", instance);
                    }
                    impacted = outcome.isRemoval();
                }
            } else if (instance.presenceState().isOfflineLooking() && isDead(instance)) {
                RefreshOutcome outcome = refresher.refresh(instance);
                if (outcome == RefreshOutcome.CRASHED) {
                    LOGGER.error("Instance {} exited unexpectedly", instance);
                }
                impacted = outcome.isRemoval();
            } else if (instance.presenceState() == PresenceState.OFFLINE
                    && elapsed(instance.presenceSince(), now, settings.offlineInstanceTimeout())) {
                LOGGER.warn("Instance {} has been offline for more than {}s, flagging it as stuck",
                        instance, settings.offlineInstanceTimeout().toSeconds());
                instance.updatePresence(PresenceState.STUCK, now);
                impacted = true;
            }
            if (impacted && instance.isPublic()) {
                impactedClusters.add(instance.cluster());
            }
        }
        if (!impactedClusters.isEmpty()) {
            LOGGER.debug("Clusters impacted by crash detection: {}", impactedClusters);
        }
        return impactedClusters;
    }

    private boolean isDead(Instance instance) {
        return instance.processId().isPresent() && !processProbe.isAlive(instance.processId().getAsLong());
    }

    private static boolean elapsed(Instant since, Instant now, Duration timeout) {
        return !timeout.isZero() && !now.isBefore(since.plus(timeout));
    }
}
