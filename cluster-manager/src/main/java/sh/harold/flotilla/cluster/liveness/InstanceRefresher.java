package sh.harold.flotilla.cluster.liveness;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.process.ProcessProbe;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.Instance;
import sh.harold.flotilla.cluster.instance.LifecycleState;
import sh.harold.flotilla.cluster.pid.InstanceKind;
import sh.harold.flotilla.cluster.pid.LoadedRecord;
import sh.harold.flotilla.cluster.pid.LockMode;
import sh.harold.flotilla.cluster.pid.PidLock;
import sh.harold.flotilla.cluster.pid.PidRecord;
import sh.harold.flotilla.cluster.pid.PidRecordException;
import sh.harold.flotilla.cluster.pid.PidRecordStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Synchronizes a tracked instance with its PID record, removing it from the fleet when its
 * process is gone.
 */
public class InstanceRefresher {
    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceRefresher.class);

    private static final Duration ERROR_LOG_INTERVAL = Duration.ofSeconds(5);

    private final PidRecordStore store;
    private final FleetIndex fleet;
    private final ProcessProbe processProbe;
    private final Clock clock;
    private final Supplier<ClusterManagerConfig> config;
    private final String managerName;
    private final Map<Integer, Instant> lastErrorLogs = new HashMap<>();

    public InstanceRefresher(PidRecordStore store,
                             FleetIndex fleet,
                             ProcessProbe processProbe,
                             Clock clock,
                             Supplier<ClusterManagerConfig> config,
                             String managerName) {
        this.store = Objects.requireNonNull(store, "store");
        this.fleet = Objects.requireNonNull(fleet, "fleet");
        this.processProbe = Objects.requireNonNull(processProbe, "processProbe");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.config = Objects.requireNonNull(config, "config");
        this.managerName = Objects.requireNonNull(managerName, "managerName");
    }

    public RefreshOutcome refresh(Instance instance) {
        int instanceNumber = instance.instanceNumber();
        if (store.exitMarkerExists(instanceNumber)) {
            return consumeExit(instance);
        }

        LoadedRecord loaded;
        try (PidLock lock = store.acquireLock(instanceNumber, LockMode.BLOCKING)) {
            Optional<LoadedRecord> read = lock.read();
            if (read.isEmpty()) {
                LOGGER.error("Instance {} disappeared: PID file not found", instance);
                remove(instance, LifecycleState.CRASHED);
                return RefreshOutcome.CRASHED;
            }
            loaded = read.get();

            List<String> inconsistentFields = inconsistentFields(instance, loaded.record());
            if (!inconsistentFields.isEmpty()) {
                logThrottled(instance, "Unable to load instance data from PID file for instance " + instance
                        + ", inconsistent data found for following field(s): " + String.join(", ", inconsistentFields));
                return RefreshOutcome.CORRUPT;
            }

            Instant now = clock.instant();
            Duration startingTimeout = config.get().settings().startingInstanceTimeout();
            if (loaded.kind() == InstanceKind.LAUNCHED || loaded.kind() == InstanceKind.RESTARTING) {
                if (!startingTimeout.isZero() && !now.isBefore(loaded.timestamp().plus(startingTimeout))) {
                    LOGGER.warn("Instance {} failed to start, removing PID file", instance);
                    deleteRecord(lock, loaded.kind());
                    remove(instance, LifecycleState.CRASHED);
                    return RefreshOutcome.CRASHED;
                }
            } else if (!processProbe.isAlive(loaded.record().processId().orElseThrow())) {
                LOGGER.warn("Instance {} exited unexpectedly, removing PID file", instance);
                deleteRecord(lock, loaded.kind());
                remove(instance, LifecycleState.CRASHED);
                return RefreshOutcome.CRASHED;
            }
        } catch (PidRecordException e) {
            logThrottled(instance, "Unable to load instance data from PID file for instance " + instance + ": " + e.getMessage());
            return e.getReason() == PidRecordException.Reason.LOCK_FAILED ? RefreshOutcome.LOCK_FAILED : RefreshOutcome.CORRUPT;
        }

        lastErrorLogs.remove(instanceNumber);
        instance.updateProcessId(loaded.record().processId());
        LifecycleState state = LifecycleState.fromKind(loaded.kind());
        if (state != instance.lifecycleState() || !loaded.timestamp().equals(instance.lifecycleSince())) {
            if (state != instance.lifecycleState() && !instance.lifecycleState().canTransitionTo(state)) {
                LOGGER.warn("Instance {} went from state {} to {} without an intermediate state",
                        instance, instance.lifecycleState(), state);
            }
            LOGGER.debug("Instance {} went from state {} (timestamp:{}) to {} (timestamp:{})",
                    instance, instance.lifecycleState(), instance.lifecycleSince(), state, loaded.timestamp());
            instance.updateLifecycle(state, loaded.timestamp());
            return RefreshOutcome.STATE_CHANGED;
        }
        return RefreshOutcome.UNCHANGED;
    }

    private RefreshOutcome consumeExit(Instance instance) {
        int instanceNumber = instance.instanceNumber();
        try {
            store.deleteExitMarker(instanceNumber);
        } catch (PidRecordException e) {
            LOGGER.error("Instance {} exited but its exit marker could not be deleted: {}", instance, e.getMessage());
        }
        if (instance.presenceState().isOfflineLooking()) {
            LOGGER.info("Instance {} exited", instance);
        } else {
            LOGGER.warn("Instance {} exited but still appears online", instance);
        }
        try (PidLock lock = store.acquireLock(instanceNumber, LockMode.BLOCKING)) {
            Optional<InstanceKind> leftover = lock.locate();
            if (leftover.isPresent()) {
                LOGGER.warn("Removing leftover PID file of exited instance {} ({})", instance, leftover.get());
                lock.delete(leftover.get());
            }
        } catch (PidRecordException e) {
            LOGGER.error("Unable to clean up PID file of exited instance {}: {}", instance, e.getMessage());
        }
        remove(instance, LifecycleState.EXITING);
        return RefreshOutcome.EXITED;
    }

    private List<String> inconsistentFields(Instance instance, PidRecord record) {
        List<String> fields = new ArrayList<>();
        if (!record.managerName().equals(managerName)) {
            fields.add("managerName");
        }
        if (record.instanceNumber() != instance.instanceNumber()) {
            fields.add("instNb");
        }
        if (!record.instanceName().equals(instance.name())) {
            fields.add("instName");
        }
        if (!record.clusterPreset().equals(instance.cluster())) {
            fields.add("clustPreset");
        }
        if (record.clusterInstanceNumber() != instance.clusterInstanceNumber()) {
            fields.add("clustInstNb");
        }
        if (!record.ownerName().equals(instance.owner())) {
            fields.add("ownerName");
        }
        return fields;
    }

    private void deleteRecord(PidLock lock, InstanceKind kind) throws PidRecordException {
        lock.delete(kind);
        lock.deleteLockFile();
    }

    private void remove(Instance instance, LifecycleState finalState) {
        instance.updateLifecycle(finalState, clock.instant());
        fleet.remove(instance);
        lastErrorLogs.remove(instance.instanceNumber());
    }

    private void logThrottled(Instance instance, String message) {
        Instant now = clock.instant();
        Instant last = lastErrorLogs.get(instance.instanceNumber());
        if (last == null || !now.isBefore(last.plus(ERROR_LOG_INTERVAL))) {
            lastErrorLogs.put(instance.instanceNumber(), now);
            LOGGER.error(message);
        }
    }
}
