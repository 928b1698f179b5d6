package sh.harold.flotilla.cluster.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.process.ProcessProbe;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.FleetStateException;
import sh.harold.flotilla.cluster.instance.Instance;
import sh.harold.flotilla.cluster.instance.LifecycleState;
import sh.harold.flotilla.cluster.instance.PresenceState;
import sh.harold.flotilla.cluster.pid.InstanceKind;
import sh.harold.flotilla.cluster.pid.LoadedRecord;
import sh.harold.flotilla.cluster.pid.LockMode;
import sh.harold.flotilla.cluster.pid.PidLock;
import sh.harold.flotilla.cluster.pid.PidRecord;
import sh.harold.flotilla.cluster.pid.PidRecordException;
import sh.harold.flotilla.cluster.pid.PidRecordStore;
import sh.harold.flotilla.cluster.presence.PresenceTracker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.function.Supplier;

/**
 * Rebuilds the fleet index from the PID records when the manager connects to the lobby.
 *
 * <p>Records of instances which failed to start or whose process is gone are removed. An
 * unreadable record only skips its instance, while an ambiguous fleet (record of another
 * manager, duplicate name, owner or cluster instance number) aborts the rebuild.</p>
 */
public class StartupReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(StartupReconciler.class);

    private final PidRecordStore store;
    private final FleetIndex fleet;
    private final ProcessProbe processProbe;
    private final PresenceTracker presenceTracker;
    private final Clock clock;
    private final Supplier<ClusterManagerConfig> config;
    private final String managerName;

    public StartupReconciler(PidRecordStore store,
                             FleetIndex fleet,
                             ProcessProbe processProbe,
                             PresenceTracker presenceTracker,
                             Clock clock,
                             Supplier<ClusterManagerConfig> config,
                             String managerName) {
        this.store = Objects.requireNonNull(store, "store");
        this.fleet = Objects.requireNonNull(fleet, "fleet");
        this.processProbe = Objects.requireNonNull(processProbe, "processProbe");
        this.presenceTracker = Objects.requireNonNull(presenceTracker, "presenceTracker");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.config = Objects.requireNonNull(config, "config");
        this.managerName = Objects.requireNonNull(managerName, "managerName");
    }

    /**
     * @throws FleetStateException if the PID records describe an unsafe fleet
     * @throws PidRecordException  if the PID directory cannot be listed
     */
    public void rebuild() throws PidRecordException {
        fleet.clear();
        SortedSet<Integer> instanceNumbers = store.listInstanceNumbers();
        ClusterManagerConfig currentConfig = config.get();
        for (int instanceNumber : instanceNumbers) {
            Optional<LoadedRecord> loaded = loadLiveRecord(instanceNumber, currentConfig.settings().startingInstanceTimeout());
            if (loaded.isEmpty()) {
                continue;
            }
            PidRecord record = loaded.get().record();
            if (!record.managerName().equals(managerName)) {
                throw new FleetStateException("Wrong manager name in PID file of instance " + instanceNumber
                        + " (expected \"" + managerName + "\", got \"" + record.managerName() + "\")");
            }
            if (!currentConfig.isConfigured(record.clusterPreset())) {
                LOGGER.warn("PID file found for unmanaged cluster \"{}\" (instance {})", record.clusterPreset(), instanceNumber);
            }

            Instant now = clock.instant();
            Instance instance = new Instance(instanceNumber, record.instanceName(), record.clusterPreset(),
                    record.clusterInstanceNumber(), record.ownerName(),
                    LifecycleState.fromKind(loaded.get().kind()), loaded.get().timestamp(),
                    PresenceState.OFFLINE, now, record.processId());
            fleet.add(instance);
        }

        Instant now = clock.instant();
        for (Instance instance : fleet.all()) {
            instance.updatePresence(presenceTracker.initialPresence(instance), now);
        }
        LOGGER.info("Fleet rebuilt from PID files: {} instance(s) ({} public, {} private)",
                fleet.size(), fleet.publicCount(), fleet.privateCount());
    }

    private Optional<LoadedRecord> loadLiveRecord(int instanceNumber, Duration startingTimeout) {
        try (PidLock lock = store.acquireLock(instanceNumber, LockMode.BLOCKING)) {
            Optional<LoadedRecord> read = lock.read();
            if (read.isEmpty()) {
                return Optional.empty();
            }
            LoadedRecord loaded = read.get();
            PidRecord record = loaded.record();
            if (record.instanceNumber() != instanceNumber) {
                LOGGER.error("Inconsistency detected for PID file of instance {} (instance number {} found)",
                        instanceNumber, record.instanceNumber());
                return Optional.empty();
            }

            InstanceKind kind = loaded.kind();
            if (kind == InstanceKind.LAUNCHED || kind == InstanceKind.RESTARTING) {
                if (!startingTimeout.isZero() && !clock.instant().isBefore(loaded.timestamp().plus(startingTimeout))) {
                    LOGGER.warn("Instance {} ({}) failed to start, removing obsolete PID file", instanceNumber, record.instanceName());
                    lock.delete(kind);
                    lock.deleteLockFile();
                    return Optional.empty();
                }
            } else if (!processProbe.isAlive(record.processId().orElseThrow())) {
                LOGGER.warn("Instance {} ({}) exited unexpectedly, removing obsolete PID file", instanceNumber, record.instanceName());
                lock.delete(kind);
                lock.deleteLockFile();
                return Optional.empty();
            }
            return read;
        } catch (PidRecordException e) {
            LOGGER.error("Unable to load PID file for instance {}: {}", instanceNumber, e.getMessage());
            return Optional.empty();
        }
    }
}
