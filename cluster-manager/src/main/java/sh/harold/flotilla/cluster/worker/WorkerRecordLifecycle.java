package sh.harold.flotilla.cluster.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.plugin.LoadContext;
import sh.harold.flotilla.api.plugin.PluginLoadException;
import sh.harold.flotilla.api.plugin.UnloadReason;
import sh.harold.flotilla.cluster.pid.InstanceKind;
import sh.harold.flotilla.cluster.pid.LoadedRecord;
import sh.harold.flotilla.cluster.pid.LockMode;
import sh.harold.flotilla.cluster.pid.PidLock;
import sh.harold.flotilla.cluster.pid.PidRecord;
import sh.harold.flotilla.cluster.pid.PidRecordException;
import sh.harold.flotilla.cluster.pid.PidRecordStore;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Advances the PID record of the worker itself when it starts and stops.
 */
public class WorkerRecordLifecycle {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerRecordLifecycle.class);

    private static final Map<LoadContext, Set<InstanceKind>> EXPECTED_KINDS = new EnumMap<>(LoadContext.class);
    private static final Map<UnloadReason, InstanceKind> UNLOAD_KINDS = new EnumMap<>(UnloadReason.class);

    static {
        EXPECTED_KINDS.put(LoadContext.LOAD, EnumSet.of(InstanceKind.UNLOADED, InstanceKind.RELOADING));
        EXPECTED_KINDS.put(LoadContext.RELOAD, EnumSet.of(InstanceKind.RELOADING));
        EXPECTED_KINDS.put(LoadContext.AUTOLOAD, EnumSet.of(InstanceKind.LAUNCHED, InstanceKind.RESTARTING));

        UNLOAD_KINDS.put(UnloadReason.RELOAD, InstanceKind.RELOADING);
        UNLOAD_KINDS.put(UnloadReason.UNLOAD, InstanceKind.UNLOADED);
        UNLOAD_KINDS.put(UnloadReason.RESTART, InstanceKind.RESTARTING);
    }

    private final PidRecordStore store;
    private final WorkerIdentity identity;
    private final String lobbyLogin;
    private final String defaultPreset;
    private final long processId;

    /**
     * @param lobbyLogin    Lobby login of the worker, which is its instance name
     * @param defaultPreset Default preset of the worker, which is its cluster
     * @param processId     Process id of the worker
     */
    public WorkerRecordLifecycle(PidRecordStore store, WorkerIdentity identity, String lobbyLogin, String defaultPreset, long processId) {
        this.store = Objects.requireNonNull(store, "store");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.lobbyLogin = Objects.requireNonNull(lobbyLogin, "lobbyLogin");
        this.defaultPreset = Objects.requireNonNull(defaultPreset, "defaultPreset");
        this.processId = processId;
    }

    /**
     * Validates the record left by the manager (autoload) or by the previous plugin instance
     * (manual load and reload), then marks the instance as running.
     *
     * @throws PluginLoadException if no record of the expected kind is found or if it does not
     *                             describe this worker
     */
    public void start(LoadContext context) throws PluginLoadException {
        int instanceNumber = identity.instanceNumber();
        try {
            store.deleteExitMarker(instanceNumber);
        } catch (PidRecordException e) {
            throw new PluginLoadException("Unable to remove stale exit marker of instance " + instanceNumber, e);
        }

        try (PidLock lock = store.acquireLock(instanceNumber, LockMode.BLOCKING)) {
            Optional<LoadedRecord> found = lock.read();
            if (found.isEmpty()) {
                throw new PluginLoadException("No PID file found for instance " + instanceNumber);
            }
            LoadedRecord loaded = found.get();
            Set<InstanceKind> expected = EXPECTED_KINDS.get(context);
            if (!expected.contains(loaded.kind())) {
                throw new PluginLoadException("No previous " + expected + " PID file found when starting instance "
                        + instanceNumber + " [" + context + "] (found " + loaded.kind() + ")");
            }

            List<String> inconsistentFields = inconsistentFields(loaded.record());
            if (!inconsistentFields.isEmpty()) {
                throw new PluginLoadException("Inconsistent data found in PID file for following field(s): "
                        + String.join(", ", inconsistentFields));
            }

            if (context == LoadContext.AUTOLOAD) {
                lock.replace(loaded.kind(), InstanceKind.RUNNING, loaded.record().withProcessId(processId));
            } else {
                lock.transition(loaded.kind(), InstanceKind.RUNNING);
            }
            LOGGER.info("Instance {} ({}) is running [{}]", instanceNumber, lobbyLogin, context);
        } catch (PidRecordException e) {
            throw new PluginLoadException("Unable to initialize instance data from PID file: " + e.getMessage(), e);
        }
    }

    /**
     * Hands the record over for the next start of the worker, or signals a clean exit to the
     * manager. Failures are logged, the worker is stopping anyway.
     */
    public void stop(UnloadReason reason) {
        int instanceNumber = identity.instanceNumber();
        try (PidLock lock = store.acquireLock(instanceNumber, LockMode.BLOCKING)) {
            Optional<InstanceKind> current = lock.locate();
            if (current.isEmpty()) {
                LOGGER.error("Unable to update PID file when unloading: PID file does not exist");
                return;
            }
            if (current.get() != InstanceKind.RUNNING) {
                LOGGER.error("Unable to update PID file when unloading: unexpected PID file kind found ({})", current.get());
                return;
            }
            if (reason == UnloadReason.EXIT) {
                store.writeExitMarker(instanceNumber);
                lock.delete(InstanceKind.RUNNING);
            } else {
                lock.transition(InstanceKind.RUNNING, UNLOAD_KINDS.get(reason));
            }
            LOGGER.debug("PID file of instance {} updated for unload [{}]", instanceNumber, reason);
        } catch (PidRecordException e) {
            LOGGER.error("Unable to update PID file when unloading [{}]: {}", reason, e.getMessage());
        }
    }

    private List<String> inconsistentFields(PidRecord record) {
        List<String> fields = new ArrayList<>();
        if (!record.managerName().equals(identity.managerName())) {
            fields.add("managerName");
        }
        if (record.instanceNumber() != identity.instanceNumber()) {
            fields.add("instNb");
        }
        if (record.clusterInstanceNumber() != identity.clusterInstanceNumber()) {
            fields.add("clustInstNb");
        }
        if (!record.ownerName().equals(identity.ownerName())) {
            fields.add("ownerName");
        }
        if (!record.clusterPreset().equals(defaultPreset)) {
            fields.add("clustPreset");
        }
        if (!record.instanceName().equals(lobbyLogin)) {
            fields.add("instName");
        }
        if (record.processId().isPresent() && record.processId().getAsLong() != processId) {
            fields.add("instPid");
        }
        return fields;
    }
}
