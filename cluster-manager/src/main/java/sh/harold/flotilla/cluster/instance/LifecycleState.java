package sh.harold.flotilla.cluster.instance;

import sh.harold.flotilla.cluster.pid.InstanceKind;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of an instance process as seen through its PID record.
 *
 * <p>{@link #EXITING} and {@link #CRASHED} are classifications made by the manager, they are
 * never stored as record kinds.</p>
 */
public enum LifecycleState {

    /**
     * Process spawned by the manager, not yet started.
     */
    LAUNCHED("Instance process is being started"),

    RUNNING("Instance is running"),

    /**
     * Process is re-executing itself.
     */
    RESTARTING("Instance is restarting"),

    /**
     * Cluster plugin of the instance is being reloaded.
     */
    RELOADING("Instance plugin is reloading"),

    /**
     * Cluster plugin of the instance was unloaded manually.
     */
    UNLOADED("Instance plugin is unloaded"),

    EXITING("Instance exited cleanly"),

    CRASHED("Instance crashed or failed to start");

    private static final Map<LifecycleState, Set<LifecycleState>> VALID_TRANSITIONS;

    static {
        Map<LifecycleState, Set<LifecycleState>> transitions = new EnumMap<>(LifecycleState.class);
        transitions.put(LAUNCHED, EnumSet.of(RUNNING, EXITING, CRASHED));
        transitions.put(RUNNING, EnumSet.of(RESTARTING, RELOADING, UNLOADED, EXITING, CRASHED));
        transitions.put(RESTARTING, EnumSet.of(RUNNING, EXITING, CRASHED));
        transitions.put(RELOADING, EnumSet.of(RUNNING, UNLOADED, EXITING, CRASHED));
        transitions.put(UNLOADED, EnumSet.of(RUNNING, RELOADING, EXITING, CRASHED));
        transitions.put(EXITING, EnumSet.noneOf(LifecycleState.class));
        transitions.put(CRASHED, EnumSet.noneOf(LifecycleState.class));
        VALID_TRANSITIONS = transitions;
    }

    private final String description;

    LifecycleState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return true while the instance process has not reported itself started
     */
    public boolean isStarting() {
        return this == LAUNCHED || this == RESTARTING;
    }

    public boolean isTerminal() {
        return this == EXITING || this == CRASHED;
    }

    public boolean canTransitionTo(LifecycleState next) {
        return VALID_TRANSITIONS.get(this).contains(next);
    }

    public static LifecycleState fromKind(InstanceKind kind) {
        return switch (kind) {
            case LAUNCHED -> LAUNCHED;
            case RUNNING -> RUNNING;
            case RESTARTING -> RESTARTING;
            case RELOADING -> RELOADING;
            case UNLOADED -> UNLOADED;
        };
    }
}
