package sh.harold.flotilla.cluster.liveness;

/**
 * Result of re-reading the PID record of a tracked instance.
 */
public enum RefreshOutcome {
    /**
     * Clean exit marker consumed, instance removed.
     */
    EXITED,

    /**
     * Instance failed to start, its process disappeared or its record vanished; instance removed.
     */
    CRASHED,

    STATE_CHANGED,

    UNCHANGED,

    /**
     * Record lock unavailable, instance left in its last known state.
     */
    LOCK_FAILED,

    /**
     * Record unreadable or inconsistent with the tracked instance, instance left in its last
     * known state.
     */
    CORRUPT;

    public boolean isRemoval() {
        return this == EXITED || this == CRASHED;
    }
}
