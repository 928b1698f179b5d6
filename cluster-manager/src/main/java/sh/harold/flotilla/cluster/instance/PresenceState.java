package sh.harold.flotilla.cluster.instance;

/**
 * Occupancy of an instance as seen from the lobby.
 */
public enum PresenceState {
    /**
     * Instance account is not logged in.
     */
    OFFLINE("offline"),

    /**
     * Online, hosting nothing in use.
     */
    SPARE("idle"),

    /**
     * Hosting an occupied battle or a running game.
     */
    IN_USE("inUse"),

    /**
     * Offline for longer than the offline timeout.
     */
    STUCK("error");

    private final String label;

    PresenceState(String label) {
        this.label = label;
    }

    /**
     * @return Label used in status tables
     */
    public String label() {
        return label;
    }

    public boolean isOfflineLooking() {
        return this == OFFLINE || this == STUCK;
    }
}
