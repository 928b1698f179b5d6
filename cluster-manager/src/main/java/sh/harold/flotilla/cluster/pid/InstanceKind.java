package sh.harold.flotilla.cluster.pid;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle kinds a PID record can be stored as. The kind is encoded as the record file suffix.
 */
public enum InstanceKind {
    LAUNCHED("launched"),
    RUNNING("running"),
    RESTARTING("restarting"),
    RELOADING("reloading"),
    UNLOADED("unloaded");

    private final String suffix;

    InstanceKind(String suffix) {
        this.suffix = suffix;
    }

    String suffix() {
        return suffix;
    }

    /**
     * @return true if records of this kind carry the process id of the instance
     */
    public boolean hasProcessId() {
        return this != LAUNCHED && this != RESTARTING;
    }

    static Optional<InstanceKind> fromSuffix(String suffix) {
        return Arrays.stream(values()).filter(kind -> kind.suffix.equals(suffix)).findFirst();
    }
}
