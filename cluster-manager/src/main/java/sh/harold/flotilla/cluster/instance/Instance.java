package sh.harold.flotilla.cluster.instance;

import sh.harold.flotilla.cluster.pid.PidRecord;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * One instance tracked by the manager. Identity is fixed, lifecycle and presence are updated by
 * the reconciliation loop.
 */
public final class Instance {
    private final int instanceNumber;
    private final String name;
    private final String cluster;
    private final int clusterInstanceNumber;
    private final String owner;

    private LifecycleState lifecycleState;
    private Instant lifecycleSince;
    private PresenceState presenceState;
    private Instant presenceSince;
    private OptionalLong processId;

    public Instance(int instanceNumber,
                    String name,
                    String cluster,
                    int clusterInstanceNumber,
                    String owner,
                    LifecycleState lifecycleState,
                    Instant lifecycleSince,
                    PresenceState presenceState,
                    Instant presenceSince,
                    OptionalLong processId) {
        if (instanceNumber < 0 || clusterInstanceNumber < 0) {
            throw new IllegalArgumentException("Instance numbers must not be negative");
        }
        this.instanceNumber = instanceNumber;
        this.name = Objects.requireNonNull(name, "name");
        this.cluster = Objects.requireNonNull(cluster, "cluster");
        this.clusterInstanceNumber = clusterInstanceNumber;
        this.owner = Objects.requireNonNull(owner, "owner");
        this.lifecycleState = Objects.requireNonNull(lifecycleState, "lifecycleState");
        this.lifecycleSince = Objects.requireNonNull(lifecycleSince, "lifecycleSince");
        this.presenceState = Objects.requireNonNull(presenceState, "presenceState");
        this.presenceSince = Objects.requireNonNull(presenceSince, "presenceSince");
        this.processId = Objects.requireNonNull(processId, "processId");
    }

    /**
     * Instance just written as a launched record, not yet seen online.
     */
    public static Instance launched(int instanceNumber, String name, String cluster, int clusterInstanceNumber,
                                    String owner, Instant now) {
        return new Instance(instanceNumber, name, cluster, clusterInstanceNumber, owner,
                LifecycleState.LAUNCHED, now, PresenceState.OFFLINE, now, OptionalLong.empty());
    }

    public int instanceNumber() {
        return instanceNumber;
    }

    public String name() {
        return name;
    }

    public String cluster() {
        return cluster;
    }

    public int clusterInstanceNumber() {
        return clusterInstanceNumber;
    }

    public String owner() {
        return owner;
    }

    public boolean isPublic() {
        return PidRecord.PUBLIC_OWNER.equals(owner);
    }

    public LifecycleState lifecycleState() {
        return lifecycleState;
    }

    public Instant lifecycleSince() {
        return lifecycleSince;
    }

    public PresenceState presenceState() {
        return presenceState;
    }

    public Instant presenceSince() {
        return presenceSince;
    }

    public OptionalLong processId() {
        return processId;
    }

    public void updateLifecycle(LifecycleState state, Instant since) {
        this.lifecycleState = Objects.requireNonNull(state, "state");
        this.lifecycleSince = Objects.requireNonNull(since, "since");
    }

    public void updatePresence(PresenceState state, Instant since) {
        this.presenceState = Objects.requireNonNull(state, "state");
        this.presenceSince = Objects.requireNonNull(since, "since");
    }

    public void updateProcessId(OptionalLong processId) {
        this.processId = Objects.requireNonNull(processId, "processId");
    }

    /**
     * @return true if the record fields shared with this instance all match
     */
    public boolean matches(PidRecord record) {
        return record.instanceNumber() == instanceNumber
                && record.instanceName().equals(name)
                && record.clusterPreset().equals(cluster)
                && record.clusterInstanceNumber() == clusterInstanceNumber
                && record.ownerName().equals(owner);
    }

    @Override
    public String toString() {
        return "#" + instanceNumber + " (" + name + ")";
    }
}
