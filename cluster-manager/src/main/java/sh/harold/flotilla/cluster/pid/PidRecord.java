package sh.harold.flotilla.cluster.pid;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Durable identity of one instance.
 *
 * @param managerName           Lobby login of the manager owning the instance
 * @param instanceNumber        Fleet-wide instance number, also the record key
 * @param instanceName          Lobby login of the instance
 * @param clusterPreset         Cluster the instance belongs to
 * @param clusterInstanceNumber Number of the instance inside its cluster
 * @param ownerName             Owner of a private instance, {@link #PUBLIC_OWNER} for public ones
 * @param processId             Process id of the instance, once known
 */
public record PidRecord(String managerName,
                        int instanceNumber,
                        String instanceName,
                        String clusterPreset,
                        int clusterInstanceNumber,
                        String ownerName,
                        OptionalLong processId) {

    public static final String PUBLIC_OWNER = "*";

    public PidRecord {
        requireValue(managerName, "managerName");
        requireValue(instanceName, "instanceName");
        requireValue(clusterPreset, "clusterPreset");
        requireValue(ownerName, "ownerName");
        Objects.requireNonNull(processId, "processId");
        if (instanceNumber < 0) {
            throw new IllegalArgumentException("instanceNumber must not be negative: " + instanceNumber);
        }
        if (clusterInstanceNumber < 0) {
            throw new IllegalArgumentException("clusterInstanceNumber must not be negative: " + clusterInstanceNumber);
        }
    }

    private static void requireValue(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isEmpty() || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException(field + " must be a non-empty single line value");
        }
    }

    public boolean isPublic() {
        return PUBLIC_OWNER.equals(ownerName);
    }

    public PidRecord withProcessId(long pid) {
        return new PidRecord(managerName, instanceNumber, instanceName, clusterPreset, clusterInstanceNumber, ownerName, OptionalLong.of(pid));
    }

    public PidRecord withoutProcessId() {
        return new PidRecord(managerName, instanceNumber, instanceName, clusterPreset, clusterInstanceNumber, ownerName, OptionalLong.empty());
    }
}
