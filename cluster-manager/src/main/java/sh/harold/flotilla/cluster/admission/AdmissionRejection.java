package sh.harold.flotilla.cluster.admission;

/**
 * Reasons for refusing a new instance, in the order they are checked.
 */
public enum AdmissionRejection {
    INVALID_CLUSTER,
    OWNER_ALREADY_HOSTING,
    CLUSTER_FULL,
    CLUSTER_PUBLIC_FULL,
    CLUSTER_PRIVATE_FULL,
    FLEET_FULL,
    FLEET_PUBLIC_FULL,
    FLEET_PRIVATE_FULL,
    /**
     * Checks passed but the instance could not be materialized.
     */
    LAUNCH_FAILED
}
