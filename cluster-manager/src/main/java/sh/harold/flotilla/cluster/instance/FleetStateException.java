package sh.harold.flotilla.cluster.instance;

/**
 * The fleet state is ambiguous (duplicate identities, records of a foreign manager) and the
 * manager cannot safely operate on it.
 */
public class FleetStateException extends RuntimeException {

    public FleetStateException(String message) {
        super(message);
    }
}
