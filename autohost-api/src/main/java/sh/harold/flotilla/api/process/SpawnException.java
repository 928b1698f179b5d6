package sh.harold.flotilla.api.process;

/**
 * Thrown when a detached process could not be created.
 */
public class SpawnException extends Exception {

    public SpawnException(String message) {
        super(message);
    }

    public SpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
