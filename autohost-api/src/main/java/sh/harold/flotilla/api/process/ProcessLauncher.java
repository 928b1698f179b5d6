package sh.harold.flotilla.api.process;

/**
 * Starts processes that outlive the caller and are never waited on.
 */
public interface ProcessLauncher {

    /**
     * @return Operating-system process id of the started process
     * @throws SpawnException if the process could not be created
     */
    long launchDetached(LaunchRequest request) throws SpawnException;
}
