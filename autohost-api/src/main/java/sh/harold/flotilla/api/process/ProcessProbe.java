package sh.harold.flotilla.api.process;

/**
 * Checks operating-system process existence without affecting the process.
 */
@FunctionalInterface
public interface ProcessProbe {

    boolean isAlive(long processId);
}
