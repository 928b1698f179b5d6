package sh.harold.flotilla.cluster.pid;

public enum LockMode {
    /**
     * Wait until the lock is available.
     */
    BLOCKING,

    /**
     * Fail immediately if another process holds the lock.
     */
    FAIL_FAST
}
