package sh.harold.flotilla.api.plugin;

/**
 * Circumstances in which a plugin is unloaded.
 */
public enum UnloadReason {
    /**
     * Unloaded as the first half of a manual reload.
     */
    RELOAD,

    /**
     * Unloaded manually by an operator.
     */
    UNLOAD,

    /**
     * The autohost process is about to re-execute itself.
     */
    RESTART,

    /**
     * The autohost process is about to exit.
     */
    EXIT
}
