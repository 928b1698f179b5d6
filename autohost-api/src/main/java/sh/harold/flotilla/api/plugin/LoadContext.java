package sh.harold.flotilla.api.plugin;

/**
 * Circumstances in which a plugin is loaded.
 */
public enum LoadContext {
    /**
     * Loaded manually by an operator while the autohost is running.
     */
    LOAD,

    /**
     * Reloaded manually by an operator (unload immediately followed by load).
     */
    RELOAD,

    /**
     * Loaded automatically while the autohost process starts.
     */
    AUTOLOAD
}
