package sh.harold.flotilla.api.plugin;

/**
 * Thrown by a plugin that refuses to load.
 */
public class PluginLoadException extends Exception {

    public PluginLoadException(String message) {
        super(message);
    }

    public PluginLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
