package sh.harold.flotilla.api.plugin;

import sh.harold.flotilla.api.command.ChatCommandSurface;
import sh.harold.flotilla.api.lobby.LobbyEvent;

import java.util.Optional;

/**
 * Interface for plugins hosted by the autohost program.
 */
public interface AutohostPlugin {
    /**
     * Called when the plugin is being loaded.
     *
     * @param environment Services exposed by the hosting autohost
     * @param context     Why the plugin is being loaded
     * @throws PluginLoadException if the plugin refuses to load
     */
    void onLoad(AutohostEnvironment environment, LoadContext context) throws PluginLoadException;

    /**
     * Called after the autohost configuration has been reloaded.
     *
     * @return false if the new configuration is unusable by this plugin
     */
    boolean onReloadConfiguration();

    /**
     * Called when the plugin is being unloaded.
     *
     * @param reason Why the plugin is being unloaded
     */
    void onUnload(UnloadReason reason);

    void onLobbyConnected();

    void onLobbyDisconnected();

    /**
     * Called for every lobby presence event, from the autohost's lobby thread.
     */
    void onLobbyEvent(LobbyEvent event);

    /**
     * Called when a private message is received from a lobby user.
     *
     * @return true if the message was consumed by this plugin
     */
    boolean onPrivateMessage(String user, String message);

    void onGameStarted();

    void onGameStopped();

    /**
     * Chat commands contributed by this plugin, if any.
     */
    Optional<ChatCommandSurface> commands();
}
