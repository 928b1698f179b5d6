package sh.harold.flotilla.api.plugin;

import sh.harold.flotilla.api.config.PresetConfiguration;
import sh.harold.flotilla.api.game.GameHost;
import sh.harold.flotilla.api.lobby.LobbyGateway;
import sh.harold.flotilla.api.process.ProcessLauncher;
import sh.harold.flotilla.api.process.ProcessProbe;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

/**
 * Services the autohost program exposes to its plugins.
 */
public interface AutohostEnvironment {

    /**
     * @return Lobby account name this autohost logs in with
     */
    String lobbyLogin();

    /**
     * Configuration macros given to the autohost on its command line.
     *
     * @return Unmodifiable macro map
     */
    Map<String, String> configurationMacros();

    /**
     * @return Directory holding persistent autohost data
     */
    Path varDirectory();

    /**
     * @return Directory holding the autohost instance data (caches, data files)
     */
    Path instanceDirectory();

    /**
     * @return Operating-system process id of this autohost
     */
    long processId();

    Clock clock();

    LobbyGateway lobby();

    GameHost gameHost();

    ProcessLauncher processLauncher();

    ProcessProbe processProbe();

    PresetConfiguration configuration();

    /**
     * Enables or disables automatic lobby account registration performed by the autohost
     * when its lobby login is refused for an unknown account.
     */
    void setAutoRegistration(boolean enabled);

    /**
     * Asks the autohost to exit as soon as possible; the autohost unloads its plugins with
     * {@link UnloadReason#EXIT} before terminating.
     *
     * @param reason Human readable reason, logged by the autohost
     */
    void quit(String reason);
}
