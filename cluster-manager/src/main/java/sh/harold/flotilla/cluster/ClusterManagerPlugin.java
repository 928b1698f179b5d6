package sh.harold.flotilla.cluster;

import sh.harold.flotilla.api.command.ChatCommandSurface;
import sh.harold.flotilla.api.lobby.LobbyEvent;
import sh.harold.flotilla.api.plugin.AutohostEnvironment;
import sh.harold.flotilla.api.plugin.AutohostPlugin;
import sh.harold.flotilla.api.plugin.LoadContext;
import sh.harold.flotilla.api.plugin.PluginLoadException;
import sh.harold.flotilla.api.plugin.UnloadReason;
import sh.harold.flotilla.cluster.manager.ManagerRole;
import sh.harold.flotilla.cluster.worker.WorkerIdentity;
import sh.harold.flotilla.cluster.worker.WorkerRole;

import java.util.Optional;

/**
 * Entry point loaded by the autohost. The process is a manager unless its configuration macros
 * carry the identity given by a manager to the instances it starts.
 */
public class ClusterManagerPlugin implements AutohostPlugin {

    private AutohostPlugin role;

    @Override
    public void onLoad(AutohostEnvironment environment, LoadContext context) throws PluginLoadException {
        AutohostPlugin selected = WorkerIdentity.isWorker(environment.configurationMacros())
                ? new WorkerRole()
                : new ManagerRole();
        selected.onLoad(environment, context);
        role = selected;
    }

    @Override
    public boolean onReloadConfiguration() {
        return role != null && role.onReloadConfiguration();
    }

    @Override
    public void onUnload(UnloadReason reason) {
        if (role != null) {
            role.onUnload(reason);
            role = null;
        }
    }

    @Override
    public void onLobbyConnected() {
        if (role != null) {
            role.onLobbyConnected();
        }
    }

    @Override
    public void onLobbyDisconnected() {
        if (role != null) {
            role.onLobbyDisconnected();
        }
    }

    @Override
    public void onLobbyEvent(LobbyEvent event) {
        if (role != null) {
            role.onLobbyEvent(event);
        }
    }

    @Override
    public boolean onPrivateMessage(String user, String message) {
        return role != null && role.onPrivateMessage(user, message);
    }

    @Override
    public void onGameStarted() {
        if (role != null) {
            role.onGameStarted();
        }
    }

    @Override
    public void onGameStopped() {
        if (role != null) {
            role.onGameStopped();
        }
    }

    @Override
    public Optional<ChatCommandSurface> commands() {
        return role == null ? Optional.empty() : role.commands();
    }

    boolean isManager() {
        return role instanceof ManagerRole;
    }
}
