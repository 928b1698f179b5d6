package sh.harold.flotilla.cluster.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.command.ChatCommandSurface;
import sh.harold.flotilla.api.lobby.LobbyEvent;
import sh.harold.flotilla.api.plugin.AutohostEnvironment;
import sh.harold.flotilla.api.plugin.AutohostPlugin;
import sh.harold.flotilla.api.plugin.LoadContext;
import sh.harold.flotilla.api.plugin.PluginLoadException;
import sh.harold.flotilla.api.plugin.UnloadReason;
import sh.harold.flotilla.cluster.RoleEventLoop;
import sh.harold.flotilla.cluster.config.ClusterConfigValidator;
import sh.harold.flotilla.cluster.config.ClusterManagerSettings;
import sh.harold.flotilla.cluster.config.ConfigValidationException;
import sh.harold.flotilla.cluster.pid.PidRecordException;
import sh.harold.flotilla.cluster.pid.PidRecordStore;

import java.time.Duration;
import java.util.Optional;

/**
 * Cluster manager plugin running inside an instance started by a manager.
 */
public class WorkerRole implements AutohostPlugin {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerRole.class);

    private static final Duration CHECK_INTERVAL = Duration.ofSeconds(1);

    private AutohostEnvironment environment;
    private volatile ClusterManagerSettings settings;
    private WorkerIdentity identity;
    private WorkerRecordLifecycle recordLifecycle;
    private WorkerSupervisor supervisor;
    private RoleEventLoop loop;

    @Override
    public void onLoad(AutohostEnvironment environment, LoadContext context) throws PluginLoadException {
        this.environment = environment;
        LOGGER.info("Loading cluster manager in worker mode...");
        try {
            settings = ClusterConfigValidator.validateGlobal(environment.configuration());
        } catch (ConfigValidationException e) {
            throw new PluginLoadException("Invalid cluster manager configuration: " + e.getMessage(), e);
        }
        environment.setAutoRegistration(settings.autoRegister() >= 1);

        identity = WorkerIdentity.fromMacros(environment.configurationMacros());
        PidRecordStore store;
        try {
            store = PidRecordStore.open(environment.varDirectory(), environment.clock());
        } catch (PidRecordException e) {
            throw new PluginLoadException("Unable to open PID directory: " + e.getMessage(), e);
        }
        recordLifecycle = new WorkerRecordLifecycle(store, identity, environment.lobbyLogin(),
                environment.configuration().defaultPreset(), environment.processId());
        recordLifecycle.start(context);

        supervisor = new WorkerSupervisor(identity, environment.lobby(), environment.gameHost(), environment.clock(),
                () -> settings, environment::quit);
        loop = new RoleEventLoop("ClusterWorker-" + identity.instanceNumber());
        loop.execute(supervisor::start);
        loop.startTick(supervisor::check, CHECK_INTERVAL);
        LOGGER.info("Cluster manager loaded in worker mode (instance {}, manager {}) [{}]",
                identity.instanceNumber(), identity.managerName(), context);
    }

    @Override
    public boolean onReloadConfiguration() {
        try {
            settings = ClusterConfigValidator.validateGlobal(environment.configuration());
        } catch (ConfigValidationException e) {
            LOGGER.error("Unable to reload cluster manager configuration: {}", e.getMessage());
            return false;
        }
        environment.setAutoRegistration(settings.autoRegister() >= 1);
        return true;
    }

    @Override
    public void onUnload(UnloadReason reason) {
        loop.stop();
        recordLifecycle.stop(reason);
        LOGGER.info("Cluster manager unloaded [{}]", reason);
    }

    @Override
    public void onLobbyConnected() {
        loop.execute(supervisor::onLobbyConnected);
    }

    @Override
    public void onLobbyDisconnected() {
        loop.execute(supervisor::onLobbyDisconnected);
    }

    @Override
    public void onLobbyEvent(LobbyEvent event) {
        loop.execute(() -> supervisor.onLobbyEvent(event));
    }

    @Override
    public boolean onPrivateMessage(String user, String message) {
        return loop.call(() -> supervisor.onPrivateMessage(user, message));
    }

    @Override
    public void onGameStarted() {
        loop.execute(supervisor::onGameStarted);
    }

    @Override
    public void onGameStopped() {
        loop.execute(supervisor::onGameStopped);
    }

    @Override
    public Optional<ChatCommandSurface> commands() {
        return Optional.empty();
    }
}
