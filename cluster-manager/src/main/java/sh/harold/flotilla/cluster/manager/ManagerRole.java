package sh.harold.flotilla.cluster.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.command.ChatCommandSurface;
import sh.harold.flotilla.api.command.CommandResult;
import sh.harold.flotilla.api.lobby.LobbyEvent;
import sh.harold.flotilla.api.plugin.AutohostEnvironment;
import sh.harold.flotilla.api.plugin.AutohostPlugin;
import sh.harold.flotilla.api.plugin.LoadContext;
import sh.harold.flotilla.api.plugin.PluginLoadException;
import sh.harold.flotilla.api.plugin.UnloadReason;
import sh.harold.flotilla.cluster.RoleEventLoop;
import sh.harold.flotilla.cluster.account.ExistingAccounts;
import sh.harold.flotilla.cluster.admission.AdmissionController;
import sh.harold.flotilla.cluster.admission.InstanceLauncher;
import sh.harold.flotilla.cluster.admission.InstanceWorkspace;
import sh.harold.flotilla.cluster.command.CommandRegistry;
import sh.harold.flotilla.cluster.command.commands.ClusterConfigCommand;
import sh.harold.flotilla.cluster.command.commands.ClusterStatsCommand;
import sh.harold.flotilla.cluster.command.commands.ClusterStatusCommand;
import sh.harold.flotilla.cluster.command.commands.HelpCommand;
import sh.harold.flotilla.cluster.command.commands.ListClustersCommand;
import sh.harold.flotilla.cluster.command.commands.ListInstancesCommand;
import sh.harold.flotilla.cluster.command.commands.PrivateHostCommand;
import sh.harold.flotilla.cluster.config.ClusterConfigValidator;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.config.ConfigValidationException;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.FleetStateException;
import sh.harold.flotilla.cluster.liveness.CrashDetector;
import sh.harold.flotilla.cluster.liveness.InstanceRefresher;
import sh.harold.flotilla.cluster.pid.ManagerLock;
import sh.harold.flotilla.cluster.pid.PidRecordException;
import sh.harold.flotilla.cluster.pid.PidRecordStore;
import sh.harold.flotilla.cluster.presence.PresenceTracker;
import sh.harold.flotilla.cluster.process.CurrentProcessCommand;
import sh.harold.flotilla.cluster.provision.PruningEngine;
import sh.harold.flotilla.cluster.provision.ProvisioningEngine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Cluster manager plugin running in the controller autohost: owns the fleet index, keeps the
 * spare pools provisioned and serves the cluster chat commands.
 */
public class ManagerRole implements AutohostPlugin {
    private static final Logger LOGGER = LoggerFactory.getLogger(ManagerRole.class);

    private static final Duration CHECK_INTERVAL = Duration.ofSeconds(1);
    static final String CLOSE_BATTLE_REASON = "Cluster Manager mode";

    private final FleetIndex fleet = new FleetIndex();
    private final Supplier<ClusterManagerConfig> config = () -> this.currentConfig;

    private volatile ClusterManagerConfig currentConfig;
    private AutohostEnvironment environment;
    private ManagerLock managerLock;
    private ExistingAccounts existingAccounts;
    private StartupReconciler reconciler;
    private CrashDetector crashDetector;
    private ProvisioningEngine provisioning;
    private PruningEngine pruning;
    private PresenceTracker presenceTracker;
    private final CommandRegistry commandRegistry = new CommandRegistry();
    private volatile RoleEventLoop loop;
    private boolean fleetInitialized;

    @Override
    public void onLoad(AutohostEnvironment environment, LoadContext context) throws PluginLoadException {
        this.environment = environment;
        LOGGER.info("Loading cluster manager in manager mode...");
        try {
            currentConfig = ClusterConfigValidator.validate(environment.configuration());
        } catch (ConfigValidationException e) {
            throw new PluginLoadException("Invalid cluster manager configuration: " + e.getMessage(), e);
        }
        environment.setAutoRegistration(currentConfig.settings().autoRegister() >= 2);
        environment.gameHost().closeBattle(CLOSE_BATTLE_REASON);

        PidRecordStore store;
        try {
            store = PidRecordStore.open(environment.varDirectory(), environment.clock());
            managerLock = ManagerLock.acquire(store);
        } catch (PidRecordException e) {
            throw new PluginLoadException(e.getMessage(), e);
        }

        try {
            existingAccounts = ExistingAccounts.load(store.directory().resolve(ExistingAccounts.FILE_NAME));
        } catch (IOException e) {
            managerLock.close();
            throw new PluginLoadException("Unable to load existing accounts data: " + e.getMessage(), e);
        }

        wire(store);

        loop = new RoleEventLoop("ClusterManager");
        if (environment.lobby().isConnected()) {
            try {
                loop.call(() -> {
                    initializeFleet();
                    return null;
                });
            } catch (FleetStateException | IllegalStateException e) {
                loop.stop();
                managerLock.close();
                throw new PluginLoadException("Unable to initialize cluster manager data: " + e.getMessage(), e);
            }
        }
        loop.startTick(this::checkClusters, CHECK_INTERVAL);
        LOGGER.info("Cluster manager loaded in manager mode ({} cluster(s): {}) [{}]",
                currentConfig.configuredClusters().size(), String.join(",", currentConfig.configuredClusters()), context);
    }

    private void wire(PidRecordStore store) {
        String managerName = environment.lobbyLogin();
        InstanceRefresher refresher = new InstanceRefresher(store, fleet, environment.processProbe(),
                environment.clock(), config, managerName);
        InstanceLauncher launcher = new InstanceLauncher(store, fleet, environment.lobby(), environment.processLauncher(),
                existingAccounts, new InstanceWorkspace(environment.instanceDirectory()), environment.clock(), config,
                new InstanceLauncher.LaunchContext(managerName, environment.configurationMacros(),
                        Path.of("").toAbsolutePath(), CurrentProcessCommand::resolve));
        AdmissionController admission = new AdmissionController(fleet, launcher, config);

        provisioning = new ProvisioningEngine(fleet, admission, config);
        pruning = new PruningEngine(fleet, environment.lobby(), environment.clock(), config);
        crashDetector = new CrashDetector(fleet, store, refresher, environment.processProbe(), environment.clock(), config);
        presenceTracker = new PresenceTracker(fleet, environment.lobby(), refresher, provisioning, existingAccounts,
                environment.clock());
        reconciler = new StartupReconciler(store, fleet, environment.processProbe(), presenceTracker,
                environment.clock(), config, managerName);

        commandRegistry.registerCommand(new PrivateHostCommand(admission, config));
        commandRegistry.registerCommand(new ListClustersCommand(config));
        commandRegistry.registerCommand(new ClusterConfigCommand(config));
        commandRegistry.registerCommand(new ClusterStatusCommand(fleet, config));
        commandRegistry.registerCommand(new ClusterStatsCommand(fleet, config));
        commandRegistry.registerCommand(new ListInstancesCommand(fleet, config));
        commandRegistry.registerCommand(new HelpCommand(commandRegistry));
    }

    /**
     * Rebuilds the fleet from the PID records and provisions every cluster.
     *
     * @throws FleetStateException if the PID records describe an unsafe fleet
     */
    private void initializeFleet() {
        fleetInitialized = false;
        try {
            reconciler.rebuild();
        } catch (PidRecordException e) {
            throw new FleetStateException("Unable to read PID directory: " + e.getMessage());
        }
        fleetInitialized = true;
        provisioning.provisionAll();
    }

    /**
     * Reconciliation tick: crash detection, then provisioning of every cluster, then pruning.
     * Clusters left short by a failed launch are retried on the next tick.
     */
    void checkClusters() {
        if (!fleetInitialized || !environment.lobby().isConnected()) {
            return;
        }
        Set<String> impactedClusters = crashDetector.sweep();
        if (!impactedClusters.isEmpty()) {
            LOGGER.debug("Instances lost in cluster(s) {}", String.join(",", impactedClusters));
        }
        provisioning.provisionAll();
        pruning.prune();
    }

    @Override
    public boolean onReloadConfiguration() {
        ClusterManagerConfig reloaded;
        try {
            reloaded = ClusterConfigValidator.validate(environment.configuration());
        } catch (ConfigValidationException e) {
            LOGGER.error("Unable to reload cluster manager configuration: {}", e.getMessage());
            return false;
        }
        loop.execute(() -> {
            currentConfig = reloaded;
            environment.setAutoRegistration(reloaded.settings().autoRegister() >= 2);
            LOGGER.info("Cluster manager configuration reloaded ({} cluster(s): {})",
                    reloaded.configuredClusters().size(), String.join(",", reloaded.configuredClusters()));
            if (fleetInitialized && environment.lobby().isConnected()) {
                provisioning.provisionAll();
            }
        });
        return true;
    }

    @Override
    public void onUnload(UnloadReason reason) {
        loop.stop();
        try {
            existingAccounts.save();
        } catch (IOException e) {
            LOGGER.error("Unable to store existing accounts data: {}", e.getMessage());
        }
        managerLock.close();
        LOGGER.info("Cluster manager unloaded [{}]", reason);
    }

    @Override
    public void onLobbyConnected() {
        loop.execute(() -> {
            try {
                initializeFleet();
            } catch (FleetStateException e) {
                LOGGER.error("Unable to initialize cluster manager data: {}", e.getMessage());
                environment.quit("unable to initialize ClusterManager plugin data");
            }
        });
    }

    @Override
    public void onLobbyDisconnected() {
        LOGGER.debug("Lobby connection lost, reconciliation suspended");
    }

    @Override
    public void onLobbyEvent(LobbyEvent event) {
        loop.execute(() -> {
            if (fleetInitialized) {
                presenceTracker.dispatch(event);
            }
        });
    }

    @Override
    public boolean onPrivateMessage(String user, String message) {
        return false;
    }

    @Override
    public void onGameStarted() {
        LOGGER.warn("Unexpected game start encountered on cluster manager");
    }

    @Override
    public void onGameStopped() {
        // the manager never hosts games
    }

    @Override
    public Optional<ChatCommandSurface> commands() {
        return Optional.of(new ChatCommandSurface() {
            @Override
            public Set<String> commandNames() {
                return commandRegistry.commandNames();
            }

            @Override
            public CommandResult execute(String user, String commandLine) {
                RoleEventLoop running = loop;
                if (running == null) {
                    return CommandResult.failure("Cluster manager is not loaded");
                }
                return running.call(() -> commandRegistry.execute(user, commandLine));
            }
        });
    }

    FleetIndex fleet() {
        return fleet;
    }
}
