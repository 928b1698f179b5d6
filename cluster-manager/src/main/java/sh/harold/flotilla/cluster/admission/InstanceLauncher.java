package sh.harold.flotilla.cluster.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.lobby.LobbyGateway;
import sh.harold.flotilla.api.process.LaunchRequest;
import sh.harold.flotilla.api.process.ProcessLauncher;
import sh.harold.flotilla.api.process.SpawnException;
import sh.harold.flotilla.cluster.account.ExistingAccounts;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.config.ClusterManagerSettings;
import sh.harold.flotilla.cluster.config.ClusterSettings;
import sh.harold.flotilla.cluster.config.ConfMacroParser;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.Instance;
import sh.harold.flotilla.cluster.pid.InstanceKind;
import sh.harold.flotilla.cluster.pid.LockMode;
import sh.harold.flotilla.cluster.pid.PidLock;
import sh.harold.flotilla.cluster.pid.PidRecord;
import sh.harold.flotilla.cluster.pid.PidRecordException;
import sh.harold.flotilla.cluster.pid.PidRecordStore;

import java.io.IOException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Materializes a new instance: numbers and name allocation, working directory, launched PID
 * record, bot account registration, configuration macros and detached process.
 */
public class InstanceLauncher {
    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceLauncher.class);

    static final String PASSWORD_CHARACTERS = "abcdefghjkmnpqrstuvwxyz123456789";
    static final int PASSWORD_LENGTH = 4;

    private final PidRecordStore store;
    private final FleetIndex fleet;
    private final LobbyGateway lobby;
    private final ProcessLauncher processLauncher;
    private final ExistingAccounts existingAccounts;
    private final InstanceWorkspace workspace;
    private final InstanceNamer namer = new InstanceNamer();
    private final Clock clock;
    private final Supplier<ClusterManagerConfig> config;
    private final LaunchContext context;
    private final Random random;

    /**
     * @param managerName         Lobby login of the manager
     * @param managerMacros       Configuration macros of the manager, inherited by instances
     * @param workingDirectory    Directory instance processes are started from
     * @param defaultCommand      Instance command used when no worker command is configured
     */
    public record LaunchContext(String managerName,
                                Map<String, String> managerMacros,
                                Path workingDirectory,
                                Supplier<List<String>> defaultCommand) {

        public LaunchContext {
            Objects.requireNonNull(managerName, "managerName");
            managerMacros = Map.copyOf(managerMacros);
            Objects.requireNonNull(workingDirectory, "workingDirectory");
            Objects.requireNonNull(defaultCommand, "defaultCommand");
        }
    }

    public InstanceLauncher(PidRecordStore store,
                            FleetIndex fleet,
                            LobbyGateway lobby,
                            ProcessLauncher processLauncher,
                            ExistingAccounts existingAccounts,
                            InstanceWorkspace workspace,
                            Clock clock,
                            Supplier<ClusterManagerConfig> config,
                            LaunchContext context) {
        this(store, fleet, lobby, processLauncher, existingAccounts, workspace, clock, config, context, new SecureRandom());
    }

    InstanceLauncher(PidRecordStore store,
                     FleetIndex fleet,
                     LobbyGateway lobby,
                     ProcessLauncher processLauncher,
                     ExistingAccounts existingAccounts,
                     InstanceWorkspace workspace,
                     Clock clock,
                     Supplier<ClusterManagerConfig> config,
                     LaunchContext context,
                     Random random) {
        this.store = Objects.requireNonNull(store, "store");
        this.fleet = Objects.requireNonNull(fleet, "fleet");
        this.lobby = Objects.requireNonNull(lobby, "lobby");
        this.processLauncher = Objects.requireNonNull(processLauncher, "processLauncher");
        this.existingAccounts = Objects.requireNonNull(existingAccounts, "existingAccounts");
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.config = Objects.requireNonNull(config, "config");
        this.context = Objects.requireNonNull(context, "context");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Starts a new instance in a cluster and adds it to the fleet as launched and offline.
     *
     * @param owner    Owner of a private instance, empty for a public instance
     * @param password Battle password of a private instance, generated if empty
     * @return The new instance, empty if it could not be started (reason logged)
     */
    public Optional<LaunchedInstance> launch(String cluster, Optional<String> owner, Optional<String> password) {
        ClusterManagerConfig currentConfig = config.get();
        ClusterManagerSettings settings = currentConfig.settings();
        ClusterSettings clusterSettings = currentConfig.cluster(cluster);
        String ownerName = owner.orElse(PidRecord.PUBLIC_OWNER);

        int instanceNumber = fleet.nextFreeInstanceNumber();
        int clusterInstanceNumber = fleet.nextFreeClusterInstanceNumber(cluster);
        InstanceName instanceName = namer.name(clusterSettings, settings.maxInstances(), instanceNumber,
                clusterInstanceNumber, context.managerName(), ownerName);
        String name = instanceName.name();

        if (!InstanceNamer.isValid(name)) {
            LOGGER.error("Unable to start new instance, invalid instance name: {}", name);
            return Optional.empty();
        }
        if (fleet.byName(name).isPresent()) {
            LOGGER.error("Unable to start new instance, duplicate instance name: {}", name);
            return Optional.empty();
        }
        if (lobby.isConnected() && lobby.isOnline(name)) {
            LOGGER.error("Unable to start new instance, instance \"{}\" is already online", name);
            return Optional.empty();
        }

        Path instanceDirectory = store.directory().resolve(name);
        try {
            workspace.prepare(instanceDirectory, settings.shareArchiveCache(), settings.privateDataFiles());
        } catch (IOException e) {
            LOGGER.error("Unable to start new instance, failed to prepare instance directory \"{}\"", instanceDirectory, e);
            return Optional.empty();
        }

        PidRecord record = new PidRecord(context.managerName(), instanceNumber, name, cluster, clusterInstanceNumber,
                ownerName, OptionalLong.empty());
        try (PidLock lock = store.acquireLock(instanceNumber, LockMode.BLOCKING)) {
            lock.write(InstanceKind.LAUNCHED, record);
            store.deleteExitMarker(instanceNumber);
        } catch (PidRecordException e) {
            LOGGER.error("Unable to start new instance {} ({}): {}", instanceNumber, name, e.getMessage());
            return Optional.empty();
        }

        if (lobby.hasAdminAccess() && clusterSettings.lobbyPassword().isEmpty() && !existingAccounts.contains(name)) {
            LOGGER.debug("Requesting lobby account creation for instance {}", name);
            lobby.createBotAccount(name);
            existingAccounts.markRegistrationRequested(name, clock.instant());
        }

        Optional<String> battlePassword = owner.isPresent()
                ? Optional.of(password.filter(p -> !p.isBlank()).orElseGet(this::generatePassword))
                : Optional.empty();
        Map<String, String> macros = instanceMacros(settings, clusterSettings, instanceName, instanceNumber, owner.isPresent(), battlePassword);

        List<String> command = new ArrayList<>(settings.workerCommand().isEmpty()
                ? context.defaultCommand().get()
                : settings.workerCommand());
        macros.forEach((key, value) -> command.add(key + "=" + value));
        try {
            long pid = processLauncher.launchDetached(new LaunchRequest(command, context.workingDirectory(), settings.createNewConsoles()));
            LOGGER.debug("Instance {} ({}) spawned with process id {}", instanceNumber, name, pid);
        } catch (SpawnException | IllegalArgumentException e) {
            LOGGER.error("Unable to create detached process to start new instance {} ({})", instanceNumber, name, e);
            discardRecord(instanceNumber);
            return Optional.empty();
        }

        Instance instance = Instance.launched(instanceNumber, name, cluster, clusterInstanceNumber, ownerName, clock.instant());
        fleet.add(instance);
        return Optional.of(new LaunchedInstance(instance, battlePassword));
    }

    private Map<String, String> instanceMacros(ClusterManagerSettings settings,
                                               ClusterSettings cluster,
                                               InstanceName instanceName,
                                               int instanceNumber,
                                               boolean privateInstance,
                                               Optional<String> battlePassword) {
        Map<String, String> macros = new TreeMap<>(context.managerMacros());
        macros.putAll(instanceName.placeholders());

        Map<String, String> overrides = ConfMacroParser.parse(cluster.confMacros()).orElseGet(TreeMap::new);
        String specific = privateInstance ? cluster.confMacrosPrivate() : cluster.confMacrosPublic();
        overrides.putAll(ConfMacroParser.parse(specific).orElseGet(TreeMap::new));
        Map<String, String> placeholderValues = Map.copyOf(macros);
        overrides.replaceAll((key, value) -> InstanceNamer.substitute(value, placeholderValues));

        macros.put("set:lobbyLogin", instanceName.name());
        macros.put("set:defaultPreset", cluster.name());
        macros.put("hSet:port", String.valueOf(settings.baseGamePort() + instanceNumber));
        macros.put("set:autoHostPort", String.valueOf(settings.baseAutoHostPort() + instanceNumber));
        macros.put("set:instanceDir", PidRecordStore.DIRECTORY_NAME + "/" + instanceName.name());
        macros.put("set:logDir", InstanceWorkspace.LOG_DIRECTORY);
        battlePassword.ifPresent(password -> macros.put("hSet:password", password));
        if (!cluster.lobbyPassword().isEmpty()) {
            macros.put("set:lobbyPassword", cluster.lobbyPassword());
        }
        macros.putAll(overrides);
        return macros;
    }

    private void discardRecord(int instanceNumber) {
        try (PidLock lock = store.acquireLock(instanceNumber, LockMode.BLOCKING)) {
            lock.delete(InstanceKind.LAUNCHED);
            lock.deleteLockFile();
        } catch (PidRecordException e) {
            LOGGER.error("Unable to remove PID file of instance {} which failed to spawn: {}", instanceNumber, e.getMessage());
        }
    }

    private String generatePassword() {
        StringBuilder password = new StringBuilder(PASSWORD_LENGTH);
        for (int i = 0; i < PASSWORD_LENGTH; i++) {
            password.append(PASSWORD_CHARACTERS.charAt(random.nextInt(PASSWORD_CHARACTERS.length())));
        }
        return password.toString();
    }
}
