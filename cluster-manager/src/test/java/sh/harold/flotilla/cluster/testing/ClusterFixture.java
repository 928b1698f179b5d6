package sh.harold.flotilla.cluster.testing;

import sh.harold.flotilla.cluster.account.ExistingAccounts;
import sh.harold.flotilla.cluster.admission.AdmissionController;
import sh.harold.flotilla.cluster.admission.InstanceLauncher;
import sh.harold.flotilla.cluster.admission.InstanceWorkspace;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.Instance;
import sh.harold.flotilla.cluster.instance.PresenceState;
import sh.harold.flotilla.cluster.pid.PidRecordException;
import sh.harold.flotilla.cluster.pid.PidRecordStore;
import sh.harold.flotilla.cluster.provision.ProvisioningEngine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Manager components wired over a temporary directory, a {@link FakeLobby} and a
 * {@link RecordingProcessLauncher}.
 */
public final class ClusterFixture {
    public static final Instant START = Instant.parse("2024-05-01T12:00:00Z");
    public static final String MANAGER_NAME = "Manager";

    private final MutableClock clock = new MutableClock(START);
    private final FleetIndex fleet = new FleetIndex();
    private final FakeLobby lobby = new FakeLobby();
    private final RecordingProcessLauncher processLauncher = new RecordingProcessLauncher();
    private final Path root;
    private final PidRecordStore store;
    private final ExistingAccounts accounts;
    private ClusterManagerConfig config;

    public ClusterFixture(Path root, ClusterManagerConfig config) {
        this.root = root;
        this.config = config;
        try {
            this.store = PidRecordStore.open(root.resolve("var"), clock);
            this.accounts = ExistingAccounts.load(store.directory().resolve(ExistingAccounts.FILE_NAME));
        } catch (PidRecordException e) {
            throw new IllegalStateException(e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public MutableClock clock() {
        return clock;
    }

    public FleetIndex fleet() {
        return fleet;
    }

    public FakeLobby lobby() {
        return lobby;
    }

    public RecordingProcessLauncher processLauncher() {
        return processLauncher;
    }

    public PidRecordStore store() {
        return store;
    }

    public ExistingAccounts accounts() {
        return accounts;
    }

    public Path managerInstanceDirectory() {
        return root.resolve("instance");
    }

    public Supplier<ClusterManagerConfig> config() {
        return () -> config;
    }

    public void setConfig(ClusterManagerConfig config) {
        this.config = config;
    }

    public InstanceLauncher.LaunchContext launchContext() {
        return new InstanceLauncher.LaunchContext(MANAGER_NAME, Map.of("configFile", "etc/spads.conf"), root,
                () -> List.of("perl", "spads.pl"));
    }

    public InstanceLauncher instanceLauncher() {
        return new InstanceLauncher(store, fleet, lobby, processLauncher, accounts,
                new InstanceWorkspace(managerInstanceDirectory()), clock, config(), launchContext());
    }

    public AdmissionController admission() {
        return new AdmissionController(fleet, instanceLauncher(), config());
    }

    public ProvisioningEngine provisioning() {
        return new ProvisioningEngine(fleet, admission(), config());
    }

    /**
     * Adds an instance directly to the fleet, without PID record.
     */
    public Instance track(int instanceNumber, String cluster, int clusterInstanceNumber, String owner, PresenceState presence) {
        Instance instance = Instance.launched(instanceNumber, cluster + instanceNumber, cluster, clusterInstanceNumber, owner, clock.instant());
        instance.updatePresence(presence, clock.instant());
        fleet.add(instance);
        return instance;
    }
}
