package sh.harold.flotilla.cluster.liveness;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.Instance;
import sh.harold.flotilla.cluster.instance.LifecycleState;
import sh.harold.flotilla.cluster.instance.PresenceState;
import sh.harold.flotilla.cluster.pid.InstanceKind;
import sh.harold.flotilla.cluster.pid.LockMode;
import sh.harold.flotilla.cluster.pid.PidLock;
import sh.harold.flotilla.cluster.pid.PidRecord;
import sh.harold.flotilla.cluster.pid.PidRecordException;
import sh.harold.flotilla.cluster.pid.PidRecordStore;
import sh.harold.flotilla.cluster.testing.MutableClock;
import sh.harold.flotilla.cluster.testing.TestConfigs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.OptionalLong;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CrashDetectorTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path varDirectory;

    private final MutableClock clock = new MutableClock(START);
    private final FleetIndex fleet = new FleetIndex();
    private final Set<Long> alive = new HashSet<>();
    private PidRecordStore store;
    private CrashDetector detector;

    @BeforeEach
    void setUp() throws PidRecordException {
        store = PidRecordStore.open(varDirectory, clock);
        ClusterManagerConfig config = TestConfigs.twoClusters();
        InstanceRefresher refresher = new InstanceRefresher(store, fleet, alive::contains, clock, () -> config, "Manager");
        detector = new CrashDetector(fleet, store, refresher, alive::contains, clock, () -> config);
    }

    @Test
    @DisplayName("Offline instance whose process died is removed along with its record")
    void deadProcessIsDetectedAsCrash() throws PidRecordException {
        Instance instance = running(0, "ffa", "*", 4242);
        instance.updatePresence(PresenceState.OFFLINE, clock.instant());

        Set<String> impacted = detector.sweep();

        assertThat(impacted).containsExactly("ffa");
        assertThat(fleet.isEmpty()).isTrue();
        assertThat(instance.lifecycleState()).isEqualTo(LifecycleState.CRASHED);
        assertThat(store.listInstanceNumbers()).isEmpty();
        assertThat(Files.exists(store.directory().resolve("0.lock"))).isFalse();
    }

    @Test
    void onlineInstanceIsNotProbed() {
        Instance instance = running(0, "ffa", "*", 4242);
        instance.updatePresence(PresenceState.SPARE, clock.instant());

        assertThat(detector.sweep()).isEmpty();
        assertThat(fleet.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Clean exit marker removes the instance without treating it as a crash")
    void exitMarkerIsConsumed() throws PidRecordException {
        Instance instance = running(1, "teams", "*", 5000);
        alive.add(5000L);
        try (PidLock lock = store.acquireLock(1, LockMode.BLOCKING)) {
            lock.delete(InstanceKind.RUNNING);
        }
        store.writeExitMarker(1);

        Set<String> impacted = detector.sweep();

        assertThat(impacted).containsExactly("teams");
        assertThat(instance.lifecycleState()).isEqualTo(LifecycleState.EXITING);
        assertThat(fleet.isEmpty()).isTrue();
        assertThat(store.exitMarkerExists(1)).isFalse();
    }

    @Test
    void instanceStuckInStartingIsRemovedAfterTimeout() throws PidRecordException {
        Instance instance = Instance.launched(2, "Host2", "ffa", 0, "*", clock.instant());
        fleet.add(instance);
        writeRecord(InstanceKind.LAUNCHED, record(instance, OptionalLong.empty()));

        clock.advance(Duration.ofSeconds(59));
        assertThat(detector.sweep()).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        assertThat(detector.sweep()).containsExactly("ffa");
        assertThat(instance.lifecycleState()).isEqualTo(LifecycleState.CRASHED);
        assertThat(store.listInstanceNumbers()).isEmpty();
    }

    @Test
    void startedInstanceIsPickedUpAfterStartingTimeout() throws PidRecordException {
        Instance instance = Instance.launched(2, "Host2", "ffa", 0, "*", clock.instant());
        fleet.add(instance);
        clock.advance(Duration.ofSeconds(61));
        alive.add(99L);
        writeRecord(InstanceKind.RUNNING, record(instance, OptionalLong.of(99)));

        assertThat(detector.sweep()).isEmpty();

        assertThat(instance.lifecycleState()).isEqualTo(LifecycleState.RUNNING);
        assertThat(instance.processId()).hasValue(99);
    }

    @Test
    @DisplayName("Instance offline for too long while its process lives is flagged stuck")
    void offlineInstanceBecomesStuck() {
        Instance instance = running(3, "ffa", "*", 77);
        alive.add(77L);
        instance.updatePresence(PresenceState.OFFLINE, clock.instant());

        clock.advance(Duration.ofSeconds(120));

        assertThat(detector.sweep()).containsExactly("ffa");
        assertThat(instance.presenceState()).isEqualTo(PresenceState.STUCK);
        assertThat(fleet.size()).isEqualTo(1);
        assertThat(detector.sweep()).isEmpty();
    }

    @Test
    void privateInstanceCrashDoesNotTriggerProvisioning() {
        Instance instance = running(4, "ffa", "alice", 12);
        instance.updatePresence(PresenceState.OFFLINE, clock.instant());

        assertThat(detector.sweep()).isEmpty();
        assertThat(fleet.byOwner("alice")).isEmpty();
    }

    private Instance running(int instanceNumber, String cluster, String owner, long processId) {
        Instance instance = new Instance(instanceNumber, "Host" + instanceNumber, cluster, 0, owner,
                LifecycleState.RUNNING, clock.instant(), PresenceState.SPARE, clock.instant(), OptionalLong.of(processId));
        fleet.add(instance);
        try {
            writeRecord(InstanceKind.RUNNING, record(instance, OptionalLong.of(processId)));
        } catch (PidRecordException e) {
            throw new IllegalStateException(e);
        }
        return instance;
    }

    private void writeRecord(InstanceKind kind, PidRecord record) throws PidRecordException {
        try (PidLock lock = store.acquireLock(record.instanceNumber(), LockMode.BLOCKING)) {
            lock.write(kind, record);
        }
    }

    private static PidRecord record(Instance instance, OptionalLong processId) {
        return new PidRecord("Manager", instance.instanceNumber(), instance.name(), instance.cluster(),
                instance.clusterInstanceNumber(), instance.owner(), processId);
    }
}
