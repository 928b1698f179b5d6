package sh.harold.flotilla.cluster.liveness;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.Instance;
import sh.harold.flotilla.cluster.instance.LifecycleState;
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
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;

class InstanceRefresherTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path varDirectory;

    private final MutableClock clock = new MutableClock(START);
    private final FleetIndex fleet = new FleetIndex();
    private PidRecordStore store;
    private InstanceRefresher refresher;
    private Instance instance;

    @BeforeEach
    void setUp() throws PidRecordException {
        store = PidRecordStore.open(varDirectory, clock);
        refresher = new InstanceRefresher(store, fleet, pid -> pid == 500, clock, TestConfigs::twoClusters, "Manager");
        instance = Instance.launched(0, "Host0", "ffa", 0, "*", START);
        fleet.add(instance);
    }

    @Test
    void launchedRecordWithinTimeoutIsUnchanged() throws PidRecordException {
        write(InstanceKind.LAUNCHED, record("Host0", OptionalLong.empty()));

        assertThat(refresher.refresh(instance)).isEqualTo(RefreshOutcome.UNCHANGED);
        assertThat(instance.lifecycleState()).isEqualTo(LifecycleState.LAUNCHED);
    }

    @Test
    void runningRecordUpdatesLifecycleAndProcessId() throws PidRecordException {
        clock.advance(Duration.ofSeconds(3));
        write(InstanceKind.RUNNING, record("Host0", OptionalLong.of(500)));

        assertThat(refresher.refresh(instance)).isEqualTo(RefreshOutcome.STATE_CHANGED);
        assertThat(instance.lifecycleState()).isEqualTo(LifecycleState.RUNNING);
        assertThat(instance.lifecycleSince()).isEqualTo(START.plusSeconds(3));
        assertThat(instance.processId()).hasValue(500);
        assertThat(refresher.refresh(instance)).isEqualTo(RefreshOutcome.UNCHANGED);
    }

    @Test
    void missingRecordMeansCrash() {
        assertThat(refresher.refresh(instance)).isEqualTo(RefreshOutcome.CRASHED);
        assertThat(fleet.isEmpty()).isTrue();
    }

    @Test
    void inconsistentRecordKeepsLastKnownState() throws PidRecordException {
        write(InstanceKind.RUNNING, record("Impostor", OptionalLong.of(500)));

        assertThat(refresher.refresh(instance)).isEqualTo(RefreshOutcome.CORRUPT);
        assertThat(fleet.byInstanceNumber(0)).containsSame(instance);
        assertThat(instance.lifecycleState()).isEqualTo(LifecycleState.LAUNCHED);
    }

    @Test
    void corruptRecordKeepsLastKnownState() throws Exception {
        Files.writeString(store.directory().resolve("0.running"), "garbage\n");

        assertThat(refresher.refresh(instance)).isEqualTo(RefreshOutcome.CORRUPT);
        assertThat(fleet.size()).isEqualTo(1);
    }

    @Test
    void deadRunningProcessIsRemoved() throws PidRecordException {
        write(InstanceKind.RUNNING, record("Host0", OptionalLong.of(501)));

        assertThat(refresher.refresh(instance)).isEqualTo(RefreshOutcome.CRASHED);
        assertThat(store.listInstanceNumbers()).isEmpty();
    }

    private void write(InstanceKind kind, PidRecord record) throws PidRecordException {
        try (PidLock lock = store.acquireLock(0, LockMode.BLOCKING)) {
            lock.write(kind, record);
        }
    }

    private static PidRecord record(String name, OptionalLong processId) {
        return new PidRecord("Manager", 0, name, "ffa", 0, "*", processId);
    }
}
