package sh.harold.flotilla.cluster.pid;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PidRecordStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path varDirectory;

    private PidRecordStore store;

    @BeforeEach
    void setUp() throws PidRecordException {
        store = PidRecordStore.open(varDirectory, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Opening the store creates its directory under the var directory")
    void openCreatesDirectory() {
        assertThat(store.directory()).isEqualTo(varDirectory.resolve("ClusterManager"));
        assertThat(Files.isDirectory(store.directory())).isTrue();
    }

    @Test
    void writtenRecordIsReadBackWithItsKindAndTimestamp() throws PidRecordException {
        PidRecord record = record(3, PidRecord.PUBLIC_OWNER, OptionalLong.empty());
        try (PidLock lock = store.acquireLock(3, LockMode.BLOCKING)) {
            lock.write(InstanceKind.LAUNCHED, record);

            Optional<LoadedRecord> loaded = lock.read();

            assertThat(loaded).isPresent();
            assertThat(loaded.get().kind()).isEqualTo(InstanceKind.LAUNCHED);
            assertThat(loaded.get().record()).isEqualTo(record);
            assertThat(loaded.get().timestamp()).isEqualTo(NOW);
        }
    }

    @Test
    void launchedRecordDoesNotStoreProcessId() throws Exception {
        try (PidLock lock = store.acquireLock(0, LockMode.BLOCKING)) {
            lock.write(InstanceKind.LAUNCHED, record(0, "alice", OptionalLong.of(42)));
        }

        List<String> lines = Files.readAllLines(store.directory().resolve("0.launched"), StandardCharsets.UTF_8);

        assertThat(lines).containsExactly(
                "managerName:Manager",
                "instNb:0",
                "instName:Host0",
                "clustPreset:ffa",
                "clustInstNb:0",
                "ownerName:alice");
    }

    @Test
    void runningRecordRequiresProcessId() throws PidRecordException {
        try (PidLock lock = store.acquireLock(1, LockMode.BLOCKING)) {
            assertThatThrownBy(() -> lock.write(InstanceKind.RUNNING, record(1, "*", OptionalLong.empty())))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void writeRefusesSecondRecord() throws PidRecordException {
        try (PidLock lock = store.acquireLock(2, LockMode.BLOCKING)) {
            lock.write(InstanceKind.LAUNCHED, record(2, "*", OptionalLong.empty()));

            assertThatThrownBy(() -> lock.write(InstanceKind.RUNNING, record(2, "*", OptionalLong.of(10))))
                    .isInstanceOfSatisfying(PidRecordException.class,
                            e -> assertThat(e.getReason()).isEqualTo(PidRecordException.Reason.ALREADY_EXISTS));
        }
    }

    @Test
    @DisplayName("Replacing a launched record by a running one keeps a single record")
    void replaceSwapsKind() throws PidRecordException {
        try (PidLock lock = store.acquireLock(4, LockMode.BLOCKING)) {
            PidRecord launched = record(4, "*", OptionalLong.empty());
            lock.write(InstanceKind.LAUNCHED, launched);

            lock.replace(InstanceKind.LAUNCHED, InstanceKind.RUNNING, launched.withProcessId(1234));

            assertThat(lock.locate()).contains(InstanceKind.RUNNING);
            assertThat(lock.read().orElseThrow().record().processId()).hasValue(1234);
        }
    }

    @Test
    void transitionRenamesRecord() throws PidRecordException {
        try (PidLock lock = store.acquireLock(5, LockMode.BLOCKING)) {
            lock.write(InstanceKind.RUNNING, record(5, "*", OptionalLong.of(77)));

            lock.transition(InstanceKind.RUNNING, InstanceKind.UNLOADED);

            LoadedRecord loaded = lock.read().orElseThrow();
            assertThat(loaded.kind()).isEqualTo(InstanceKind.UNLOADED);
            assertThat(loaded.record().processId()).hasValue(77);
        }
    }

    @Test
    void transitionFromMissingRecordFails() throws PidRecordException {
        try (PidLock lock = store.acquireLock(6, LockMode.BLOCKING)) {
            assertThatThrownBy(() -> lock.transition(InstanceKind.RUNNING, InstanceKind.RELOADING))
                    .isInstanceOfSatisfying(PidRecordException.class,
                            e -> assertThat(e.getReason()).isEqualTo(PidRecordException.Reason.MISSING));
        }
    }

    @Test
    void multipleRecordsAreInconsistent() throws Exception {
        Files.writeString(store.directory().resolve("7.running"), "");
        Files.writeString(store.directory().resolve("7.unloaded"), "");

        try (PidLock lock = store.acquireLock(7, LockMode.BLOCKING)) {
            assertThatThrownBy(lock::locate)
                    .isInstanceOfSatisfying(PidRecordException.class,
                            e -> assertThat(e.getReason()).isEqualTo(PidRecordException.Reason.INCONSISTENT));
        }
    }

    @Test
    @DisplayName("A start interrupted between writing the running record and deleting the launched one keeps the running record")
    void interruptedReplaceKeepsRunningRecord() throws Exception {
        Files.writeString(store.directory().resolve("7.launched"), "");
        Files.writeString(store.directory().resolve("7.running"), "");

        try (PidLock lock = store.acquireLock(7, LockMode.BLOCKING)) {
            assertThat(lock.locate()).contains(InstanceKind.RUNNING);
        }
        assertThat(Files.exists(store.directory().resolve("7.launched"))).isFalse();
        assertThat(Files.exists(store.directory().resolve("7.running"))).isTrue();
    }

    @Test
    void writeLeavesNoTemporaryFile() throws Exception {
        try (PidLock lock = store.acquireLock(4, LockMode.BLOCKING)) {
            lock.write(InstanceKind.LAUNCHED, record(4, "*", OptionalLong.empty()));
            lock.replace(InstanceKind.LAUNCHED, InstanceKind.RUNNING, record(4, "*", OptionalLong.of(99)));

            assertThat(lock.read().orElseThrow().timestamp()).isEqualTo(NOW);
        }
        try (Stream<Path> files = Files.list(store.directory())) {
            assertThat(files.map(file -> file.getFileName().toString()))
                    .containsExactlyInAnyOrder("4.running", "4.lock");
        }
    }

    @Test
    void unknownFieldMakesRecordCorrupt() throws Exception {
        Files.write(store.directory().resolve("8.launched"), List.of(
                "managerName:Manager", "instNb:8", "instName:Host8", "clustPreset:ffa",
                "clustInstNb:0", "ownerName:*", "color:blue"), StandardCharsets.UTF_8);

        try (PidLock lock = store.acquireLock(8, LockMode.BLOCKING)) {
            assertThatThrownBy(lock::read)
                    .isInstanceOfSatisfying(PidRecordException.class,
                            e -> assertThat(e.getReason()).isEqualTo(PidRecordException.Reason.CORRUPT))
                    .hasMessageContaining("invalid data color");
        }
    }

    @Test
    void missingProcessIdMakesRunningRecordCorrupt() throws Exception {
        Files.write(store.directory().resolve("9.running"), List.of(
                "managerName:Manager", "instNb:9", "instName:Host9", "clustPreset:ffa",
                "clustInstNb:0", "ownerName:*"), StandardCharsets.UTF_8);

        try (PidLock lock = store.acquireLock(9, LockMode.BLOCKING)) {
            assertThatThrownBy(lock::read).hasMessageContaining("missing data instPid");
        }
    }

    @Test
    void listsInstanceNumbersOwningRecords() throws Exception {
        Files.writeString(store.directory().resolve("2.running"), "");
        Files.writeString(store.directory().resolve("11.unloaded"), "");
        Files.writeString(store.directory().resolve("5.lock"), "");
        Files.writeString(store.directory().resolve("6.exiting"), "");
        Files.writeString(store.directory().resolve("notes.txt"), "");

        assertThat(store.listInstanceNumbers()).containsExactly(2, 11);
    }

    @Test
    void exitMarkerLifecycle() throws PidRecordException {
        assertThat(store.exitMarkerExists(3)).isFalse();

        store.writeExitMarker(3);

        assertThat(store.exitMarkerExists(3)).isTrue();
        assertThat(store.deleteExitMarker(3)).isTrue();
        assertThat(store.deleteExitMarker(3)).isFalse();
    }

    @Test
    void deleteRemovesRecordAndLockFile() throws PidRecordException {
        try (PidLock lock = store.acquireLock(12, LockMode.BLOCKING)) {
            lock.write(InstanceKind.LAUNCHED, record(12, "*", OptionalLong.empty()));

            assertThat(lock.delete(InstanceKind.LAUNCHED)).isTrue();
            lock.deleteLockFile();

            assertThat(lock.locate()).isEmpty();
        }
        assertThat(Files.exists(store.directory().resolve("12.lock"))).isFalse();
    }

    @Test
    void recordOfAnotherInstanceIsRejected() throws PidRecordException {
        try (PidLock lock = store.acquireLock(1, LockMode.BLOCKING)) {
            assertThatThrownBy(() -> lock.write(InstanceKind.LAUNCHED, record(2, "*", OptionalLong.empty())))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static PidRecord record(int instanceNumber, String owner, OptionalLong processId) {
        return new PidRecord("Manager", instanceNumber, "Host" + instanceNumber, "ffa", 0, owner, processId);
    }
}
