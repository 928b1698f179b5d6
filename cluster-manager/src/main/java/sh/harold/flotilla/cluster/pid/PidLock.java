package sh.harold.flotilla.cluster.pid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exclusive lock on the records of one instance. All record operations go through a held lock.
 */
public final class PidLock implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(PidLock.class);

    static final String MANAGER_NAME = "managerName";
    static final String INSTANCE_NUMBER = "instNb";
    static final String INSTANCE_NAME = "instName";
    static final String CLUSTER_PRESET = "clustPreset";
    static final String CLUSTER_INSTANCE_NUMBER = "clustInstNb";
    static final String OWNER_NAME = "ownerName";
    static final String PROCESS_ID = "instPid";

    private static final List<String> IDENTITY_FIELDS =
            List.of(MANAGER_NAME, INSTANCE_NUMBER, INSTANCE_NAME, CLUSTER_PRESET, CLUSTER_INSTANCE_NUMBER, OWNER_NAME);
    private static final Pattern LINE_PATTERN = Pattern.compile("^([^:]+):(.+)$");

    private final PidRecordStore store;
    private final int instanceNumber;
    private final FileChannel channel;
    private final FileLock lock;

    PidLock(PidRecordStore store, int instanceNumber, FileChannel channel, FileLock lock) {
        this.store = store;
        this.instanceNumber = instanceNumber;
        this.channel = channel;
        this.lock = lock;
    }

    public int instanceNumber() {
        return instanceNumber;
    }

    /**
     * A running record left next to the launched or restarting record it replaced is the result
     * of an interrupted {@link #replace}: the running record wins and the other one is deleted.
     *
     * @return Kind of the record stored for this instance, if any
     * @throws PidRecordException {@code INCONSISTENT} if more than one record exists
     */
    public Optional<InstanceKind> locate() throws PidRecordException {
        List<InstanceKind> found = new ArrayList<>();
        for (InstanceKind kind : InstanceKind.values()) {
            if (Files.isRegularFile(recordFile(kind))) {
                found.add(kind);
            }
        }
        if (found.size() == 2 && found.contains(InstanceKind.RUNNING) && isStarting(found)) {
            InstanceKind stale = found.get(0) == InstanceKind.RUNNING ? found.get(1) : found.get(0);
            LOGGER.warn("Interrupted start detected for instance {}, removing stale {} PID file", instanceNumber, stale.suffix());
            delete(stale);
            return Optional.of(InstanceKind.RUNNING);
        }
        if (found.size() > 1) {
            throw new PidRecordException(PidRecordException.Reason.INCONSISTENT,
                    "Multiple PID files found for instance " + instanceNumber + " " + found);
        }
        return found.stream().findFirst();
    }

    private static boolean isStarting(List<InstanceKind> kinds) {
        return kinds.contains(InstanceKind.LAUNCHED) || kinds.contains(InstanceKind.RESTARTING);
    }

    /**
     * Reads the record of this instance.
     *
     * @return Record with its kind and the time it entered that kind, empty if no record exists
     * @throws PidRecordException {@code CORRUPT} for unknown, duplicate or missing fields and
     *                            malformed lines
     */
    public Optional<LoadedRecord> read() throws PidRecordException {
        Optional<InstanceKind> located = locate();
        if (located.isEmpty()) {
            return Optional.empty();
        }
        InstanceKind kind = located.get();
        Path file = recordFile(kind);
        List<String> lines;
        Instant timestamp;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            timestamp = Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            throw new PidRecordException(PidRecordException.Reason.IO_FAILURE,
                    "Unable to open PID file \"" + file + "\" for reading", e);
        }

        List<String> expectedFields = new ArrayList<>(IDENTITY_FIELDS);
        if (kind != InstanceKind.LAUNCHED) {
            expectedFields.add(PROCESS_ID);
        }
        Map<String, String> values = new HashMap<>();
        for (String line : lines) {
            Matcher matcher = LINE_PATTERN.matcher(line);
            if (!matcher.matches()) {
                throw corrupt(file, "invalid line (" + line + ")");
            }
            String key = matcher.group(1);
            if (!expectedFields.contains(key)) {
                throw corrupt(file, "invalid data " + key);
            }
            if (values.putIfAbsent(key, matcher.group(2)) != null) {
                throw corrupt(file, "duplicate data " + key);
            }
        }
        for (String field : expectedFields) {
            if (!values.containsKey(field)) {
                throw corrupt(file, "missing data " + field);
            }
        }

        try {
            OptionalLong processId = kind == InstanceKind.LAUNCHED || kind == InstanceKind.RESTARTING
                    ? OptionalLong.empty()
                    : OptionalLong.of(Long.parseLong(values.get(PROCESS_ID)));
            PidRecord record = new PidRecord(
                    values.get(MANAGER_NAME),
                    Integer.parseInt(values.get(INSTANCE_NUMBER)),
                    values.get(INSTANCE_NAME),
                    values.get(CLUSTER_PRESET),
                    Integer.parseInt(values.get(CLUSTER_INSTANCE_NUMBER)),
                    values.get(OWNER_NAME),
                    processId);
            return Optional.of(new LoadedRecord(record, kind, timestamp));
        } catch (IllegalArgumentException e) {
            throw corrupt(file, e.getMessage());
        }
    }

    /**
     * Creates the record of this instance.
     *
     * @throws PidRecordException {@code ALREADY_EXISTS} if a record of any kind already exists
     */
    public void write(InstanceKind kind, PidRecord record) throws PidRecordException {
        Optional<InstanceKind> existing = locate();
        if (existing.isPresent()) {
            throw new PidRecordException(PidRecordException.Reason.ALREADY_EXISTS,
                    "A PID file already exists for instance " + instanceNumber + ": " + recordFile(existing.get()));
        }
        create(kind, record);
    }

    /**
     * Renames the record to a new kind and sets its timestamp to now.
     */
    public void transition(InstanceKind from, InstanceKind to) throws PidRecordException {
        Path source = recordFile(from);
        Path destination = recordFile(to);
        if (!Files.isRegularFile(source)) {
            throw new PidRecordException(PidRecordException.Reason.MISSING,
                    "Unable to rename PID file \"" + source + "\": file does not exist");
        }
        if (Files.exists(destination)) {
            throw new PidRecordException(PidRecordException.Reason.ALREADY_EXISTS,
                    "Unable to rename PID file \"" + source + "\": \"" + destination + "\" already exists");
        }
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PidRecordException(PidRecordException.Reason.IO_FAILURE,
                    "Unable to rename PID file from \"" + source + "\" to \"" + destination + "\"", e);
        }
        store.touch(destination);
    }

    /**
     * Writes a new record of another kind, then deletes the current one. The new record is
     * complete as soon as it is visible; if the deletion does not happen, {@link #locate()} keeps
     * the new record.
     */
    public void replace(InstanceKind from, InstanceKind to, PidRecord record) throws PidRecordException {
        if (from == to) {
            throw new IllegalArgumentException("Cannot replace a record by a record of the same kind");
        }
        Path source = recordFile(from);
        if (!Files.isRegularFile(source)) {
            throw new PidRecordException(PidRecordException.Reason.MISSING,
                    "Unable to replace PID file \"" + source + "\": file does not exist");
        }
        create(to, record);
        try {
            Files.delete(source);
        } catch (IOException e) {
            Path created = recordFile(to);
            try {
                Files.deleteIfExists(created);
            } catch (IOException cleanupFailure) {
                e.addSuppressed(cleanupFailure);
            }
            throw new PidRecordException(PidRecordException.Reason.IO_FAILURE,
                    "Unable to delete previous PID file \"" + source + "\"", e);
        }
    }

    /**
     * @return true if a record of the given kind was deleted
     */
    public boolean delete(InstanceKind kind) throws PidRecordException {
        Path file = recordFile(kind);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new PidRecordException(PidRecordException.Reason.IO_FAILURE,
                    "Unable to delete PID file \"" + file + "\"", e);
        }
    }

    public void deleteLockFile() throws PidRecordException {
        Path file = store.file(instanceNumber, PidRecordStore.LOCK_SUFFIX);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new PidRecordException(PidRecordException.Reason.IO_FAILURE,
                    "Unable to delete lock file \"" + file + "\"", e);
        }
    }

    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
            }
            channel.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to release lock of instance {}: {}", instanceNumber, e.getMessage());
        }
    }

    private void create(InstanceKind kind, PidRecord record) throws PidRecordException {
        if (record.instanceNumber() != instanceNumber) {
            throw new IllegalArgumentException("Record of instance " + record.instanceNumber()
                    + " cannot be written under lock of instance " + instanceNumber);
        }
        if (kind != InstanceKind.LAUNCHED && record.processId().isEmpty()) {
            throw new IllegalArgumentException("A " + kind.suffix() + " PID file requires a process id");
        }
        List<String> lines = new ArrayList<>(List.of(
                MANAGER_NAME + ":" + record.managerName(),
                INSTANCE_NUMBER + ":" + record.instanceNumber(),
                INSTANCE_NAME + ":" + record.instanceName(),
                CLUSTER_PRESET + ":" + record.clusterPreset(),
                CLUSTER_INSTANCE_NUMBER + ":" + record.clusterInstanceNumber(),
                OWNER_NAME + ":" + record.ownerName()));
        if (kind != InstanceKind.LAUNCHED) {
            lines.add(PROCESS_ID + ":" + record.processId().getAsLong());
        }
        Path file = recordFile(kind);
        if (Files.exists(file)) {
            throw new PidRecordException(PidRecordException.Reason.ALREADY_EXISTS,
                    "PID file \"" + file + "\" already exists");
        }
        Path temporary = store.file(instanceNumber, PidRecordStore.TEMPORARY_SUFFIX);
        try {
            Files.write(temporary, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            store.touch(temporary);
            Files.move(temporary, file, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temporary);
            } catch (IOException cleanupFailure) {
                e.addSuppressed(cleanupFailure);
            }
            throw new PidRecordException(PidRecordException.Reason.IO_FAILURE,
                    "Unable to write PID file \"" + file + "\"", e);
        }
    }

    private Path recordFile(InstanceKind kind) {
        return store.file(instanceNumber, kind.suffix());
    }

    private static PidRecordException corrupt(Path file, String detail) {
        return new PidRecordException(PidRecordException.Reason.CORRUPT,
                "Corrupt PID file \"" + file + "\": " + detail);
    }
}
