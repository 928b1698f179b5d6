package sh.harold.flotilla.cluster.pid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Directory of PID records shared by the manager and its instances.
 *
 * <p>Files of instance {@code n}: {@code n.lock} (advisory lock, contents unused), at most one
 * record {@code n.<kind>} holding {@code key:value} lines, and the zero-byte clean exit marker
 * {@code n.exiting}. Record reads and writes must happen while holding the instance lock, see
 * {@link #acquireLock(int, LockMode)}.</p>
 */
public class PidRecordStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(PidRecordStore.class);

    public static final String DIRECTORY_NAME = "ClusterManager";
    static final String LOCK_SUFFIX = "lock";
    static final String EXIT_MARKER_SUFFIX = "exiting";
    static final String TEMPORARY_SUFFIX = "tmp";

    private static final Pattern RECORD_FILE_PATTERN =
            Pattern.compile("^(\\d+)\\.(launched|running|restarting|reloading|unloaded)$");

    private final Path directory;
    private final Clock clock;

    public PidRecordStore(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens the store located in the {@value #DIRECTORY_NAME} sub-directory of the autohost var
     * directory, creating it if needed.
     */
    public static PidRecordStore open(Path varDirectory, Clock clock) throws PidRecordException {
        Path directory = varDirectory.resolve(DIRECTORY_NAME);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new PidRecordException(PidRecordException.Reason.IO_FAILURE,
                    "Unable to create directory for persistent plugin data \"" + directory + "\"", e);
        }
        return new PidRecordStore(directory, clock);
    }

    public Path directory() {
        return directory;
    }

    Clock clock() {
        return clock;
    }

    Path file(int instanceNumber, String suffix) {
        return directory.resolve(instanceNumber + "." + suffix);
    }

    /**
     * Takes the exclusive advisory lock of an instance.
     *
     * @throws PidRecordException {@code LOCK_FAILED} if the lock cannot be taken
     */
    public PidLock acquireLock(int instanceNumber, LockMode mode) throws PidRecordException {
        Path lockFile = file(instanceNumber, LOCK_SUFFIX);
        FileChannel channel;
        try {
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new PidRecordException(PidRecordException.Reason.LOCK_FAILED,
                    "Failed to open PID file lock of instance " + instanceNumber, e);
        }
        try {
            FileLock lock = mode == LockMode.BLOCKING ? channel.lock() : channel.tryLock();
            if (lock == null) {
                closeQuietly(channel, lockFile);
                throw new PidRecordException(PidRecordException.Reason.LOCK_FAILED,
                        "Lock for PID file of instance " + instanceNumber + " is held by another process");
            }
            return new PidLock(this, instanceNumber, channel, lock);
        } catch (IOException | OverlappingFileLockException e) {
            closeQuietly(channel, lockFile);
            throw new PidRecordException(PidRecordException.Reason.LOCK_FAILED,
                    "Failed to acquire lock for PID file of instance " + instanceNumber, e);
        }
    }

    /**
     * @return Instance numbers owning at least one record file
     */
    public SortedSet<Integer> listInstanceNumbers() throws PidRecordException {
        SortedSet<Integer> instanceNumbers = new TreeSet<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                Matcher matcher = RECORD_FILE_PATTERN.matcher(entry.getFileName().toString());
                if (matcher.matches() && Files.isRegularFile(entry)) {
                    instanceNumbers.add(Integer.parseInt(matcher.group(1)));
                }
            }
        } catch (IOException | NumberFormatException e) {
            throw new PidRecordException(PidRecordException.Reason.IO_FAILURE,
                    "Unable to open PID directory \"" + directory + "\"", e);
        }
        return instanceNumbers;
    }

    public boolean exitMarkerExists(int instanceNumber) {
        return Files.isRegularFile(file(instanceNumber, EXIT_MARKER_SUFFIX));
    }

    public void writeExitMarker(int instanceNumber) throws PidRecordException {
        Path marker = file(instanceNumber, EXIT_MARKER_SUFFIX);
        try {
            Files.write(marker, new byte[0]);
        } catch (IOException e) {
            throw new PidRecordException(PidRecordException.Reason.IO_FAILURE,
                    "Unable to write exit marker \"" + marker + "\"", e);
        }
    }

    /**
     * @return true if a marker was deleted
     */
    public boolean deleteExitMarker(int instanceNumber) throws PidRecordException {
        Path marker = file(instanceNumber, EXIT_MARKER_SUFFIX);
        try {
            return Files.deleteIfExists(marker);
        } catch (IOException e) {
            throw new PidRecordException(PidRecordException.Reason.IO_FAILURE,
                    "Unable to delete exit marker \"" + marker + "\"", e);
        }
    }

    void touch(Path file) {
        try {
            Files.setLastModifiedTime(file, FileTime.from(clock.instant().truncatedTo(ChronoUnit.SECONDS)));
        } catch (IOException e) {
            LOGGER.error("Failed to update PID file timestamp of \"{}\": {}", file, e.getMessage());
        }
    }

    private static void closeQuietly(FileChannel channel, Path lockFile) {
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close lock file \"{}\": {}", lockFile, e.getMessage());
        }
    }
}
