package sh.harold.flotilla.cluster.pid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Fleet-wide lock held by the running manager for its whole lifetime.
 */
public final class ManagerLock implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ManagerLock.class);

    static final String FILE_NAME = "ClusterManager.lock";

    private final FileChannel channel;
    private final FileLock lock;

    private ManagerLock(FileChannel channel, FileLock lock) {
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * @throws PidRecordException {@code LOCK_FAILED} if another manager runs on the same directory
     */
    public static ManagerLock acquire(PidRecordStore store) throws PidRecordException {
        Path lockFile = store.directory().resolve(FILE_NAME);
        FileChannel channel;
        try {
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new PidRecordException(PidRecordException.Reason.LOCK_FAILED,
                    "Unable to open manager lock file \"" + lockFile + "\"", e);
        }
        FileLock lock = null;
        try {
            lock = channel.tryLock();
        } catch (IOException | OverlappingFileLockException e) {
            LOGGER.debug("Manager lock attempt failed on \"{}\"", lockFile, e);
        }
        if (lock == null) {
            try {
                channel.close();
            } catch (IOException e) {
                LOGGER.warn("Failed to close manager lock file \"{}\": {}", lockFile, e.getMessage());
            }
            throw new PidRecordException(PidRecordException.Reason.LOCK_FAILED,
                    "Another manager instance is running in same directory (" + store.directory() + ")");
        }
        return new ManagerLock(channel, lock);
    }

    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
            }
            channel.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to release manager lock: {}", e.getMessage());
        }
    }
}
