package sh.harold.flotilla.cluster.pid;

import java.time.Instant;

/**
 * A PID record read from disk.
 *
 * @param timestamp When the record entered its current kind
 */
public record LoadedRecord(PidRecord record, InstanceKind kind, Instant timestamp) {
}
