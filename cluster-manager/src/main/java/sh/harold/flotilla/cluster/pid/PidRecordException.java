package sh.harold.flotilla.cluster.pid;

/**
 * Failure of a PID record store operation. The operation had no partial effect on the records
 * unless stated otherwise by the operation.
 */
public class PidRecordException extends Exception {

    public enum Reason {
        LOCK_FAILED,
        CORRUPT,
        INCONSISTENT,
        IO_FAILURE,
        MISSING,
        ALREADY_EXISTS
    }

    private final Reason reason;

    public PidRecordException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public PidRecordException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
