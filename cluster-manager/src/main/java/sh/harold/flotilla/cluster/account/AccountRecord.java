package sh.harold.flotilla.cluster.account;

import java.time.Instant;

/**
 * @param lastRecorded          Last time the account was seen online or requested
 * @param registrationRequested Whether the manager asked the lobby to create the account and
 *                              has not seen it online since
 */
public record AccountRecord(Instant lastRecorded, boolean registrationRequested) {
}
