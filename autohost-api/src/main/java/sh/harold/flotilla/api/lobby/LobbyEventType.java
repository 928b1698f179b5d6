package sh.harold.flotilla.api.lobby;

/**
 * Lobby presence notifications forwarded to plugins.
 */
public enum LobbyEventType {
    USER_ADDED,
    USER_REMOVED,
    JOINED_BATTLE,
    LEFT_BATTLE,
    /**
     * A battle is about to be closed; the battle is still known to the gateway.
     */
    BATTLE_CLOSING,
    /**
     * A battle has been closed and is no longer known to the gateway.
     */
    BATTLE_CLOSED,
    CLIENT_STATUS
}
