package sh.harold.flotilla.api.lobby;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A lobby presence notification.
 *
 * @param type     What happened
 * @param user     Lobby user the event is about (battle founder for battle closing events)
 * @param battleId Battle involved, when the event concerns a battle
 */
public record LobbyEvent(LobbyEventType type, String user, OptionalInt battleId) {

    public LobbyEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(battleId, "battleId");
    }

    public static LobbyEvent userAdded(String user) {
        return new LobbyEvent(LobbyEventType.USER_ADDED, user, OptionalInt.empty());
    }

    public static LobbyEvent userRemoved(String user) {
        return new LobbyEvent(LobbyEventType.USER_REMOVED, user, OptionalInt.empty());
    }

    public static LobbyEvent joinedBattle(int battleId, String user) {
        return new LobbyEvent(LobbyEventType.JOINED_BATTLE, user, OptionalInt.of(battleId));
    }

    public static LobbyEvent leftBattle(int battleId, String user) {
        return new LobbyEvent(LobbyEventType.LEFT_BATTLE, user, OptionalInt.of(battleId));
    }

    public static LobbyEvent battleClosing(int battleId, String founder) {
        return new LobbyEvent(LobbyEventType.BATTLE_CLOSING, founder, OptionalInt.of(battleId));
    }

    public static LobbyEvent battleClosed(int battleId, String founder) {
        return new LobbyEvent(LobbyEventType.BATTLE_CLOSED, founder, OptionalInt.of(battleId));
    }

    public static LobbyEvent clientStatus(String user) {
        return new LobbyEvent(LobbyEventType.CLIENT_STATUS, user, OptionalInt.empty());
    }
}
