package sh.harold.flotilla.api.lobby;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of an open battle as known by the lobby gateway.
 *
 * @param battleId Lobby battle id
 * @param founder  Account hosting the battle
 * @param users    Accounts currently in the battle, founder included
 */
public record BattleView(int battleId, String founder, List<String> users) {

    public BattleView {
        Objects.requireNonNull(founder, "founder");
        users = List.copyOf(users);
    }

    public int userCount() {
        return users.size();
    }
}
