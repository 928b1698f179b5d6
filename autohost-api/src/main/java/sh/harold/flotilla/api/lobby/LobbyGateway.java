package sh.harold.flotilla.api.lobby;

import java.util.Optional;

/**
 * View of the lobby server connection owned by the autohost.
 */
public interface LobbyGateway {

    /**
     * @return true once logged in and the initial user/battle lists are synchronized
     */
    boolean isConnected();

    boolean isOnline(String user);

    boolean isInGame(String user);

    boolean isBot(String user);

    /**
     * @return true if the autohost account has lobby administration access
     */
    boolean hasAdminAccess();

    /**
     * @return Battle currently hosted by the given account
     */
    Optional<BattleView> battleHostedBy(String founder);

    Optional<BattleView> battle(int battleId);

    /**
     * @return Battle hosted by the autohost account itself
     */
    Optional<BattleView> ownBattle();

    void sayPrivate(String user, String message);

    /**
     * Requests the lobby to register a bot account (administration access required).
     */
    void createBotAccount(String accountName);

    /**
     * Requests the lobby to flag a user as a bot (administration access required).
     */
    void setBotMode(String user, boolean enabled);
}
