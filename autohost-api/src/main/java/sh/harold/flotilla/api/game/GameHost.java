package sh.harold.flotilla.api.game;

/**
 * State of the game room hosted by this autohost.
 */
public interface GameHost {

    /**
     * @return true while a game engine process is running or being started
     */
    boolean isGameInProgress();

    /**
     * @return true when the hosted battle has at least one user besides the host
     */
    boolean isBattleInUse();

    /**
     * Closes the hosted battle, if any.
     *
     * @param reason Reason shown to users
     */
    void closeBattle(String reason);
}
