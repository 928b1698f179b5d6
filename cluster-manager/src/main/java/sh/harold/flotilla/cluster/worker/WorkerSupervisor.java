package sh.harold.flotilla.cluster.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.game.GameHost;
import sh.harold.flotilla.api.lobby.BattleView;
import sh.harold.flotilla.api.lobby.LobbyEvent;
import sh.harold.flotilla.api.lobby.LobbyGateway;
import sh.harold.flotilla.cluster.config.ClusterManagerSettings;
import sh.harold.flotilla.cluster.provision.PruningEngine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Makes a worker exit by itself when it is no longer useful: idle while its manager is gone,
 * private and idle for too long, or private and idle while its owner is offline.
 */
public class WorkerSupervisor {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerSupervisor.class);

    static final Duration OWNER_OFFLINE_DELAY = Duration.ofSeconds(10);

    private final WorkerIdentity identity;
    private final LobbyGateway lobby;
    private final GameHost gameHost;
    private final Clock clock;
    private final Supplier<ClusterManagerSettings> settings;
    private final Consumer<String> quit;

    private Instant idleSince;
    private Instant orphanSince;

    /**
     * @param quit Asks the autohost to exit, with the reason
     */
    public WorkerSupervisor(WorkerIdentity identity,
                            LobbyGateway lobby,
                            GameHost gameHost,
                            Clock clock,
                            Supplier<ClusterManagerSettings> settings,
                            Consumer<String> quit) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.lobby = Objects.requireNonNull(lobby, "lobby");
        this.gameHost = Objects.requireNonNull(gameHost, "gameHost");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.quit = Objects.requireNonNull(quit, "quit");
    }

    /**
     * Initializes idle and orphan timestamps from the current state of the worker.
     */
    public void start() {
        Instant now = clock.instant();
        idleSince = gameHost.isBattleInUse() || gameHost.isGameInProgress() ? null : now;
        orphanSince = lobby.isOnline(identity.managerName()) ? null : now;
    }

    public void onLobbyConnected() {
        if (lobby.isOnline(identity.managerName())) {
            orphanSince = null;
        }
    }

    public void onLobbyDisconnected() {
        Instant now = clock.instant();
        if (orphanSince == null) {
            orphanSince = now;
        }
        if (idleSince == null && !gameHost.isGameInProgress()) {
            idleSince = now;
        }
    }

    public void onLobbyEvent(LobbyEvent event) {
        switch (event.type()) {
            case USER_ADDED -> {
                if (event.user().equals(identity.managerName())) {
                    orphanSince = null;
                }
            }
            case USER_REMOVED -> {
                if (event.user().equals(identity.managerName())) {
                    orphanSince = clock.instant();
                }
            }
            case JOINED_BATTLE -> {
                if (isOwnBattle(event)) {
                    idleSince = null;
                }
            }
            case LEFT_BATTLE -> {
                if (isOwnBattle(event) && !gameHost.isBattleInUse() && !gameHost.isGameInProgress()) {
                    idleSince = clock.instant();
                }
            }
            case BATTLE_CLOSED -> {
                if (idleSince == null && lobby.ownBattle().isEmpty() && !gameHost.isGameInProgress()) {
                    idleSince = clock.instant();
                }
            }
            default -> {
                // not relevant for a worker
            }
        }
    }

    public void onGameStarted() {
        idleSince = null;
    }

    public void onGameStopped() {
        if (!gameHost.isBattleInUse()) {
            idleSince = clock.instant();
        }
    }

    /**
     * Handles a quit request sent by the manager when pruning spare instances.
     *
     * @return true if the message was a quit request from the manager
     */
    public boolean onPrivateMessage(String user, String message) {
        if (!user.equals(identity.managerName()) || !PruningEngine.QUIT_IF_IDLE_REQUEST.equals(message)) {
            return false;
        }
        if (isIdle()) {
            LOGGER.info("Spare instance removal requested by cluster manager, exiting");
            quit.accept("requested by Cluster manager");
        }
        return true;
    }

    /**
     * Periodic check, only effective while the instance is idle.
     */
    public void check() {
        if (idleSince == null) {
            return;
        }
        Instant now = clock.instant();
        ClusterManagerSettings current = settings.get();
        Duration orphanTimeout = current.orphanInstanceTimeout();
        if (!orphanTimeout.isZero() && orphanSince != null && now.isAfter(orphanSince.plus(orphanTimeout))) {
            orphanSince = now;
            LOGGER.warn("Timeout for idle orphan instance, exiting");
            quit.accept("cluster manager is offline");
        } else if (!identity.isPublic()) {
            if (now.isAfter(idleSince.plus(current.removePrivateInstanceDelay()))) {
                idleSince = now;
                LOGGER.info("Timeout for idle private instance, exiting");
                quit.accept("private instance is idle");
            } else if (lobby.isConnected()
                    && !lobby.isOnline(identity.ownerName())
                    && !now.isBefore(idleSince.plus(OWNER_OFFLINE_DELAY))) {
                idleSince = now;
                LOGGER.info("Owner of private instance is offline, exiting");
                quit.accept("private instance owner is offline");
            }
        }
    }

    public boolean isIdle() {
        return idleSince != null;
    }

    public boolean isOrphan() {
        return orphanSince != null;
    }

    private boolean isOwnBattle(LobbyEvent event) {
        Optional<BattleView> ownBattle = lobby.ownBattle();
        return ownBattle.isPresent()
                && event.battleId().isPresent()
                && ownBattle.get().battleId() == event.battleId().getAsInt();
    }
}
