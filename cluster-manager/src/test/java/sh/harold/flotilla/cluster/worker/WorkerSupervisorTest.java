package sh.harold.flotilla.cluster.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sh.harold.flotilla.api.game.GameHost;
import sh.harold.flotilla.api.lobby.LobbyEvent;
import sh.harold.flotilla.cluster.config.ClusterManagerSettings;
import sh.harold.flotilla.cluster.provision.PruningEngine;
import sh.harold.flotilla.cluster.testing.FakeLobby;
import sh.harold.flotilla.cluster.testing.MutableClock;
import sh.harold.flotilla.cluster.testing.TestConfigs;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerSupervisorTest {

    private static final String MANAGER = "Manager";

    @Mock
    private GameHost gameHost;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    private final FakeLobby lobby = new FakeLobby();
    private final List<String> quitReasons = new ArrayList<>();
    private ClusterManagerSettings settings;

    @BeforeEach
    void setUp() {
        settings = TestConfigs.twoClusters().settings();
        lobby.setLogin("Host0");
    }

    @Test
    @DisplayName("Idle worker exits once its manager has been offline for the orphan timeout")
    void idleOrphanExits() {
        WorkerSupervisor supervisor = started("*");

        assertThat(supervisor.isOrphan()).isTrue();
        clock.advance(Duration.ofSeconds(300));
        supervisor.check();
        assertThat(quitReasons).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        supervisor.check();
        assertThat(quitReasons).containsExactly("cluster manager is offline");
    }

    @Test
    void busyOrphanKeepsRunning() {
        when(gameHost.isGameInProgress()).thenReturn(true);
        WorkerSupervisor supervisor = started("*");

        clock.advance(Duration.ofHours(1));
        supervisor.check();

        assertThat(supervisor.isIdle()).isFalse();
        assertThat(quitReasons).isEmpty();
    }

    @Test
    void managerComingBackClearsOrphanState() {
        WorkerSupervisor supervisor = started("*");

        supervisor.onLobbyEvent(LobbyEvent.userAdded(MANAGER));
        clock.advance(Duration.ofHours(1));
        supervisor.check();

        assertThat(supervisor.isOrphan()).isFalse();
        assertThat(quitReasons).isEmpty();

        supervisor.onLobbyEvent(LobbyEvent.userRemoved(MANAGER));
        assertThat(supervisor.isOrphan()).isTrue();
    }

    @Test
    void idlePrivateInstanceExitsAfterDelay() {
        lobby.login(MANAGER);
        lobby.login("alice");
        WorkerSupervisor supervisor = started("alice");

        clock.advance(Duration.ofSeconds(600));
        supervisor.check();
        assertThat(quitReasons).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        supervisor.check();
        assertThat(quitReasons).containsExactly("private instance is idle");
    }

    @Test
    void privateInstanceExitsWhenOwnerIsOffline() {
        lobby.login(MANAGER);
        WorkerSupervisor supervisor = started("alice");

        clock.advance(Duration.ofSeconds(9));
        supervisor.check();
        assertThat(quitReasons).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        supervisor.check();
        assertThat(quitReasons).containsExactly("private instance owner is offline");
    }

    @Test
    void gameActivityResetsIdleTimer() {
        lobby.login(MANAGER);
        lobby.login("alice");
        WorkerSupervisor supervisor = started("alice");

        clock.advance(Duration.ofSeconds(500));
        supervisor.onGameStarted();
        assertThat(supervisor.isIdle()).isFalse();
        clock.advance(Duration.ofSeconds(500));
        supervisor.onGameStopped();
        clock.advance(Duration.ofSeconds(500));
        supervisor.check();

        assertThat(supervisor.isIdle()).isTrue();
        assertThat(quitReasons).isEmpty();
    }

    @Test
    void playerJoiningOwnBattleMakesWorkerBusy() {
        lobby.login(MANAGER);
        lobby.openBattle(4, "Host0", "bob");
        WorkerSupervisor supervisor = started("*");

        supervisor.onLobbyEvent(LobbyEvent.joinedBattle(4, "bob"));
        assertThat(supervisor.isIdle()).isFalse();

        supervisor.onLobbyEvent(LobbyEvent.leftBattle(4, "bob"));
        assertThat(supervisor.isIdle()).isTrue();
    }

    @Test
    void quitRequestFromManagerIsHonouredWhenIdle() {
        lobby.login(MANAGER);
        WorkerSupervisor supervisor = started("*");

        assertThat(supervisor.onPrivateMessage("bob", PruningEngine.QUIT_IF_IDLE_REQUEST)).isFalse();
        assertThat(supervisor.onPrivateMessage(MANAGER, "hello")).isFalse();
        assertThat(quitReasons).isEmpty();

        assertThat(supervisor.onPrivateMessage(MANAGER, PruningEngine.QUIT_IF_IDLE_REQUEST)).isTrue();
        assertThat(quitReasons).containsExactly("requested by Cluster manager");
    }

    @Test
    void quitRequestIsIgnoredWhileInUse() {
        lobby.login(MANAGER);
        when(gameHost.isBattleInUse()).thenReturn(true);
        WorkerSupervisor supervisor = started("*");

        assertThat(supervisor.onPrivateMessage(MANAGER, PruningEngine.QUIT_IF_IDLE_REQUEST)).isTrue();
        assertThat(quitReasons).isEmpty();
    }

    @Test
    void lobbyDisconnectionMakesWorkerOrphan() {
        lobby.login(MANAGER);
        WorkerSupervisor supervisor = started("*");
        assertThat(supervisor.isOrphan()).isFalse();

        supervisor.onLobbyDisconnected();
        assertThat(supervisor.isOrphan()).isTrue();

        supervisor.onLobbyConnected();
        assertThat(supervisor.isOrphan()).isFalse();
    }

    private WorkerSupervisor started(String owner) {
        WorkerSupervisor supervisor = new WorkerSupervisor(new WorkerIdentity(MANAGER, 0, 0, owner), lobby, gameHost,
                clock, () -> settings, quitReasons::add);
        supervisor.start();
        return supervisor;
    }
}
