package sh.harold.flotilla.cluster.presence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.lobby.BattleView;
import sh.harold.flotilla.api.lobby.LobbyEvent;
import sh.harold.flotilla.api.lobby.LobbyGateway;
import sh.harold.flotilla.cluster.account.ExistingAccounts;
import sh.harold.flotilla.cluster.instance.FleetIndex;
import sh.harold.flotilla.cluster.instance.Instance;
import sh.harold.flotilla.cluster.instance.PresenceState;
import sh.harold.flotilla.cluster.liveness.InstanceRefresher;
import sh.harold.flotilla.cluster.liveness.RefreshOutcome;
import sh.harold.flotilla.cluster.provision.ProvisioningEngine;

import java.time.Clock;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps lobby presence events of instance accounts to instance presence states.
 */
public class PresenceTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(PresenceTracker.class);

    private final FleetIndex fleet;
    private final LobbyGateway lobby;
    private final InstanceRefresher refresher;
    private final ProvisioningEngine provisioning;
    private final ExistingAccounts existingAccounts;
    private final Clock clock;
    private final Set<String> botModeRequested = new HashSet<>();

    public PresenceTracker(FleetIndex fleet,
                           LobbyGateway lobby,
                           InstanceRefresher refresher,
                           ProvisioningEngine provisioning,
                           ExistingAccounts existingAccounts,
                           Clock clock) {
        this.fleet = Objects.requireNonNull(fleet, "fleet");
        this.lobby = Objects.requireNonNull(lobby, "lobby");
        this.refresher = Objects.requireNonNull(refresher, "refresher");
        this.provisioning = Objects.requireNonNull(provisioning, "provisioning");
        this.existingAccounts = Objects.requireNonNull(existingAccounts, "existingAccounts");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void dispatch(LobbyEvent event) {
        switch (event.type()) {
            case USER_ADDED -> onUserAdded(event.user());
            case USER_REMOVED -> onUserRemoved(event.user());
            case JOINED_BATTLE -> onJoinedBattle(event);
            case LEFT_BATTLE -> onLeftBattle(event);
            case BATTLE_CLOSING -> onBattleClosing(event.user());
            case CLIENT_STATUS -> onClientStatus(event.user());
            case BATTLE_CLOSED -> {
                // battle already gone, occupancy was updated when it was closing
            }
        }
    }

    /**
     * Computes the presence of an instance from the current lobby state, used when rebuilding
     * the fleet.
     */
    public PresenceState initialPresence(Instance instance) {
        if (!lobby.isOnline(instance.name())) {
            return PresenceState.OFFLINE;
        }
        return lobby.battleHostedBy(instance.name())
                .filter(battle -> battle.userCount() > 1)
                .map(battle -> PresenceState.IN_USE)
                .orElse(PresenceState.SPARE);
    }

    private void onUserAdded(String user) {
        Optional<Instance> found = fleet.byName(user);
        if (found.isEmpty()) {
            return;
        }
        Instance instance = found.get();
        existingAccounts.markSeen(user, clock.instant());
        update(instance, PresenceState.SPARE);
        refresher.refresh(instance);
    }

    private void onUserRemoved(String user) {
        Optional<Instance> found = fleet.byName(user);
        if (found.isEmpty()) {
            return;
        }
        Instance instance = found.get();
        update(instance, PresenceState.OFFLINE);
        RefreshOutcome outcome = refresher.refresh(instance);
        if (outcome.isRemoval() && instance.isPublic()) {
            provisioning.provision(instance.cluster());
        }
    }

    private void onJoinedBattle(LobbyEvent event) {
        Optional<Instance> found = founderInstance(event);
        if (found.isEmpty()) {
            return;
        }
        Instance instance = found.get();
        if (instance.presenceState() != PresenceState.SPARE) {
            return;
        }
        update(instance, PresenceState.IN_USE);
        if (instance.isPublic()) {
            provisioning.provision(instance.cluster());
        }
    }

    private void onLeftBattle(LobbyEvent event) {
        Optional<BattleView> battle = battle(event);
        if (battle.isEmpty() || battle.get().userCount() > 1) {
            return;
        }
        String founder = battle.get().founder();
        Optional<Instance> found = fleet.byName(founder);
        if (found.isEmpty() || lobby.isInGame(founder)) {
            return;
        }
        update(found.get(), PresenceState.SPARE);
    }

    private void onBattleClosing(String founder) {
        Optional<Instance> found = fleet.byName(founder);
        if (found.isEmpty() || lobby.isInGame(founder) || found.get().presenceState() == PresenceState.SPARE) {
            return;
        }
        update(found.get(), PresenceState.SPARE);
    }

    private void onClientStatus(String user) {
        Optional<Instance> found = fleet.byName(user);
        if (found.isEmpty()) {
            return;
        }
        Instance instance = found.get();
        if (!lobby.isBot(user) && !botModeRequested.contains(user) && lobby.hasAdminAccess()) {
            LOGGER.debug("Flagging instance account {} as bot", user);
            lobby.setBotMode(user, true);
            botModeRequested.add(user);
        }

        boolean inGame = lobby.isInGame(user);
        if (instance.presenceState() == PresenceState.SPARE && inGame) {
            update(instance, PresenceState.IN_USE);
            if (instance.isPublic()) {
                provisioning.provision(instance.cluster());
            }
        } else if (instance.presenceState() == PresenceState.IN_USE && !inGame) {
            boolean emptyBattle = lobby.battleHostedBy(user).map(battle -> battle.userCount() <= 1).orElse(true);
            if (emptyBattle) {
                update(instance, PresenceState.SPARE);
            }
        }
    }

    private Optional<Instance> founderInstance(LobbyEvent event) {
        return battle(event).flatMap(battle -> fleet.byName(battle.founder()));
    }

    private Optional<BattleView> battle(LobbyEvent event) {
        if (event.battleId().isEmpty()) {
            return Optional.empty();
        }
        return lobby.battle(event.battleId().getAsInt());
    }

    private void update(Instance instance, PresenceState state) {
        LOGGER.debug("Instance {} went from lobby state {} to {}", instance, instance.presenceState().label(), state.label());
        instance.updatePresence(state, clock.instant());
    }
}
