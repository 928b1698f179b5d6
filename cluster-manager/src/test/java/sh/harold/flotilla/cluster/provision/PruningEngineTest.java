package sh.harold.flotilla.cluster.provision;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sh.harold.flotilla.cluster.instance.PresenceState;
import sh.harold.flotilla.cluster.testing.ClusterFixture;
import sh.harold.flotilla.cluster.testing.TestConfigs;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PruningEngineTest {

    private static final String CONFIG = """
            defaultPreset: ffa
            settings:
              maxInstances: 10
              removeSpareInstanceDelay: 60
            presets:
              ffa:
                targetSpares: 1
                nameTemplate: "Host%InstNb%"
            """;

    @TempDir
    Path root;

    @Test
    void asksSurplusOldSparesToQuitHighestNumberFirst() {
        ClusterFixture fixture = new ClusterFixture(root, TestConfigs.config(CONFIG));
        fixture.track(0, "ffa", 0, "*", PresenceState.SPARE);
        fixture.track(1, "ffa", 1, "*", PresenceState.SPARE);
        fixture.track(2, "ffa", 2, "*", PresenceState.SPARE);
        fixture.clock().advance(Duration.ofSeconds(60));
        PruningEngine pruning = new PruningEngine(fixture.fleet(), fixture.lobby(), fixture.clock(), fixture.config());

        assertThat(pruning.prune()).containsExactly("ffa2", "ffa1");
        assertThat(fixture.lobby().messagesTo("ffa2")).containsExactly(PruningEngine.QUIT_IF_IDLE_REQUEST);
        assertThat(fixture.lobby().messagesTo("ffa0")).isEmpty();
        assertThat(fixture.fleet().size()).isEqualTo(3);
    }

    @Test
    void recentSparesAreKept() {
        ClusterFixture fixture = new ClusterFixture(root, TestConfigs.config(CONFIG));
        fixture.track(0, "ffa", 0, "*", PresenceState.SPARE);
        fixture.clock().advance(Duration.ofSeconds(59));
        fixture.track(1, "ffa", 1, "*", PresenceState.SPARE);
        fixture.clock().advance(Duration.ofSeconds(1));
        PruningEngine pruning = new PruningEngine(fixture.fleet(), fixture.lobby(), fixture.clock(), fixture.config());

        assertThat(pruning.prune()).isEmpty();
    }

    @Test
    void privateAndBusyInstancesAreNeverPruned() {
        ClusterFixture fixture = new ClusterFixture(root, TestConfigs.config(CONFIG));
        fixture.track(0, "ffa", 0, "*", PresenceState.SPARE);
        fixture.track(1, "ffa", 1, "alice", PresenceState.SPARE);
        fixture.track(2, "ffa", 2, "*", PresenceState.IN_USE);
        fixture.clock().advance(Duration.ofMinutes(10));
        PruningEngine pruning = new PruningEngine(fixture.fleet(), fixture.lobby(), fixture.clock(), fixture.config());

        assertThat(pruning.prune()).isEmpty();
    }

    @Test
    void requestsAreRepeatedAtMostEveryFiveSeconds() {
        ClusterFixture fixture = new ClusterFixture(root, TestConfigs.config(CONFIG));
        fixture.track(0, "ffa", 0, "*", PresenceState.SPARE);
        fixture.track(1, "ffa", 1, "*", PresenceState.SPARE);
        fixture.clock().advance(Duration.ofSeconds(60));
        PruningEngine pruning = new PruningEngine(fixture.fleet(), fixture.lobby(), fixture.clock(), fixture.config());

        assertThat(pruning.prune()).containsExactly("ffa1");
        fixture.clock().advance(Duration.ofSeconds(4));
        assertThat(pruning.prune()).isEmpty();
        fixture.clock().advance(Duration.ofSeconds(1));
        assertThat(pruning.prune()).containsExactly("ffa1");
    }

    @Test
    void zeroDelayDisablesSparePruning() {
        ClusterFixture fixture = new ClusterFixture(root, TestConfigs.config(CONFIG.replace("60", "0")));
        fixture.track(0, "ffa", 0, "*", PresenceState.SPARE);
        fixture.track(1, "ffa", 1, "*", PresenceState.SPARE);
        fixture.clock().advance(Duration.ofHours(1));
        PruningEngine pruning = new PruningEngine(fixture.fleet(), fixture.lobby(), fixture.clock(), fixture.config());

        assertThat(pruning.prune()).isEmpty();
    }

    @Test
    void everySpareOfObsoleteClusterIsAskedToQuit() {
        ClusterFixture fixture = new ClusterFixture(root, TestConfigs.config(CONFIG));
        fixture.track(0, "legacy", 0, "*", PresenceState.SPARE);
        fixture.track(1, "legacy", 1, "bob", PresenceState.SPARE);
        fixture.track(2, "legacy", 2, "*", PresenceState.IN_USE);
        PruningEngine pruning = new PruningEngine(fixture.fleet(), fixture.lobby(), fixture.clock(), fixture.config());

        assertThat(pruning.prune()).containsExactlyInAnyOrder("legacy0", "legacy1");
    }
}
