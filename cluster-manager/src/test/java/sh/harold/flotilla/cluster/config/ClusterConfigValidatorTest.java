package sh.harold.flotilla.cluster.config;

import org.junit.jupiter.api.Test;
import sh.harold.flotilla.cluster.testing.TestConfigs;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterConfigValidatorTest {

    @Test
    void appliesDefaultsForMissingSettings() {
        ClusterManagerConfig config = TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 4
                presets:
                  ffa: {}
                """);

        ClusterManagerSettings settings = config.settings();
        assertThat(config.configuredClusters()).containsExactly("ffa");
        assertThat(config.defaultCluster()).isEqualTo("ffa");
        assertThat(settings.removeSpareInstanceDelay()).isEqualTo(Duration.ofSeconds(300));
        assertThat(settings.startingInstanceTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(settings.baseGamePort()).isEqualTo(9000);
        assertThat(settings.autoRegister()).isEqualTo(1);
        assertThat(settings.workerCommand()).isEmpty();
        assertThat(config.cluster("ffa").targetSpares()).isEqualTo(1);
        assertThat(config.cluster("ffa").nameTemplate()).isEqualTo("%PresetName%");
    }

    @Test
    void maxInstancesIsMandatory() {
        assertThatThrownBy(() -> TestConfigs.config("""
                defaultPreset: ffa
                presets:
                  ffa: {}
                """))
                .isInstanceOfSatisfying(ConfigValidationException.class, e -> assertThat(e.getProblems())
                        .contains("\"maxInstances\" setting must be a non-zero positive integer"));
    }

    @Test
    void unknownClusterPresetIsRejected() {
        assertThatThrownBy(() -> TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 4
                  clusters: ffa,ctf,koth
                presets:
                  ffa: {}
                """))
                .isInstanceOfSatisfying(ConfigValidationException.class, e -> assertThat(e.getProblems())
                        .containsExactly("Invalid value for \"clusters\" setting (invalid presets: ctf, koth)"));
    }

    @Test
    void clusterPresetMustDeclareEveryAutohostKeyOfDefaultPreset() {
        assertThatThrownBy(() -> TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 4
                  clusters: ffa,teams
                presets:
                  ffa:
                    map: Comet Catcher Redux
                    targetSpares: 2
                  teams:
                    targetSpares: 1
                """))
                .isInstanceOfSatisfying(ConfigValidationException.class, e -> assertThat(e.getProblems())
                        .contains("Invalid value for \"clusters\" setting (partial preset: teams)"));
    }

    @Test
    void descriptionIsNotRequiredFromClusterPresets() {
        ClusterManagerConfig config = TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 4
                  clusters: ffa,teams
                presets:
                  ffa:
                    description: Free for all
                    map: Comet Catcher Redux
                    nameTemplate: Ffa%InstNb%
                  teams:
                    map: Red Comet
                    nameTemplate: Team%InstNb%
                """);

        assertThat(config.configuredClusters()).containsExactly("ffa", "teams");
        assertThat(config.cluster("ffa").description()).contains("Free for all");
        assertThat(config.cluster("teams").description()).isEmpty();
    }

    @Test
    void sharedNameTemplatesConflict() {
        assertThatThrownBy(() -> TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 4
                  clusters: ffa,teams
                presets:
                  ffa:
                    nameTemplate: "Host%ClustInstNb%"
                  teams:
                    nameTemplate: "Host%ClustInstNb%"
                """))
                .isInstanceOfSatisfying(ConfigValidationException.class, e -> assertThat(e.getProblems())
                        .contains("Conflicting name templates found for following clusters: (ffa,teams)"));
    }

    @Test
    void templatesWithInstanceNumberNeverConflict() {
        ClusterManagerConfig config = TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 4
                  clusters: ffa,teams
                presets:
                  ffa:
                    nameTemplate: "Host%InstNb%"
                  teams:
                    nameTemplate: "Host%InstNb%"
                """);

        assertThat(config.configuredClusters()).containsExactly("ffa", "teams");
    }

    @Test
    void portRangesMustFitInstances() {
        assertThatThrownBy(() -> TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 20
                  baseGamePort: 9000
                  baseAutoHostPort: 9010
                presets:
                  ffa: {}
                """))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("not enough ports between 9000 and 9010 to allow 20 instances");
    }

    @Test
    void managerPortInsideInstanceRangeIsRejected() {
        assertThatThrownBy(() -> TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 10
                  autoHostPort: 10003
                presets:
                  ffa: {}
                """))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("the autoHostPort of the manager is inside the port range used by instances");
    }

    @Test
    void malformedConfigurationMacrosAreRejected() {
        assertThatThrownBy(() -> TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 4
                presets:
                  ffa:
                    confMacros: "battleName=\\"unterminated"
                """))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("Invalid configuration macro definition (preset \"ffa\", setting \"confMacros\")");
    }

    @Test
    void sharedArchiveCacheWithoutSequentialUnitsyncOnlyWarns() {
        ClusterManagerConfig config = TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 4
                  shareArchiveCache: true
                presets:
                  ffa: {}
                """);

        assertThat(config.warnings()).singleElement().asString().contains("race conditions");
    }

    @Test
    void obsoleteClusterSettingsAreReadLeniently() {
        ClusterManagerConfig config = TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 4
                presets:
                  ffa:
                    targetSpares: 3
                  legacy:
                    targetSpares: nope
                """);

        assertThat(config.isConfigured("legacy")).isFalse();
        assertThat(config.configuredCluster("legacy")).isEmpty();
        assertThat(config.cluster("legacy").targetSpares()).isEqualTo(1);
    }

    @Test
    void globalValidationIgnoresPresets() {
        ClusterManagerSettings settings = ClusterConfigValidator.validateGlobal(TestConfigs.yaml("""
                defaultPreset: ffa
                settings:
                  maxInstances: 4
                  clusters: ffa,unknown
                  removePrivateInstanceDelay: 30
                presets:
                  ffa: {}
                """));

        assertThat(settings.clusters()).containsExactly("ffa", "unknown");
        assertThat(settings.removePrivateInstanceDelay()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void clusterSettingsHideLobbyPassword() {
        ClusterManagerConfig config = TestConfigs.config("""
                defaultPreset: ffa
                settings:
                  maxInstances: 4
                presets:
                  ffa:
                    lobbyPassword: hunter2
                """);

        assertThat(config.cluster("ffa").lobbyPassword()).isEqualTo("hunter2");
        assertThat(config.cluster("ffa").publicSettings()).doesNotContainKey("lobbyPassword");
    }
}
