package sh.harold.flotilla.cluster.config;

import sh.harold.flotilla.api.config.PresetConfiguration;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Fleet-wide settings of the cluster manager.
 *
 * <p>A zero cap or delay disables the corresponding limit, except {@code maxInstances} and
 * {@code removePrivateInstanceDelay} which must be non-zero.</p>
 *
 * @param clusters      Configured cluster presets, first one being the default cluster
 * @param autoRegister  0 = never, 1 = instances only, 2 = manager and instances
 * @param autoHostPort  Control port of the manager itself, when known
 * @param workerCommand Executable and leading arguments used to start instances, empty to reuse
 *                      the command line of the current process
 */
public record ClusterManagerSettings(int maxInstances,
                                     int maxInstancesPublic,
                                     int maxInstancesPrivate,
                                     Duration removeSpareInstanceDelay,
                                     Duration removePrivateInstanceDelay,
                                     Duration startingInstanceTimeout,
                                     Duration offlineInstanceTimeout,
                                     Duration orphanInstanceTimeout,
                                     int baseGamePort,
                                     int baseAutoHostPort,
                                     List<String> clusters,
                                     boolean createNewConsoles,
                                     int autoRegister,
                                     boolean shareArchiveCache,
                                     boolean sequentialUnitsync,
                                     OptionalInt autoHostPort,
                                     List<String> workerCommand,
                                     List<String> privateDataFiles) {

    static final long DEFAULT_REMOVE_SPARE_INSTANCE_DELAY = 300;
    static final long DEFAULT_REMOVE_PRIVATE_INSTANCE_DELAY = 600;
    static final long DEFAULT_STARTING_INSTANCE_TIMEOUT = 60;
    static final long DEFAULT_OFFLINE_INSTANCE_TIMEOUT = 120;
    static final long DEFAULT_ORPHAN_INSTANCE_TIMEOUT = 300;
    static final int DEFAULT_BASE_GAME_PORT = 9000;
    static final int DEFAULT_BASE_AUTOHOST_PORT = 10000;

    public ClusterManagerSettings {
        clusters = List.copyOf(clusters);
        workerCommand = List.copyOf(workerCommand);
        privateDataFiles = List.copyOf(privateDataFiles);
    }

    /**
     * Reads the settings from the global section of a configuration store.
     *
     * @param problems Receives a message for every invalid value
     */
    static ClusterManagerSettings read(PresetConfiguration source, List<String> problems) {
        SettingReader reader = new SettingReader(problems, key -> source.global(key));

        int maxInstances = reader.integer("maxInstances", 0);
        if (maxInstances <= 0) {
            problems.add("\"maxInstances\" setting must be a non-zero positive integer");
        }
        Duration removePrivateInstanceDelay = reader.seconds("removePrivateInstanceDelay", DEFAULT_REMOVE_PRIVATE_INSTANCE_DELAY);
        if (removePrivateInstanceDelay.isZero()) {
            problems.add("\"removePrivateInstanceDelay\" setting must be non-zero");
        }

        String clusterList = source.global("clusters").orElse("").trim();
        List<String> clusters = clusterList.isEmpty()
                ? List.of(source.defaultPreset())
                : Arrays.stream(clusterList.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();

        String workerCommandSetting = source.global("workerCommand").orElse("");
        List<String> workerCommand = ConfMacroParser.splitShellWords(workerCommandSetting).orElseGet(() -> {
            problems.add("Invalid value for \"workerCommand\" setting: " + workerCommandSetting);
            return List.of();
        });

        List<String> privateDataFiles = Arrays.stream(source.global("privateDataFiles").orElse("").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();

        int autoRegister = reader.integer("autoRegister", 1);
        if (autoRegister < 0 || autoRegister > 2) {
            problems.add("\"autoRegister\" setting must be 0, 1 or 2");
        }

        int baseGamePort = reader.port("baseGamePort", DEFAULT_BASE_GAME_PORT);
        int baseAutoHostPort = reader.port("baseAutoHostPort", DEFAULT_BASE_AUTOHOST_PORT);
        OptionalInt autoHostPort = source.global("autoHostPort").isPresent()
                ? OptionalInt.of(reader.port("autoHostPort", 0))
                : OptionalInt.empty();

        return new ClusterManagerSettings(
                maxInstances,
                reader.integer("maxInstancesPublic", 0),
                reader.integer("maxInstancesPrivate", 0),
                reader.seconds("removeSpareInstanceDelay", DEFAULT_REMOVE_SPARE_INSTANCE_DELAY),
                removePrivateInstanceDelay,
                reader.seconds("startingInstanceTimeout", DEFAULT_STARTING_INSTANCE_TIMEOUT),
                reader.seconds("offlineInstanceTimeout", DEFAULT_OFFLINE_INSTANCE_TIMEOUT),
                reader.seconds("orphanInstanceTimeout", DEFAULT_ORPHAN_INSTANCE_TIMEOUT),
                baseGamePort,
                baseAutoHostPort,
                clusters,
                reader.bool("createNewConsoles", false),
                autoRegister,
                reader.bool("shareArchiveCache", false),
                reader.bool("sequentialUnitsync", false),
                autoHostPort,
                workerCommand,
                privateDataFiles
        );
    }

    public String defaultCluster() {
        return clusters.get(0);
    }

    /**
     * Settings users may inspect with the cluster configuration command, sorted by name.
     */
    public Map<String, String> publicSettings() {
        Map<String, String> settings = new TreeMap<>();
        settings.put("maxInstances", String.valueOf(maxInstances));
        settings.put("maxInstancesPublic", String.valueOf(maxInstancesPublic));
        settings.put("maxInstancesPrivate", String.valueOf(maxInstancesPrivate));
        settings.put("removeSpareInstanceDelay", String.valueOf(removeSpareInstanceDelay.toSeconds()));
        settings.put("removePrivateInstanceDelay", String.valueOf(removePrivateInstanceDelay.toSeconds()));
        settings.put("startingInstanceTimeout", String.valueOf(startingInstanceTimeout.toSeconds()));
        settings.put("offlineInstanceTimeout", String.valueOf(offlineInstanceTimeout.toSeconds()));
        settings.put("orphanInstanceTimeout", String.valueOf(orphanInstanceTimeout.toSeconds()));
        settings.put("baseGamePort", String.valueOf(baseGamePort));
        settings.put("baseAutoHostPort", String.valueOf(baseAutoHostPort));
        settings.put("clusters", String.join(",", clusters));
        settings.put("autoRegister", String.valueOf(autoRegister));
        settings.put("shareArchiveCache", shareArchiveCache ? "1" : "0");
        return settings;
    }
}
