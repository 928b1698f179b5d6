package sh.harold.flotilla.cluster.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.flotilla.api.config.PresetConfiguration;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link ClusterManagerConfig} from a configuration store, rejecting unusable
 * configurations.
 */
public final class ClusterConfigValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClusterConfigValidator.class);

    /**
     * Placeholders making a name template unique to one cluster.
     */
    private static final List<String> DISTINCT_TEMPLATE_PLACEHOLDERS =
            List.of("InstNb", "InstNb2", "InstNb3", "InstNb0", "PresetName");

    private ClusterConfigValidator() {
    }

    /**
     * Reads the global settings only, as needed by workers.
     *
     * @throws ConfigValidationException listing every invalid global setting
     */
    public static ClusterManagerSettings validateGlobal(PresetConfiguration source) {
        List<String> problems = new ArrayList<>();
        ClusterManagerSettings settings = ClusterManagerSettings.read(source, problems);
        if (!problems.isEmpty()) {
            throw new ConfigValidationException(problems);
        }
        return settings;
    }

    /**
     * @throws ConfigValidationException listing every problem found
     */
    public static ClusterManagerConfig validate(PresetConfiguration source) {
        List<String> problems = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        ClusterManagerSettings settings = ClusterManagerSettings.read(source, problems);

        List<String> invalidClusters = settings.clusters().stream()
                .filter(cluster -> !source.presets().contains(cluster))
                .toList();
        if (!invalidClusters.isEmpty()) {
            problems.add("Invalid value for \"clusters\" setting (invalid preset" + plural(invalidClusters) + ": "
                    + String.join(", ", invalidClusters) + ")");
            throw new ConfigValidationException(problems);
        }

        Set<String> requiredKeys = new HashSet<>(source.declaredKeys(source.defaultPreset()));
        requiredKeys.removeAll(ClusterSettings.KEYS);
        List<String> partialClusters = settings.clusters().stream()
                .filter(cluster -> !source.declaredKeys(cluster).containsAll(requiredKeys))
                .toList();
        if (!partialClusters.isEmpty()) {
            problems.add("Invalid value for \"clusters\" setting (partial preset" + plural(partialClusters) + ": "
                    + String.join(", ", partialClusters) + ")");
        }

        Map<String, ClusterSettings> clusters = new LinkedHashMap<>();
        Map<String, List<String>> sharedTemplates = new LinkedHashMap<>();
        for (String cluster : settings.clusters()) {
            ClusterSettings clusterSettings = ClusterSettings.read(source, cluster, problems);
            clusters.put(cluster, clusterSettings);
            String template = clusterSettings.nameTemplate();
            boolean distinct = DISTINCT_TEMPLATE_PLACEHOLDERS.stream().anyMatch(p -> template.contains("%" + p + "%"));
            if (!distinct) {
                sharedTemplates.computeIfAbsent(template, t -> new ArrayList<>()).add(cluster);
            }
        }
        String conflicts = sharedTemplates.values().stream()
                .filter(group -> group.size() > 1)
                .map(group -> "(" + String.join(",", group) + ")")
                .collect(Collectors.joining(" "));
        if (!conflicts.isEmpty()) {
            problems.add("Conflicting name templates found for following clusters: " + conflicts);
        }

        checkPorts(settings, problems);

        for (String preset : source.presets()) {
            for (String key : ClusterSettings.CONF_MACRO_KEYS) {
                source.declared(preset, key)
                        .filter(value -> ConfMacroParser.parse(value).isEmpty())
                        .ifPresent(value -> problems.add("Invalid configuration macro definition (preset \"" + preset
                                + "\", setting \"" + key + "\"): " + value));
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigValidationException(problems);
        }

        if (settings.shareArchiveCache() && !settings.sequentialUnitsync()) {
            warnings.add("Archive cache data are shared but unitsync sequential mode is disabled, "
                    + "this can lead to race conditions and cache data corruption");
        }
        warnings.forEach(LOGGER::warn);
        return new ClusterManagerConfig(source, settings, clusters, warnings);
    }

    private static void checkPorts(ClusterManagerSettings settings, List<String> problems) {
        int maxInstances = settings.maxInstances();
        int baseGamePort = settings.baseGamePort();
        int baseAutoHostPort = settings.baseAutoHostPort();
        if (maxInstances > Math.abs(baseGamePort - baseAutoHostPort)) {
            problems.add("Incompatible values for maxInstances (" + maxInstances + "), baseGamePort (" + baseGamePort
                    + ") and baseAutoHostPort (" + baseAutoHostPort + ") settings: not enough ports between "
                    + baseGamePort + " and " + baseAutoHostPort + " to allow " + maxInstances + " instances");
            return;
        }
        boolean gamePortIsHigh = baseGamePort > baseAutoHostPort;
        int highPort = gamePortIsHigh ? baseGamePort : baseAutoHostPort;
        if (maxInstances > 65536 - highPort) {
            problems.add("Incompatible values for maxInstances (" + maxInstances + ") and "
                    + (gamePortIsHigh ? "baseGamePort" : "baseAutoHostPort") + " (" + highPort
                    + ") settings: not enough valid ports above " + highPort + " to allow " + maxInstances + " instances");
            return;
        }
        settings.autoHostPort().ifPresent(autoHostPort -> {
            if (autoHostPort >= baseGamePort && autoHostPort < baseGamePort + maxInstances) {
                problems.add("Incompatible values for autoHostPort (" + autoHostPort + "), baseGamePort (" + baseGamePort
                        + ") and maxInstances (" + maxInstances + ") settings: the autoHostPort of the manager is inside"
                        + " the port range used by instances");
            }
            if (autoHostPort >= baseAutoHostPort && autoHostPort < baseAutoHostPort + maxInstances) {
                problems.add("Incompatible values for autoHostPort (" + autoHostPort + "), baseAutoHostPort ("
                        + baseAutoHostPort + ") and maxInstances (" + maxInstances + ") settings: the autoHostPort of the"
                        + " manager is inside the port range used by instances");
            }
        });
    }

    private static String plural(List<String> values) {
        return values.size() > 1 ? "s" : "";
    }
}
