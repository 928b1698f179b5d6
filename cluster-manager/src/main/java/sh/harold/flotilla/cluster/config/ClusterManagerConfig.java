package sh.harold.flotilla.cluster.config;

import sh.harold.flotilla.api.config.PresetConfiguration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated snapshot of the cluster manager configuration. A reload produces a new snapshot.
 */
public final class ClusterManagerConfig {
    private final PresetConfiguration source;
    private final ClusterManagerSettings settings;
    private final Map<String, ClusterSettings> clusters;
    private final List<String> warnings;

    ClusterManagerConfig(PresetConfiguration source,
                         ClusterManagerSettings settings,
                         Map<String, ClusterSettings> clusters,
                         List<String> warnings) {
        this.source = Objects.requireNonNull(source, "source");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clusters = Collections.unmodifiableMap(new LinkedHashMap<>(clusters));
        this.warnings = List.copyOf(warnings);
    }

    public ClusterManagerSettings settings() {
        return settings;
    }

    /**
     * @return Configured clusters in configuration order, the first one being the default cluster
     */
    public List<String> configuredClusters() {
        return settings.clusters();
    }

    public boolean isConfigured(String cluster) {
        return clusters.containsKey(cluster);
    }

    public String defaultCluster() {
        return settings.defaultCluster();
    }

    /**
     * Settings of a cluster. Clusters which are no longer configured are read leniently from the
     * configuration store, invalid values falling back to built-in defaults.
     */
    public ClusterSettings cluster(String cluster) {
        ClusterSettings configured = clusters.get(cluster);
        if (configured != null) {
            return configured;
        }
        return ClusterSettings.read(source, cluster, new ArrayList<>());
    }

    public Optional<ClusterSettings> configuredCluster(String cluster) {
        return Optional.ofNullable(clusters.get(cluster));
    }

    public String defaultPreset() {
        return source.defaultPreset();
    }

    public List<String> warnings() {
        return warnings;
    }
}
