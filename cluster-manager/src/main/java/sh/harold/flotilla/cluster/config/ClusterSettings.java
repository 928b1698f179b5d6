package sh.harold.flotilla.cluster.config;

import sh.harold.flotilla.api.config.PresetConfiguration;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Settings of one cluster, read from the cluster preset with fallback on the default preset.
 */
public record ClusterSettings(String name,
                              int maxInstancesInCluster,
                              int maxInstancesInClusterPublic,
                              int maxInstancesInClusterPrivate,
                              int targetSpares,
                              String nameTemplate,
                              String lobbyPassword,
                              String confMacros,
                              String confMacrosPublic,
                              String confMacrosPrivate,
                              Optional<String> description) {

    /**
     * Preset keys owned by the cluster manager. Other preset keys belong to the autohost.
     */
    public static final Set<String> KEYS = Set.of(
            "maxInstancesInCluster", "maxInstancesInClusterPublic", "maxInstancesInClusterPrivate",
            "targetSpares", "nameTemplate", "lobbyPassword",
            "confMacros", "confMacrosPublic", "confMacrosPrivate", "description");

    public static final Set<String> CONF_MACRO_KEYS = Set.of("confMacros", "confMacrosPublic", "confMacrosPrivate");

    static final int DEFAULT_TARGET_SPARES = 1;
    static final String DEFAULT_NAME_TEMPLATE = "%PresetName%";

    public ClusterSettings {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(nameTemplate, "nameTemplate");
        Objects.requireNonNull(lobbyPassword, "lobbyPassword");
        Objects.requireNonNull(description, "description");
    }

    static ClusterSettings read(PresetConfiguration source, String cluster, List<String> problems) {
        SettingReader reader = new SettingReader(problems, key -> source.preset(cluster, key), cluster);
        String nameTemplate = reader.string("nameTemplate", DEFAULT_NAME_TEMPLATE).trim();
        if (nameTemplate.isEmpty()) {
            problems.add("\"nameTemplate\" setting of preset \"" + cluster + "\" must not be empty");
            nameTemplate = DEFAULT_NAME_TEMPLATE;
        }
        return new ClusterSettings(
                cluster,
                reader.integer("maxInstancesInCluster", 0),
                reader.integer("maxInstancesInClusterPublic", 0),
                reader.integer("maxInstancesInClusterPrivate", 0),
                reader.integer("targetSpares", DEFAULT_TARGET_SPARES),
                nameTemplate,
                reader.string("lobbyPassword", ""),
                reader.string("confMacros", ""),
                reader.string("confMacrosPublic", ""),
                reader.string("confMacrosPrivate", ""),
                source.declared(cluster, "description").filter(s -> !s.isBlank())
        );
    }

    /**
     * Settings users may inspect with the cluster configuration command, sorted by name,
     * lobby password excluded.
     */
    public Map<String, String> publicSettings() {
        Map<String, String> settings = new TreeMap<>();
        settings.put("maxInstancesInCluster", String.valueOf(maxInstancesInCluster));
        settings.put("maxInstancesInClusterPublic", String.valueOf(maxInstancesInClusterPublic));
        settings.put("maxInstancesInClusterPrivate", String.valueOf(maxInstancesInClusterPrivate));
        settings.put("targetSpares", String.valueOf(targetSpares));
        settings.put("nameTemplate", nameTemplate);
        settings.put("confMacros", confMacros);
        settings.put("confMacrosPublic", confMacrosPublic);
        settings.put("confMacrosPrivate", confMacrosPrivate);
        return settings;
    }
}
