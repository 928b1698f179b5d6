package sh.harold.flotilla.cluster.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import sh.harold.flotilla.api.config.PresetConfiguration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * {@link PresetConfiguration} backed by a YAML document.
 *
 * <pre>
 * defaultPreset: ffa
 * settings:
 *   maxInstances: 20
 * presets:
 *   ffa:
 *     targetSpares: 2
 * </pre>
 *
 * String values of the form {@code ${ENV_VAR:default}} are replaced by the environment variable
 * value, or by the default when the variable is not set.
 */
public final class YamlPresetConfiguration implements PresetConfiguration {
    private static final Logger LOGGER = LoggerFactory.getLogger(YamlPresetConfiguration.class);

    public static final String DEFAULT_RESOURCE = "/cluster-manager.yml";

    private final String defaultPreset;
    private final Map<String, String> globals;
    private final Map<String, Map<String, String>> presets;

    private YamlPresetConfiguration(String defaultPreset,
                                    Map<String, String> globals,
                                    Map<String, Map<String, String>> presets) {
        this.defaultPreset = defaultPreset;
        this.globals = globals;
        this.presets = presets;
    }

    public static YamlPresetConfiguration load(Path file) {
        try (InputStream inputStream = Files.newInputStream(file)) {
            return load(inputStream, System::getenv);
        } catch (IOException e) {
            throw new ConfigValidationException(List.of("Unable to read configuration file \"" + file + "\": " + e.getMessage()));
        }
    }

    public static YamlPresetConfiguration loadResource(String resource) {
        try (InputStream inputStream = YamlPresetConfiguration.class.getResourceAsStream(resource)) {
            if (inputStream == null) {
                throw new ConfigValidationException(List.of("Configuration resource " + resource + " not found"));
            }
            return load(inputStream, System::getenv);
        } catch (IOException e) {
            throw new ConfigValidationException(List.of("Unable to read configuration resource " + resource + ": " + e.getMessage()));
        }
    }

    /**
     * Parses a configuration document.
     *
     * @param inputStream YAML document
     * @param environment Environment variable lookup used for substitutions
     */
    @SuppressWarnings("unchecked")
    public static YamlPresetConfiguration load(InputStream inputStream, UnaryOperator<String> environment) {
        Object document = new Yaml().load(inputStream);
        if (!(document instanceof Map)) {
            throw new ConfigValidationException(List.of("Configuration document must be a mapping"));
        }
        Map<String, Object> root = (Map<String, Object>) document;

        Map<String, String> globals = flatten("settings", root.get("settings"), environment);
        Map<String, Map<String, String>> presets = new LinkedHashMap<>();
        Object presetsNode = root.get("presets");
        if (presetsNode instanceof Map<?, ?> presetMap) {
            for (Map.Entry<?, ?> entry : presetMap.entrySet()) {
                String presetName = String.valueOf(entry.getKey());
                presets.put(presetName, flatten("presets." + presetName, entry.getValue(), environment));
            }
        } else if (presetsNode != null) {
            throw new ConfigValidationException(List.of("\"presets\" must be a mapping"));
        }

        Object defaultNode = root.get("defaultPreset");
        String defaultPreset = defaultNode == null ? null : substitute(String.valueOf(defaultNode), environment);
        if (defaultPreset == null || defaultPreset.isBlank()) {
            throw new ConfigValidationException(List.of("Missing \"defaultPreset\" setting"));
        }
        if (!presets.containsKey(defaultPreset)) {
            throw new ConfigValidationException(List.of("Default preset \"" + defaultPreset + "\" is not declared"));
        }

        LOGGER.debug("Loaded configuration with {} global settings and presets {}", globals.size(), presets.keySet());
        return new YamlPresetConfiguration(defaultPreset, Collections.unmodifiableMap(globals), Collections.unmodifiableMap(presets));
    }

    private static Map<String, String> flatten(String section, Object node, UnaryOperator<String> environment) {
        Map<String, String> values = new LinkedHashMap<>();
        if (node == null) {
            return values;
        }
        if (!(node instanceof Map<?, ?> map)) {
            throw new ConfigValidationException(List.of("\"" + section + "\" must be a mapping"));
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (value instanceof Map) {
                throw new ConfigValidationException(List.of("\"" + section + "." + key + "\" must be a scalar or a list"));
            }
            values.put(key, substitute(stringify(value), environment));
        }
        return values;
    }

    private static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean bool) {
            return bool ? "1" : "0";
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        return String.valueOf(value);
    }

    private static String substitute(String value, UnaryOperator<String> environment) {
        if (value.startsWith("${") && value.endsWith("}")) {
            String envVarWithDefault = value.substring(2, value.length() - 1);
            String[] parts = envVarWithDefault.split(":", 2);
            String defaultValue = parts.length > 1 ? parts[1] : "";
            String resolved = environment.apply(parts[0]);
            return resolved != null ? resolved : defaultValue;
        }
        return value;
    }

    @Override
    public String defaultPreset() {
        return defaultPreset;
    }

    @Override
    public Set<String> presets() {
        return presets.keySet();
    }

    @Override
    public Optional<String> global(String key) {
        return Optional.ofNullable(globals.get(key));
    }

    @Override
    public Optional<String> preset(String preset, String key) {
        Optional<String> declared = declared(preset, key);
        if (declared.isPresent()) {
            return declared;
        }
        return declared(defaultPreset, key);
    }

    @Override
    public Optional<String> declared(String preset, String key) {
        Map<String, String> values = presets.get(preset);
        return values == null ? Optional.empty() : Optional.ofNullable(values.get(key));
    }

    @Override
    public Set<String> declaredKeys(String preset) {
        Map<String, String> values = presets.get(preset);
        return values == null ? Set.of() : Collections.unmodifiableSet(values.keySet());
    }
}
