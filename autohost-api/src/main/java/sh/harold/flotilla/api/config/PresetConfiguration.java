package sh.harold.flotilla.api.config;

import java.util.Optional;
import java.util.Set;

/**
 * Key/value configuration store organised in presets.
 *
 * <p>A value looked up in a preset falls back to the default preset when the preset does
 * not define it.</p>
 */
public interface PresetConfiguration {

    /**
     * @return Name of the preset every other preset inherits from
     */
    String defaultPreset();

    /**
     * @return Names of all declared presets
     */
    Set<String> presets();

    /**
     * Looks up a global (non preset) setting.
     */
    Optional<String> global(String key);

    /**
     * Looks up a setting in a preset, falling back to the default preset.
     */
    Optional<String> preset(String preset, String key);

    /**
     * Looks up a setting declared directly by a preset, without inheritance.
     */
    Optional<String> declared(String preset, String key);

    /**
     * @return Keys declared directly by a preset, empty if the preset does not exist
     */
    Set<String> declaredKeys(String preset);
}
