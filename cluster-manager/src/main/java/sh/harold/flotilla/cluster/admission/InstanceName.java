package sh.harold.flotilla.cluster.admission;

import java.util.Map;

/**
 * @param name         Generated instance name
 * @param placeholders Values of every naming placeholder, {@code InstanceName} included
 */
public record InstanceName(String name, Map<String, String> placeholders) {

    public InstanceName {
        placeholders = Map.copyOf(placeholders);
    }
}
