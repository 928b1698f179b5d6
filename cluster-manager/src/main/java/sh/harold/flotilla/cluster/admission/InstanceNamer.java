package sh.harold.flotilla.cluster.admission;

import sh.harold.flotilla.cluster.config.ClusterSettings;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generates instance names from cluster name templates.
 *
 * <p>Supported placeholders: {@code %InstNb%}, {@code %InstNb2%}, {@code %InstNb3%},
 * {@code %InstNb0%}, the {@code %ClustInstNb...%} equivalents for the cluster instance number,
 * {@code %PresetName%}, {@code %ManagerName%} and {@code %OwnerName%}. The {@code 2} and
 * {@code 3} variants are zero-padded to that many digits, the {@code 0} variants to the number of
 * digits of the highest possible number.</p>
 */
public final class InstanceNamer {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[\\w\\[\\]]{2,20}$");
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("%(\\w+)%");
    private static final List<String> NUMBERING_PLACEHOLDERS = List.of(
            "InstNb", "InstNb2", "InstNb3", "InstNb0",
            "ClustInstNb", "ClustInstNb2", "ClustInstNb3", "ClustInstNb0");
    private static final String DEFAULT_SUFFIX = "%ClustInstNb0%";

    /**
     * Applies the name template of a cluster. The result is not validated, see {@link #isValid(String)}.
     *
     * @param maxInstances Fleet-wide instance cap, used for {@code %InstNb0%} padding
     * @param owner        Owner name, {@code *} for public instances
     */
    public InstanceName name(ClusterSettings cluster,
                             int maxInstances,
                             int instanceNumber,
                             int clusterInstanceNumber,
                             String managerName,
                             String owner) {
        String configured = cluster.nameTemplate();
        String template = NUMBERING_PLACEHOLDERS.stream().anyMatch(p -> configured.contains("%" + p + "%"))
                ? configured
                : configured + DEFAULT_SUFFIX;

        int instanceDigits = digits(maxInstances - 1);
        int clusterDigits = cluster.maxInstancesInCluster() > 0 ? digits(cluster.maxInstancesInCluster() - 1) : instanceDigits;

        Map<String, String> placeholders = new LinkedHashMap<>();
        placeholders.put("InstNb", String.valueOf(instanceNumber));
        placeholders.put("InstNb2", pad(instanceNumber, 2));
        placeholders.put("InstNb3", pad(instanceNumber, 3));
        placeholders.put("InstNb0", pad(instanceNumber, instanceDigits));
        placeholders.put("ClustInstNb", String.valueOf(clusterInstanceNumber));
        placeholders.put("ClustInstNb2", pad(clusterInstanceNumber, 2));
        placeholders.put("ClustInstNb3", pad(clusterInstanceNumber, 3));
        placeholders.put("ClustInstNb0", pad(clusterInstanceNumber, clusterDigits));
        placeholders.put("PresetName", cluster.name());
        placeholders.put("ManagerName", managerName);
        placeholders.put("OwnerName", owner);

        String name = substitute(template, placeholders);
        placeholders.put("InstanceName", name);
        return new InstanceName(name, placeholders);
    }

    public static boolean isValid(String name) {
        return NAME_PATTERN.matcher(name).matches();
    }

    /**
     * Replaces every {@code %Key%} occurrence whose key is known, leaving unknown ones untouched.
     */
    static String substitute(String value, Map<String, String> placeholders) {
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = placeholders.getOrDefault(matcher.group(1), matcher.group());
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static int digits(int value) {
        return String.valueOf(Math.max(value, 0)).length();
    }

    private static String pad(int value, int width) {
        return String.format("%0" + width + "d", value);
    }
}
