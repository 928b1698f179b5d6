package sh.harold.flotilla.cluster.worker;

import sh.harold.flotilla.api.plugin.PluginLoadException;
import sh.harold.flotilla.cluster.pid.PidRecord;

import java.util.Map;
import java.util.Objects;

/**
 * Identity of a worker as given by its manager through configuration macros.
 *
 * @param managerName           Lobby login of the manager
 * @param instanceNumber        Fleet-wide instance number
 * @param clusterInstanceNumber Instance number within the cluster
 * @param ownerName             Owner of a private instance, {@link PidRecord#PUBLIC_OWNER} otherwise
 */
public record WorkerIdentity(String managerName, int instanceNumber, int clusterInstanceNumber, String ownerName) {

    public static final String MANAGER_NAME_MACRO = "ManagerName";
    public static final String INSTANCE_NUMBER_MACRO = "InstNb";
    public static final String CLUSTER_INSTANCE_NUMBER_MACRO = "ClustInstNb";
    public static final String OWNER_NAME_MACRO = "OwnerName";

    public WorkerIdentity {
        Objects.requireNonNull(managerName, "managerName");
        Objects.requireNonNull(ownerName, "ownerName");
    }

    /**
     * @return true if the configuration macros designate a worker rather than a manager
     */
    public static boolean isWorker(Map<String, String> macros) {
        return macros.containsKey(MANAGER_NAME_MACRO);
    }

    /**
     * @throws PluginLoadException if a macro is missing or malformed
     */
    public static WorkerIdentity fromMacros(Map<String, String> macros) throws PluginLoadException {
        return new WorkerIdentity(
                required(macros, MANAGER_NAME_MACRO),
                number(macros, INSTANCE_NUMBER_MACRO),
                number(macros, CLUSTER_INSTANCE_NUMBER_MACRO),
                required(macros, OWNER_NAME_MACRO));
    }

    public boolean isPublic() {
        return PidRecord.PUBLIC_OWNER.equals(ownerName);
    }

    private static String required(Map<String, String> macros, String macro) throws PluginLoadException {
        String value = macros.get(macro);
        if (value == null || value.isEmpty()) {
            throw new PluginLoadException("Missing configuration macro " + macro + " for loading cluster manager in worker mode");
        }
        return value;
    }

    private static int number(Map<String, String> macros, String macro) throws PluginLoadException {
        String value = required(macros, macro);
        try {
            int number = Integer.parseInt(value);
            if (number < 0) {
                throw new PluginLoadException("Invalid value for configuration macro " + macro + ": " + value);
            }
            return number;
        } catch (NumberFormatException e) {
            throw new PluginLoadException("Invalid value for configuration macro " + macro + ": " + value, e);
        }
    }
}
