package sh.harold.flotilla.cluster.instance;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory index of the instances tracked by the manager.
 *
 * <p>Not thread-safe: the manager only touches it from its reconciliation loop thread.</p>
 */
public final class FleetIndex {
    private final NavigableMap<Integer, Instance> byInstanceNumber = new TreeMap<>();
    private final Map<String, Instance> byName = new HashMap<>();
    private final Map<String, NavigableMap<Integer, Instance>> byCluster = new TreeMap<>();
    private final Map<String, Instance> byOwner = new HashMap<>();

    /**
     * @throws FleetStateException if the instance number, name, owner or cluster instance number
     *                             is already used
     */
    public void add(Instance instance) {
        Instance existing = byInstanceNumber.get(instance.instanceNumber());
        if (existing != null) {
            throw new FleetStateException("Duplicate instance number " + instance.instanceNumber()
                    + " (" + existing.name() + " and " + instance.name() + ")");
        }
        existing = byName.get(instance.name());
        if (existing != null) {
            throw new FleetStateException("Duplicate instance name \"" + instance.name() + "\" (instance numbers "
                    + existing.instanceNumber() + " and " + instance.instanceNumber() + ")");
        }
        if (!instance.isPublic()) {
            existing = byOwner.get(instance.owner());
            if (existing != null) {
                throw new FleetStateException("Duplicate owner \"" + instance.owner() + "\" (instance numbers "
                        + existing.instanceNumber() + " and " + instance.instanceNumber() + ")");
            }
        }
        existing = byCluster.getOrDefault(instance.cluster(), Collections.emptyNavigableMap())
                .get(instance.clusterInstanceNumber());
        if (existing != null) {
            throw new FleetStateException("Duplicate cluster instance number " + instance.clusterInstanceNumber()
                    + " in cluster \"" + instance.cluster() + "\" (instance numbers " + existing.instanceNumber()
                    + " and " + instance.instanceNumber() + ")");
        }

        byInstanceNumber.put(instance.instanceNumber(), instance);
        byName.put(instance.name(), instance);
        byCluster.computeIfAbsent(instance.cluster(), c -> new TreeMap<>()).put(instance.clusterInstanceNumber(), instance);
        if (!instance.isPublic()) {
            byOwner.put(instance.owner(), instance);
        }
    }

    /**
     * Forgets every instance, before rebuilding the index from the PID records.
     */
    public void clear() {
        byInstanceNumber.clear();
        byName.clear();
        byCluster.clear();
        byOwner.clear();
    }

    /**
     * @return true if the instance was tracked
     */
    public boolean remove(Instance instance) {
        if (byInstanceNumber.get(instance.instanceNumber()) != instance) {
            return false;
        }
        byInstanceNumber.remove(instance.instanceNumber());
        byName.remove(instance.name());
        NavigableMap<Integer, Instance> clusterInstances = byCluster.get(instance.cluster());
        if (clusterInstances != null) {
            clusterInstances.remove(instance.clusterInstanceNumber());
            if (clusterInstances.isEmpty()) {
                byCluster.remove(instance.cluster());
            }
        }
        if (!instance.isPublic()) {
            byOwner.remove(instance.owner());
        }
        return true;
    }

    public Optional<Instance> byInstanceNumber(int instanceNumber) {
        return Optional.ofNullable(byInstanceNumber.get(instanceNumber));
    }

    public Optional<Instance> byName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<Instance> byOwner(String owner) {
        return Optional.ofNullable(byOwner.get(owner));
    }

    /**
     * @return Instances of a cluster ordered by cluster instance number
     */
    public Collection<Instance> byCluster(String cluster) {
        NavigableMap<Integer, Instance> instances = byCluster.get(cluster);
        return instances == null ? List.of() : Collections.unmodifiableCollection(instances.values());
    }

    /**
     * @return Clusters having at least one tracked instance, sorted by name
     */
    public Set<String> clusters() {
        return Collections.unmodifiableSet(byCluster.keySet());
    }

    /**
     * @return All instances ordered by instance number
     */
    public Collection<Instance> all() {
        return Collections.unmodifiableCollection(byInstanceNumber.values());
    }

    /**
     * @return Copy of all instances, safe to iterate while removing instances
     */
    public List<Instance> snapshot() {
        return List.copyOf(byInstanceNumber.values());
    }

    public int size() {
        return byInstanceNumber.size();
    }

    public boolean isEmpty() {
        return byInstanceNumber.isEmpty();
    }

    public int privateCount() {
        return byOwner.size();
    }

    public int publicCount() {
        return byInstanceNumber.size() - byOwner.size();
    }

    public int countInCluster(String cluster) {
        NavigableMap<Integer, Instance> instances = byCluster.get(cluster);
        return instances == null ? 0 : instances.size();
    }

    public int countInCluster(String cluster, boolean publicInstances) {
        return (int) byCluster(cluster).stream().filter(i -> i.isPublic() == publicInstances).count();
    }

    /**
     * @return Lowest instance number not currently tracked
     */
    public int nextFreeInstanceNumber() {
        return lowestFree(byInstanceNumber);
    }

    /**
     * @return Lowest cluster instance number not currently tracked in the cluster
     */
    public int nextFreeClusterInstanceNumber(String cluster) {
        return lowestFree(byCluster.getOrDefault(cluster, Collections.emptyNavigableMap()));
    }

    private static int lowestFree(NavigableMap<Integer, Instance> used) {
        int candidate = 0;
        for (Integer number : used.keySet()) {
            if (number != candidate) {
                break;
            }
            candidate++;
        }
        return candidate;
    }
}
