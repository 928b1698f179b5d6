package sh.harold.flotilla.cluster.admission;

import sh.harold.flotilla.cluster.instance.Instance;

import java.util.Optional;

/**
 * @param password Battle password of a private instance
 */
public record LaunchedInstance(Instance instance, Optional<String> password) {
}
