package sh.harold.flotilla.cluster.config;

import java.util.List;

/**
 * Thrown when the cluster configuration cannot be used.
 */
public class ConfigValidationException extends RuntimeException {
    private final List<String> problems;

    public ConfigValidationException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
