package sh.harold.flotilla.cluster.config;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Typed access to string settings, collecting a problem message for every unparsable value.
 */
final class SettingReader {
    private final List<String> problems;
    private final Function<String, Optional<String>> lookup;
    private final String scope;

    SettingReader(List<String> problems, Function<String, Optional<String>> lookup) {
        this(problems, lookup, "");
    }

    SettingReader(List<String> problems, Function<String, Optional<String>> lookup, String scope) {
        this.problems = problems;
        this.lookup = lookup;
        this.scope = scope;
    }

    String string(String key, String defaultValue) {
        return lookup.apply(key).orElse(defaultValue);
    }

    int integer(String key, int defaultValue) {
        Optional<String> value = lookup.apply(key).map(String::trim).filter(s -> !s.isEmpty());
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.get());
            if (parsed < 0) {
                problems.add(describe(key) + " must not be negative: " + value.get());
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            problems.add(describe(key) + " must be an integer: " + value.get());
            return defaultValue;
        }
    }

    Duration seconds(String key, long defaultSeconds) {
        return Duration.ofSeconds(integer(key, (int) defaultSeconds));
    }

    int port(String key, int defaultValue) {
        int port = integer(key, defaultValue);
        if (port < 1 || port > 65535) {
            problems.add(describe(key) + " must be a valid port number: " + port);
            return defaultValue;
        }
        return port;
    }

    boolean bool(String key, boolean defaultValue) {
        Optional<String> value = lookup.apply(key).map(s -> s.trim().toLowerCase(Locale.ROOT)).filter(s -> !s.isEmpty());
        if (value.isEmpty()) {
            return defaultValue;
        }
        return switch (value.get()) {
            case "1", "true", "yes", "on" -> true;
            case "0", "false", "no", "off" -> false;
            default -> {
                problems.add(describe(key) + " must be a boolean: " + value.get());
                yield defaultValue;
            }
        };
    }

    private String describe(String key) {
        return scope.isEmpty() ? "\"" + key + "\" setting" : "\"" + key + "\" setting of preset \"" + scope + "\"";
    }
}
