package sh.harold.flotilla.cluster.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses configuration macro overrides written as shell words, e.g.
 * {@code battleName="Team game %ClustInstNb%" set:maxSpecs=4}.
 */
public final class ConfMacroParser {

    private ConfMacroParser() {
    }

    /**
     * @return Macros in declaration order, empty map for a blank string, or empty if the string
     * is malformed (unbalanced quotes, token without {@code =}, empty macro name)
     */
    public static Optional<Map<String, String>> parse(String macros) {
        if (macros == null || macros.isBlank()) {
            return Optional.of(new LinkedHashMap<>());
        }
        Optional<List<String>> tokens = splitShellWords(macros);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> parsed = new LinkedHashMap<>();
        for (String token : tokens.get()) {
            int separator = token.indexOf('=');
            if (separator <= 0) {
                return Optional.empty();
            }
            parsed.put(token.substring(0, separator), token.substring(separator + 1));
        }
        return Optional.of(parsed);
    }

    /**
     * Splits a string into words using POSIX shell quoting rules (single quotes, double quotes
     * and backslash escapes).
     *
     * @return Words, or empty if a quote is left open or the string ends with a lone backslash
     */
    public static Optional<List<String>> splitShellWords(String input) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inWord = false;
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                if (inWord) {
                    words.add(current.toString());
                    current.setLength(0);
                    inWord = false;
                }
                i++;
            } else if (c == '\'') {
                int end = input.indexOf('\'', i + 1);
                if (end < 0) {
                    return Optional.empty();
                }
                current.append(input, i + 1, end);
                inWord = true;
                i = end + 1;
            } else if (c == '"') {
                i++;
                boolean closed = false;
                while (i < input.length()) {
                    char q = input.charAt(i);
                    if (q == '"') {
                        closed = true;
                        i++;
                        break;
                    }
                    if (q == '\\' && i + 1 < input.length() && "\"\\$`".indexOf(input.charAt(i + 1)) >= 0) {
                        current.append(input.charAt(i + 1));
                        i += 2;
                    } else {
                        current.append(q);
                        i++;
                    }
                }
                if (!closed) {
                    return Optional.empty();
                }
                inWord = true;
            } else if (c == '\\') {
                if (i + 1 >= input.length()) {
                    return Optional.empty();
                }
                current.append(input.charAt(i + 1));
                inWord = true;
                i += 2;
            } else {
                current.append(c);
                inWord = true;
                i++;
            }
        }
        if (inWord) {
            words.add(current.toString());
        }
        return Optional.of(words);
    }
}
