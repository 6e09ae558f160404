package work.mcps.shared;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code .env} files: {@code KEY=VALUE} lines, {@code #} comments, optional {@code export} prefix and
 * surrounding quotes. Values from the process environment win over file values.
 */
public final class DotenvLoader {
    private DotenvLoader() {}

    public static Map<String, String> load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return Map.of();
        }
        try {
            return parse(Files.readAllLines(file));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read env file " + file, ex);
        }
    }

    static Map<String, String> parse(List<String> lines) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String rawLine : lines) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).trim();
            }
            int separator = line.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            String key = line.substring(0, separator).trim();
            String value = line.substring(separator + 1).trim();
            values.put(key, unquote(value));
        }
        return values;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                String inner = value.substring(1, value.length() - 1);
                return first == '"' ? inner.replace("\\n", "\n") : inner;
            }
        }
        int comment = value.indexOf(" #");
        return comment >= 0 ? value.substring(0, comment).trim() : value;
    }

    /**
     * File values overlaid by the process environment.
     */
    public static Map<String, String> merge(Map<String, String> fileValues, Map<String, String> processEnvironment) {
        Map<String, String> merged = new LinkedHashMap<>(fileValues);
        merged.putAll(processEnvironment);
        return merged;
    }
}
