package work.mcps.runtime;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of environment variables exposed to scripts as {@code env}.
 */
public interface EnvironmentAccessor {
    String READ_ONLY_MESSAGE = "Environment variables are read-only";

    Optional<String> get(String key);

    default void set(String key, String value) {
        throw new UnsupportedOperationException(READ_ONLY_MESSAGE);
    }

    static EnvironmentAccessor of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return key -> Optional.ofNullable(copy.get(key));
    }

    static EnvironmentAccessor system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
