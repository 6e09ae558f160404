package work.mcps.runtime;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A completed run: the script's top-level variables, converted to plain Java values.
 */
public record ExecutionOutcome(Map<String, Object> bindings, Duration elapsed) {
    public ExecutionOutcome {
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public Object binding(String name) {
        return bindings.get(name);
    }
}
