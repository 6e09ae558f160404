package work.mcps.runtime;

import java.util.Map;

/**
 * Builds the model handle for a {@code model} declaration. The handle is opaque to the runtime and is only
 * passed on to the {@link AgentFactory}.
 */
@FunctionalInterface
public interface ModelFactory {
    Object create(String name, Map<String, Object> config);
}
