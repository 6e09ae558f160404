package work.mcps.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything an {@code agent} declaration configured, with its tool list already flattened.
 * {@code model} is the opaque handle produced by the {@link ModelFactory}.
 */
public record AgentDefinition(
    String name,
    Object model,
    String description,
    String systemPrompt,
    List<Tool> tools,
    Double temperature,
    Integer maxTokens,
    Map<String, Object> options
) {
    public AgentDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(model, "model");
        tools = List.copyOf(tools);
        options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }
}
