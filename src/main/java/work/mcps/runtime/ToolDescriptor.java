package work.mcps.runtime;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tool advertised by a tool server. {@code inputSchema} is the server's JSON schema for the arguments.
 */
public record ToolDescriptor(String name, String description, Map<String, Object> inputSchema) {
    public ToolDescriptor {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? Map.of() : inputSchema;
    }

    /**
     * Argument names in schema order, used to map positional script arguments.
     */
    public List<String> parameterNames() {
        Object properties = inputSchema.get("properties");
        if (properties instanceof Map<?, ?> map) {
            return map.keySet().stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
