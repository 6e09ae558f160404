package work.mcps.runtime;

import java.util.Map;

/**
 * Creates the client for an {@code mcp} declaration from its config
 * ({@code command}/{@code args}/{@code env} or {@code url}/{@code transportOptions}).
 */
@FunctionalInterface
public interface ToolServerClientFactory {
    ToolServerClient create(String name, Map<String, Object> config);
}
