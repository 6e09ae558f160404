package work.mcps.runtime;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Client for one tool server (an MCP process or endpoint). Implementations own the transport.
 */
public interface ToolServerClient {
    CompletableFuture<Void> connect();

    CompletableFuture<List<ToolDescriptor>> listTools();

    CompletableFuture<Object> callTool(String name, Map<String, Object> arguments);

    CompletableFuture<Void> close();
}
