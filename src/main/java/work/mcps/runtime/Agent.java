package work.mcps.runtime;

import java.util.concurrent.CompletableFuture;

/**
 * LLM-backed agent. The delegation operator calls {@link #run(Object)} with either a prompt string or a
 * {@link Conversation} to continue.
 */
public interface Agent {
    String name();

    CompletableFuture<Conversation> run(Object promptOrConversation);
}
