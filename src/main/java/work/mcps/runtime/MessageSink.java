package work.mcps.runtime;

/**
 * Observer for {@code addMessage} and, when configured, for {@code print}.
 */
@FunctionalInterface
public interface MessageSink {
    void accept(AppMessage message);
}
