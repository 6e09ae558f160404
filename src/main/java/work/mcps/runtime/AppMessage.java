package work.mcps.runtime;

/**
 * Structured progress event delivered to a {@link MessageSink}.
 */
public record AppMessage(String title, String body) {
    public AppMessage {
        title = title == null ? "" : title;
        body = body == null ? "" : body;
    }
}
