package work.mcps.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered message history of an agent interaction. Delegating a conversation to another agent continues it.
 */
public final class Conversation {
    private final List<Message> messages = new ArrayList<>();

    public Conversation() {}

    public Conversation(String initialPrompt) {
        if (initialPrompt != null && !initialPrompt.isEmpty()) {
            messages.add(new Message(Message.USER, initialPrompt));
        }
    }

    public Conversation(List<Message> messages) {
        this.messages.addAll(messages);
    }

    public synchronized Conversation add(Message message) {
        messages.add(Objects.requireNonNull(message, "message"));
        return this;
    }

    public synchronized List<Message> messages() {
        return List.copyOf(messages);
    }

    /**
     * Content of the last assistant message, or an empty string when the agent has not answered yet.
     */
    public synchronized String result() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (Message.ASSISTANT.equals(messages.get(i).role())) {
                return messages.get(i).content();
            }
        }
        return "";
    }

    @Override
    public String toString() {
        return result();
    }

    public record Message(String role, String content) {
        public static final String USER = "user";
        public static final String ASSISTANT = "assistant";
        public static final String SYSTEM = "system";
        public static final String TOOL = "tool";

        public Message {
            Objects.requireNonNull(role, "role");
            content = content == null ? "" : content;
        }
    }
}
