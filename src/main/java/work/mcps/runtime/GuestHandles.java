package work.mcps.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;

/**
 * Guest-visible wrappers for the objects declarations produce. Each handle is read-only from the script's
 * point of view and unwraps to its Java object when it crosses back to the host.
 */
final class GuestHandles {
    private GuestHandles() {}

    interface Handle {
        Object unwrap();
    }

    /**
     * Fixed-member proxy. Writes fail like any other read-only host value.
     */
    abstract static class ReadOnlyObject implements ProxyObject, Handle {
        private final Map<String, Object> members = new LinkedHashMap<>();

        protected final void member(String name, Object value) {
            members.put(name, value);
        }

        @Override
        public Object getMember(String key) {
            return members.get(key);
        }

        @Override
        public Object getMemberKeys() {
            return ProxyArray.fromList(new ArrayList<>(members.keySet()));
        }

        @Override
        public boolean hasMember(String key) {
            return members.containsKey(key);
        }

        @Override
        public void putMember(String key, Value value) {
            throw new UnsupportedOperationException("Cannot assign '" + key + "' on " + this);
        }
    }

    static final class ModelHandle extends ReadOnlyObject {
        private final String name;
        private final Object model;

        ModelHandle(String name, Object model) {
            this.name = name;
            this.model = model;
            member("name", name);
        }

        @Override
        public Object unwrap() {
            return model;
        }

        @Override
        public String toString() {
            return "[model " + name + "]";
        }
    }

    /**
     * A declared tool. Calling it from the script runs the body directly; agents go through {@link Tool#invoke}.
     */
    static final class ToolHandle extends ReadOnlyObject implements ProxyExecutable {
        private final Tool tool;
        private final Value function;

        ToolHandle(Tool tool, Value function) {
            this.tool = tool;
            this.function = function;
            member("name", tool.name());
        }

        @Override
        public Object execute(Value... arguments) {
            return function.execute((Object[]) arguments);
        }

        @Override
        public Tool unwrap() {
            return tool;
        }

        @Override
        public String toString() {
            return "[tool " + tool.name() + "]";
        }
    }

    /**
     * A connected tool server: one callable member per advertised tool.
     */
    static final class ToolServerHandle extends ReadOnlyObject {
        private final String name;
        private final List<Tool> tools;

        ToolServerHandle(String name, List<Tool> tools, Map<String, ProxyExecutable> functions) {
            this.name = name;
            this.tools = List.copyOf(tools);
            functions.forEach(this::member);
        }

        @Override
        public ToolReference.Group unwrap() {
            return new ToolReference.Group(name, tools);
        }

        @Override
        public String toString() {
            return "[mcp " + name + "]";
        }
    }

    static final class AgentHandle extends ReadOnlyObject {
        private final Agent agent;

        AgentHandle(Agent agent, ProxyExecutable run) {
            this.agent = agent;
            member("name", agent.name());
            member("run", run);
        }

        @Override
        public Agent unwrap() {
            return agent;
        }

        @Override
        public String toString() {
            return "[agent " + agent.name() + "]";
        }
    }

    static final class ConversationHandle extends ReadOnlyObject {
        private final Conversation conversation;

        ConversationHandle(Conversation conversation) {
            this.conversation = conversation;
            member("messages", (ProxyExecutable) args -> messages());
            member("result", (ProxyExecutable) args -> conversation.result());
            member("toString", (ProxyExecutable) args -> conversation.result());
        }

        private ProxyArray messages() {
            List<Object> messages = new ArrayList<>();
            for (Conversation.Message message : conversation.messages()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("role", message.role());
                entry.put("content", message.content());
                messages.add(ProxyObject.fromMap(entry));
            }
            return ProxyArray.fromList(messages);
        }

        @Override
        public Conversation unwrap() {
            return conversation;
        }

        @Override
        public String toString() {
            return conversation.result();
        }
    }

    /**
     * Text results of a tool-server call ({@code content[0].type == "text"}) are unwrapped to their text.
     */
    static Object unwrapToolResult(Object result) {
        if (result instanceof Map<?, ?> map && map.get("content") instanceof List<?> content && !content.isEmpty()
            && content.get(0) instanceof Map<?, ?> first && "text".equals(first.get("type"))) {
            return first.get("text");
        }
        return result;
    }
}
