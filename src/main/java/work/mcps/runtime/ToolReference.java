package work.mcps.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.mcps.error.DeclarationException;

/**
 * One entry of an agent's {@code tools} list: a declared tool, every tool of a tool server, or a plain
 * callable that carries no tool metadata.
 */
public interface ToolReference {

    record Single(Tool tool) implements ToolReference {
        public Single {
            Objects.requireNonNull(tool, "tool");
        }
    }

    record Group(String server, List<Tool> tools) implements ToolReference {
        public Group {
            Objects.requireNonNull(server, "server");
            tools = List.copyOf(tools);
        }
    }

    record Raw(String description) implements ToolReference {}

    /**
     * Flattens references in order. A {@link Raw} entry fails the agent declaration at that position.
     */
    static List<Tool> flatten(String agentName, List<ToolReference> references) {
        List<Tool> tools = new ArrayList<>();
        for (int i = 0; i < references.size(); i++) {
            ToolReference reference = references.get(i);
            if (reference instanceof Single single) {
                tools.add(single.tool());
            } else if (reference instanceof Group group) {
                tools.addAll(group.tools());
            } else if (reference instanceof Raw raw) {
                throw new DeclarationException(
                    agentName,
                    "Agent \"" + agentName + "\" tools[" + i + "] (" + raw.description() + ") is not a tool; declare it with 'tool'"
                );
            }
        }
        return tools;
    }
}
