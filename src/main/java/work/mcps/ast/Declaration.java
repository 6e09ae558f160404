package work.mcps.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Named top-level declarations. Names are unique per kind; all of them are hoisted before executable statements.
 */
public interface Declaration extends Statement {

    String name();

    /**
     * {@code mcp}, {@code model} and {@code agent} declarations: a name plus an ordered config block.
     */
    record Configured(Kind kind, String name, List<Property> config) implements Declaration {
        public Configured {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(name, "name");
            if (kind != Kind.MCP_DECLARATION && kind != Kind.MODEL_DECLARATION && kind != Kind.AGENT_DECLARATION) {
                throw new IllegalArgumentException("Not a configured declaration kind: " + kind);
            }
            config = List.copyOf(config);
        }

        public static Configured mcp(String name, List<Property> config) {
            return new Configured(Kind.MCP_DECLARATION, name, config);
        }

        public static Configured model(String name, List<Property> config) {
            return new Configured(Kind.MODEL_DECLARATION, name, config);
        }

        public static Configured agent(String name, List<Property> config) {
            return new Configured(Kind.AGENT_DECLARATION, name, config);
        }

        /**
         * Last value written for {@code key}, matching what the generated object literal evaluates to.
         */
        public Optional<Expression> get(String key) {
            Expression found = null;
            for (Property property : config) {
                if (property.key().equals(key)) {
                    found = property.value();
                }
            }
            return Optional.ofNullable(found);
        }
    }

    record Parameter(String name, TypeAnnotation type, boolean optional) {
        public Parameter {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * {@code tool name(params) [: returnType] { body }}. {@code returnType} is {@code null} when not annotated.
     */
    record Tool(String name, List<Parameter> parameters, TypeAnnotation returnType, Block body) implements Declaration {
        public Tool {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(body, "body");
            parameters = List.copyOf(parameters);
        }

        @Override
        public Kind kind() {
            return Kind.TOOL_DECLARATION;
        }
    }
}
