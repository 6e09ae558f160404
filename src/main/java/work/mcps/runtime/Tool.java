package work.mcps.runtime;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import work.mcps.error.ErrorKind;
import work.mcps.error.ScriptException;

/**
 * A callable tool handed to agents: a declared {@code tool} or one advertised by a tool server.
 * Created once, when the tool is declared or discovered.
 *
 * <p>{@code parameterSchema} maps parameter names, in order, to compiled type descriptors. Arguments are
 * checked against it before the invoker runs. The returned future completes on the script's driver thread;
 * callers must compose on it rather than block the thread that called {@link #invoke(Map)}.
 */
public record Tool(
    String name,
    String description,
    Map<String, Object> parameterSchema,
    Function<Map<String, Object>, CompletableFuture<Object>> invoker
) {
    public Tool {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(invoker, "invoker");
        description = description == null ? "" : description;
        parameterSchema = parameterSchema == null ? Map.of() : parameterSchema;
    }

    public CompletableFuture<Object> invoke(Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        var violation = SchemaValidator.checkArguments(parameterSchema, args);
        if (violation.isPresent()) {
            return CompletableFuture.failedFuture(
                new ScriptException(ErrorKind.RUNTIME, "Tool \"" + name + "\": " + violation.get())
            );
        }
        return invoker.apply(args);
    }
}
