package work.mcps.codegen;

import java.util.List;
import java.util.Objects;

/**
 * Output of the code generator: the body of an async JavaScript function plus the top-level names it returns.
 */
public record GeneratedScript(String code, List<String> bindings) {
    public GeneratedScript {
        Objects.requireNonNull(code, "code");
        bindings = List.copyOf(bindings);
    }
}
