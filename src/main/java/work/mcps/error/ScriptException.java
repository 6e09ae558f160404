package work.mcps.error;

import java.util.Objects;

/**
 * Base class for every classified MCP Script failure.
 */
public class ScriptException extends RuntimeException {
    private final ErrorKind kind;

    public ScriptException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ScriptException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Single-line rendering used by the CLI, e.g. {@code DeclarationError: Agent "A" must specify a model reference}.
     */
    public String describe() {
        return kind.label() + ": " + getMessage();
    }
}
