package work.mcps.runtime;

import java.util.Objects;
import work.mcps.error.ErrorKind;
import work.mcps.error.ScriptException;

public record ExecutionError(ErrorKind kind, String message) {
    public ExecutionError {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }

    static ExecutionError from(ScriptException ex) {
        return new ExecutionError(ex.kind(), ex.getMessage());
    }

    public String describe() {
        return kind.label() + ": " + message;
    }
}
