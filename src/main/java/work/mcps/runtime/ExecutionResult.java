package work.mcps.runtime;

import java.util.Optional;
import work.mcps.error.ScriptException;

/**
 * Either an {@link ExecutionOutcome} or an {@link ExecutionError}; never both.
 */
public record ExecutionResult(Status status, ExecutionOutcome outcome, ExecutionError error) {

    public static ExecutionResult success(ExecutionOutcome outcome) {
        return new ExecutionResult(Status.COMPLETED, outcome, null);
    }

    public static ExecutionResult failure(ExecutionError error) {
        return new ExecutionResult(Status.FAILED, null, error);
    }

    public boolean isSuccess() {
        return status == Status.COMPLETED;
    }

    public Optional<ExecutionOutcome> outcomeIfPresent() {
        return Optional.ofNullable(outcome);
    }

    /**
     * Returns the outcome or rethrows the failure as a {@link ScriptException} of the same kind.
     */
    public ExecutionOutcome orThrow() {
        if (isSuccess()) {
            return outcome;
        }
        throw new ScriptException(error.kind(), error.message());
    }

    public enum Status {
        COMPLETED(0),
        FAILED(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
