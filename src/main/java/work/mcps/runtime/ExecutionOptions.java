package work.mcps.runtime;

import java.time.Duration;
import java.util.Objects;

/**
 * Host configuration for one script run. A {@link Duration#ZERO} timeout means no deadline.
 * Unset collaborators are {@code null}; code that needs one fails with a host configuration error.
 */
public record ExecutionOptions(
    Duration timeout,
    InputHandler inputHandler,
    MessageSink messageSink,
    EnvironmentAccessor environment,
    ScriptConsole console,
    ModelFactory modelFactory,
    AgentFactory agentFactory,
    ToolServerClientFactory toolServerFactory
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public ExecutionOptions {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(console, "console");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must not be negative: " + timeout);
        }
    }

    public static ExecutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration timeout = DEFAULT_TIMEOUT;
        private InputHandler inputHandler;
        private MessageSink messageSink;
        private EnvironmentAccessor environment = EnvironmentAccessor.system();
        private ScriptConsole console = ScriptConsole.standard();
        private ModelFactory modelFactory;
        private AgentFactory agentFactory;
        private ToolServerClientFactory toolServerFactory;

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder inputHandler(InputHandler inputHandler) {
            this.inputHandler = inputHandler;
            return this;
        }

        public Builder messageSink(MessageSink messageSink) {
            this.messageSink = messageSink;
            return this;
        }

        public Builder environment(EnvironmentAccessor environment) {
            this.environment = environment;
            return this;
        }

        public Builder console(ScriptConsole console) {
            this.console = console;
            return this;
        }

        public Builder modelFactory(ModelFactory modelFactory) {
            this.modelFactory = modelFactory;
            return this;
        }

        public Builder agentFactory(AgentFactory agentFactory) {
            this.agentFactory = agentFactory;
            return this;
        }

        public Builder toolServerFactory(ToolServerClientFactory toolServerFactory) {
            this.toolServerFactory = toolServerFactory;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(
                timeout,
                inputHandler,
                messageSink,
                environment,
                console,
                modelFactory,
                agentFactory,
                toolServerFactory
            );
        }
    }
}
