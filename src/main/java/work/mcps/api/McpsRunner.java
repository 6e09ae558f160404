package work.mcps.api;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mcps.codegen.GeneratedScript;
import work.mcps.error.ErrorKind;
import work.mcps.error.ScriptException;
import work.mcps.runtime.EnvironmentAccessor;
import work.mcps.runtime.ExecutionEngine;
import work.mcps.runtime.ExecutionOptions;
import work.mcps.runtime.ExecutionResult;
import work.mcps.shared.DotenvLoader;

/**
 * Public entry point for running a script file: read, compile, execute.
 * Collaborators (input, agents, models, tool servers) are supplied through the options customizer.
 */
public final class McpsRunner {
    private static final Logger LOG = LoggerFactory.getLogger(McpsRunner.class);
    static final String ENGINE_LOGGER = "work.mcps";

    private final McpsCompiler compiler = new McpsCompiler();
    private final UnaryOperator<ExecutionOptions.Builder> collaborators;

    public McpsRunner() {
        this(UnaryOperator.identity());
    }

    public McpsRunner(UnaryOperator<ExecutionOptions.Builder> collaborators) {
        this.collaborators = collaborators;
    }

    public RunResult run(McpsRunConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("script", configuration.scriptPath().toString());
        metadata.put("logLevel", configuration.logLevel().name());
        applyLogLevel(configuration.logLevel());
        try {
            String source = Files.readString(configuration.scriptPath());
            GeneratedScript script = compiler.compile(source, configuration.scriptPath().toString());
            ExecutionOptions options = collaborators.apply(ExecutionOptions.builder()
                .timeout(configuration.timeout().orElse(ExecutionOptions.DEFAULT_TIMEOUT))
                .environment(environment(configuration)))
                .build();
            ExecutionResult result;
            try (var engine = new ExecutionEngine()) {
                result = engine.execute(script, options);
            }
            if (!result.isSuccess()) {
                return RunResult.failure(result.error().kind(), result.error().message(), metadata, started);
            }
            metadata.put("bindings", result.outcome().bindings());
            metadata.put("elapsedMs", result.outcome().elapsed().toMillis());
            return RunResult.success(metadata, started);
        } catch (ScriptException ex) {
            LOG.debug("Compilation failed", ex);
            return RunResult.failure(ex.kind(), ex.getMessage(), metadata, started);
        } catch (IOException ex) {
            if (Boolean.getBoolean("mcps.debug")) {
                ex.printStackTrace();
            }
            return RunResult.failure(ErrorKind.RUNTIME, "Unable to read " + configuration.scriptPath() + ": " + ex.getMessage(), metadata, started);
        }
    }

    /**
     * Sets the threshold for the engine's own diagnostics; script output is unaffected.
     */
    private static void applyLogLevel(LogLevel level) {
        if (LoggerFactory.getLogger(ENGINE_LOGGER) instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.toLevel(level.name(), Level.WARN));
        }
    }

    private static EnvironmentAccessor environment(McpsRunConfiguration configuration) {
        Map<String, String> fileValues = configuration.envFile()
            .map(DotenvLoader::load)
            .orElseGet(() -> DotenvLoader.load(configuration.workingDirectory().resolve(".env")));
        return EnvironmentAccessor.of(DotenvLoader.merge(fileValues, System.getenv()));
    }
}
