package work.mcps.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import work.mcps.runtime.Agent;
import work.mcps.runtime.Conversation;
import work.mcps.runtime.ScriptConsole;
import work.mcps.runtime.ToolDescriptor;
import work.mcps.runtime.ToolServerClient;

class McpsRunnerTest {
    private static final Path SCRIPTS = Path.of("src", "test", "resources", "scripts").toAbsolutePath();

    @Test
    void runsLocalScriptFile() {
        List<String> printed = new CopyOnWriteArrayList<>();
        var runner = new McpsRunner(options -> options.console(new ScriptConsole() {
            @Override
            public void out(String line) {
                printed.add(line);
            }

            @Override
            public void err(String line) {
                printed.add(line);
            }
        }));

        var result = runner.run(McpsRunConfiguration.builder()
            .scriptPath(SCRIPTS.resolve("counter.mcps"))
            .logLevel(LogLevel.INFO)
            .build());

        assertEquals(RunResult.Status.SUCCESS, result.status(), result::errorSummary);
        var bindings = (Map<?, ?>) result.metadata().get("bindings");
        assertEquals(3, bindings.get("total"));
        assertEquals("total: 3", bindings.get("label"));
        assertEquals(List.of("total: 3"), printed);
    }

    @Test
    void wiresCollaboratorsIntoDeclarations() {
        List<String> toolNames = new CopyOnWriteArrayList<>();
        var runner = new McpsRunner(options -> options
            .modelFactory((name, config) -> config.get("model"))
            .toolServerFactory((name, config) -> new EmptyToolServer())
            .agentFactory(definition -> {
                definition.tools().forEach(tool -> toolNames.add(tool.name()));
                return new Agent() {
                    @Override
                    public String name() {
                        return definition.name();
                    }

                    @Override
                    public CompletableFuture<Conversation> run(Object prompt) {
                        return CompletableFuture.completedFuture(new Conversation(String.valueOf(prompt))
                            .add(new Conversation.Message(Conversation.Message.ASSISTANT, "Hello!")));
                    }
                };
            }));

        var result = runner.run(McpsRunConfiguration.builder()
            .scriptPath(SCRIPTS.resolve("agents.mcps"))
            .build());

        assertEquals(RunResult.Status.SUCCESS, result.status(), result::errorSummary);
        var bindings = (Map<?, ?>) result.metadata().get("bindings");
        assertEquals("Hello!", bindings.get("answer"));
        assertEquals(List.of("shout"), toolNames);
    }

    private static final class EmptyToolServer implements ToolServerClient {
        @Override
        public CompletableFuture<Void> connect() {
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<List<ToolDescriptor>> listTools() {
            return CompletableFuture.completedFuture(List.of());
        }

        @Override
        public CompletableFuture<Object> callTool(String name, Map<String, Object> arguments) {
            return CompletableFuture.failedFuture(new IllegalStateException("no tools"));
        }

        @Override
        public CompletableFuture<Void> close() {
            return CompletableFuture.completedFuture(null);
        }
    }

    @Test
    void appliesTheConfiguredLogLevel() {
        var result = new McpsRunner().run(McpsRunConfiguration.builder()
            .scriptPath(SCRIPTS.resolve("broken.mcps"))
            .logLevel(LogLevel.DEBUG)
            .build());

        assertEquals("DEBUG", result.metadata().get("logLevel"));
        var logger = (Logger) LoggerFactory.getLogger(McpsRunner.ENGINE_LOGGER);
        assertEquals(Level.DEBUG, logger.getLevel());
        logger.setLevel(Level.INFO);
    }

    @Test
    void syntaxErrorsFailBeforeExecution() {
        var result = new McpsRunner().run(McpsRunConfiguration.builder()
            .scriptPath(SCRIPTS.resolve("broken.mcps"))
            .build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("SyntaxError", result.metadata().get("errorKind"));
        assertTrue(result.errorSummary().startsWith("SyntaxError: line "), result.errorSummary());
    }

    @Test
    void missingFileIsARuntimeFailure(@TempDir Path dir) {
        var result = new McpsRunner().run(McpsRunConfiguration.builder()
            .scriptPath(dir.resolve("absent.mcps"))
            .build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("RuntimeError", result.metadata().get("errorKind"));
    }

    @Test
    void envFileValuesReachTheScript(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("greet.mcps");
        Files.writeString(script, "who = env.MCPS_TEST_WHO");
        Path envFile = dir.resolve("test.env");
        Files.writeString(envFile, "MCPS_TEST_WHO=Ada\n");

        var result = new McpsRunner().run(McpsRunConfiguration.builder()
            .scriptPath(script)
            .envFile(Optional.of(envFile))
            .build());

        var bindings = (Map<?, ?>) result.metadata().get("bindings");
        assertEquals("Ada", bindings.get("who"));
    }

    @Test
    void serializesToJson() {
        var result = new McpsRunner().run(McpsRunConfiguration.builder()
            .scriptPath(SCRIPTS.resolve("broken.mcps"))
            .build());

        String json = result.toPrettyJson();
        assertTrue(json.contains("\"status\" : \"failure\""), json);
        assertTrue(json.contains("\"errorKind\" : \"SyntaxError\""), json);
    }
}
