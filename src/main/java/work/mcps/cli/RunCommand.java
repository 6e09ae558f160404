package work.mcps.cli;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.mcps.api.LogLevel;
import work.mcps.api.McpsRunConfiguration;
import work.mcps.api.McpsRunner;
import work.mcps.api.RunResult;
import work.mcps.shared.DurationParser;
import work.mcps.shared.ProjectConfig;

@CommandLine.Command(
    name = "run",
    description = "Compile and execute a script.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class RunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Script to run (.mcps).")
    private Path file;

    @CommandLine.Option(
        names = "--timeout",
        description = "Execution timeout (e.g. 500ms, 30s, 2m; 0 disables it).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Engine log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--env-file",
        description = "Dotenv file (default: .env next to the script).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path envFile;

    @CommandLine.Option(
        names = "--json",
        description = "Print the run result (bindings or error) as JSON."
    )
    private boolean json;

    @Override
    public Integer call() throws Exception {
        McpsCommand.requireSource(spec.commandLine(), file);
        Path directory = file.toAbsolutePath().getParent();
        ProjectConfig project = ProjectConfig.load(directory);

        Optional<Duration> timeout = DurationParser.parse(timeoutRaw).or(project::timeout);
        LogLevel logLevel = resolveLogLevel(project);

        var configuration = McpsRunConfiguration.builder()
            .scriptPath(file)
            .workingDirectory(directory)
            .timeout(timeout)
            .envFile(Optional.ofNullable(envFile).or(project::envFile))
            .logLevel(logLevel)
            .build();
        var input = new ConsoleInputHandler(System.in, spec.commandLine().getOut());
        RunResult result = new McpsRunner(options -> options.inputHandler(input)).run(configuration);

        if (json) {
            spec.commandLine().getOut().println(result.toPrettyJson());
        } else if (result.status() == RunResult.Status.FAILURE) {
            spec.commandLine().getErr().println(spec.commandLine().getColorScheme().errorText(result.errorSummary()));
        }
        return result.status().exitCode();
    }

    private LogLevel resolveLogLevel(ProjectConfig project) {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("MCPS_LOG_LEVEL");
        }
        if (candidate == null || candidate.isBlank()) {
            candidate = project.logLevel().orElse(null);
        }
        return LogLevel.from(candidate);
    }
}
