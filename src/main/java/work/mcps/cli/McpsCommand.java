package work.mcps.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;
import work.mcps.api.McpsCompiler;

@CommandLine.Command(
    name = "mcps",
    description = "Compile and run MCP Script (.mcps) programs.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { RunCommand.class, CompileCommand.class, BuildCommand.class }
)
final class McpsCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: run, compile or build");
    }

    /**
     * Rejects anything that is not an existing {@code .mcps} file.
     */
    static Path requireSource(CommandLine commandLine, Path file) {
        if (!McpsCompiler.isSourceFile(file)) {
            throw new CommandLine.ParameterException(commandLine, "Expected a " + McpsCompiler.SOURCE_EXTENSION + " file: " + file);
        }
        if (!Files.isRegularFile(file)) {
            throw new CommandLine.ParameterException(commandLine, "File not found: " + file);
        }
        return file;
    }
}
