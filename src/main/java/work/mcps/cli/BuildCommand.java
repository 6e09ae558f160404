package work.mcps.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.mcps.api.McpsCompiler;

@CommandLine.Command(
    name = "build",
    description = "Write a script's generated module to <name>.mjs.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class BuildCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Script to build (.mcps).")
    private Path file;

    @CommandLine.Option(
        names = {"-o", "--out-dir"},
        description = "Output directory (default: the script's directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path outDir;

    @Override
    public Integer call() throws Exception {
        McpsCommand.requireSource(spec.commandLine(), file);
        var compiler = new McpsCompiler();
        var script = compiler.compile(Files.readString(file), file.toString());
        Path directory = outDir != null ? outDir : file.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path target = directory.resolve(McpsCompiler.moduleName(file));
        Files.writeString(target, compiler.toModule(script));
        spec.commandLine().getOut().println("Wrote " + target);
        spec.commandLine().getOut().flush();
        return 0;
    }
}
