package work.mcps.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.mcps.api.McpsCompiler;

@CommandLine.Command(
    name = "compile",
    description = "Print the JavaScript generated for a script.",
    mixinStandardHelpOptions = true
)
final class CompileCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Script to compile (.mcps).")
    private Path file;

    @Override
    public Integer call() throws Exception {
        McpsCommand.requireSource(spec.commandLine(), file);
        var script = new McpsCompiler().compile(Files.readString(file), file.toString());
        spec.commandLine().getOut().print(script.code());
        spec.commandLine().getOut().flush();
        return 0;
    }
}
