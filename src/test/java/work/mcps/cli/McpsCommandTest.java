package work.mcps.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class McpsCommandTest {
    private static final Path SCRIPTS = Path.of("src", "test", "resources", "scripts").toAbsolutePath();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void compilePrintsGeneratedCode() {
        int exit = commandLine.execute("compile", SCRIPTS.resolve("counter.mcps").toString());

        assertEquals(0, exit, err::toString);
        assertTrue(out.toString().startsWith("// Main\n// Counts to three and reports the total.\nvar total = 0;\n"), out.toString());
        assertTrue(out.toString().contains("await print(label);"), out.toString());
    }

    @Test
    void compileReportsSyntaxErrors() {
        int exit = commandLine.execute("compile", SCRIPTS.resolve("broken.mcps").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("SyntaxError: line "), err.toString());
    }

    @Test
    void rejectsOtherExtensions(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("script.js");
        Files.writeString(file, "x = 1");

        int exit = commandLine.execute("compile", file.toString());

        assertEquals(2, exit);
        assertTrue(err.toString().contains("Expected a .mcps file"), err.toString());
    }

    @Test
    void buildWritesModule(@TempDir Path dir) throws Exception {
        int exit = commandLine.execute("build", SCRIPTS.resolve("counter.mcps").toString(), "--out-dir", dir.toString());

        assertEquals(0, exit, err::toString);
        Path module = dir.resolve("counter.mjs");
        assertTrue(Files.isRegularFile(module));
        assertTrue(Files.readString(module).startsWith("export default async function main() {\n"));
        assertTrue(out.toString().contains("Wrote " + module), out.toString());
    }

    @Test
    void runFailsWithExitCodeOne() {
        int exit = commandLine.execute("run", SCRIPTS.resolve("broken.mcps").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("SyntaxError"), err.toString());
    }

    @Test
    void runPrintsJsonResult() {
        int exit = commandLine.execute("run", "--json", "--timeout", "10s", SCRIPTS.resolve("counter.mcps").toString());

        assertEquals(0, exit, err::toString);
        assertTrue(out.toString().contains("\"status\" : \"success\""), out.toString());
        assertTrue(out.toString().contains("\"label\" : \"total: 3\""), out.toString());
    }

    @Test
    void missingSubcommandIsAUsageError() {
        assertEquals(2, commandLine.execute());
    }
}
