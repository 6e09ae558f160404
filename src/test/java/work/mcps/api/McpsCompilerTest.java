package work.mcps.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import work.mcps.error.ErrorKind;
import work.mcps.error.ScriptException;

class McpsCompilerTest {
    private final McpsCompiler compiler = new McpsCompiler();

    @Test
    void wrapsScriptsAsModules() {
        String module = compiler.toModule(compiler.compile("x = 1"));

        assertEquals(
            "export default async function main() {\n  // Main\n  var x = 1;\n\n  return { x };\n}\n",
            module
        );
    }

    @Test
    void invalidProgramsProduceNoCode() {
        var error = assertThrows(ScriptException.class, () -> compiler.compile("y = missing + 1"));

        assertEquals(ErrorKind.REFERENCE, error.kind());
    }

    @Test
    void namesModulesAfterTheSource() {
        assertEquals("agent.mjs", McpsCompiler.moduleName(Path.of("dir", "agent.mcps")));
        assertTrue(McpsCompiler.isSourceFile(Path.of("agent.mcps")));
        assertFalse(McpsCompiler.isSourceFile(Path.of("agent.js")));
    }
}
