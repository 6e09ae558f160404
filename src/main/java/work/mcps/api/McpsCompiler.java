package work.mcps.api;

import java.nio.file.Path;
import work.mcps.ast.Program;
import work.mcps.codegen.CodeGenerator;
import work.mcps.codegen.GeneratedScript;
import work.mcps.parser.ScriptParser;
import work.mcps.validate.Validator;

/**
 * Parse, validate and generate in one call. Any failure stops the pipeline with a
 * {@link work.mcps.error.ScriptException}; nothing is generated for an invalid program.
 */
public final class McpsCompiler {
    public static final String SOURCE_EXTENSION = ".mcps";
    public static final String MODULE_EXTENSION = ".mjs";

    private final Validator validator = new Validator();
    private final CodeGenerator generator = new CodeGenerator();

    public GeneratedScript compile(String source) {
        return compile(source, "<script>");
    }

    public GeneratedScript compile(String source, String sourceName) {
        Program program = ScriptParser.parse(source, sourceName);
        validator.validate(program);
        return generator.generate(program);
    }

    /**
     * Standalone module form written by {@code mcps build}: the script body as the default-exported async function.
     */
    public String toModule(GeneratedScript script) {
        StringBuilder out = new StringBuilder("export default async function main() {\n");
        String code = script.code().endsWith("\n") ? script.code().substring(0, script.code().length() - 1) : script.code();
        for (String line : code.split("\n", -1)) {
            if (!line.isEmpty()) {
                out.append("  ").append(line);
            }
            out.append('\n');
        }
        return out.append("}\n").toString();
    }

    public static boolean isSourceFile(Path path) {
        return path.getFileName() != null && path.getFileName().toString().endsWith(SOURCE_EXTENSION);
    }

    /**
     * {@code dir/agent.mcps} builds to {@code agent.mjs}.
     */
    public static String moduleName(Path source) {
        String name = source.getFileName().toString();
        String base = name.endsWith(SOURCE_EXTENSION) ? name.substring(0, name.length() - SOURCE_EXTENSION.length()) : name;
        return base + MODULE_EXTENSION;
    }
}
