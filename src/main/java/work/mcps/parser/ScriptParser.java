package work.mcps.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import work.mcps.ast.Program;

/**
 * Entry point of the front end: source text to {@link Program}.
 * Any lexical or grammatical error raises {@link work.mcps.error.ScriptSyntaxException}.
 */
public final class ScriptParser {
    private ScriptParser() {}

    public static Program parse(String source) {
        return parse(CharStreams.fromString(source));
    }

    public static Program parse(String source, String sourceName) {
        return parse(CharStreams.fromString(source, sourceName));
    }

    static Program parse(CharStream input) {
        McpScriptLexer lexer = new McpScriptLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        McpScriptParser parser = new McpScriptParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);

        McpScriptParser.ProgramContext tree = parser.program();
        return new AstBuilder(tokens).buildProgram(tree);
    }
}
