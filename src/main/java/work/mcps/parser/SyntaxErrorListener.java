package work.mcps.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.IntervalSet;
import work.mcps.error.ScriptSyntaxException;

/**
 * Turns the first lexer or parser error into a {@link ScriptSyntaxException}; no recovery is attempted.
 */
final class SyntaxErrorListener extends BaseErrorListener {
    static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

    private SyntaxErrorListener() {}

    @Override
    public void syntaxError(
        Recognizer<?, ?> recognizer,
        Object offendingSymbol,
        int line,
        int charPositionInLine,
        String msg,
        RecognitionException e
    ) {
        throw new ScriptSyntaxException(line, charPositionInLine, expected(recognizer, e), msg);
    }

    private static String expected(Recognizer<?, ?> recognizer, RecognitionException e) {
        if (!(recognizer instanceof Parser parser)) {
            return "valid token";
        }
        IntervalSet tokens = e != null && e.getExpectedTokens() != null ? e.getExpectedTokens() : parser.getExpectedTokens();
        if (tokens == null || tokens.isNil()) {
            return "";
        }
        return tokens.toString(parser.getVocabulary());
    }
}
