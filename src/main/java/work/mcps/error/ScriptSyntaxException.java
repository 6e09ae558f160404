package work.mcps.error;

/**
 * Structurally invalid source. Line is 1-based, column 0-based (as reported by the lexer).
 */
public final class ScriptSyntaxException extends ScriptException {
    private final int line;
    private final int column;
    private final String expected;

    public ScriptSyntaxException(int line, int column, String expected, String message) {
        super(ErrorKind.SYNTAX, "line " + line + ":" + column + " " + message);
        this.line = line;
        this.column = column;
        this.expected = expected;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public String expected() {
        return expected;
    }
}
