package work.mcps.ast;

import java.util.List;

/**
 * Root of a parsed MCP Script: the statements in document order.
 */
public record Program(List<Statement> statements) {
    public Program {
        statements = List.copyOf(statements);
    }

    public static Program of(Statement... statements) {
        return new Program(List.of(statements));
    }
}
