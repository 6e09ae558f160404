package work.mcps.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Binary operators ordered by binding strength: a higher precedence binds tighter.
 */
public enum BinaryOperator {
    DELEGATE("->", 0),
    COALESCE("??", 1),
    OR("||", 2),
    AND("&&", 3),
    EQUAL("==", 4),
    NOT_EQUAL("!=", 4),
    LESS("<", 4),
    GREATER(">", 4),
    LESS_EQUAL("<=", 4),
    GREATER_EQUAL(">=", 4),
    ADD("+", 5),
    SUBTRACT("-", 5),
    MULTIPLY("*", 6),
    DIVIDE("/", 6),
    MODULO("%", 6);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * True for the operators the target language refuses to mix with {@code ??} without parentheses.
     */
    public boolean isShortCircuitLogical() {
        return this == OR || this == AND;
    }

    /**
     * Resolves a source spelling; both {@code ->} and {@code |} denote delegation.
     */
    public static Optional<BinaryOperator> fromSymbol(String symbol) {
        if ("|".equals(symbol)) {
            return Optional.of(DELEGATE);
        }
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }
}
