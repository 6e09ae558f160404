package work.mcps.codegen;

import java.util.ArrayList;
import java.util.List;
import work.mcps.ast.BinaryOperator;
import work.mcps.ast.Expression;
import work.mcps.ast.Property;
import work.mcps.ast.UnaryOperator;

/**
 * Renders expressions as JavaScript source.
 * Every call is a suspension point and is prefixed with {@code await}; parentheses are only added where
 * the target grammar would otherwise regroup the operands.
 */
final class ExpressionEmitter {

    String emit(Expression expr) {
        return switch (expr.kind()) {
            case IDENTIFIER -> ((Expression.Identifier) expr).name();
            case STRING -> JsLiterals.string(((Expression.StringLiteral) expr).value());
            case NUMBER -> JsLiterals.number(((Expression.NumberLiteral) expr).value());
            case BOOLEAN -> String.valueOf(((Expression.BooleanLiteral) expr).value());
            case NULL -> "null";
            case ARRAY -> array((Expression.ArrayLiteral) expr);
            case OBJECT -> object((Expression.ObjectLiteral) expr);
            case CALL -> call((Expression.Call) expr);
            case MEMBER -> member((Expression.Member) expr);
            case BRACKET -> bracket((Expression.Bracket) expr);
            case BINARY -> binary((Expression.Binary) expr);
            case UNARY -> unary((Expression.Unary) expr);
        };
    }

    private String array(Expression.ArrayLiteral expr) {
        return "[" + join(expr.elements()) + "]";
    }

    String object(Expression.ObjectLiteral expr) {
        return objectLiteral(expr.properties());
    }

    String objectLiteral(List<Property> properties) {
        if (properties.isEmpty()) {
            return "{}";
        }
        List<String> parts = new ArrayList<>(properties.size());
        for (Property property : properties) {
            parts.add(JsLiterals.propertyKey(property.key()) + ": " + emit(property.value()));
        }
        return "{ " + String.join(", ", parts) + " }";
    }

    private String call(Expression.Call expr) {
        return "await " + operand(expr.callee()) + "(" + join(expr.arguments()) + ")";
    }

    private String member(Expression.Member expr) {
        return operand(expr.object()) + "." + expr.property();
    }

    private String bracket(Expression.Bracket expr) {
        return operand(expr.object()) + "[" + emit(expr.index()) + "]";
    }

    /**
     * Object position of a member access or call: anything that is not already a primary gets wrapped,
     * so {@code a.b().c} becomes {@code (await a.b()).c} and the bare access stays unawaited.
     */
    private String operand(Expression expr) {
        String code = emit(expr);
        return switch (expr.kind()) {
            case CALL, BINARY, UNARY, NUMBER, OBJECT -> "(" + code + ")";
            default -> code;
        };
    }

    private String binary(Expression.Binary expr) {
        if (expr.operator() == BinaryOperator.DELEGATE) {
            return delegation(expr);
        }
        String left = emit(expr.left());
        String right = emit(expr.right());
        if (needsParentheses(expr.left(), expr.operator(), false)) {
            left = "(" + left + ")";
        }
        if (needsParentheses(expr.right(), expr.operator(), true)) {
            right = "(" + right + ")";
        }
        return left + " " + expr.operator().symbol() + " " + right;
    }

    /**
     * {@code prompt -> agent} becomes {@code await agent.run(prompt)}.
     */
    private String delegation(Expression.Binary expr) {
        String prompt = emit(expr.left());
        return "await " + operand(expr.right()) + "." + HostFunctions.AGENT_ENTRYPOINT + "(" + prompt + ")";
    }

    private static boolean needsParentheses(Expression child, BinaryOperator parent, boolean rightSide) {
        if (!(child instanceof Expression.Binary binary) || binary.operator() == BinaryOperator.DELEGATE) {
            return false;
        }
        BinaryOperator op = binary.operator();
        if (parent == BinaryOperator.COALESCE && op.isShortCircuitLogical()) {
            return true;
        }
        if (parent.isShortCircuitLogical() && op == BinaryOperator.COALESCE) {
            return true;
        }
        if (op.precedence() < parent.precedence()) {
            return true;
        }
        if (op.precedence() == parent.precedence()) {
            // equality and relational share a level here but not in JavaScript, so keep comparisons grouped
            return rightSide || op.precedence() == BinaryOperator.EQUAL.precedence();
        }
        return false;
    }

    private String unary(Expression.Unary expr) {
        String operand = emit(expr.operand());
        boolean wrap = expr.operand() instanceof Expression.Binary binary && binary.operator() != BinaryOperator.DELEGATE
            || expr.operator() == UnaryOperator.NEGATE && operand.startsWith("-");
        return expr.operator().symbol() + (wrap ? "(" + operand + ")" : operand);
    }

    private String join(List<Expression> expressions) {
        List<String> parts = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            parts.add(emit(expression));
        }
        return String.join(", ", parts);
    }
}
