package work.mcps.ast;

import java.util.List;
import java.util.Objects;

/**
 * Expression nodes. Every node reports its {@link Kind} so consumers can dispatch with a switch.
 */
public interface Expression {

    Kind kind();

    enum Kind {
        IDENTIFIER,
        STRING,
        NUMBER,
        BOOLEAN,
        NULL,
        ARRAY,
        OBJECT,
        CALL,
        MEMBER,
        BRACKET,
        BINARY,
        UNARY
    }

    /**
     * True when this expression may appear on the left of {@code =}.
     */
    default boolean isAssignable() {
        return kind() == Kind.IDENTIFIER || kind() == Kind.MEMBER || kind() == Kind.BRACKET;
    }

    record Identifier(String name) implements Expression {
        public Identifier {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public Kind kind() {
            return Kind.IDENTIFIER;
        }
    }

    record StringLiteral(String value) implements Expression {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    record NumberLiteral(double value) implements Expression {
        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }
    }

    record BooleanLiteral(boolean value) implements Expression {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }
    }

    record NullLiteral() implements Expression {
        @Override
        public Kind kind() {
            return Kind.NULL;
        }
    }

    record ArrayLiteral(List<Expression> elements) implements Expression {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }

    /**
     * Object literal; properties keep their source order and duplicates are retained as written.
     */
    record ObjectLiteral(List<Property> properties) implements Expression {
        public ObjectLiteral {
            properties = List.copyOf(properties);
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }
    }

    record Call(Expression callee, List<Expression> arguments) implements Expression {
        public Call {
            Objects.requireNonNull(callee, "callee");
            arguments = List.copyOf(arguments);
        }

        @Override
        public Kind kind() {
            return Kind.CALL;
        }
    }

    record Member(Expression object, String property) implements Expression {
        public Member {
            Objects.requireNonNull(object, "object");
            Objects.requireNonNull(property, "property");
        }

        @Override
        public Kind kind() {
            return Kind.MEMBER;
        }
    }

    record Bracket(Expression object, Expression index) implements Expression {
        public Bracket {
            Objects.requireNonNull(object, "object");
            Objects.requireNonNull(index, "index");
        }

        @Override
        public Kind kind() {
            return Kind.BRACKET;
        }
    }

    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
        public Binary {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public Kind kind() {
            return Kind.BINARY;
        }
    }

    record Unary(UnaryOperator operator, Expression operand) implements Expression {
        public Unary {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public Kind kind() {
            return Kind.UNARY;
        }
    }
}
