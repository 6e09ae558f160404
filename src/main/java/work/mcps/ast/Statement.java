package work.mcps.ast;

import java.util.List;
import java.util.Objects;

/**
 * Statement nodes. Declarations live in {@link Declaration}; the remaining variants are nested here.
 */
public interface Statement {

    Kind kind();

    enum Kind {
        COMMENT,
        MCP_DECLARATION,
        MODEL_DECLARATION,
        AGENT_DECLARATION,
        TOOL_DECLARATION,
        ASSIGNMENT,
        EXPRESSION,
        BLOCK,
        IF,
        WHILE,
        FOR,
        BREAK,
        CONTINUE,
        RETURN;

        public boolean isDeclaration() {
            return this == MCP_DECLARATION || this == MODEL_DECLARATION || this == AGENT_DECLARATION || this == TOOL_DECLARATION;
        }
    }

    /**
     * Source comment, kept verbatim including its delimiters.
     */
    record Comment(String text) implements Statement {
        public Comment {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public Kind kind() {
            return Kind.COMMENT;
        }
    }

    /**
     * {@code target = value}; the target is an identifier, member or bracket expression.
     */
    record Assignment(Expression target, Expression value) implements Statement {
        public Assignment {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
            if (!target.isAssignable()) {
                throw new IllegalArgumentException("Invalid assignment target: " + target.kind());
            }
        }

        @Override
        public Kind kind() {
            return Kind.ASSIGNMENT;
        }
    }

    record ExpressionStatement(Expression expression) implements Statement {
        public ExpressionStatement {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public Kind kind() {
            return Kind.EXPRESSION;
        }
    }

    record Block(List<Statement> statements) implements Statement {
        public Block {
            statements = List.copyOf(statements);
        }

        public static Block of(Statement... statements) {
            return new Block(List.of(statements));
        }

        @Override
        public Kind kind() {
            return Kind.BLOCK;
        }
    }

    /**
     * Conditional. {@code elseBranch} is {@code null} when absent; either branch may be a single statement or a block.
     */
    record If(Expression condition, Statement thenBranch, Statement elseBranch) implements Statement {
        public If {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(thenBranch, "thenBranch");
        }

        @Override
        public Kind kind() {
            return Kind.IF;
        }
    }

    record While(Expression condition, Statement body) implements Statement {
        public While {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public Kind kind() {
            return Kind.WHILE;
        }
    }

    /**
     * C-style loop. Each clause is {@code null} when omitted; {@code for (;;)} leaves all three empty.
     */
    record For(Assignment init, Expression condition, Assignment update, Statement body) implements Statement {
        public For {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public Kind kind() {
            return Kind.FOR;
        }
    }

    record Break() implements Statement {
        @Override
        public Kind kind() {
            return Kind.BREAK;
        }
    }

    record Continue() implements Statement {
        @Override
        public Kind kind() {
            return Kind.CONTINUE;
        }
    }

    record Return(Expression value) implements Statement {
        @Override
        public Kind kind() {
            return Kind.RETURN;
        }
    }
}
