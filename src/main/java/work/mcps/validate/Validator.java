package work.mcps.validate;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mcps.ast.Declaration;
import work.mcps.ast.Expression;
import work.mcps.ast.Program;
import work.mcps.ast.Property;
import work.mcps.ast.Statement;
import work.mcps.codegen.HostFunctions;
import work.mcps.codegen.ScopeStack;
import work.mcps.error.DeclarationException;
import work.mcps.error.UndefinedReferenceException;

/**
 * Static checks run between parsing and code generation: name resolution and declaration completeness.
 *
 * <p>Scoping follows {@link ScopeStack} exactly as the generator uses it. Declaration names are hoisted
 * before any statement is inspected; declaration config blocks only see the built-ins and those names,
 * since their code runs before the main statement stream. The first failure is thrown.
 */
public final class Validator {
    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    // JavaScript reserved words, including strict-mode and async-function ones; none can name a binding.
    private static final Set<String> RESERVED_WORDS = Set.of(
        "await", "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete", "do",
        "else", "enum", "export", "extends", "false", "finally", "for", "function", "if", "implements", "import",
        "in", "instanceof", "interface", "let", "new", "null", "package", "private", "protected", "public",
        "return", "static", "super", "switch", "this", "throw", "true", "try", "typeof", "var", "void", "while",
        "with", "yield"
    );

    public void validate(Program program) {
        Map<String, Statement.Kind> declarations = collectDeclarations(program);
        List<String> initial = HostFunctions.initialScope(List.copyOf(declarations.keySet()));
        var pass = new Pass(new ScopeStack(initial), new ScopeStack(initial), declarations);
        for (Statement statement : program.statements()) {
            pass.topLevel(statement);
        }
    }

    private static Map<String, Statement.Kind> collectDeclarations(Program program) {
        Map<String, Statement.Kind> declarations = new LinkedHashMap<>();
        for (Statement statement : program.statements()) {
            if (!(statement instanceof Declaration declaration)) {
                continue;
            }
            requireBindable(declaration.name(), declaration.name());
            Statement.Kind previous = declarations.putIfAbsent(declaration.name(), declaration.kind());
            if (previous != null) {
                throw new DeclarationException(
                    declaration.name(),
                    "\"" + declaration.name() + "\" is already declared as " + label(previous)
                );
            }
        }
        return declarations;
    }

    private static void requireBindable(String name, String declarationName) {
        if (RESERVED_WORDS.contains(name)) {
            throw new DeclarationException(declarationName, "\"" + name + "\" is a reserved word and cannot be used as a name");
        }
    }

    private static String label(Statement.Kind kind) {
        return switch (kind) {
            case MCP_DECLARATION -> "an mcp server";
            case MODEL_DECLARATION -> "a model";
            case AGENT_DECLARATION -> "an agent";
            case TOOL_DECLARATION -> "a tool";
            default -> "a declaration";
        };
    }

    private static String keyword(Statement.Kind kind) {
        return switch (kind) {
            case MCP_DECLARATION -> "mcp";
            case MODEL_DECLARATION -> "model";
            case AGENT_DECLARATION -> "agent";
            default -> "tool";
        };
    }

    private static final class Pass {
        private final ScopeStack scope;
        private final ScopeStack declarationScope;
        private final Map<String, Statement.Kind> declarations;
        private final Set<String> parameters = new HashSet<>();
        private String context;

        Pass(ScopeStack scope, ScopeStack declarationScope, Map<String, Statement.Kind> declarations) {
            this.scope = scope;
            this.declarationScope = declarationScope;
            this.declarations = declarations;
        }

        void topLevel(Statement statement) {
            if (statement instanceof Declaration.Configured configured) {
                configured(configured);
            } else if (statement instanceof Declaration.Tool tool) {
                tool(tool);
            } else {
                statement(statement);
            }
        }

        // --- Declarations ---

        private void configured(Declaration.Configured declaration) {
            context = keyword(declaration.kind()) + " \"" + declaration.name() + "\"";
            Set<String> keys = new HashSet<>();
            for (Property property : declaration.config()) {
                if (!keys.add(property.key())) {
                    throw new DeclarationException(
                        declaration.name(),
                        "Duplicate key \"" + property.key() + "\" in " + context
                    );
                }
                expression(property.value(), declarationScope);
            }
            if (declaration.kind() == Statement.Kind.AGENT_DECLARATION) {
                boolean modelResolves = declaration.get("model")
                    .filter(Expression.Identifier.class::isInstance)
                    .map(expr -> declarations.get(((Expression.Identifier) expr).name()))
                    .filter(kind -> kind == Statement.Kind.MODEL_DECLARATION)
                    .isPresent();
                if (!modelResolves) {
                    throw new DeclarationException(
                        declaration.name(),
                        "Agent \"" + declaration.name() + "\" must specify a model reference"
                    );
                }
            }
            context = null;
        }

        private void tool(Declaration.Tool tool) {
            context = keyword(tool.kind()) + " \"" + tool.name() + "\"";
            scope.push();
            Set<String> seen = new HashSet<>();
            for (Declaration.Parameter parameter : tool.parameters()) {
                if (!seen.add(parameter.name())) {
                    throw new DeclarationException(tool.name(), "Duplicate parameter \"" + parameter.name() + "\" in " + context);
                }
                requireBindable(parameter.name(), tool.name());
                scope.declare(parameter.name());
            }
            parameters.addAll(seen);
            for (Statement statement : tool.body().statements()) {
                statement(statement);
            }
            parameters.clear();
            scope.pop();
            context = null;
        }

        // --- Statements ---

        private void statement(Statement statement) {
            switch (statement.kind()) {
                case COMMENT, BREAK, CONTINUE -> {
                }
                case MCP_DECLARATION, MODEL_DECLARATION, AGENT_DECLARATION, TOOL_DECLARATION -> {
                    String name = ((Declaration) statement).name();
                    throw new DeclarationException(name, "Declaration \"" + name + "\" must appear at the top level");
                }
                case ASSIGNMENT -> assignment((Statement.Assignment) statement, true);
                case EXPRESSION -> expression(((Statement.ExpressionStatement) statement).expression(), scope);
                case BLOCK -> block((Statement.Block) statement);
                case IF -> {
                    var ifStatement = (Statement.If) statement;
                    expression(ifStatement.condition(), scope);
                    body(ifStatement.thenBranch());
                    if (ifStatement.elseBranch() != null) {
                        body(ifStatement.elseBranch());
                    }
                }
                case WHILE -> {
                    var loop = (Statement.While) statement;
                    expression(loop.condition(), scope);
                    body(loop.body());
                }
                case FOR -> {
                    var loop = (Statement.For) statement;
                    if (loop.init() != null) {
                        assignment(loop.init(), true);
                    }
                    if (loop.condition() != null) {
                        expression(loop.condition(), scope);
                    }
                    if (loop.update() != null) {
                        assignment(loop.update(), false);
                    }
                    body(loop.body());
                }
                case RETURN -> {
                    Expression value = ((Statement.Return) statement).value();
                    if (value != null) {
                        expression(value, scope);
                    }
                }
                default -> throw new IllegalStateException("Unknown statement kind: " + statement.kind());
            }
        }

        private void block(Statement.Block block) {
            scope.push();
            for (Statement statement : block.statements()) {
                statement(statement);
            }
            scope.pop();
        }

        private void body(Statement body) {
            if (body instanceof Statement.Block block) {
                block(block);
            } else {
                statement(body);
            }
        }

        /**
         * The value is checked before the target is introduced, so {@code x = x + 1} needs an earlier {@code x}.
         * A for-loop update never introduces its target. Declared names are constants; a tool parameter of the
         * same name shadows them inside the tool.
         */
        private void assignment(Statement.Assignment assignment, boolean declares) {
            expression(assignment.value(), scope);
            Expression target = assignment.target();
            if (target instanceof Expression.Identifier identifier) {
                String name = identifier.name();
                requireBindable(name, name);
                Statement.Kind declared = declarations.get(name);
                if (declared != null && !parameters.contains(name)) {
                    throw new DeclarationException(name, "Cannot assign to " + label(declared) + " \"" + name + "\"");
                }
                if (declares) {
                    scope.declare(identifier.name());
                }
            } else {
                expression(target, scope);
            }
        }

        // --- Expressions ---

        private void expression(Expression expr, ScopeStack visible) {
            switch (expr.kind()) {
                case IDENTIFIER -> {
                    String name = ((Expression.Identifier) expr).name();
                    if (!visible.isDeclared(name)) {
                        throw new UndefinedReferenceException(name, context);
                    }
                }
                case STRING, NUMBER, BOOLEAN, NULL -> {
                }
                case ARRAY -> ((Expression.ArrayLiteral) expr).elements().forEach(element -> expression(element, visible));
                case OBJECT -> {
                    Map<String, Integer> counts = new HashMap<>();
                    for (Property property : ((Expression.ObjectLiteral) expr).properties()) {
                        if (counts.merge(property.key(), 1, Integer::sum) == 2) {
                            LOG.warn("Duplicate key \"{}\" in object literal; the last value wins", property.key());
                        }
                        expression(property.value(), visible);
                    }
                }
                case CALL -> {
                    var call = (Expression.Call) expr;
                    expression(call.callee(), visible);
                    call.arguments().forEach(argument -> expression(argument, visible));
                }
                case MEMBER -> expression(((Expression.Member) expr).object(), visible);
                case BRACKET -> {
                    var bracket = (Expression.Bracket) expr;
                    expression(bracket.object(), visible);
                    expression(bracket.index(), visible);
                }
                case BINARY -> {
                    var binary = (Expression.Binary) expr;
                    expression(binary.left(), visible);
                    expression(binary.right(), visible);
                }
                case UNARY -> expression(((Expression.Unary) expr).operand(), visible);
                default -> throw new IllegalStateException("Unknown expression kind: " + expr.kind());
            }
        }
    }
}
