package work.mcps.codegen;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mcps.ast.Declaration;
import work.mcps.ast.Expression;
import work.mcps.ast.Program;
import work.mcps.ast.Statement;

/**
 * Turns a validated {@link Program} into the body of an async JavaScript function.
 *
 * <p>Output layout: tool-server connections, models, tools, agents (each in source order), then the
 * remaining statements, then a {@code return} of the top-level variables. Variables are declared with
 * {@code var} the first time they are assigned in a scope frame; explicit blocks push a frame while the
 * synthetic block wrapped around a single-statement {@code if}/{@code while}/{@code for} body does not.
 */
public final class CodeGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);
    private static final String INDENT = "  ";

    public GeneratedScript generate(Program program) {
        var emission = new Emission(declarationNames(program));
        for (Statement statement : program.statements()) {
            emission.topLevel(statement);
        }
        GeneratedScript script = emission.finish();
        LOG.debug("Generated {} characters, exporting {}", script.code().length(), script.bindings());
        return script;
    }

    static List<String> declarationNames(Program program) {
        List<String> names = new ArrayList<>();
        for (Statement statement : program.statements()) {
            if (statement instanceof Declaration declaration) {
                names.add(declaration.name());
            }
        }
        return names;
    }

    private static final class Emission {
        private final ExpressionEmitter expressions = new ExpressionEmitter();
        private final ScopeStack scope;
        private final StringBuilder servers = new StringBuilder();
        private final StringBuilder models = new StringBuilder();
        private final StringBuilder tools = new StringBuilder();
        private final StringBuilder agents = new StringBuilder();
        private final StringBuilder main = new StringBuilder();

        Emission(List<String> declarations) {
            this.scope = new ScopeStack(HostFunctions.initialScope(declarations));
        }

        void topLevel(Statement statement) {
            switch (statement.kind()) {
                case MCP_DECLARATION -> servers.append(configured((Declaration.Configured) statement, HostFunctions.CONNECT_TOOL_SERVER, true));
                case MODEL_DECLARATION -> models.append(configured((Declaration.Configured) statement, HostFunctions.CREATE_MODEL, false));
                case AGENT_DECLARATION -> agents.append(configured((Declaration.Configured) statement, HostFunctions.CREATE_AGENT, false));
                case TOOL_DECLARATION -> tool((Declaration.Tool) statement, tools);
                default -> statement(statement, main, 0);
            }
        }

        GeneratedScript finish() {
            StringBuilder out = new StringBuilder();
            section(out, "// Tool servers", servers);
            section(out, "// Models", models);
            section(out, "// Tools", tools);
            section(out, "// Agents", agents);
            section(out, "// Main", main);
            List<String> bindings = scope.globalDeclarations();
            out.append("return {");
            if (!bindings.isEmpty()) {
                out.append(' ').append(String.join(", ", bindings)).append(' ');
            }
            out.append("};\n");
            return new GeneratedScript(out.toString(), bindings);
        }

        private static void section(StringBuilder out, String header, StringBuilder body) {
            if (body.length() == 0) {
                return;
            }
            out.append(header).append('\n').append(body).append('\n');
        }

        // --- Declarations ---

        private String configured(Declaration.Configured declaration, String factory, boolean suspends) {
            return "const " + declaration.name() + " = " + (suspends ? "await " : "") + factory + "("
                + JsLiterals.string(declaration.name()) + ", " + expressions.objectLiteral(declaration.config()) + ");\n";
        }

        private void tool(Declaration.Tool declaration, StringBuilder out) {
            List<String> params = new ArrayList<>();
            for (Declaration.Parameter parameter : declaration.parameters()) {
                params.add(parameter.name());
            }
            String schema = SchemaCompiler.toJavaScript(SchemaCompiler.compileParameters(declaration.parameters()));
            out.append("const ").append(declaration.name()).append(" = ").append(HostFunctions.CREATE_TOOL).append('(')
                .append(JsLiterals.string(declaration.name())).append(", ").append(schema)
                .append(", async (").append(String.join(", ", params)).append(") => {\n");
            scope.push();
            params.forEach(scope::declare);
            for (Statement statement : declaration.body().statements()) {
                statement(statement, out, 1);
            }
            scope.pop();
            out.append("});\n");
        }

        // --- Statements ---

        private void statement(Statement statement, StringBuilder out, int depth) {
            String pad = INDENT.repeat(depth);
            switch (statement.kind()) {
                case COMMENT -> out.append(pad).append(((Statement.Comment) statement).text()).append('\n');
                case ASSIGNMENT -> out.append(pad).append(assignment((Statement.Assignment) statement)).append(";\n");
                case EXPRESSION -> out.append(pad).append(expressionStatement(((Statement.ExpressionStatement) statement).expression())).append(";\n");
                case BLOCK -> {
                    out.append(pad).append("{\n");
                    block((Statement.Block) statement, out, depth + 1);
                    out.append(pad).append("}\n");
                }
                case IF -> ifStatement((Statement.If) statement, out, depth);
                case WHILE -> {
                    var loop = (Statement.While) statement;
                    out.append(pad).append("while (").append(expressions.emit(loop.condition())).append(") {\n");
                    body(loop.body(), out, depth);
                    out.append(pad).append("}\n");
                }
                case FOR -> forStatement((Statement.For) statement, out, depth);
                case BREAK -> out.append(pad).append("break;\n");
                case CONTINUE -> out.append(pad).append("continue;\n");
                case RETURN -> {
                    Expression value = ((Statement.Return) statement).value();
                    out.append(pad).append(value == null ? "return" : "return " + expressions.emit(value)).append(";\n");
                }
                default -> throw new IllegalStateException("Unexpected statement in executable position: " + statement.kind());
            }
        }

        private void block(Statement.Block block, StringBuilder out, int depth) {
            scope.push();
            for (Statement statement : block.statements()) {
                statement(statement, out, depth);
            }
            scope.pop();
        }

        /**
         * Emits the inside of a braced body. A written block pushes a frame; a lone statement shares the enclosing one.
         */
        private void body(Statement body, StringBuilder out, int depth) {
            if (body instanceof Statement.Block block) {
                block(block, out, depth + 1);
            } else {
                statement(body, out, depth + 1);
            }
        }

        private void ifStatement(Statement.If statement, StringBuilder out, int depth) {
            String pad = INDENT.repeat(depth);
            out.append(pad).append("if (").append(expressions.emit(statement.condition())).append(") {\n");
            body(statement.thenBranch(), out, depth);
            if (statement.elseBranch() != null) {
                out.append(pad).append("} else {\n");
                body(statement.elseBranch(), out, depth);
            }
            out.append(pad).append("}\n");
        }

        private void forStatement(Statement.For loop, StringBuilder out, int depth) {
            String init = loop.init() == null ? "" : assignment(loop.init());
            String condition = loop.condition() == null ? "" : " " + expressions.emit(loop.condition());
            String update = loop.update() == null ? "" : " " + reassignment(loop.update());
            out.append(INDENT.repeat(depth)).append("for (").append(init).append(';').append(condition).append(';').append(update).append(") {\n");
            body(loop.body(), out, depth);
            out.append(INDENT.repeat(depth)).append("}\n");
        }

        /**
         * Declares the target in the top frame on first assignment, otherwise reassigns. No terminator.
         */
        private String assignment(Statement.Assignment assignment) {
            String value = expressions.emit(assignment.value());
            if (assignment.target() instanceof Expression.Identifier identifier && scope.declare(identifier.name())) {
                return "var " + identifier.name() + " = " + value;
            }
            return expressions.emit(assignment.target()) + " = " + value;
        }

        private String reassignment(Statement.Assignment assignment) {
            return expressions.emit(assignment.target()) + " = " + expressions.emit(assignment.value());
        }

        private String expressionStatement(Expression expression) {
            String code = expressions.emit(expression);
            return expression.kind() == Expression.Kind.OBJECT ? "(" + code + ")" : code;
        }
    }
}
