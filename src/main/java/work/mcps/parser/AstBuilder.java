package work.mcps.parser;

import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.BufferedTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import work.mcps.ast.BinaryOperator;
import work.mcps.ast.Declaration;
import work.mcps.ast.Expression;
import work.mcps.ast.Program;
import work.mcps.ast.Property;
import work.mcps.ast.Statement;
import work.mcps.ast.TypeAnnotation;
import work.mcps.ast.UnaryOperator;
import work.mcps.error.ScriptSyntaxException;
import work.mcps.error.TypeAnnotationException;

/**
 * Builds AST nodes from the ANTLR parse tree.
 * Expressions go through the generated visitor; statements and types are mapped by the private helpers below.
 */
final class AstBuilder extends McpScriptBaseVisitor<Expression> {
    private final BufferedTokenStream tokens;
    private int loopDepth;
    private int toolDepth;

    AstBuilder(BufferedTokenStream tokens) {
        this.tokens = tokens;
    }

    Program buildProgram(McpScriptParser.ProgramContext ctx) {
        List<Statement> statements = statementList(ctx.statement(), ctx.EOF().getSymbol());
        return new Program(statements);
    }

    // --- Statements ---

    private List<Statement> statementList(List<McpScriptParser.StatementContext> contexts, Token closing) {
        List<Statement> statements = new ArrayList<>();
        for (McpScriptParser.StatementContext stmtCtx : contexts) {
            statements.addAll(commentsBefore(stmtCtx.getStart()));
            statements.add(statement(stmtCtx));
        }
        statements.addAll(commentsBefore(closing));
        return statements;
    }

    private List<Statement> commentsBefore(Token token) {
        List<Token> hidden = tokens.getHiddenTokensToLeft(token.getTokenIndex(), Token.HIDDEN_CHANNEL);
        if (hidden == null) {
            return List.of();
        }
        List<Statement> comments = new ArrayList<>(hidden.size());
        for (Token comment : hidden) {
            comments.add(new Statement.Comment(comment.getText()));
        }
        return comments;
    }

    private Statement statement(McpScriptParser.StatementContext ctx) {
        if (ctx.mcpDeclaration() != null) {
            var decl = ctx.mcpDeclaration();
            return Declaration.Configured.mcp(name(decl.IDENTIFIER(), decl), config(decl.objectLiteral(), decl));
        } else if (ctx.modelDeclaration() != null) {
            var decl = ctx.modelDeclaration();
            return Declaration.Configured.model(name(decl.IDENTIFIER(), decl), config(decl.objectLiteral(), decl));
        } else if (ctx.agentDeclaration() != null) {
            var decl = ctx.agentDeclaration();
            return Declaration.Configured.agent(name(decl.IDENTIFIER(), decl), config(decl.objectLiteral(), decl));
        } else if (ctx.toolDeclaration() != null) {
            return toolDeclaration(ctx.toolDeclaration());
        } else if (ctx.ifStatement() != null) {
            var ifCtx = ctx.ifStatement();
            Statement elseBranch = ifCtx.statement().size() > 1 ? statement(ifCtx.statement(1)) : null;
            return new Statement.If(expr(ifCtx.expression()), statement(ifCtx.statement(0)), elseBranch);
        } else if (ctx.whileStatement() != null) {
            var whileCtx = ctx.whileStatement();
            return new Statement.While(expr(whileCtx.expression()), loopBody(whileCtx.statement()));
        } else if (ctx.forStatement() != null) {
            return forStatement(ctx.forStatement());
        } else if (ctx.breakStatement() != null) {
            requireContext(loopDepth > 0, ctx, "'break' outside of a loop");
            return new Statement.Break();
        } else if (ctx.continueStatement() != null) {
            requireContext(loopDepth > 0, ctx, "'continue' outside of a loop");
            return new Statement.Continue();
        } else if (ctx.returnStatement() != null) {
            requireContext(toolDepth > 0, ctx, "'return' outside of a tool body");
            var returnCtx = ctx.returnStatement();
            return new Statement.Return(returnCtx.expression() == null ? null : expr(returnCtx.expression()));
        } else if (ctx.block() != null) {
            return block(ctx.block());
        } else if (ctx.assignment() != null) {
            return assignment(ctx.assignment());
        } else if (ctx.expression() != null) {
            return new Statement.ExpressionStatement(expr(ctx.expression()));
        }
        throw missing(ctx, "statement");
    }

    private Statement.Block block(McpScriptParser.BlockContext ctx) {
        return new Statement.Block(statementList(ctx.statement(), ctx.getStop()));
    }

    private Statement.Assignment assignment(McpScriptParser.AssignmentContext ctx) {
        Expression target = expr(ctx.expression(0));
        if (!target.isAssignable()) {
            Token start = ctx.expression(0).getStart();
            throw new ScriptSyntaxException(
                start.getLine(),
                start.getCharPositionInLine(),
                "identifier, member or bracket expression",
                "invalid assignment target '" + ctx.expression(0).getText() + "'"
            );
        }
        return new Statement.Assignment(target, expr(ctx.expression(1)));
    }

    /**
     * Walks the loop header children; the clause slot advances at each ';' so every clause is optional.
     */
    private Statement.For forStatement(McpScriptParser.ForStatementContext ctx) {
        Statement.Assignment init = null;
        Expression condition = null;
        Statement.Assignment update = null;
        int slot = 0;
        for (ParseTree child : ctx.children) {
            if (child instanceof TerminalNode terminal && ";".equals(terminal.getText())) {
                slot++;
            } else if (child instanceof McpScriptParser.AssignmentContext assignCtx) {
                if (slot == 0) {
                    init = assignment(assignCtx);
                } else {
                    update = assignment(assignCtx);
                }
            } else if (child instanceof McpScriptParser.ExpressionContext exprCtx && slot == 1) {
                condition = expr(exprCtx);
            }
        }
        if (slot != 2) {
            throw missing(ctx, "';'");
        }
        return new Statement.For(init, condition, update, loopBody(ctx.statement()));
    }

    private Statement loopBody(McpScriptParser.StatementContext ctx) {
        loopDepth++;
        try {
            return statement(ctx);
        } finally {
            loopDepth--;
        }
    }

    private static void requireContext(boolean allowed, ParserRuleContext ctx, String message) {
        if (!allowed) {
            Token start = ctx.getStart();
            throw new ScriptSyntaxException(start.getLine(), start.getCharPositionInLine(), "statement", message);
        }
    }

    private Declaration.Tool toolDeclaration(McpScriptParser.ToolDeclarationContext ctx) {
        String name = name(ctx.IDENTIFIER(), ctx);
        List<Declaration.Parameter> parameters = new ArrayList<>();
        if (ctx.parameterList() != null) {
            for (McpScriptParser.ParameterContext paramCtx : ctx.parameterList().parameter()) {
                TypeAnnotation type = paramCtx.typeExpression() == null ? null : type(paramCtx.typeExpression());
                boolean optional = paramCtx.getChildCount() > 1 && "?".equals(paramCtx.getChild(1).getText());
                parameters.add(new Declaration.Parameter(paramCtx.IDENTIFIER().getText(), type, optional));
            }
        }
        TypeAnnotation returnType = ctx.typeExpression() == null ? null : type(ctx.typeExpression());
        if (ctx.block() == null) {
            throw missing(ctx, "tool body");
        }
        int enclosingLoops = loopDepth;
        loopDepth = 0;
        toolDepth++;
        try {
            return new Declaration.Tool(name, parameters, returnType, block(ctx.block()));
        } finally {
            toolDepth--;
            loopDepth = enclosingLoops;
        }
    }

    private String name(TerminalNode identifier, ParserRuleContext owner) {
        if (identifier == null || identifier.getSymbol().getTokenIndex() < 0) {
            throw missing(owner, "declaration name");
        }
        return identifier.getText();
    }

    private List<Property> config(McpScriptParser.ObjectLiteralContext ctx, ParserRuleContext owner) {
        if (ctx == null) {
            throw missing(owner, "config object");
        }
        return properties(ctx);
    }

    private static ScriptSyntaxException missing(ParserRuleContext ctx, String expected) {
        Token start = ctx.getStart();
        return new ScriptSyntaxException(start.getLine(), start.getCharPositionInLine(), expected, "missing " + expected);
    }

    // --- Expressions ---

    private Expression expr(McpScriptParser.ExpressionContext ctx) {
        return visit(ctx);
    }

    @Override
    public Expression visitPrimaryExpression(McpScriptParser.PrimaryExpressionContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Expression visitMemberExpression(McpScriptParser.MemberExpressionContext ctx) {
        return new Expression.Member(expr(ctx.expression()), ctx.identifierName().getText());
    }

    @Override
    public Expression visitBracketExpression(McpScriptParser.BracketExpressionContext ctx) {
        return new Expression.Bracket(expr(ctx.expression(0)), expr(ctx.expression(1)));
    }

    @Override
    public Expression visitCallExpression(McpScriptParser.CallExpressionContext ctx) {
        List<Expression> args = new ArrayList<>();
        if (ctx.argumentList() != null) {
            for (McpScriptParser.ExpressionContext argCtx : ctx.argumentList().expression()) {
                args.add(expr(argCtx));
            }
        }
        return new Expression.Call(expr(ctx.expression()), args);
    }

    @Override
    public Expression visitUnaryExpression(McpScriptParser.UnaryExpressionContext ctx) {
        UnaryOperator op = UnaryOperator.fromSymbol(ctx.op.getText())
            .orElseThrow(() -> missing(ctx, "unary operator"));
        return new Expression.Unary(op, expr(ctx.expression()));
    }

    @Override
    public Expression visitBinaryExpression(McpScriptParser.BinaryExpressionContext ctx) {
        BinaryOperator op = BinaryOperator.fromSymbol(ctx.op.getText())
            .orElseThrow(() -> missing(ctx, "binary operator"));
        return new Expression.Binary(op, expr(ctx.expression(0)), expr(ctx.expression(1)));
    }

    @Override
    public Expression visitIdentifierPrimary(McpScriptParser.IdentifierPrimaryContext ctx) {
        return new Expression.Identifier(ctx.IDENTIFIER().getText());
    }

    @Override
    public Expression visitStringPrimary(McpScriptParser.StringPrimaryContext ctx) {
        return new Expression.StringLiteral(StringLiterals.unquote(ctx.STRING().getText()));
    }

    @Override
    public Expression visitNumberPrimary(McpScriptParser.NumberPrimaryContext ctx) {
        return new Expression.NumberLiteral(Double.parseDouble(ctx.NUMBER().getText()));
    }

    @Override
    public Expression visitBooleanPrimary(McpScriptParser.BooleanPrimaryContext ctx) {
        return new Expression.BooleanLiteral(ctx.TRUE() != null);
    }

    @Override
    public Expression visitNullPrimary(McpScriptParser.NullPrimaryContext ctx) {
        return new Expression.NullLiteral();
    }

    @Override
    public Expression visitArrayPrimary(McpScriptParser.ArrayPrimaryContext ctx) {
        List<Expression> elements = new ArrayList<>();
        for (McpScriptParser.ExpressionContext elementCtx : ctx.arrayLiteral().expression()) {
            elements.add(expr(elementCtx));
        }
        return new Expression.ArrayLiteral(elements);
    }

    @Override
    public Expression visitObjectPrimary(McpScriptParser.ObjectPrimaryContext ctx) {
        return new Expression.ObjectLiteral(properties(ctx.objectLiteral()));
    }

    @Override
    public Expression visitParenthesizedPrimary(McpScriptParser.ParenthesizedPrimaryContext ctx) {
        return expr(ctx.expression());
    }

    private List<Property> properties(McpScriptParser.ObjectLiteralContext ctx) {
        List<Property> properties = new ArrayList<>();
        for (McpScriptParser.PropertyContext propCtx : ctx.property()) {
            String key = propCtx.STRING() != null
                ? StringLiterals.unquote(propCtx.STRING().getText())
                : propCtx.identifierName().getText();
            properties.add(new Property(key, expr(propCtx.expression())));
        }
        return properties;
    }

    // --- Types ---

    private TypeAnnotation type(McpScriptParser.TypeExpressionContext ctx) {
        List<McpScriptParser.TypeTermContext> terms = ctx.typeTerm();
        if (terms.size() == 1) {
            return typeTerm(terms.get(0));
        }
        List<TypeAnnotation> members = new ArrayList<>();
        for (McpScriptParser.TypeTermContext termCtx : terms) {
            TypeAnnotation member = typeTerm(termCtx);
            if (member instanceof TypeAnnotation.Union union) {
                members.addAll(union.members());
            } else {
                members.add(member);
            }
        }
        return new TypeAnnotation.Union(members);
    }

    private TypeAnnotation typeTerm(McpScriptParser.TypeTermContext ctx) {
        TypeAnnotation type = typePrimary(ctx.typePrimary());
        int dimensions = (ctx.getChildCount() - 1) / 2;
        for (int i = 0; i < dimensions; i++) {
            type = new TypeAnnotation.ArrayType(type);
        }
        return type;
    }

    private TypeAnnotation typePrimary(McpScriptParser.TypePrimaryContext ctx) {
        if (ctx instanceof McpScriptParser.NamedTypeContext named) {
            String keyword = named.IDENTIFIER().getText();
            return TypeAnnotation.PrimitiveType.fromKeyword(keyword)
                .<TypeAnnotation>map(TypeAnnotation.Primitive::new)
                .orElseThrow(() -> new TypeAnnotationException(
                    "Unknown type '" + keyword + "' at line " + named.getStart().getLine()
                        + " (expected string, number, boolean, any or null)"
                ));
        }
        if (ctx instanceof McpScriptParser.NullTypeContext) {
            return new TypeAnnotation.Primitive(TypeAnnotation.PrimitiveType.NULL);
        }
        if (ctx instanceof McpScriptParser.ObjectTypeLiteralContext objectCtx) {
            List<TypeAnnotation.Field> fields = new ArrayList<>();
            for (McpScriptParser.TypeFieldContext fieldCtx : objectCtx.objectType().typeField()) {
                boolean optional = "?".equals(fieldCtx.getChild(1).getText());
                fields.add(new TypeAnnotation.Field(fieldCtx.identifierName().getText(), type(fieldCtx.typeExpression()), optional));
            }
            return new TypeAnnotation.ObjectType(fields);
        }
        if (ctx instanceof McpScriptParser.GroupedTypeContext grouped) {
            return type(grouped.typeExpression());
        }
        throw missing(ctx, "type");
    }
}
