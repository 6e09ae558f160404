package work.mcps.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.mcps.ast.Program;
import work.mcps.parser.ScriptParser;

class CodeGeneratorTest {
    private final CodeGenerator generator = new CodeGenerator();

    @Test
    void generatesMainSectionAndBindings() {
        GeneratedScript script = generate("x = 1\nif (x > 0) y = 2");

        assertEquals(
            "// Main\n"
                + "var x = 1;\n"
                + "if (x > 0) {\n"
                + "  var y = 2;\n"
                + "}\n"
                + "\n"
                + "return { x, y };\n",
            script.code()
        );
        assertEquals(List.of("x", "y"), script.bindings());
    }

    @Test
    void generationIsDeterministic() {
        Program program = ScriptParser.parse("""
            model gpt { provider: "openai" }
            agent A { model: gpt }
            tool f(a: string) { return a }
            r = "p" -> A
            n = f("x")
            """);

        assertEquals(generator.generate(program), generator.generate(program));
    }

    @Test
    void reassignmentDoesNotRedeclare() {
        assertEquals("var x = 1;\nx = 2;\n", main("x = 1\nx = 2"));
    }

    @Test
    void blockLocalsAreRedeclaredAfterTheBlock() {
        GeneratedScript script = generate("if (true) { z = 1 }\nz = 2");

        assertTrue(script.code().contains("if (true) {\n  var z = 1;\n}\nvar z = 2;\n"), script.code());
        assertEquals(List.of("z"), script.bindings());
    }

    @Test
    void keepsPrecedenceWithoutRedundantParentheses() {
        assertEquals("var r = a + b * c;\n", main("r = a + b * c"));
        assertEquals("var r = (a + b) * c;\n", main("r = (a + b) * c"));
        assertEquals("var r = a - b - c;\n", main("r = a - b - c"));
        assertEquals("var r = a - (b - c);\n", main("r = a - (b - c)"));
        assertEquals("var r = a && b || c;\n", main("r = a && b || c"));
        assertEquals("var r = a == (b < c);\n", main("r = a == (b < c)"));
        assertEquals("var r = (a == b) == c;\n", main("r = a == b == c"));
    }

    @Test
    void separatesCoalescingFromLogicalOperators() {
        assertEquals("var r = a ?? (b || c);\n", main("r = a ?? (b || c)"));
        assertEquals("var r = (a ?? b) || c;\n", main("r = (a ?? b) || c"));
        assertEquals("var r = (a && b) ?? c;\n", main("r = a && b ?? c"));
    }

    @Test
    void wrapsUnaryOperandsWhenNeeded() {
        assertEquals("var r = -(a + b);\n", main("r = -(a + b)"));
        assertEquals("var r = !a;\n", main("r = !a"));
        assertEquals("var r = -(-a);\n", main("r = - -a"));
    }

    @Test
    void awaitsEveryCallSiteButNotBareMemberAccess() {
        assertEquals("await print(\"hi\");\n", main("print(\"hi\")"));
        assertEquals("var r = (await a.b()).c;\n", main("r = a.b().c"));
        assertEquals("var r = a.b.c;\n", main("r = a.b.c"));
        assertEquals("var r = await (await f(1))(2);\n", main("r = f(1)(2)"));
        assertEquals("var r = items[i + 1];\n", main("r = items[i + 1]"));
    }

    @Test
    void delegationCallsTheAgentEntrypoint() {
        assertEquals("var r = await A.run(\"p\");\n", main("r = \"p\" -> A"));
        assertEquals("var r = await A.run(\"p\");\n", main("r = \"p\" | A"));
    }

    @Test
    void chainedDelegationFeedsEachResultToTheNextAgent() {
        assertEquals("var r = await B.run(await A.run(\"p\"));\n", main("r = \"p\" -> A -> B"));
    }

    @Test
    void groupedDelegationDelegatesToTheGroupResult() {
        assertEquals("var r = await (await B.run(A)).run(\"p\");\n", main("r = \"p\" -> (A -> B)"));
    }

    @Test
    void forLoopInitDeclaresAndUpdateReassigns() {
        assertEquals(
            "for (var i = 0; i < 3; i = i + 1) {\n  var total = i;\n}\n",
            main("for (i = 0; i < 3; i = i + 1) { total = i }")
        );
        assertEquals("for (;;) {\n  break;\n}\n", main("for (;;) { break }"));
    }

    @Test
    void whileAndElseBodiesAreBraced() {
        assertEquals("while (n < 3) {\n  n = n + 1;\n}\n", main("n = 0\nwhile (n < 3) n = n + 1").substring("var n = 0;\n".length()));
        assertEquals(
            "if (a) {\n  var b = 1;\n} else {\n  var b = 2;\n}\n",
            main("if (a) { b = 1 } else { b = 2 }")
        );
    }

    @Test
    void literalsRoundTrip() {
        assertEquals(
            "var o = { a: [1, true, null, 2.5], \"b c\": { d: \"x\\ny\" } };\n",
            main("o = { a: [1, true, null, 2.5], \"b c\": { d: \"x\\ny\" } }")
        );
        assertEquals("var n = 100000;\n", main("n = 1e5"));
        assertEquals("var n = 0.0025;\n", main("n = 2.5e-3"));
    }

    @Test
    void reEmitsComments() {
        assertEquals("// note\nvar x = 1;\n/* end */\n", main("// note\nx = 1\n/* end */"));
    }

    @Test
    void emitsDeclarationSectionsInFixedOrder() {
        String code = generate("""
            agent A { model: gpt, tools: [f, fs] }
            tool f(value: string | null) { return value }
            model gpt { provider: "openai" }
            mcp fs { command: "npx", args: ["-y", "server"] }
            r = "p" -> A
            """).code();

        assertTrue(code.startsWith(
            "// Tool servers\n"
                + "const fs = await __connectToolServer(\"fs\", { command: \"npx\", args: [\"-y\", \"server\"] });\n"
                + "\n"
                + "// Models\n"
                + "const gpt = __createModel(\"gpt\", { provider: \"openai\" });\n"
                + "\n"
                + "// Tools\n"
                + "const f = __createTool(\"f\", {\"value\":{\"kind\":\"union\",\"members\":[{\"kind\":\"string\"},{\"kind\":\"null\"}]}}, async (value) => {\n"
                + "  return value;\n"
                + "});\n"
                + "\n"
                + "// Agents\n"
                + "const A = __createAgent(\"A\", { model: gpt, tools: [f, fs] });\n"
                + "\n"
                + "// Main\n"
                + "var r = await A.run(\"p\");\n"
        ), code);
        assertTrue(code.endsWith("return { r };\n"), code);
    }

    @Test
    void toolLocalsStayInsideTheTool() {
        GeneratedScript script = generate("tool f(a) { b = a\nreturn b }\nb = 1");

        assertTrue(script.code().contains("async (a) => {\n  var b = a;\n  return b;\n});\n"), script.code());
        assertTrue(script.code().contains("// Main\nvar b = 1;\n"), script.code());
        assertEquals(List.of("b"), script.bindings());
    }

    @Test
    void emptyProgramReturnsAnEmptyObject() {
        assertEquals("return {};\n", generate("").code());
    }

    private GeneratedScript generate(String source) {
        return generator.generate(ScriptParser.parse(source));
    }

    /**
     * The statements of the main section only.
     */
    private String main(String source) {
        String code = generate(source).code();
        int start = code.indexOf("// Main\n") + "// Main\n".length();
        int end = code.lastIndexOf("\nreturn {");
        return code.substring(start, end);
    }
}
