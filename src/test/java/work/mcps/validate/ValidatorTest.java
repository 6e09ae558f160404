package work.mcps.validate;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.mcps.error.DeclarationException;
import work.mcps.error.ErrorKind;
import work.mcps.error.UndefinedReferenceException;
import work.mcps.parser.ScriptParser;

class ValidatorTest {
    private final Validator validator = new Validator();

    @Test
    void agentWithoutModelIsRejected() {
        var error = assertThrows(DeclarationException.class, () -> validate("agent A { description: \"x\" }"));

        assertEquals("A", error.declarationName());
        assertEquals(ErrorKind.DECLARATION, error.kind());
        assertTrue(error.getMessage().contains("\"A\""), error.getMessage());
    }

    @Test
    void agentModelMustNameAModelDeclaration() {
        assertThrows(DeclarationException.class, () -> validate("""
            mcp fs { command: "npx" }
            agent A { model: fs }
            """));
        assertDoesNotThrow(() -> validate("""
            agent A { model: gpt }
            model gpt { provider: "openai" }
            """));
    }

    @Test
    void undeclaredNamesAreReported() {
        var error = assertThrows(UndefinedReferenceException.class, () -> validate("print(missing)"));

        assertEquals("missing", error.name());
        assertEquals("Undefined variable: 'missing'", error.getMessage());
    }

    @Test
    void valueIsCheckedBeforeTheTargetIsDeclared() {
        assertThrows(UndefinedReferenceException.class, () -> validate("x = x + 1"));
    }

    @Test
    void blockLocalsDoNotLeak() {
        var error = assertThrows(UndefinedReferenceException.class, () -> validate("if (true) { z = 1 }\nprint(z)"));

        assertEquals("z", error.name());
    }

    @Test
    void singleStatementBodiesShareTheEnclosingScope() {
        assertDoesNotThrow(() -> validate("if (true) z = 1\nprint(z)"));
    }

    @Test
    void forInitIsVisibleInTheLoop() {
        assertDoesNotThrow(() -> validate("total = 0\nfor (i = 0; i < 3; i = i + 1) { total = total + i }"));
    }

    @Test
    void toolParametersAreScopedToTheBody() {
        assertDoesNotThrow(() -> validate("tool f(a, b) { return a + b }\nr = f(1, 2)"));
        var error = assertThrows(UndefinedReferenceException.class, () -> validate("tool f(a) { return q }"));
        assertEquals("Undefined variable: 'q' in tool \"f\"", error.getMessage());
        assertThrows(UndefinedReferenceException.class, () -> validate("tool f(a) { return a }\nprint(a)"));
    }

    @Test
    void declarationsAreHoisted() {
        assertDoesNotThrow(() -> validate("r = \"hi\" -> Writer\nagent Writer { model: gpt }\nmodel gpt { provider: \"x\" }"));
    }

    @Test
    void builtInsNeedNoDeclaration() {
        assertDoesNotThrow(() -> validate("""
            print(JSON.stringify({ a: 1 }))
            log.info(env.HOME)
            s = Set([1, 2])
            n = parseInt("3") + Math.max(1, 2)
            """));
    }

    @Test
    void declarationConfigsOnlySeeDeclarationsAndBuiltIns() {
        var error = assertThrows(UndefinedReferenceException.class, () -> validate("""
            key = "secret"
            model gpt { provider: "openai", apiKey: key }
            """));

        assertTrue(error.getMessage().endsWith("in model \"gpt\""), error.getMessage());
        assertDoesNotThrow(() -> validate("model gpt { provider: \"openai\", apiKey: env.OPENAI_API_KEY }"));
    }

    @Test
    void duplicateDeclarationNamesAreRejected() {
        var error = assertThrows(DeclarationException.class, () -> validate("""
            model gpt { provider: "a" }
            tool gpt() { return 1 }
            """));

        assertEquals("gpt", error.declarationName());
    }

    @Test
    void reservedWordsCannotNameAnything() {
        var variable = assertThrows(DeclarationException.class, () -> validate("new = 1\nprint(new)"));
        assertEquals("new", variable.declarationName());
        assertTrue(variable.getMessage().contains("reserved word"), variable.getMessage());

        assertThrows(DeclarationException.class, () -> validate("model class { provider: \"a\" }"));
        assertThrows(DeclarationException.class, () -> validate("tool f(typeof) { return 1 }"));
        assertThrows(DeclarationException.class, () -> validate("tool f() { await = 1\nreturn 1 }"));
        assertDoesNotThrow(() -> validate("o = { new: 1 }\nn = o.new"));
    }

    @Test
    void declaredNamesCannotBeReassigned() {
        var error = assertThrows(DeclarationException.class, () -> validate("""
            model gpt { provider: "openai" }
            gpt = 1
            """));

        assertEquals("gpt", error.declarationName());
        assertEquals("Cannot assign to a model \"gpt\"", error.getMessage());
        assertThrows(DeclarationException.class, () -> validate("tool f() { return 1 }\ntool g() { f = 2\nreturn f }"));
        assertDoesNotThrow(() -> validate("model gpt { provider: \"openai\" }\ntool f(gpt) { gpt = 2\nreturn gpt }"));
    }

    @Test
    void duplicateConfigKeysAreRejected() {
        assertThrows(DeclarationException.class, () -> validate("model gpt { provider: \"a\", provider: \"b\" }"));
    }

    @Test
    void duplicateObjectLiteralKeysAreAllowed() {
        assertDoesNotThrow(() -> validate("o = { a: 1, a: 2 }"));
    }

    @Test
    void nestedDeclarationsAreRejected() {
        var error = assertThrows(DeclarationException.class, () -> validate("if (true) { model m { provider: \"x\" } }"));

        assertTrue(error.getMessage().contains("top level"), error.getMessage());
    }

    @Test
    void duplicateParametersAreRejected() {
        assertThrows(DeclarationException.class, () -> validate("tool f(a, a) { return a }"));
    }

    private void validate(String source) {
        validator.validate(ScriptParser.parse(source));
    }
}
