package work.mcps.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class JsLiteralsTest {

    @Test
    void formatsNumbersLikeJavaScript() {
        assertEquals("1", JsLiterals.number(1.0));
        assertEquals("-2.5", JsLiterals.number(-2.5));
        assertEquals("100000", JsLiterals.number(1e5));
        assertEquals("1e+21", JsLiterals.number(1e21));
        assertEquals("1.5e-7", JsLiterals.number(1.5e-7));
    }

    @Test
    void escapesStrings() {
        assertEquals("\"a\\\"b\\n\"", JsLiterals.string("a\"b\n"));
    }

    @Test
    void quotesKeysThatAreNotIdentifiers() {
        assertEquals("name", JsLiterals.propertyKey("name"));
        assertEquals("\"two words\"", JsLiterals.propertyKey("two words"));
    }
}
