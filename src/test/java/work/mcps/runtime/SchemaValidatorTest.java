package work.mcps.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SchemaValidatorTest {
    private static final Map<String, Object> STRING = Map.of("kind", "string");
    private static final Map<String, Object> NULLABLE_STRING =
        Map.of("kind", "union", "members", List.of(STRING, Map.of("kind", "null")));

    @Test
    void unionAcceptsAnyMember() {
        assertTrue(SchemaValidator.accepts(NULLABLE_STRING, "x"));
        assertTrue(SchemaValidator.accepts(NULLABLE_STRING, null));
        assertFalse(SchemaValidator.accepts(NULLABLE_STRING, 3));
    }

    @Test
    void checksArrayElementsAndObjectFields() {
        Map<String, Object> items = Map.of("kind", "array", "element", Map.of("kind", "number"));
        assertTrue(SchemaValidator.accepts(items, List.of(1, 2.5)));
        assertFalse(SchemaValidator.accepts(items, List.of(1, "two")));

        Map<String, Object> person = Map.of("kind", "object", "fields", Map.of(
            "name", STRING,
            "age", Map.of("kind", "optional", "inner", Map.of("kind", "number"))
        ));
        assertTrue(SchemaValidator.accepts(person, Map.of("name", "Ada")));
        assertFalse(SchemaValidator.accepts(person, Map.of("age", 3)));
    }

    @Test
    void reportsTheFirstBadArgument() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("text", STRING);
        schema.put("times", Map.of("kind", "optional", "inner", Map.of("kind", "number")));

        assertEquals(Optional.empty(), SchemaValidator.checkArguments(schema, Map.of("text", "hi")));
        assertEquals(
            Optional.of("argument \"text\" expected string but got number"),
            SchemaValidator.checkArguments(schema, Map.of("text", 5))
        );
        assertEquals(Optional.of("missing argument \"text\""), SchemaValidator.checkArguments(schema, Map.of()));
    }

    @Test
    void untypedParametersAcceptAnything() {
        Map<String, Object> schema = Map.of("raw", Map.of("kind", "any"));

        assertEquals(Optional.empty(), SchemaValidator.checkArguments(schema, Map.of()));
        assertEquals(Optional.empty(), SchemaValidator.checkArguments(schema, Map.of("raw", List.of())));
    }
}
