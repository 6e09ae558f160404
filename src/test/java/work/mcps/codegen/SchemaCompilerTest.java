package work.mcps.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.mcps.ast.Declaration;
import work.mcps.ast.TypeAnnotation;
import work.mcps.ast.TypeAnnotation.PrimitiveType;

class SchemaCompilerTest {

    @Test
    void unionKeepsMemberOrderIncludingNull() {
        var type = new TypeAnnotation.Union(List.of(
            new TypeAnnotation.Primitive(PrimitiveType.STRING),
            new TypeAnnotation.Primitive(PrimitiveType.NULL)
        ));

        assertEquals(
            Map.of("kind", "union", "members", List.of(Map.of("kind", "string"), Map.of("kind", "null"))),
            SchemaCompiler.compile(type)
        );
    }

    @Test
    void compilesNestedArraysAndObjects() {
        var type = new TypeAnnotation.ArrayType(new TypeAnnotation.ObjectType(List.of(
            new TypeAnnotation.Field("id", new TypeAnnotation.Primitive(PrimitiveType.NUMBER), false),
            new TypeAnnotation.Field("tag", new TypeAnnotation.Primitive(PrimitiveType.STRING), true)
        )));

        assertEquals(
            "{\"kind\":\"array\",\"element\":{\"kind\":\"object\",\"fields\":{"
                + "\"id\":{\"kind\":\"number\"},"
                + "\"tag\":{\"kind\":\"optional\",\"inner\":{\"kind\":\"string\"}}}}}",
            SchemaCompiler.toJavaScript(SchemaCompiler.compile(type))
        );
    }

    @Test
    void unannotatedAndOptionalParameters() {
        var schema = SchemaCompiler.compileParameters(List.of(
            new Declaration.Parameter("raw", null, false),
            new Declaration.Parameter("flag", new TypeAnnotation.Primitive(PrimitiveType.BOOLEAN), true)
        ));

        assertEquals(List.of("raw", "flag"), List.copyOf(schema.keySet()));
        assertEquals(Map.of("kind", "any"), schema.get("raw"));
        assertEquals(Map.of("kind", "optional", "inner", Map.of("kind", "boolean")), schema.get("flag"));
    }
}
