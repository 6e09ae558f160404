package work.mcps.codegen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.mcps.ast.Declaration;
import work.mcps.ast.TypeAnnotation;

/**
 * Compiles type annotations into the descriptor maps handed to tool collaborators.
 * Descriptors are plain maps keyed by {@code kind}, e.g. {@code {kind: "array", element: {kind: "string"}}}.
 */
public final class SchemaCompiler {
    public static final Map<String, Object> ANY = Map.of("kind", "any");

    private static final ObjectMapper JSON = new ObjectMapper();

    private SchemaCompiler() {}

    public static Map<String, Object> compile(TypeAnnotation type) {
        if (type == null) {
            return ANY;
        }
        Map<String, Object> descriptor = new LinkedHashMap<>();
        switch (type.kind()) {
            case PRIMITIVE -> descriptor.put("kind", ((TypeAnnotation.Primitive) type).type().keyword());
            case ARRAY -> {
                descriptor.put("kind", "array");
                descriptor.put("element", compile(((TypeAnnotation.ArrayType) type).element()));
            }
            case OBJECT -> {
                Map<String, Object> fields = new LinkedHashMap<>();
                for (TypeAnnotation.Field field : ((TypeAnnotation.ObjectType) type).fields()) {
                    fields.put(field.name(), field.optional() ? optional(compile(field.type())) : compile(field.type()));
                }
                descriptor.put("kind", "object");
                descriptor.put("fields", fields);
            }
            case UNION -> {
                List<Object> members = new ArrayList<>();
                for (TypeAnnotation member : ((TypeAnnotation.Union) type).members()) {
                    members.add(compile(member));
                }
                descriptor.put("kind", "union");
                descriptor.put("members", members);
            }
            case OPTIONAL -> {
                return optional(compile(((TypeAnnotation.Optional) type).inner()));
            }
            default -> throw new IllegalStateException("Unknown type annotation: " + type.kind());
        }
        return descriptor;
    }

    /**
     * Parameter name to descriptor, in declaration order. Optional parameters are wrapped.
     */
    public static Map<String, Object> compileParameters(List<Declaration.Parameter> parameters) {
        Map<String, Object> schema = new LinkedHashMap<>();
        for (Declaration.Parameter parameter : parameters) {
            Map<String, Object> compiled = compile(parameter.type());
            schema.put(parameter.name(), parameter.optional() ? optional(compiled) : compiled);
        }
        return schema;
    }

    public static String toJavaScript(Map<String, Object> descriptor) {
        try {
            return JSON.writeValueAsString(descriptor);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render schema descriptor", ex);
        }
    }

    private static Map<String, Object> optional(Map<String, Object> inner) {
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("kind", "optional");
        wrapped.put("inner", inner);
        return wrapped;
    }
}
