package work.mcps.runtime;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks host-side values (as produced by {@link GuestValues#toJava}) against compiled type descriptors.
 */
final class SchemaValidator {
    private SchemaValidator() {}

    static Optional<String> checkArguments(Map<String, Object> parameters, Map<String, Object> arguments) {
        for (var entry : parameters.entrySet()) {
            String name = entry.getKey();
            Map<?, ?> descriptor = asMap(entry.getValue());
            String kind = kind(descriptor);
            if (!arguments.containsKey(name) || arguments.get(name) == null && "optional".equals(kind)) {
                if ("optional".equals(kind) || "any".equals(kind)) {
                    continue;
                }
                if (!accepts(descriptor, null)) {
                    return Optional.of("missing argument \"" + name + "\"");
                }
                continue;
            }
            Object value = arguments.get(name);
            if (!accepts(descriptor, value)) {
                return Optional.of("argument \"" + name + "\" expected " + describe(descriptor) + " but got " + typeOf(value));
            }
        }
        return Optional.empty();
    }

    static boolean accepts(Map<?, ?> descriptor, Object value) {
        String kind = kind(descriptor);
        switch (kind) {
            case "any":
                return true;
            case "string":
                return value instanceof String;
            case "number":
                return value instanceof Number;
            case "boolean":
                return value instanceof Boolean;
            case "null":
                return value == null;
            case "optional":
                return value == null || accepts(asMap(descriptor.get("inner")), value);
            case "array":
                if (!(value instanceof List<?> list)) {
                    return false;
                }
                Map<?, ?> element = asMap(descriptor.get("element"));
                return list.stream().allMatch(item -> accepts(element, item));
            case "object":
                if (!(value instanceof Map<?, ?> object)) {
                    return false;
                }
                for (var field : asMap(descriptor.get("fields")).entrySet()) {
                    Map<?, ?> fieldDescriptor = asMap(field.getValue());
                    Object fieldValue = object.get(field.getKey());
                    if (fieldValue == null && !object.containsKey(field.getKey()) && "optional".equals(kind(fieldDescriptor))) {
                        continue;
                    }
                    if (!accepts(fieldDescriptor, fieldValue)) {
                        return false;
                    }
                }
                return true;
            case "union":
                Object members = descriptor.get("members");
                if (!(members instanceof List<?> list)) {
                    return false;
                }
                return list.stream().anyMatch(member -> accepts(asMap(member), value));
            default:
                return false;
        }
    }

    static String describe(Map<?, ?> descriptor) {
        String kind = kind(descriptor);
        return switch (kind) {
            case "array" -> describe(asMap(descriptor.get("element"))) + "[]";
            case "optional" -> describe(asMap(descriptor.get("inner"))) + "?";
            case "union" -> {
                Object members = descriptor.get("members");
                StringBuilder out = new StringBuilder();
                if (members instanceof List<?> list) {
                    for (Object member : list) {
                        if (out.length() > 0) {
                            out.append(" | ");
                        }
                        out.append(describe(asMap(member)));
                    }
                }
                yield out.toString();
            }
            default -> kind;
        };
    }

    private static String typeOf(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        return "object";
    }

    private static String kind(Map<?, ?> descriptor) {
        Object kind = descriptor.get("kind");
        return kind == null ? "any" : kind.toString();
    }

    private static Map<?, ?> asMap(Object raw) {
        return raw instanceof Map<?, ?> map ? map : Map.of();
    }
}
