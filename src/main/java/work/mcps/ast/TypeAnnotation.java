package work.mcps.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parameter type annotations of tool declarations.
 * A nullable type is a {@link Union} that lists {@code Primitive(NULL)} as one of its members.
 */
public interface TypeAnnotation {

    Kind kind();

    enum Kind {
        PRIMITIVE,
        ARRAY,
        OBJECT,
        UNION,
        OPTIONAL
    }

    enum PrimitiveType {
        STRING,
        NUMBER,
        BOOLEAN,
        ANY,
        NULL;

        public String keyword() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static java.util.Optional<PrimitiveType> fromKeyword(String keyword) {
            return Arrays.stream(values()).filter(type -> type.keyword().equals(keyword)).findFirst();
        }
    }

    record Primitive(PrimitiveType type) implements TypeAnnotation {
        public Primitive {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public Kind kind() {
            return Kind.PRIMITIVE;
        }
    }

    record ArrayType(TypeAnnotation element) implements TypeAnnotation {
        public ArrayType {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }

    record Field(String name, TypeAnnotation type, boolean optional) {
        public Field {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }

    record ObjectType(List<Field> fields) implements TypeAnnotation {
        public ObjectType {
            fields = List.copyOf(fields);
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }
    }

    record Union(List<TypeAnnotation> members) implements TypeAnnotation {
        public Union {
            members = List.copyOf(members);
            if (members.size() < 2) {
                throw new IllegalArgumentException("A union needs at least two members");
            }
        }

        @Override
        public Kind kind() {
            return Kind.UNION;
        }
    }

    /**
     * Marks an optional object field or parameter. Never produced for a standalone type.
     */
    record Optional(TypeAnnotation inner) implements TypeAnnotation {
        public Optional {
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public Kind kind() {
            return Kind.OPTIONAL;
        }
    }
}
