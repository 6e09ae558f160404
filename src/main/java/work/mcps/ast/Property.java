package work.mcps.ast;

import java.util.Objects;

/**
 * Key/value pair of an object literal or a declaration config block.
 */
public record Property(String key, Expression value) {
    public Property {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
