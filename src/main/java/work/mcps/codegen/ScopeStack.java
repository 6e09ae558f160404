package work.mcps.codegen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Copy-down lexical scopes. A pushed frame starts as a copy of the current top frame; lookups only
 * ever read the top frame, so names declared in a child never leak to the parent or to siblings.
 * Shared by the validator and the generator so both agree on visibility.
 */
public final class ScopeStack {
    private final Deque<Set<String>> frames = new ArrayDeque<>();
    private final List<String> globalDeclarations = new ArrayList<>();

    public ScopeStack(Collection<String> seed) {
        frames.push(new LinkedHashSet<>(seed));
    }

    public void push() {
        frames.push(new LinkedHashSet<>(frames.peek()));
    }

    public void pop() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("Cannot pop the global scope");
        }
        frames.pop();
    }

    public boolean isDeclared(String name) {
        return frames.peek().contains(name);
    }

    /**
     * Adds {@code name} to the top frame. Returns false when it was already visible there.
     */
    public boolean declare(String name) {
        boolean added = frames.peek().add(name);
        if (added && frames.size() == 1) {
            globalDeclarations.add(name);
        }
        return added;
    }

    public int depth() {
        return frames.size();
    }

    /**
     * Names declared in the global frame after construction, in declaration order.
     */
    public List<String> globalDeclarations() {
        return List.copyOf(globalDeclarations);
    }
}
