package dumb.tactic;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * Named tactics of one top-level run. Race candidates work on a {@link #fork()} so that their registrations stay
 * invisible to siblings.
 */
public final class Definitions {
    private final ConcurrentMap<String, Tactic> defs = new ConcurrentHashMap<>();
    @Nullable
    private final Definitions parent;

    public Definitions() {
        this(null);
    }

    private Definitions(@Nullable Definitions parent) {
        this.parent = parent;
    }

    public void define(String name, Tactic body) {
        defs.put(requireNonNull(name), requireNonNull(body));
    }

    public Optional<Tactic> get(String name) {
        var t = defs.get(name);
        if (t != null) return Optional.of(t);
        return parent != null ? parent.get(name) : Optional.empty();
    }

    /** A child scope that sees this scope's definitions but registers into its own. */
    public Definitions fork() {
        return new Definitions(this);
    }
}
