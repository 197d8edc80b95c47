package dumb.tactic;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Bindings of pattern variables produced by {@link Unifier#match(Sequent, Sequent)}.
 */
public record Subst(Map<Term.Var, Term> bindings) {

    public static final Subst EMPTY = new Subst(Map.of());

    public Subst {
        bindings = Map.copyOf(requireNonNull(bindings));
    }

    public Optional<Term> get(Term.Var v) {
        return Optional.ofNullable(bindings.get(v));
    }

    /** Binding of {@code ?name}, failing if the pattern did not bind it. */
    public Term get(String name) {
        return get(Term.var(name)).orElseThrow(() -> new IllegalArgumentException("Unbound variable " + name + " in " + this));
    }

    public Term apply(Term t) {
        return Unifier.subst(t, bindings);
    }

    public Sequent apply(Sequent s) {
        return new Sequent(s.ante().stream().map(this::apply).toList(), s.succ().stream().map(this::apply).toList());
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    @Override
    public String toString() {
        return bindings.entrySet().stream()
                .map(e -> e.getKey() + "~>" + e.getValue())
                .sorted()
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
