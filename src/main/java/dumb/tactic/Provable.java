package dumb.tactic;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Proof certificate: the conclusion follows from the open subgoals. Instances are only produced by
 * {@link #startProof}, {@link #apply(Rule, int)}, {@link #apply(Provable, int)} and {@link #substitute}, so the
 * derivation of the conclusion from the subgoals is maintained by construction.
 */
public final class Provable {
    private final Sequent conclusion;
    private final List<Sequent> subgoals;

    private Provable(Sequent conclusion, List<Sequent> subgoals) {
        this.conclusion = requireNonNull(conclusion);
        this.subgoals = List.copyOf(subgoals);
    }

    public static Provable startProof(Sequent goal) {
        return new Provable(goal, List.of(goal));
    }

    public static Provable startProof(Term formula) {
        return startProof(Sequent.of(formula));
    }

    public Sequent conclusion() {
        return conclusion;
    }

    public List<Sequent> subgoals() {
        return subgoals;
    }

    public Sequent subgoal(int i) {
        return subgoals.get(i);
    }

    public int size() {
        return subgoals.size();
    }

    public boolean isProved() {
        return subgoals.isEmpty();
    }

    /** Starts a separate proof of subgoal {@code i}, to be merged back with {@link #apply(Provable, int)}. */
    public Provable sub(int i) {
        checkIndex(i);
        return startProof(subgoals.get(i));
    }

    /** Replaces subgoal {@code i} by the premises of {@code rule}. */
    public Provable apply(Rule rule, int i) {
        checkIndex(i);
        var premises = requireNonNull(rule.apply(subgoals.get(i)), "premises");
        return new Provable(conclusion, splice(i, premises));
    }

    /**
     * Replaces subgoal {@code i} by the open subgoals of {@code sub}, in place, provided {@code sub} concludes
     * exactly that subgoal.
     */
    public Provable apply(Provable sub, int i) {
        checkIndex(i);
        if (!sub.conclusion.equals(subgoals.get(i)))
            throw new Rule.InapplicableException("Sub-proof concludes\n" + sub.conclusion + "\nbut subgoal " + (i + 1) + " is\n" + subgoals.get(i));
        return new Provable(conclusion, splice(i, sub.subgoals));
    }

    /**
     * Uniform substitution of the uninterpreted symbol application {@code what} by {@code repl} throughout the
     * whole certificate.
     */
    public Provable substitute(Term what, Term repl) {
        if (!substitutable(what))
            throw new Rule.InapplicableException("Nonsubstitutable expression " + what.toKif());
        return new Provable(conclusion.replace(what, repl), subgoals.stream().map(s -> s.replace(what, repl)).toList());
    }

    static boolean substitutable(Term what) {
        if (what instanceof Term.Atom a)
            return !SequentCalculus.isReserved(a.value()) && !Arithmetic.isNumeral(a.value());
        if (what instanceof Term.Lst l)
            return l.op().filter(op -> !SequentCalculus.isReserved(op)).isPresent() && !l.containsVar();
        return false;
    }

    private List<Sequent> splice(int i, List<Sequent> replacement) {
        var next = new ArrayList<Sequent>(subgoals.size() - 1 + replacement.size());
        next.addAll(subgoals.subList(0, i));
        next.addAll(replacement);
        next.addAll(subgoals.subList(i + 1, subgoals.size()));
        return next;
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= subgoals.size())
            throw new Rule.InapplicableException("Subgoal " + (i + 1) + " does not exist; " + subgoals.size() + " subgoals are open");
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return this == o || (o instanceof Provable p && conclusion.equals(p.conclusion) && subgoals.equals(p.subgoals));
    }

    @Override
    public int hashCode() {
        return Objects.hash(conclusion, subgoals);
    }

    @Override
    public String toString() {
        var b = new StringBuilder("Provable{\n").append(conclusion);
        if (subgoals.isEmpty()) b.append("\n  proved");
        for (var s : subgoals) b.append("\n  from\n").append(s);
        return b.append('}').toString();
    }
}
