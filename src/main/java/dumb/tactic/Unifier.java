package dumb.tactic;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNullElse;

/**
 * One-way matching of patterns containing {@link Term.Var}s against ground formulas and sequents.
 */
public enum Unifier {
    ;

    private static final int MAX_SUBST_DEPTH = 50;

    /** Matches {@code pattern} against {@code goal} formula by formula, on both sides of the turnstile. */
    public static Optional<Subst> match(Sequent pattern, Sequent goal) {
        if (pattern.ante().size() != goal.ante().size() || pattern.succ().size() != goal.succ().size())
            return Optional.empty();
        var bindings = match(pattern.ante(), goal.ante(), Map.of());
        bindings = match(pattern.succ(), goal.succ(), bindings);
        return Optional.ofNullable(bindings).map(Subst::new);
    }

    @Nullable
    static Map<Term.Var, Term> match(Term pattern, Term term, Map<Term.Var, Term> bindings) {
        return matchRecursive(pattern, term, bindings, 0);
    }

    static Term subst(Term term, Map<Term.Var, Term> bindings) {
        return substRecursive(term, bindings, 0);
    }

    @Nullable
    private static Map<Term.Var, Term> match(List<Term> patterns, List<Term> terms, @Nullable Map<Term.Var, Term> bindings) {
        var current = bindings;
        for (var i = 0; i < patterns.size() && current != null; i++)
            current = matchRecursive(patterns.get(i), terms.get(i), current, 0);
        return current;
    }

    @Nullable
    private static Map<Term.Var, Term> matchRecursive(Term pattern, Term term, @Nullable Map<Term.Var, Term> bindings, int depth) {
        if (bindings == null || depth > MAX_SUBST_DEPTH) return null;
        var patternSubst = substRecursive(pattern, bindings, depth + 1);
        if (patternSubst instanceof Term.Var varP) return bindVariable(varP, term, bindings, depth);
        if (patternSubst.equals(term)) return bindings;
        if (patternSubst instanceof Term.Lst lp && term instanceof Term.Lst lt) {
            var s = lp.size();
            if (s == lt.size()) {
                var current = bindings;
                for (var i = 0; i < s; i++) {
                    current = matchRecursive(lp.get(i), lt.get(i), current, depth + 1);
                    if (current == null) return null;
                }
                return current;
            }
        }
        return null;
    }

    private static Term substRecursive(Term term, Map<Term.Var, Term> bindings, int depth) {
        if (bindings.isEmpty() || depth > MAX_SUBST_DEPTH || !term.containsVar())
            return term;
        if (term instanceof Term.Var var) {
            var binding = bindings.get(var);
            return binding != null ? substRecursive(binding, bindings, depth + 1) : requireNonNullElse(binding, var);
        }
        var list = (Term.Lst) term;
        var changed = new boolean[]{false};
        var newTerms = list.terms.stream().map(sub -> {
            var subSubst = substRecursive(sub, bindings, depth + 1);
            if (subSubst != sub) changed[0] = true;
            return subSubst;
        }).toList();
        return changed[0] ? new Term.Lst(newTerms) : list;
    }

    @Nullable
    private static Map<Term.Var, Term> bindVariable(Term.Var var, Term value, Map<Term.Var, Term> bindings, int depth) {
        if (var.equals(value)) return bindings;
        if (bindings.containsKey(var))
            return matchRecursive(bindings.get(var), value, bindings, depth + 1);
        Map<Term.Var, Term> newBindings = new HashMap<>(bindings);
        newBindings.put(var, value);
        return Collections.unmodifiableMap(newBindings);
    }
}
