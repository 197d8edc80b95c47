package dumb.tactic;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Formulas and terms of the logic as S-expressions. Connectives and predicates are the operator atom at the
 * head of a {@link Lst}; pattern variables ({@link Var}) only appear in sequent patterns.
 */
sealed public interface Term permits Term.Atom, Term.Var, Term.Lst {

    static Atom atom(String value) {
        return Atom.of(value);
    }

    static Var var(String name) {
        return Var.of(name.startsWith("?") ? name : "?" + name);
    }

    static Lst list(String op, Term... args) {
        var terms = new ArrayList<Term>(args.length + 1);
        terms.add(Atom.of(op));
        terms.addAll(List.of(args));
        return new Lst(terms);
    }

    String toKif();

    boolean containsVar();

    Set<Var> vars();

    int weight();

    /** True if {@code t} occurs in this term, including this term itself. */
    default boolean contains(Term t) {
        if (equals(t)) return true;
        return this instanceof Lst l && l.terms.stream().anyMatch(sub -> sub.contains(t));
    }

    /** Replaces every occurrence of {@code what}, outermost first. */
    default Term replace(Term what, Term repl) {
        if (equals(what)) return repl;
        if (!(this instanceof Lst l)) return this;
        var changed = false;
        var next = new ArrayList<Term>(l.size());
        for (var sub : l.terms) {
            var r = sub.replace(what, repl);
            if (r != sub) changed = true;
            next.add(r);
        }
        return changed ? new Lst(next) : this;
    }

    record Var(String name) implements Term {
        private static final Map<String, Var> internCache = new ConcurrentHashMap<>(256);

        public Var {
            requireNonNull(name);
            if (!name.startsWith("?") || name.length() < 2)
                throw new IllegalArgumentException("Variable name must start with '?' and have length > 1: " + name);
        }

        public static Var of(String name) {
            return internCache.computeIfAbsent(name, Var::new);
        }

        @JsonValue
        @Override
        public String toKif() {
            return name;
        }

        @Override
        public boolean containsVar() {
            return true;
        }

        @Override
        public Set<Var> vars() {
            return Set.of(this);
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public String toString() {
            return toKif();
        }
    }

    final class Lst implements Term {
        public final List<Term> terms;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated = false;
        private volatile String kifStringCache;
        private volatile int weightCache = -1;
        private volatile Set<Var> variablesCache;
        private volatile Boolean containsVariableCache;

        public Lst(List<Term> terms) {
            this.terms = List.copyOf(terms);
        }

        public Lst(Term... terms) {
            this(List.of(terms));
        }

        public Term get(int index) {
            return terms.get(index);
        }

        public int size() {
            return terms.size();
        }

        public Optional<String> op() {
            return terms.isEmpty() || !(terms.get(0) instanceof Atom a) ? Optional.empty() : Optional.of(a.value());
        }

        public boolean is(String op, int arity) {
            return size() == arity + 1 && op().filter(op::equals).isPresent();
        }

        public List<Term> args() {
            return terms.isEmpty() ? List.of() : terms.subList(1, terms.size());
        }

        @JsonValue
        @Override
        public String toKif() {
            if (kifStringCache == null)
                kifStringCache = terms.stream().map(Term::toKif).collect(Collectors.joining(" ", "(", ")"));
            return kifStringCache;
        }

        @Override
        public boolean containsVar() {
            if (containsVariableCache == null) containsVariableCache = terms.stream().anyMatch(Term::containsVar);
            return containsVariableCache;
        }

        @Override
        public Set<Var> vars() {
            if (variablesCache == null)
                variablesCache = terms.stream().flatMap(t -> t.vars().stream()).collect(Collectors.toUnmodifiableSet());
            return variablesCache;
        }

        @Override
        public int weight() {
            if (weightCache == -1) weightCache = 1 + terms.stream().mapToInt(Term::weight).sum();
            return weightCache;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Lst that && this.hashCode() == that.hashCode() && terms.equals(that.terms));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = terms.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return toKif();
        }
    }

    record Atom(String value) implements Term {
        private static final Pattern SAFE_ATOM_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-+*/.<>=:!#%&']+$");
        private static final Map<String, Atom> internCache = new ConcurrentHashMap<>(1024);

        public Atom {
            requireNonNull(value);
        }

        public static Atom of(String value) {
            return internCache.computeIfAbsent(value, Atom::new);
        }

        @JsonValue
        @Override
        public String toKif() {
            var needsQuotes = value.isEmpty() || !SAFE_ATOM_PATTERN.matcher(value).matches() || value.chars().anyMatch(c -> Character.isWhitespace(c) || "()\";?".indexOf(c) != -1);
            return needsQuotes ? '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"' : value;
        }

        @Override
        public boolean containsVar() {
            return false;
        }

        @Override
        public Set<Var> vars() {
            return Set.of();
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public String toString() {
            return toKif();
        }
    }
}
