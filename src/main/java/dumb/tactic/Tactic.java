package dumb.tactic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Proof-search programs. The set of variants is closed; {@link Interpreter} evaluates each of them.
 */
sealed public interface Tactic permits Tactic.Atomic, Tactic.Seq, Tactic.Either, Tactic.Branch, Tactic.BranchByLabel,
        Tactic.Saturate, Tactic.RepeatPlus, Tactic.After, Tactic.OnAll, Tactic.LabelTactic, Tactic.USubstPattern,
        Tactic.TimeoutAlternatives, Tactic.Fail, Tactic.Skip, Tactic.DefTactic, Tactic.ApplyDefTactic, Tactic.Let {

    /** Short identity of this node in failure traces. */
    String frame();

    /** Full rendering of this tactic. */
    String describe();

    static Tactic rule(Rule r) {
        return new Atomic(r);
    }

    /** Right-nested sequence, {@code seq(a, b, c) = a ; (b ; c)}. */
    static Tactic seq(Tactic first, Tactic... rest) {
        return fold(first, rest, Seq::new);
    }

    static Tactic either(Tactic first, Tactic... rest) {
        return fold(first, rest, Either::new);
    }

    static Tactic after(Tactic first, Tactic then) {
        return new After(first, then);
    }

    static Tactic branch(Tactic... children) {
        return new Branch(List.of(children));
    }

    static Tactic cases(Map<Label, Tactic> cases) {
        return new BranchByLabel(cases);
    }

    static Tactic onAll(Tactic t) {
        return new OnAll(t);
    }

    static Tactic saturate(Tactic t) {
        return new Saturate(t);
    }

    static Tactic repeatPlus(Tactic t) {
        return new RepeatPlus(t, RepeatPlus.UNBOUNDED);
    }

    /** {@code t} exactly {@code n} times in sequence. */
    static Tactic repeat(int n, Tactic t) {
        if (n < 0) throw new IllegalArgumentException("Negative repetition count " + n);
        if (n == 0) return skip();
        var rest = new Tactic[n - 1];
        Arrays.fill(rest, t);
        return seq(t, rest);
    }

    /** {@code t} once, failing if it did not change the proof state. */
    static Tactic must(Tactic t) {
        return new RepeatPlus(t, 1);
    }

    /** Fails unless every subgoal is closed. */
    static Tactic done() {
        return new OnAll(new Fail("Expected proved provable, but subgoals remain open"));
    }

    /** {@code t} on subgoal {@code i} of {@code n} open subgoals, leaving the others alone. */
    static Tactic atSubgoal(int i, int n, Tactic t) {
        if (i < 0 || i >= n) throw new IllegalArgumentException("Subgoal " + i + " out of range for " + n + " subgoals");
        var children = new ArrayList<Tactic>(Collections.nCopies(n, skip()));
        children.set(i, t);
        return new Branch(children);
    }

    static Tactic label(Label l) {
        return new LabelTactic(l);
    }

    static Tactic label(String name) {
        return new LabelTactic(Label.of(name));
    }

    static Tactic fail(String message) {
        return new Fail(message);
    }

    static Tactic skip() {
        return Skip.the;
    }

    static Tactic def(String name, Tactic body) {
        return new DefTactic(name, body);
    }

    static Tactic use(String name) {
        return new ApplyDefTactic(name);
    }

    static Tactic let(Term abbreviation, Term value, Tactic inner) {
        return new Let(abbreviation, value, inner);
    }

    static Tactic pattern(Sequent pattern, Function<Subst, Tactic> then) {
        return new USubstPattern(List.of(new USubstPattern.Case(pattern, then)));
    }

    static Tactic timeoutAlternatives(long timeoutMillis, Tactic... alternatives) {
        return new TimeoutAlternatives(List.of(alternatives), timeoutMillis);
    }

    /** Alternatives raced under the prover's configured default timeout. */
    static Tactic timeoutAlternatives(Tactic... alternatives) {
        return new TimeoutAlternatives(List.of(alternatives), TimeoutAlternatives.DEFAULT);
    }

    private static Tactic fold(Tactic first, Tactic[] rest, BinaryOperator<Tactic> op) {
        if (rest.length == 0) return first;
        var result = rest[rest.length - 1];
        for (var i = rest.length - 2; i >= 0; i--) result = op.apply(rest[i], result);
        return op.apply(first, result);
    }

    private static String describeAll(List<Tactic> ts) {
        return ts.stream().map(Tactic::describe).collect(Collectors.joining(", "));
    }

    /** A single kernel rule applied to the one open subgoal. */
    record Atomic(Rule rule) implements Tactic {
        public Atomic {
            requireNonNull(rule);
        }

        @Override
        public String frame() {
            return rule.name();
        }

        @Override
        public String describe() {
            return rule.name();
        }
    }

    record Seq(Tactic first, Tactic then) implements Tactic {
        public Seq {
            requireNonNull(first);
            requireNonNull(then);
        }

        @Override
        public String frame() {
            return "Seq";
        }

        @Override
        public String describe() {
            return "(" + first.describe() + " ; " + then.describe() + ")";
        }
    }

    /** {@code left}, or {@code right} from the original state if {@code left} fails. */
    record Either(Tactic left, Tactic right) implements Tactic {
        public Either {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public String frame() {
            return "Either";
        }

        @Override
        public String describe() {
            return "(" + left.describe() + " | " + right.describe() + ")";
        }
    }

    record Branch(List<Tactic> children) implements Tactic {
        public Branch {
            children = List.copyOf(children);
        }

        @Override
        public String frame() {
            return "Branch";
        }

        @Override
        public String describe() {
            return "<(" + describeAll(children) + ")";
        }
    }

    /** Children are matched to subgoals whose label ends with the case label. */
    record BranchByLabel(Map<Label, Tactic> cases) implements Tactic {
        public BranchByLabel {
            if (cases.isEmpty()) throw new IllegalArgumentException("No cases");
            cases = Collections.unmodifiableMap(new LinkedHashMap<>(cases));
        }

        @Override
        public String frame() {
            return "BranchByLabel";
        }

        @Override
        public String describe() {
            return cases.entrySet().stream()
                    .map(e -> '"' + e.getKey().toString() + "\": " + e.getValue().describe())
                    .collect(Collectors.joining(", ", "case(", ")"));
        }
    }

    /** Repeats {@code body} while it succeeds and makes progress. Never fails. */
    record Saturate(Tactic body) implements Tactic {
        public Saturate {
            requireNonNull(body);
        }

        @Override
        public String frame() {
            return "Saturate";
        }

        @Override
        public String describe() {
            return body.describe() + "*";
        }
    }

    /**
     * Like {@link Saturate} but the first application must succeed with progress.
     *
     * @param max iteration bound, {@link #UNBOUNDED} for none
     */
    record RepeatPlus(Tactic body, int max) implements Tactic {
        public static final int UNBOUNDED = Integer.MAX_VALUE;

        public RepeatPlus {
            requireNonNull(body);
            if (max < 1) throw new IllegalArgumentException("Iteration bound must be positive: " + max);
        }

        @Override
        public String frame() {
            return max == 1 ? "must" : "RepeatPlus";
        }

        @Override
        public String describe() {
            return max == 1 ? "must(" + body.describe() + ")" : body.describe() + "+";
        }
    }

    /** {@code then} runs on the outcome of {@code first}, including a failure. */
    record After(Tactic first, Tactic then) implements Tactic {
        public After {
            requireNonNull(first);
            requireNonNull(then);
        }

        @Override
        public String frame() {
            return "After";
        }

        @Override
        public String describe() {
            return "(" + first.describe() + " > " + then.describe() + ")";
        }
    }

    record OnAll(Tactic body) implements Tactic {
        public OnAll {
            requireNonNull(body);
        }

        @Override
        public String frame() {
            return "OnAll";
        }

        @Override
        public String describe() {
            return "onAll(" + body.describe() + ")";
        }
    }

    record LabelTactic(Label label) implements Tactic {
        public LabelTactic {
            requireNonNull(label);
        }

        @Override
        public String frame() {
            return "label(" + label + ")";
        }

        @Override
        public String describe() {
            return "label(\"" + label + "\")";
        }
    }

    /** Runs the continuation of the first case whose pattern matches the single open subgoal. */
    record USubstPattern(List<Case> cases) implements Tactic {
        public USubstPattern {
            cases = List.copyOf(cases);
            if (cases.isEmpty()) throw new IllegalArgumentException("No patterns");
        }

        @Override
        public String frame() {
            return "USubstPattern";
        }

        @Override
        public String describe() {
            return cases.stream().map(c -> c.pattern.toString().replace('\n', ' ').strip())
                    .collect(Collectors.joining(" | ", "pattern(", ")"));
        }

        public record Case(Sequent pattern, Function<Subst, Tactic> then) {
            public Case {
                requireNonNull(pattern);
                requireNonNull(then);
            }
        }
    }

    /**
     * Races {@code alternatives} on copies of the input state and commits to the first success.
     *
     * @param timeoutMillis wall-clock bound, or {@link #DEFAULT} for the configured default
     */
    record TimeoutAlternatives(List<Tactic> alternatives, long timeoutMillis) implements Tactic {
        public static final long DEFAULT = 0;

        public TimeoutAlternatives {
            alternatives = List.copyOf(alternatives);
            if (alternatives.isEmpty()) throw new IllegalArgumentException("No alternatives");
            if (timeoutMillis < 0) throw new IllegalArgumentException("Negative timeout " + timeoutMillis);
        }

        @Override
        public String frame() {
            return "TimeoutAlternatives";
        }

        @Override
        public String describe() {
            return "race(" + describeAll(alternatives) + (timeoutMillis == DEFAULT ? "" : "; " + timeoutMillis + "ms") + ")";
        }
    }

    record Fail(String message) implements Tactic {
        public Fail {
            requireNonNull(message);
        }

        @Override
        public String frame() {
            return "fail";
        }

        @Override
        public String describe() {
            return "fail(\"" + message + "\")";
        }
    }

    final class Skip implements Tactic {
        static final Skip the = new Skip();

        private Skip() {
        }

        @Override
        public String frame() {
            return "skip";
        }

        @Override
        public String describe() {
            return "skip";
        }

        @Override
        public String toString() {
            return describe();
        }
    }

    /** Registers {@code body} under {@code name} for the rest of the run. */
    record DefTactic(String name, Tactic body) implements Tactic {
        public DefTactic {
            requireNonNull(name);
            requireNonNull(body);
        }

        @Override
        public String frame() {
            return "def " + name;
        }

        @Override
        public String describe() {
            return "def " + name + " = " + body.describe();
        }
    }

    /** Runs the tactic registered under {@code name}, looked up when applied. */
    record ApplyDefTactic(String name) implements Tactic {
        public ApplyDefTactic {
            requireNonNull(name);
        }

        @Override
        public String frame() {
            return name;
        }

        @Override
        public String describe() {
            return "use " + name;
        }
    }

    /**
     * Proves the goal with {@code value} abstracted to the uninterpreted {@code abbreviation}, then specializes the
     * inner proof back.
     */
    record Let(Term abbreviation, Term value, Tactic inner) implements Tactic {
        public Let {
            requireNonNull(abbreviation);
            requireNonNull(value);
            requireNonNull(inner);
        }

        @Override
        public String frame() {
            return "let " + abbreviation.toKif();
        }

        @Override
        public String describe() {
            return "let(" + abbreviation.toKif() + " = " + value.toKif() + ", " + inner.describe() + ")";
        }
    }
}
