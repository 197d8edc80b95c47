package dumb.tactic;

import dumb.tactic.Tactic.*;
import dumb.tactic.Value.Proof;
import dumb.tactic.util.Log;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Evaluates a {@link Tactic} against a {@link Value}. Every state transition goes through {@link Provable}, so a
 * defect here can fail a proof but never fake one.
 * <p>
 * The two disciplines differ only in {@link Branch}-like nodes: {@link Lazy} stops at the first failing branch,
 * {@link Exhaustive} attempts all of them and reports every failure.
 */
public abstract class Interpreter {

    final Listeners listeners;
    final Definitions defs;
    final ExecutorService exe;
    final long defaultTimeoutMillis;
    private final AtomicBoolean killed = new AtomicBoolean();
    @Nullable
    private final Interpreter parent;

    Interpreter(Listeners listeners, Definitions defs, ExecutorService exe, long defaultTimeoutMillis) {
        this.listeners = requireNonNull(listeners);
        this.defs = requireNonNull(defs);
        this.exe = requireNonNull(exe);
        this.defaultTimeoutMillis = defaultTimeoutMillis;
        this.parent = null;
    }

    /** A race candidate of {@code parent}: own registry scope, own cancellation, listeners muted once killed. */
    Interpreter(Interpreter parent) {
        this.parent = parent;
        this.listeners = parent.listeners.gate(killed::get);
        this.defs = parent.defs.fork();
        this.exe = parent.exe;
        this.defaultTimeoutMillis = parent.defaultTimeoutMillis;
    }

    public abstract Kind kind();

    abstract Interpreter candidate();

    /** Whether a failing branch stops the remaining branches. */
    abstract boolean failFast();

    /** Requests cooperative cancellation. Nodes entered afterwards yield {@link Failure.Kind#CANCELLED}. */
    public void kill() {
        if (killed.compareAndSet(false, true)) {
            Log.debug("Interpreter killed");
            listeners.kill();
        }
    }

    public boolean isKilled() {
        return killed.get() || (parent != null && parent.isKilled());
    }

    public Value apply(Tactic tactic, Value input) {
        var entered = listeners.enter(input, tactic);
        Value outcome;
        if (input instanceof Failure f)
            outcome = f;
        else if (isKilled())
            outcome = Failure.of(Failure.Kind.CANCELLED, "Proof search was cancelled", ((Proof) input).provable(), tactic.frame());
        else
            outcome = eval(tactic, (Proof) input);
        if (entered) listeners.exit(input, tactic, outcome);
        return outcome;
    }

    private Value eval(Tactic tactic, Proof p) {
        if (tactic instanceof Atomic a) return atomic(a, p);
        if (tactic instanceof Seq s) return seq(s, p);
        if (tactic instanceof Either e) return either(e, p);
        if (tactic instanceof Branch b) return branch(b.children(), p, b.frame());
        if (tactic instanceof BranchByLabel b) return branchByLabel(b, p);
        if (tactic instanceof OnAll o) return branch(Collections.nCopies(p.provable().size(), o.body()), p, o.frame());
        if (tactic instanceof Saturate s) return saturate(s.body(), p);
        if (tactic instanceof RepeatPlus r) return repeatPlus(r, p);
        if (tactic instanceof After a) return after(a, p);
        if (tactic instanceof LabelTactic l) return label(l, p);
        if (tactic instanceof USubstPattern u) return pattern(u, p);
        if (tactic instanceof TimeoutAlternatives t) return new Race(this, t, p).run();
        if (tactic instanceof Fail f) return Failure.of(Failure.Kind.USER, f.message(), p.provable(), f.frame());
        if (tactic instanceof Skip) return p;
        if (tactic instanceof DefTactic d) {
            defs.define(d.name(), d.body());
            return p;
        }
        if (tactic instanceof ApplyDefTactic u) return use(u, p);
        if (tactic instanceof Let l) return let(l, p);
        throw new IllegalStateException("Unknown tactic " + tactic.getClass());
    }

    private static Value within(Value v, String frame) {
        return v instanceof Failure f ? f.within(frame) : v;
    }

    /** A cancelled body ends a loop with the cancellation rather than the state reached so far. */
    private static boolean cancelled(Value v) {
        return v instanceof Failure f && f.kind() == Failure.Kind.CANCELLED;
    }

    @Nullable
    private static Failure single(Tactic t, Proof p) {
        var n = p.provable().size();
        return n == 1 ? null : Failure.of(Failure.Kind.SHAPE_MISMATCH,
                t.frame() + " requires exactly one open subgoal, found " + n, p.provable(), t.frame());
    }

    private Value atomic(Atomic a, Proof p) {
        var shape = single(a, p);
        if (shape != null) return shape;
        var rule = a.rule();
        try {
            var next = p.provable().apply(rule, 0);
            return new Proof(next, p.splice(0, next.size()));
        } catch (Rule.InapplicableException e) {
            return Failure.of(Failure.Kind.RULE_INAPPLICABLE, e.getMessage(), p.provable(), a.frame());
        } catch (RuntimeException e) {
            Log.warning("Rule " + rule.name() + " raised " + e);
            return Failure.of(Failure.Kind.RULE_INAPPLICABLE, "Rule " + rule.name() + " raised " + e, p.provable(), a.frame());
        }
    }

    private Value seq(Seq s, Proof p) {
        var first = apply(s.first(), p);
        if (first instanceof Failure f) return f.within(s.frame());
        return within(apply(s.then(), first), s.frame());
    }

    private Value either(Either e, Proof p) {
        var left = apply(e.left(), p);
        if (left instanceof Proof) return left;
        var right = apply(e.right(), p);
        if (right instanceof Proof) return right;
        return Failure.compound((Failure) left, (Failure) right, p.provable(), e.frame());
    }

    private Value after(After a, Proof p) {
        var first = apply(a.first(), p);
        return within(apply(a.then(), first), a.frame());
    }

    /** Runs {@code children.get(i)} on subgoal {@code i} and splices the results back in place. */
    private Value branch(List<Tactic> children, Proof p, String frame) {
        var provable = p.provable();
        var n = provable.size();
        if (children.size() != n)
            return Failure.of(Failure.Kind.SHAPE_MISMATCH, frame + ": number of tactics does not match number of subgoals, expected "
                    + children.size() + ", found " + n, provable, frame);

        var results = new Value[n];
        var failures = new ArrayList<Failure>();
        for (var i = 0; i < n; i++) {
            var r = apply(children.get(i), p.sub(i));
            results[i] = r;
            if (r instanceof Failure f) {
                failures.add(f.within(frame + " on subgoal " + (i + 1)));
                if (failFast()) return failures.get(0);
            }
        }

        Proof merged;
        try {
            merged = merge(p, results);
        } catch (Rule.InapplicableException e) {
            return Failure.of(Failure.Kind.RULE_INAPPLICABLE, e.getMessage(), provable, frame);
        }
        if (failures.isEmpty()) return merged;
        return Failure.combine(failures, merged.provable(), frame).withState(merged.provable());
    }

    /** Successful results replace their subgoal; failed or missing ones leave it open. */
    private static Proof merge(Proof p, Value[] results) {
        var provable = p.provable();
        for (var i = results.length - 1; i >= 0; i--)
            if (results[i] instanceof Proof r) provable = provable.apply(r.provable(), i);

        var labelled = p.labelled();
        for (var r : results) if (r instanceof Proof rp && rp.labelled()) labelled = true;
        if (!labelled) return new Proof(provable, null);

        var labels = new ArrayList<Label>(provable.size());
        for (var i = 0; i < results.length; i++) {
            var own = p.label(i);
            var base = own != null ? own : Label.of(String.valueOf(i + 1));
            if (results[i] instanceof Proof r) {
                if (r.labelled()) labels.addAll(r.labels());
                else labels.addAll(base.split(r.provable().size()));
            } else {
                labels.add(base);
            }
        }
        return new Proof(provable, labels);
    }

    private Value branchByLabel(BranchByLabel b, Proof p) {
        var n = p.provable().size();
        if (!p.labelled())
            return Failure.of(Failure.Kind.SHAPE_MISMATCH, b.frame() + " requires labelled subgoals", p.provable(), b.frame());
        var children = new ArrayList<Tactic>(n);
        var used = new HashSet<Label>();
        for (var i = 0; i < n; i++) {
            var goal = requireNonNull(p.label(i));
            var match = b.cases().entrySet().stream().filter(c -> goal.endsWith(c.getKey())).findFirst();
            if (match.isEmpty())
                return Failure.of(Failure.Kind.SHAPE_MISMATCH, b.frame() + ": no case for subgoal " + (i + 1)
                        + " labelled \"" + goal + "\"", p.provable(), b.frame());
            used.add(match.get().getKey());
            children.add(match.get().getValue());
        }
        if (used.size() < b.cases().size()) {
            var unused = new ArrayList<>(b.cases().keySet());
            unused.removeAll(used);
            return Failure.of(Failure.Kind.SHAPE_MISMATCH, b.frame() + ": no subgoal labelled " + unused, p.provable(), b.frame());
        }
        return branch(children, p, b.frame());
    }

    private Value saturate(Tactic body, Proof p) {
        var current = p;
        while (!current.isProved()) {
            var next = apply(body, current);
            if (cancelled(next)) return next;
            if (!(next instanceof Proof np) || np.equals(current)) break;
            current = np;
        }
        return current;
    }

    private Value repeatPlus(RepeatPlus r, Proof p) {
        var first = apply(r.body(), p);
        if (first instanceof Failure f) return f.within(r.frame());
        var current = (Proof) first;
        if (current.equals(p))
            return Failure.of(Failure.Kind.NO_PROGRESS, r.frame() + ": " + r.body().describe() + " made no progress", p.provable(), r.frame());
        for (var i = 1; i < r.max() && !current.isProved(); i++) {
            var next = apply(r.body(), current);
            if (cancelled(next)) return next;
            if (!(next instanceof Proof np) || np.equals(current)) break;
            current = np;
        }
        return current;
    }

    private Value label(LabelTactic l, Proof p) {
        var shape = single(l, p);
        if (shape != null) return shape;
        var existing = p.label(0);
        return p.withLabels(List.of(existing == null ? l.label() : existing.append(l.label())));
    }

    private Value pattern(USubstPattern u, Proof p) {
        var shape = single(u, p);
        if (shape != null) return shape;
        var goal = p.provable().subgoal(0);
        for (var c : u.cases()) {
            var subst = Unifier.match(c.pattern(), goal);
            if (subst.isPresent()) {
                if (Log.debugging()) Log.debug("Pattern matched with " + subst.get());
                Tactic next;
                try {
                    next = c.then().apply(subst.get());
                } catch (RuntimeException e) {
                    Log.warning("Pattern continuation raised " + e);
                    return Failure.of(Failure.Kind.PATTERN_UNIFICATION, "Pattern continuation raised " + e, p.provable(), u.frame());
                }
                if (next == null)
                    return Failure.of(Failure.Kind.PATTERN_UNIFICATION, "Pattern continuation produced no tactic for "
                            + subst.get(), p.provable(), u.frame());
                return within(apply(next, p), u.frame());
            }
        }
        return Failure.of(Failure.Kind.PATTERN_UNIFICATION, "Sequent does not match any of the expected patterns "
                + u.describe(), p.provable(), u.frame());
    }

    private Value use(ApplyDefTactic u, Proof p) {
        var body = defs.get(u.name());
        if (body.isEmpty())
            return Failure.of(Failure.Kind.UNDEFINED, "Undefined tactic " + u.name(), p.provable(), u.frame());
        return within(apply(body.get(), p), u.frame());
    }

    private Value let(Let l, Proof p) {
        var shape = single(l, p);
        if (shape != null) return shape;
        var provable = p.provable();
        var goal = provable.subgoal(0);
        var abbrv = l.abbreviation();
        if (!Provable.substitutable(abbrv) || goal.contains(abbrv))
            return Failure.of(Failure.Kind.LET_INAPPLICABLE, "Unable to abbreviate " + l.value().toKif() + " by "
                    + abbrv.toKif() + ": abbreviation must be a fresh uninterpreted symbol", provable, l.frame());

        var abstracted = Provable.startProof(goal.replace(l.value(), abbrv));
        var inner = apply(l.inner(), new Proof(abstracted, p.labels()));
        if (inner instanceof Failure f) return f.within(l.frame());
        var result = (Proof) inner;
        try {
            var specialized = result.provable().substitute(abbrv, l.value());
            if (!specialized.conclusion().equals(goal))
                return Failure.of(Failure.Kind.LET_INAPPLICABLE, "Unable to specialize inner proof back to\n" + goal
                        + "\nobtained\n" + specialized.conclusion(), provable, l.frame());
            return new Proof(provable.apply(specialized, 0), result.labels());
        } catch (Rule.InapplicableException e) {
            return Failure.of(Failure.Kind.LET_INAPPLICABLE, e.getMessage(), provable, l.frame());
        }
    }

    public enum Kind {
        LAZY, EXHAUSTIVE;

        public Interpreter create(List<? extends Listener> listeners, ExecutorService exe, long defaultTimeoutMillis) {
            var l = new Listeners(listeners);
            var d = new Definitions();
            return this == LAZY ? new Lazy(l, d, exe, defaultTimeoutMillis) : new Exhaustive(l, d, exe, defaultTimeoutMillis);
        }
    }

    /** Fail-fast: the first failing branch aborts the remaining ones. */
    public static final class Lazy extends Interpreter {
        Lazy(Listeners listeners, Definitions defs, ExecutorService exe, long defaultTimeoutMillis) {
            super(listeners, defs, exe, defaultTimeoutMillis);
        }

        private Lazy(Interpreter parent) {
            super(parent);
        }

        @Override
        public Kind kind() {
            return Kind.LAZY;
        }

        @Override
        Interpreter candidate() {
            return new Lazy(this);
        }

        @Override
        boolean failFast() {
            return true;
        }
    }

    /** Attempts every branch, then reports all branch failures together. */
    public static final class Exhaustive extends Interpreter {
        Exhaustive(Listeners listeners, Definitions defs, ExecutorService exe, long defaultTimeoutMillis) {
            super(listeners, defs, exe, defaultTimeoutMillis);
        }

        private Exhaustive(Interpreter parent) {
            super(parent);
        }

        @Override
        public Kind kind() {
            return Kind.EXHAUSTIVE;
        }

        @Override
        Interpreter candidate() {
            return new Exhaustive(this);
        }

        @Override
        boolean failFast() {
            return false;
        }
    }
}
