package dumb.tactic;

import dumb.tactic.Tactic.TimeoutAlternatives;
import dumb.tactic.Value.Proof;
import dumb.tactic.util.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * One evaluation of {@link TimeoutAlternatives}. Each alternative runs in its own candidate interpreter on the
 * shared executor; the first successful outcome wins and every other candidate is killed. Candidates are never
 * interrupted, their late results are just discarded.
 */
final class Race {
    /** How often a waiting race checks whether its interpreter was killed. */
    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(20);

    private final Interpreter parent;
    private final TimeoutAlternatives tactic;
    private final Proof input;
    private final List<Interpreter> candidates = new ArrayList<>();
    private final List<Future<Outcome>> futures = new ArrayList<>();

    Race(Interpreter parent, TimeoutAlternatives tactic, Proof input) {
        this.parent = parent;
        this.tactic = tactic;
        this.input = input;
    }

    Value run() {
        var timeout = tactic.timeoutMillis() == TimeoutAlternatives.DEFAULT ? parent.defaultTimeoutMillis : tactic.timeoutMillis();
        var deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeout);
        var frame = tactic.frame();
        var alternatives = tactic.alternatives();
        var completion = new ExecutorCompletionService<Outcome>(parent.exe);
        for (var i = 0; i < alternatives.size(); i++) {
            var index = i;
            var c = parent.candidate();
            candidates.add(c);
            futures.add(completion.submit(() -> new Outcome(index, c.apply(alternatives.get(index), input))));
        }

        var failures = new TreeMap<Integer, Failure>();
        try {
            for (var remaining = alternatives.size(); remaining > 0; remaining--) {
                Future<Outcome> done = null;
                while (done == null) {
                    if (parent.isKilled()) {
                        stopAll(-1);
                        return Failure.of(Failure.Kind.CANCELLED, "Proof search was cancelled", input.provable(), frame);
                    }
                    var wait = deadline - System.nanoTime();
                    if (wait <= 0) {
                        Log.debug(frame + ": no alternative succeeded within " + timeout + "ms");
                        stopAll(-1);
                        return Failure.of(Failure.Kind.TIMEOUT, "Alternative timed out after " + timeout + "ms", input.provable(), frame);
                    }
                    done = completion.poll(Math.min(wait, POLL_NANOS), TimeUnit.NANOSECONDS);
                }
                var outcome = outcome(done);
                if (outcome.value instanceof Proof winner) {
                    Log.debug(frame + ": alternative " + (outcome.index + 1) + " of " + alternatives.size() + " succeeded");
                    stopAll(outcome.index);
                    return winner;
                }
                failures.put(outcome.index, ((Failure) outcome.value).within(frame + " alternative " + (outcome.index + 1)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopAll(-1);
            return Failure.of(Failure.Kind.CANCELLED, "Interrupted while waiting for alternatives", input.provable(), frame);
        }
        return Failure.combine(new ArrayList<>(failures.values()), input.provable(), frame);
    }

    private Outcome outcome(Future<Outcome> done) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            var index = futures.indexOf(done);
            Log.error(tactic.frame() + ": alternative " + (index + 1) + " raised", e.getCause());
            return new Outcome(index, Failure.of(Failure.Kind.RULE_INAPPLICABLE, "Alternative raised " + e.getCause(),
                    input.provable(), tactic.alternatives().get(index).frame()));
        }
    }

    /** Kills every candidate except {@code winner}. */
    private void stopAll(int winner) {
        for (var i = 0; i < candidates.size(); i++) {
            if (i == winner) continue;
            candidates.get(i).kill();
            futures.get(i).cancel(false);
        }
    }

    private record Outcome(int index, Value value) {
    }
}
