package dumb.tactic;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.io.Closeable;
import java.time.Instant;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Write-only sink for evaluation history, sufficient to audit or replay a run. The interpreter never reads it.
 */
public interface ProofStore extends Closeable {

    void record(Step step);

    @Override
    default void close() {
    }

    /**
     * Tactic {@code tactic} applied to {@code input} produced either {@code output} or {@code failure}.
     *
     * @param step  completion order within the run, starting at 1
     * @param depth nesting depth of the node on its evaluating thread, the root being 0
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Step(String runId, long step, int depth, String tactic,
                @Nullable List<Sequent> input, @Nullable List<Sequent> output, @Nullable List<Label> labels,
                @Nullable String failure, Instant time) {
        public Step {
            requireNonNull(runId);
            requireNonNull(tactic);
            requireNonNull(time);
        }

        static Step of(String runId, long step, int depth, Tactic tactic, Value input, Value outcome) {
            var in = input instanceof Value.Proof p ? p.provable().subgoals() : null;
            if (outcome instanceof Value.Proof p)
                return new Step(runId, step, depth, tactic.describe(), in, p.provable().subgoals(), p.labels(), null, Instant.now());
            return new Step(runId, step, depth, tactic.describe(), in, null, null, ((Failure) outcome).render(), Instant.now());
        }

        public boolean failed() {
            return failure != null;
        }
    }
}
