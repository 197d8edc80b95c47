package dumb.tactic;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * What flows through the interpreter: a proof state, optionally labelled, or a {@link Failure}.
 */
sealed public interface Value permits Value.Proof, Failure {

    static Proof of(Provable provable) {
        return new Proof(provable, null);
    }

    static Proof of(Provable provable, @Nullable List<Label> labels) {
        return new Proof(provable, labels);
    }

    /** @param labels one per open subgoal, or null if no branch has been labelled */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Proof(Provable provable, @Nullable List<Label> labels) implements Value {
        public Proof {
            requireNonNull(provable);
            if (labels != null) {
                labels = List.copyOf(labels);
                if (labels.size() != provable.size())
                    throw new IllegalArgumentException(labels.size() + " labels for " + provable.size() + " subgoals");
            }
        }

        public boolean isProved() {
            return provable.isProved();
        }

        public boolean labelled() {
            return labels != null;
        }

        @Nullable
        public Label label(int i) {
            return labels == null ? null : labels.get(i);
        }

        /** Subgoal {@code i} as a proof of its own, carrying its label. */
        Proof sub(int i) {
            return new Proof(provable.sub(i), labels == null ? null : List.of(labels.get(i)));
        }

        /** Labels for this state after subgoal {@code i} was replaced by {@code k} subgoals of an unlabelled result. */
        @Nullable
        List<Label> splice(int i, int k) {
            if (labels == null) return null;
            var next = new ArrayList<Label>(labels.size() - 1 + k);
            next.addAll(labels.subList(0, i));
            next.addAll(labels.get(i).split(k));
            next.addAll(labels.subList(i + 1, labels.size()));
            return next;
        }

        Proof withLabels(@Nullable List<Label> labels) {
            return new Proof(provable, labels);
        }
    }
}
