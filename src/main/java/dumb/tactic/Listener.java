package dumb.tactic;

/**
 * Observes evaluation. {@link #begin} and {@link #end} are called synchronously around every tactic node, nested
 * like the tactic tree.
 */
public interface Listener {

    default void begin(Value input, Tactic tactic) {
    }

    default void end(Value input, Tactic tactic, Value outcome) {
    }

    /** The run (or race candidate) this listener observes was cancelled. */
    default void kill() {
    }
}
