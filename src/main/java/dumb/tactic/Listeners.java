package dumb.tactic;

import dumb.tactic.util.Log;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Dispatches to a set of {@link Listener}s. A throwing listener is logged and skipped; it never affects proof
 * search.
 */
public class Listeners implements Listener {
    private final CopyOnWriteArrayList<Listener> listeners;
    private final BooleanSupplier closed;

    public Listeners(List<? extends Listener> listeners) {
        this(new CopyOnWriteArrayList<>(listeners), () -> false);
    }

    private Listeners(CopyOnWriteArrayList<Listener> listeners, BooleanSupplier closed) {
        this.listeners = listeners;
        this.closed = closed;
    }

    private static void exeSafe(Consumer<Listener> call, Listener listener, String what) {
        try {
            call.accept(listener);
        } catch (RuntimeException e) {
            Log.warning("Error in " + what + " of listener " + listener.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public void add(Listener l) {
        listeners.add(l);
    }

    public boolean isEmpty() {
        return listeners.isEmpty();
    }

    /** A view on the same listeners that drops {@code begin} once {@code closed} holds. */
    Listeners gate(BooleanSupplier closed) {
        var outer = this.closed;
        return new Listeners(listeners, () -> outer.getAsBoolean() || closed.getAsBoolean());
    }

    @Override
    public void begin(Value input, Tactic tactic) {
        enter(input, tactic);
    }

    @Override
    public void end(Value input, Tactic tactic, Value outcome) {
        exit(input, tactic, outcome);
    }

    /** Delivers {@code begin} unless closed; returns whether it was delivered. */
    boolean enter(Value input, Tactic tactic) {
        if (closed.getAsBoolean()) return false;
        listeners.forEach(l -> exeSafe(x -> x.begin(input, tactic), l, "begin"));
        return true;
    }

    /** Delivers {@code end} even when closed, so every delivered {@code begin} is matched. */
    void exit(Value input, Tactic tactic, Value outcome) {
        listeners.forEach(l -> exeSafe(x -> x.end(input, tactic, outcome), l, "end"));
    }

    @Override
    public void kill() {
        listeners.forEach(l -> exeSafe(Listener::kill, l, "kill"));
    }
}
