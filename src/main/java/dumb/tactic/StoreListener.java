package dumb.tactic;

import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * Records every completed tactic node of one run to a {@link ProofStore}. Depth is counted per thread, so the nodes of
 * a race candidate start again at depth 0.
 */
public class StoreListener implements Listener {
    private static final AtomicLong runs = new AtomicLong();

    private final ProofStore store;
    private final String runId;
    private final AtomicLong steps = new AtomicLong();
    private final ThreadLocal<int[]> depth = ThreadLocal.withInitial(() -> new int[1]);

    public StoreListener(ProofStore store) {
        this(store, "run-" + runs.incrementAndGet());
    }

    public StoreListener(ProofStore store, String runId) {
        this.store = requireNonNull(store);
        this.runId = requireNonNull(runId);
    }

    public String runId() {
        return runId;
    }

    @Override
    public void begin(Value input, Tactic tactic) {
        depth.get()[0]++;
    }

    @Override
    public void end(Value input, Tactic tactic, Value outcome) {
        var d = --depth.get()[0];
        store.record(ProofStore.Step.of(runId, steps.incrementAndGet(), d, tactic, input, outcome));
    }
}
