package dumb.tactic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/** Logs entry and exit of every tactic node with its elapsed time. */
public class Tracer implements Listener {
    private static final Logger logger = LoggerFactory.getLogger(Tracer.class);

    private final ThreadLocal<Deque<Long>> started = ThreadLocal.withInitial(ArrayDeque::new);

    @Override
    public void begin(Value input, Tactic tactic) {
        if (logger.isDebugEnabled())
            logger.debug("{}> {}", indent(), tactic.frame());
        started.get().push(System.nanoTime());
    }

    @Override
    public void end(Value input, Tactic tactic, Value outcome) {
        var stack = started.get();
        var start = stack.isEmpty() ? System.nanoTime() : stack.pop();
        if (logger.isDebugEnabled()) {
            var ms = (System.nanoTime() - start) / 1_000_000.0;
            var result = outcome instanceof Failure f ? "failed: " + f.kind()
                    : ((Value.Proof) outcome).provable().size() + " open";
            logger.debug("{}< {} {} ({} ms)", indent(), tactic.frame(), result, String.format("%.1f", ms));
        }
    }

    @Override
    public void kill() {
        logger.debug("killed");
    }

    private String indent() {
        return "  ".repeat(started.get().size());
    }
}
