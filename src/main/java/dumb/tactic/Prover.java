package dumb.tactic;

import dumb.tactic.util.Log;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static dumb.tactic.util.Log.error;
import static java.util.Objects.requireNonNull;

/**
 * Entry point: runs tactics against proof states under a {@link Config}. Owns the threads used for racing
 * alternatives, so close it when done.
 */
public class Prover implements AutoCloseable {
    private static final long EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS = 2;

    public final Config config;
    private final ExecutorService exe;
    @Nullable
    private final ProofStore store;

    public Prover() {
        this(Config.load());
    }

    public Prover(Config config) {
        this(config, config.storePath() == null ? null : new JsonProofStore(Path.of(config.storePath())));
    }

    public Prover(Config config, @Nullable ProofStore store) {
        this.config = requireNonNull(config);
        this.store = store;
        this.exe = executor(config.raceThreads());
        Log.message("Prover started: " + config.interpreter() + " interpreter, " + config.raceThreads() + " race threads");
    }

    /** Grows on demand so that nested races cannot starve each other; {@code core} threads stay alive. */
    private static ExecutorService executor(int core) {
        var n = new AtomicInteger();
        ThreadFactory threads = r -> {
            var t = new Thread(r, "tactic-race-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(core, Integer.MAX_VALUE, 60, TimeUnit.SECONDS, new SynchronousQueue<>(), threads);
    }

    private static void shutdownExecutor(ExecutorService executor, String name) {
        if (executor.isShutdown()) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                error(name + " did not terminate gracefully, forcing shutdown.");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            error("Interrupted while waiting for " + name + " shutdown.");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * A fresh interpreter with its own named-tactic registry, observed by {@code listeners} plus the configured
     * tracing and recording. Keep a reference to {@link Interpreter#kill()} a run from another thread.
     */
    public Interpreter interpreter(Interpreter.Kind kind, List<? extends Listener> listeners) {
        var all = new ArrayList<Listener>(listeners);
        if (config.traceEnabled()) all.add(new Tracer());
        if (store != null) all.add(new StoreListener(store));
        return kind.create(all, exe, config.defaultTimeoutMillis());
    }

    public Value run(Tactic tactic, Provable initial, Interpreter.Kind kind, List<? extends Listener> listeners) {
        return interpreter(kind, listeners).apply(tactic, Value.of(initial));
    }

    public Value run(Tactic tactic, Provable initial) {
        return run(tactic, initial, config.interpreter(), List.of());
    }

    /**
     * Runs {@code tactic} and returns the resulting certificate, which may still have open subgoals.
     *
     * @throws ProofFailedException if the tactic failed
     */
    public Provable prove(Tactic tactic, Provable initial) {
        var result = run(tactic, initial);
        if (result instanceof Failure f) throw new ProofFailedException(f);
        return ((Value.Proof) result).provable();
    }

    public Provable prove(Tactic tactic, Term formula) {
        return prove(tactic, Provable.startProof(formula));
    }

    @Override
    public void close() {
        shutdownExecutor(exe, "Race executor");
        if (store != null) store.close();
    }

    public static class ProofFailedException extends RuntimeException {
        public final Failure failure;

        public ProofFailedException(Failure failure) {
            super(failure.render());
            this.failure = failure;
        }
    }
}
