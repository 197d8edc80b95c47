package dumb.tactic;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.tactic.util.Json;
import dumb.tactic.util.Log;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Prover settings. Absent JSON fields take their defaults.
 *
 * @param raceThreads          threads kept alive for racing {@link Tactic.TimeoutAlternatives}
 * @param defaultTimeoutMillis bound for alternatives built without an explicit timeout
 * @param storePath            JSON-lines file every evaluation step is appended to, or null for none
 * @param traceEnabled         log tactic entry and exit at DEBUG level
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Config(
        Interpreter.Kind interpreter,
        int raceThreads,
        long defaultTimeoutMillis,
        @Nullable String storePath,
        boolean traceEnabled
) {
    public static final String RESOURCE = "tactic.json";
    public static final Interpreter.Kind DEFAULT_INTERPRETER = Interpreter.Kind.EXHAUSTIVE;
    public static final long DEFAULT_TIMEOUT_MILLIS = 10_000;
    public static final int DEFAULT_RACE_THREADS = Runtime.getRuntime().availableProcessors();

    public Config {
        requireNonNull(interpreter);
        if (raceThreads < 1) throw new IllegalArgumentException("raceThreads must be positive: " + raceThreads);
        if (defaultTimeoutMillis < 1)
            throw new IllegalArgumentException("defaultTimeoutMillis must be positive: " + defaultTimeoutMillis);
    }

    @JsonCreator
    public Config(
            @JsonProperty("interpreter") @Nullable Interpreter.Kind interpreter,
            @JsonProperty("raceThreads") @Nullable Integer raceThreads,
            @JsonProperty("defaultTimeoutMillis") @Nullable Long defaultTimeoutMillis,
            @JsonProperty("storePath") @Nullable String storePath,
            @JsonProperty("traceEnabled") @Nullable Boolean traceEnabled
    ) {
        this(
                interpreter != null ? interpreter : DEFAULT_INTERPRETER,
                raceThreads != null ? raceThreads : DEFAULT_RACE_THREADS,
                defaultTimeoutMillis != null ? defaultTimeoutMillis : DEFAULT_TIMEOUT_MILLIS,
                storePath,
                traceEnabled != null && traceEnabled
        );
    }

    public Config() {
        this(DEFAULT_INTERPRETER, DEFAULT_RACE_THREADS, DEFAULT_TIMEOUT_MILLIS, null, false);
    }

    /** The class-path {@value RESOURCE} if there is one, otherwise the defaults. */
    public static Config load() {
        try (var in = Config.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                Log.debug("No " + RESOURCE + " on class path, using defaults");
                return new Config();
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
    }

    public static Config load(Path file) {
        try {
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read configuration " + file, e);
        }
    }

    public static Config parse(String json) {
        try {
            return Json.obj(json, Config.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
    }

    public Config withInterpreter(Interpreter.Kind kind) {
        return new Config(kind, raceThreads, defaultTimeoutMillis, storePath, traceEnabled);
    }

    public Config withStorePath(@Nullable String path) {
        return new Config(interpreter, raceThreads, defaultTimeoutMillis, path, traceEnabled);
    }

    public Config withDefaultTimeoutMillis(long millis) {
        return new Config(interpreter, raceThreads, millis, storePath, traceEnabled);
    }
}
