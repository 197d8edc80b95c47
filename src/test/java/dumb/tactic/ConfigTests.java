package dumb.tactic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTests {

    @Test
    void absentFieldsTakeDefaults() {
        var c = Config.parse("{}");
        assertEquals(Interpreter.Kind.EXHAUSTIVE, c.interpreter());
        assertEquals(Config.DEFAULT_RACE_THREADS, c.raceThreads());
        assertEquals(Config.DEFAULT_TIMEOUT_MILLIS, c.defaultTimeoutMillis());
        assertNull(c.storePath());
        assertFalse(c.traceEnabled());
        assertEquals(new Config(), c);
    }

    @Test
    void parsesAllFields() {
        var c = Config.parse("""
                {"interpreter": "LAZY", "raceThreads": 3, "defaultTimeoutMillis": 250,
                 "storePath": "steps.jsonl", "traceEnabled": true, "unknown": 1}
                """);
        assertEquals(new Config(Interpreter.Kind.LAZY, 3, 250, "steps.jsonl", true), c);
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(UncheckedIOException.class, () -> Config.parse("{\"raceThreads\": 0}"));
        assertThrows(UncheckedIOException.class, () -> Config.parse("{\"interpreter\": \"EAGER\"}"));
        assertThrows(UncheckedIOException.class, () -> Config.parse("not json"));
        assertThrows(IllegalArgumentException.class, () -> new Config().withDefaultTimeoutMillis(0));
    }

    @Test
    void loadsClassPathResource() {
        var c = Config.load();
        assertEquals(Interpreter.Kind.EXHAUSTIVE, c.interpreter());
        assertEquals(10_000, c.defaultTimeoutMillis());
    }

    @Test
    void loadsFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("tactic.json");
        Files.writeString(file, "{\"interpreter\": \"LAZY\"}");
        assertEquals(Interpreter.Kind.LAZY, Config.load(file).interpreter());
        assertThrows(UncheckedIOException.class, () -> Config.load(dir.resolve("missing.json")));
    }

    @Test
    void proverUsesConfiguredInterpreter() {
        try (var prover = new Prover(new Config().withInterpreter(Interpreter.Kind.LAZY))) {
            assertEquals(Interpreter.Kind.LAZY, prover.interpreter(prover.config.interpreter(), List.of()).kind());
        }
    }
}
