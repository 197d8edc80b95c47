package dumb.tactic;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.tactic.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static dumb.tactic.SequentCalculus.*;
import static dumb.tactic.Tactic.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProofStoreTests extends AbstractTest {

    @Test
    void everyNodeIsRecordedChildrenFirst() {
        var steps = new CopyOnWriteArrayList<ProofStore.Step>();
        ProofStore store = steps::add;
        var t = seq(rule(andR(0)), branch(close(), close()));
        proved(run(Interpreter.Kind.LAZY, t, goal(and(eq(num(1), num(1)), eq(num(2), num(2)))), new StoreListener(store, "r1")));

        assertEquals(7, steps.size());
        for (var i = 0; i < steps.size(); i++) {
            assertEquals(i + 1, steps.get(i).step());
            assertEquals("r1", steps.get(i).runId());
        }
        var root = steps.get(steps.size() - 1);
        assertEquals(0, root.depth());
        assertEquals(t.describe(), root.tactic());
        assertEquals(List.of(), root.output());
        assertFalse(root.failed());
        assertEquals("andR(0)", steps.get(0).tactic());
        assertEquals(1, steps.get(0).depth());
    }

    @Test
    void failuresAreRecordedRendered() {
        var steps = new ArrayList<ProofStore.Step>();
        ProofStore store = steps::add;
        run(Interpreter.Kind.LAZY, fail("boom"), goal(a), new StoreListener(store));
        assertEquals(1, steps.size());
        var s = steps.get(0);
        assertTrue(s.failed());
        assertNull(s.output());
        assertTrue(s.failure().startsWith("[Tactic Runtime] boom"), s.failure());
        assertEquals(List.of(goal(a)), s.input());
    }

    @Test
    void jsonLinesFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("store").resolve("steps.jsonl");
        try (var p = new Prover(config().withStorePath(file.toString()))) {
            p.prove(seq(rule(andR(0)), branch(rule(closeTrue()), label("open"))), and(T, a));
        }
        var lines = Files.readAllLines(file);
        assertEquals(5, lines.size());
        var root = Json.the.readTree(lines.get(lines.size() - 1));
        assertEquals(5, root.get("step").asInt());
        assertEquals(0, root.get("depth").asInt());
        assertEquals("(and true a)", root.get("input").get(0).get("succ").get(0).asText());
        assertEquals("a", root.get("output").get(0).get("succ").get(0).asText());
        assertEquals("open", root.get("labels").get(0).asText());
        assertFalse(root.has("failure"));
        assertTrue(root.get("time").isTextual());
        for (var line : lines) {
            JsonNode n = Json.the.readTree(line);
            assertTrue(n.get("runId").asText().startsWith("run-"));
        }
    }

    @Test
    void fileStoreAppends(@TempDir Path dir) throws IOException {
        var file = dir.resolve("steps.jsonl");
        for (var i = 0; i < 2; i++) {
            try (var store = new JsonProofStore(file)) {
                assertEquals(file, store.file());
                store.record(ProofStore.Step.of("r", 1, 0, skip(), Value.of(Provable.startProof(a)), Value.of(Provable.startProof(a))));
            }
        }
        assertEquals(2, Files.readAllLines(file).size());
    }
}
