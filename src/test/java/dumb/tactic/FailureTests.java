package dumb.tactic;

import dumb.tactic.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FailureTests extends AbstractTest {

    private static Failure user(String msg) {
        return Failure.of(Failure.Kind.USER, msg, Provable.startProof(a), "fail");
    }

    @Test
    void framesArePrependedOutermostFirst() {
        var f = user("boom").within("Branch on subgoal 1").within("Seq");
        assertEquals(List.of("Seq", "Branch on subgoal 1", "fail"), f.trace());
        assertEquals("boom", f.message());
    }

    @Test
    void renderShowsMessageTraceAndState() {
        var r = user("boom").within("Seq").render();
        assertTrue(r.startsWith("[Tactic Runtime] boom\nin Seq / fail\nThe error occurred on\nProvable{"), r);
    }

    @Test
    void compoundKeepsBothSides() {
        var f = Failure.compound(user("l"), user("r"), null, "Either");
        assertEquals(Failure.Kind.COMPOUND, f.kind());
        assertEquals("Left Message: [Tactic Runtime] l\nin fail\nThe error occurred on\n" + Provable.startProof(a)
                + "\nRight Message: [Tactic Runtime] r\nin fail\nThe error occurred on\n" + Provable.startProof(a), f.message());
        assertThrows(IllegalArgumentException.class,
                () -> new Failure(Failure.Kind.COMPOUND, "m", null, List.of(), user("l"), null));
    }

    @Test
    void combineNestsToTheRight() {
        var f = Failure.combine(List.of(user("1"), user("2"), user("3")), null, "Branch");
        assertEquals("1", f.left().message());
        assertEquals("2", f.right().left().message());
        assertEquals("3", f.right().right().message());
        var single = user("only");
        assertSame(single, Failure.combine(List.of(single), null, "Branch"));
    }

    @Test
    void kindsClassifyFailures() {
        assertFalse(user("x").isIllFormed());
        assertTrue(Failure.of(Failure.Kind.SHAPE_MISMATCH, "m", null, "Branch").isIllFormed());
        assertTrue(Failure.of(Failure.Kind.UNDEFINED, "m", null, "x").isIllFormed());
        var timeout = Failure.of(Failure.Kind.TIMEOUT, "t", null, "TimeoutAlternatives");
        assertTrue(Failure.compound(user("x"), timeout, null, "Either").involves(Failure.Kind.TIMEOUT));
        assertFalse(user("x").involves(Failure.Kind.TIMEOUT));
    }

    @Test
    void serializesWithoutState() throws Exception {
        var node = Json.the.readTree(Json.str(user("boom")));
        assertEquals("USER", node.get("kind").asText());
        assertEquals("boom", node.get("message").asText());
        assertTrue(node.get("rendered").asText().startsWith(Failure.PREFIX));
        assertFalse(node.has("state"));
        assertFalse(node.has("left"));
    }
}
