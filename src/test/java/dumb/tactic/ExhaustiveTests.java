package dumb.tactic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static dumb.tactic.SequentCalculus.*;
import static dumb.tactic.Tactic.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExhaustiveTests extends AbstractTest {

    @Test
    void lazyNeverStartsLaterBranches() {
        var second = label("recorded");
        var r = new Recorder();
        failure(run(Interpreter.Kind.LAZY, seq(rule(andR(0)), branch(fail("first"), second)), goal(and(a, b)), r),
                Failure.Kind.USER);
        assertFalse(r.begun.contains(second));
    }

    @Test
    void exhaustiveRunsEveryBranch() {
        var second = label("recorded");
        var r = new Recorder();
        failure(run(Interpreter.Kind.EXHAUSTIVE, seq(rule(andR(0)), branch(fail("first"), second)), goal(and(a, b)), r),
                Failure.Kind.USER);
        assertTrue(r.begun.contains(second));
        assertTrue(r.ended.contains(second));
    }

    @Test
    void exhaustiveCombinesAllBranchFailures() {
        var g = failure(run(Interpreter.Kind.EXHAUSTIVE, seq(rule(andR(0)), branch(fail("x"), fail("y"))), goal(and(a, b))),
                Failure.Kind.COMPOUND);
        assertEquals("x", g.left().message());
        assertEquals("y", g.right().message());
        assertEquals(List.of("Branch on subgoal 1", "fail"), g.left().trace());
        assertEquals(List.of("Branch on subgoal 2", "fail"), g.right().trace());
    }

    @Test
    void threeFailuresNestToTheRight() {
        var t = seq(rule(andR(0)), branch(rule(andR(0)), skip()), branch(fail("x"), fail("y"), fail("z")));
        var f = failure(run(Interpreter.Kind.EXHAUSTIVE, t, goal(and(and(a, b), c))), Failure.Kind.COMPOUND);
        assertEquals("x", f.left().message());
        assertEquals(Failure.Kind.COMPOUND, f.right().kind());
        assertEquals("y", f.right().left().message());
        assertEquals("z", f.right().right().message());
        assertEquals(3, f.state().size());
    }

    @Test
    void exhaustiveAttachesBestEffortState() {
        var t = seq(rule(andR(0)), branch(fail("open"), rule(closeTrue())));
        var f = failure(run(Interpreter.Kind.EXHAUSTIVE, t, goal(and(a, T))), Failure.Kind.USER);
        assertEquals(List.of(goal(a)), f.state().subgoals());

        var lazy = failure(run(Interpreter.Kind.LAZY, t, goal(and(a, T))), Failure.Kind.USER);
        assertEquals(List.of(goal(a)), lazy.state().subgoals());
        assertEquals(Provable.startProof(a), lazy.state());
    }

    @Test
    void bothDisciplinesAgreeOnSuccess() {
        var t = seq(rule(andR(0)), onAll(either(rule(andR(0)), skip())), onAll(close()));
        var s = goal(and(and(T, eq(num(1), num(1))), op("<", num(1), num(2))));
        assertEquals(proved(run(Interpreter.Kind.LAZY, t, s)), proved(run(Interpreter.Kind.EXHAUSTIVE, t, s)));
    }
}
