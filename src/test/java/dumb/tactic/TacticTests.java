package dumb.tactic;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static dumb.tactic.SequentCalculus.*;
import static dumb.tactic.Tactic.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TacticTests extends AbstractTest {

    @Test
    void seqAndEitherNestToTheRight() {
        var split = rule(andR(0));
        var close = rule(closeTrue());
        var t = assertInstanceOf(Seq.class, seq(split, skip(), close));
        assertEquals(split, t.first());
        assertEquals(new Seq(skip(), close), t.then());
        assertEquals("(a | (b | c))", either(label("x"), label("y"), label("z")).describe()
                .replace("label(\"x\")", "a").replace("label(\"y\")", "b").replace("label(\"z\")", "c"));
        assertEquals(skip(), seq(skip()));
    }

    @Test
    void describeRendersTheTree() {
        assertEquals("(andR(0) ; <(closeTrue, skip))", seq(rule(andR(0)), branch(rule(closeTrue()), skip())).describe());
        assertEquals("onAll(andL(0))*", saturate(onAll(rule(andL(0)))).describe());
        assertEquals("andL(0)+", repeatPlus(rule(andL(0))).describe());
        assertEquals("must(skip)", must(skip()).describe());
        assertEquals("(fail(\"x\") > skip)", after(fail("x"), skip()).describe());
        assertEquals("def d = use d", def("d", use("d")).describe());
        assertEquals("let(c = (+ x 1), skip)", let(c, op("+", x, num(1)), skip()).describe());
        assertEquals("race(skip, closeTrue; 500ms)", timeoutAlternatives(500, skip(), rule(closeTrue())).describe());
        assertEquals("race(skip)", timeoutAlternatives(skip()).describe());
        assertEquals("case(\"Show\": skip)", cases(Map.of(Label.cutShow, skip())).describe());
    }

    @Test
    void framesAreShort() {
        assertEquals("Seq", seq(skip(), skip()).frame());
        assertEquals("Branch", branch().frame());
        assertEquals("label(Step.Show)", label(Label.parse("Step.Show")).frame());
        assertEquals("d", use("d").frame());
        assertEquals("let c", let(c, x, skip()).frame());
    }

    @Test
    void invalidConstructionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> repeat(-1, skip()));
        assertThrows(IllegalArgumentException.class, () -> atSubgoal(2, 2, skip()));
        assertThrows(IllegalArgumentException.class, () -> new TimeoutAlternatives(List.of(), 100));
        assertThrows(IllegalArgumentException.class, () -> timeoutAlternatives(-1, skip()));
        assertThrows(IllegalArgumentException.class, () -> new RepeatPlus(skip(), 0));
        assertThrows(IllegalArgumentException.class, () -> cases(Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new USubstPattern(List.of()));
        assertThrows(NullPointerException.class, () -> new Seq(null, skip()));
    }

    @Test
    void atSubgoalFillsWithSkip() {
        var split = rule(andR(0));
        assertEquals(new Branch(List.of(skip(), split, skip())), atSubgoal(1, 3, split));
    }
}
