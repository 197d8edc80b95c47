package dumb.tactic;

import dumb.tactic.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TermTests extends AbstractTest {

    @Test
    void rendersAsKif() {
        assertEquals("(and (= 1 1) b)", and(eq(num(1), num(1)), b).toKif());
        assertEquals("\"two words\"", Term.atom("two words").toKif());
        assertEquals("?p", Term.var("p").toKif());
        assertEquals("?p", Term.var("?p").toKif());
    }

    @Test
    void atomsAndVariablesAreInterned() {
        assertSame(Term.atom("a"), Term.atom("a"));
        assertSame(Term.var("p"), Term.var("?p"));
        assertThrows(IllegalArgumentException.class, () -> new Term.Var("p"));
    }

    @Test
    void replaceAndContains() {
        var f = and(op("+", x, num(1)), op("<", op("+", x, num(1)), num(2)));
        var g = f.replace(op("+", x, num(1)), c);
        assertEquals(and(c, op("<", c, num(2))), g);
        assertTrue(f.contains(x));
        assertFalse(g.contains(x));
        assertSame(f, f.replace(a, b));
    }

    @Test
    void structure() {
        var l = (Term.Lst) and(a, Term.var("q"));
        assertEquals("and", l.op().orElseThrow());
        assertTrue(l.is("and", 2));
        assertFalse(l.is("and", 3));
        assertEquals(List.of(a, Term.var("q")), l.args());
        assertEquals(Set.of(Term.var("q")), l.vars());
        assertTrue(l.containsVar());
        assertEquals(4, l.weight());
    }

    @Test
    void sequentsRenderNumberedFormulas() {
        var s = goal(List.of(a, b), c);
        assertEquals("   -1:  a\n   -2:  b\n==> 1:  c", s.toString());
        assertEquals(goal(List.of(x, b), c), s.replace(a, x));
        assertEquals("{\"ante\":[\"a\",\"b\"],\"succ\":[\"c\"]}", Json.str(s));
    }
}
