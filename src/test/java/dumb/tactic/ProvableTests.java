package dumb.tactic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static dumb.tactic.SequentCalculus.*;
import static org.junit.jupiter.api.Assertions.*;

class ProvableTests extends AbstractTest {

    @Test
    void startProofHasGoalAsOnlySubgoal() {
        var p = Provable.startProof(and(a, b));
        assertEquals(goal(and(a, b)), p.conclusion());
        assertEquals(List.of(goal(and(a, b))), p.subgoals());
        assertFalse(p.isProved());
    }

    @Test
    void ruleReplacesSubgoalByPremises() {
        var p = Provable.startProof(and(a, b)).apply(andR(0), 0);
        assertEquals(goal(and(a, b)), p.conclusion());
        assertEquals(List.of(goal(a), goal(b)), p.subgoals());
    }

    @Test
    void missingSubgoalIsInapplicable() {
        var p = Provable.startProof(T);
        var e = assertThrows(Rule.InapplicableException.class, () -> p.apply(closeTrue(), 3));
        assertTrue(e.getMessage().startsWith("Subgoal 4 does not exist"), e.getMessage());
        assertThrows(Rule.InapplicableException.class, () -> p.sub(-1));
    }

    @Test
    void subProofMergesInPlace() {
        var p = Provable.startProof(and(a, T)).apply(andR(0), 0);
        var closed = p.sub(1).apply(closeTrue(), 0);
        assertTrue(closed.isProved());
        assertEquals(List.of(goal(a)), p.apply(closed, 1).subgoals());
    }

    @Test
    void subProofMustConcludeTheSubgoal() {
        var p = Provable.startProof(and(a, T)).apply(andR(0), 0);
        assertThrows(Rule.InapplicableException.class, () -> p.apply(p.sub(0), 1));
    }

    @Test
    void substituteReplacesUninterpretedSymbol() {
        var value = op("+", x, num(1));
        var p = Provable.startProof(op(">", c, num(0))).substitute(c, value);
        assertEquals(goal(op(">", value, num(0))), p.conclusion());
        assertEquals(List.of(goal(op(">", value, num(0)))), p.subgoals());
    }

    @Test
    void interpretedSymbolsAreNotSubstitutable() {
        var p = Provable.startProof(and(a, b));
        assertThrows(Rule.InapplicableException.class, () -> p.substitute(Term.atom(AND), b));
        assertThrows(Rule.InapplicableException.class, () -> p.substitute(num(3), b));
        assertThrows(Rule.InapplicableException.class, () -> p.substitute(Term.var("v"), b));
        assertTrue(Provable.substitutable(op("f", x)));
        assertFalse(Provable.substitutable(op("f", Term.var("v"))));
    }

    @Test
    void structuralEquality() {
        var p = Provable.startProof(and(a, b)).apply(andR(0), 0);
        var q = Provable.startProof(and(a, b)).apply(andR(0), 0);
        assertEquals(p, q);
        assertEquals(p.hashCode(), q.hashCode());
        assertNotEquals(p, Provable.startProof(and(a, b)));
    }

    @Test
    void rendersOpenAndProvedStates() {
        var open = Provable.startProof(a).toString();
        assertTrue(open.contains("from"), open);
        var proved = Provable.startProof(T).apply(closeTrue(), 0).toString();
        assertTrue(proved.contains("proved"), proved);
    }
}
