package dumb.tactic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static dumb.tactic.Arithmetic.Verdict.*;
import static dumb.tactic.SequentCalculus.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArithmeticTests extends AbstractTest {

    private final Arithmetic oracle = new Arithmetic.Ground();

    @Test
    void comparisons() {
        assertEquals(PROVED, oracle.decide(eq(op("+", num(1), num(2)), num(3))));
        assertEquals(REFUTED, oracle.decide(op(">", op("*", num(2), num(3)), num(7))));
        assertEquals(PROVED, oracle.decide(op("<=", op("-", num(5)), op("-", num(2), num(7)))));
        assertEquals(PROVED, oracle.decide(op("!=", num(1), num(2))));
        assertEquals(PROVED, oracle.decide(eq(Term.atom("0.5"), op("*", Term.atom("0.25"), num(2)))));
    }

    @Test
    void connectives() {
        assertEquals(PROVED, oracle.decide(and(T, op("<", num(1), num(2)))));
        assertEquals(REFUTED, oracle.decide(not(T)));
        assertEquals(PROVED, oracle.decide(imp(F, op("<", x, num(1)))));
        assertEquals(PROVED, oracle.decide(op(EQUIV, F, op(">", num(1), num(2)))));
    }

    @Test
    void knownDisjunctShortCircuitsUnknown() {
        assertEquals(PROVED, oracle.decide(or(eq(x, num(1)), T)));
        assertEquals(REFUTED, oracle.decide(and(eq(x, num(1)), F)));
        assertEquals(UNKNOWN, oracle.decide(and(eq(x, num(1)), T)));
    }

    @Test
    void symbolsAreUnknownUnlessReflexive() {
        assertEquals(UNKNOWN, oracle.decide(op("<", x, num(1))));
        assertEquals(PROVED, oracle.decide(eq(x, x)));
        assertEquals(UNKNOWN, oracle.decide(op("f", num(1))));
        assertEquals(UNKNOWN, oracle.decide(a));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "42", "-7", "3.25", "-0.5"})
    void numerals(String s) {
        assertTrue(Arithmetic.isNumeral(s));
    }

    @ParameterizedTest
    @ValueSource(strings = {"x", "1e3", "--1", ".5", "1."})
    void notNumerals(String s) {
        assertFalse(Arithmetic.isNumeral(s));
    }
}
