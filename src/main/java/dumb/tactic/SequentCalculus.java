package dumb.tactic;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * The propositional sequent calculus rules of the kernel. Positions are 0-based indices into the antecedent
 * (rules ending in {@code L}) or the succedent (rules ending in {@code R}).
 */
public final class SequentCalculus {
    public static final String AND = "and";
    public static final String OR = "or";
    public static final String IMPLIES = "=>";
    public static final String EQUIV = "<=>";
    public static final String NOT = "not";
    public static final String EQUAL = "=";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    private static final Set<String> RESERVED = Set.of(AND, OR, IMPLIES, EQUIV, NOT, TRUE, FALSE,
            EQUAL, "!=", "<", ">", "<=", ">=", "+", "-", "*");

    private SequentCalculus() {
    }

    static boolean isReserved(String symbol) {
        return RESERVED.contains(symbol);
    }

    public static Rule andR(int pos) {
        return rule("andR(" + pos + ")", s -> {
            var f = succ(s, pos, AND, "andR");
            return List.of(s.updateSucc(pos, List.of(f.get(1))), s.updateSucc(pos, List.of(f.get(2))));
        });
    }

    public static Rule andL(int pos) {
        return rule("andL(" + pos + ")", s -> {
            var f = ante(s, pos, AND, "andL");
            return List.of(s.updateAnte(pos, List.of(f.get(1), f.get(2))));
        });
    }

    public static Rule orR(int pos) {
        return rule("orR(" + pos + ")", s -> {
            var f = succ(s, pos, OR, "orR");
            return List.of(s.updateSucc(pos, List.of(f.get(1), f.get(2))));
        });
    }

    public static Rule orL(int pos) {
        return rule("orL(" + pos + ")", s -> {
            var f = ante(s, pos, OR, "orL");
            return List.of(s.updateAnte(pos, List.of(f.get(1))), s.updateAnte(pos, List.of(f.get(2))));
        });
    }

    public static Rule implyR(int pos) {
        return rule("implyR(" + pos + ")", s -> {
            var f = succ(s, pos, IMPLIES, "implyR");
            return List.of(s.updateSucc(pos, List.of(f.get(2))).withAnte(f.get(1)));
        });
    }

    public static Rule implyL(int pos) {
        return rule("implyL(" + pos + ")", s -> {
            var f = ante(s, pos, IMPLIES, "implyL");
            return List.of(s.updateAnte(pos, List.of()).withSucc(f.get(1)), s.updateAnte(pos, List.of(f.get(2))));
        });
    }

    public static Rule notR(int pos) {
        return rule("notR(" + pos + ")", s -> {
            var f = succ(s, pos, NOT, 1, "notR");
            return List.of(s.updateSucc(pos, List.of()).withAnte(f.get(1)));
        });
    }

    public static Rule notL(int pos) {
        return rule("notL(" + pos + ")", s -> {
            var f = ante(s, pos, NOT, 1, "notL");
            return List.of(s.updateAnte(pos, List.of()).withSucc(f.get(1)));
        });
    }

    public static Rule equivR(int pos) {
        return rule("equivR(" + pos + ")", s -> {
            var f = succ(s, pos, EQUIV, "equivR");
            var rest = s.updateSucc(pos, List.of());
            return List.of(rest.withAnte(f.get(1)).withSucc(f.get(2)), rest.withAnte(f.get(2)).withSucc(f.get(1)));
        });
    }

    public static Rule hideL(int pos) {
        return rule("hideL(" + pos + ")", s -> {
            checkPos(s.ante(), pos, "hideL");
            return List.of(s.updateAnte(pos, List.of()));
        });
    }

    public static Rule hideR(int pos) {
        return rule("hideR(" + pos + ")", s -> {
            checkPos(s.succ(), pos, "hideR");
            return List.of(s.updateSucc(pos, List.of()));
        });
    }

    /** Premises: the use case (cut formula assumed) followed by the show case. */
    public static Rule cut(Term cut) {
        requireNonNull(cut);
        return rule("cut(" + cut.toKif() + ")", s -> List.of(s.withAnte(cut), s.withSucc(cut)));
    }

    public static Rule closeId() {
        return rule("closeId", s -> {
            if (s.ante().stream().anyMatch(s.succ()::contains)) return List.of();
            throw new Rule.InapplicableException("Expects same formula in antecedent and succedent. Found:\n" + s);
        });
    }

    public static Rule closeTrue() {
        return rule("closeTrue", s -> {
            if (s.succ().contains(Term.atom(TRUE))) return List.of();
            throw new Rule.InapplicableException("Expects true in succedent. Found:\n" + s);
        });
    }

    public static Rule closeFalse() {
        return rule("closeFalse", s -> {
            if (s.ante().contains(Term.atom(FALSE))) return List.of();
            throw new Rule.InapplicableException("Expects false in antecedent. Found:\n" + s);
        });
    }

    public static Rule equalRefl() {
        return rule("equalRefl", s -> {
            var refl = s.succ().stream().anyMatch(f -> f instanceof Term.Lst l && l.is(EQUAL, 2) && l.get(1).equals(l.get(2)));
            if (refl) return List.of();
            throw new Rule.InapplicableException("Expects a reflexive equation t=t in succedent. Found:\n" + s);
        });
    }

    /** Closes the goal when the arithmetic oracle proves the sequent's formula valid. */
    public static Rule qe(Arithmetic oracle) {
        requireNonNull(oracle);
        return rule("qe", s -> {
            var f = toFormula(s);
            var verdict = oracle.decide(f);
            switch (verdict) {
                case PROVED:
                    return List.of();
                case REFUTED:
                    throw new Rule.InapplicableException("QE found a counterexample to " + f.toKif());
                default:
                    throw new Rule.InapplicableException("QE was unable to decide " + f.toKif());
            }
        });
    }

    /** {@code (=> (and ante) (or succ))}, collapsing empty and singleton junctions. */
    public static Term toFormula(Sequent s) {
        var ante = junction(AND, TRUE, s.ante());
        var succ = junction(OR, FALSE, s.succ());
        return s.ante().isEmpty() ? succ : Term.list(IMPLIES, ante, succ);
    }

    private static Term junction(String op, String unit, List<Term> fmls) {
        if (fmls.isEmpty()) return Term.atom(unit);
        if (fmls.size() == 1) return fmls.get(0);
        var terms = new ArrayList<Term>(fmls.size() + 1);
        terms.add(Term.atom(op));
        terms.addAll(fmls);
        return new Term.Lst(terms);
    }

    private static Term.Lst succ(Sequent s, int pos, String op, String rule) {
        return succ(s, pos, op, 2, rule);
    }

    private static Term.Lst succ(Sequent s, int pos, String op, int arity, String rule) {
        checkPos(s.succ(), pos, rule);
        return shaped(s.succ(pos), op, arity, rule, s);
    }

    private static Term.Lst ante(Sequent s, int pos, String op, String rule) {
        return ante(s, pos, op, 2, rule);
    }

    private static Term.Lst ante(Sequent s, int pos, String op, int arity, String rule) {
        checkPos(s.ante(), pos, rule);
        return shaped(s.ante(pos), op, arity, rule, s);
    }

    private static Term.Lst shaped(Term f, String op, int arity, String rule, Sequent s) {
        if (f instanceof Term.Lst l && l.is(op, arity)) return l;
        throw new Rule.InapplicableException("Tactic " + rule + " applied on a non-matching expression " + f.toKif() + " in\n" + s);
    }

    private static void checkPos(List<Term> side, int pos, String rule) {
        if (pos < 0 || pos >= side.size())
            throw new Rule.InapplicableException("Tactic " + rule + " position " + pos + " out of range; " + side.size() + " formulas");
    }

    private static Rule rule(String name, Function<Sequent, List<Sequent>> step) {
        return new Step(name, step);
    }

    record Step(String name, Function<Sequent, List<Sequent>> step) implements Rule {
        Step {
            requireNonNull(name);
            requireNonNull(step);
        }

        @Override
        public List<Sequent> apply(Sequent goal) {
            return step.apply(goal);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
