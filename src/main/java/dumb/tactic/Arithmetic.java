package dumb.tactic;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

import static dumb.tactic.SequentCalculus.*;

/**
 * Decision procedure for first-order arithmetic, consumed by the {@code qe} rule.
 */
public interface Arithmetic {

    Pattern NUMERAL = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    static boolean isNumeral(String s) {
        return NUMERAL.matcher(s).matches();
    }

    Verdict decide(Term formula);

    enum Verdict {PROVED, REFUTED, UNKNOWN}

    /**
     * Decides variable-free arithmetic over numerals with {@code + - *}, the comparisons and the propositional
     * connectives. Anything involving other symbols is {@link Verdict#UNKNOWN}, except syntactically reflexive
     * equations.
     */
    final class Ground implements Arithmetic {

        @Override
        public Verdict decide(Term formula) {
            return truth(formula).map(v -> v ? Verdict.PROVED : Verdict.REFUTED).orElse(Verdict.UNKNOWN);
        }

        private Optional<Boolean> truth(Term f) {
            if (f instanceof Term.Atom a) {
                if (a.value().equals(TRUE)) return Optional.of(true);
                if (a.value().equals(FALSE)) return Optional.of(false);
                return Optional.empty();
            }
            if (!(f instanceof Term.Lst l) || l.op().isEmpty()) return Optional.empty();
            var args = l.args();
            switch (l.op().get()) {
                case AND:
                    return all(args, true);
                case OR:
                    return all(args, false);
                case NOT:
                    return args.size() == 1 ? truth(args.get(0)).map(v -> !v) : Optional.empty();
                case IMPLIES:
                    if (args.size() != 2) return Optional.empty();
                    return implies(truth(args.get(0)), truth(args.get(1)));
                case EQUIV:
                    if (args.size() != 2) return Optional.empty();
                    var p = truth(args.get(0));
                    var q = truth(args.get(1));
                    return p.isPresent() && q.isPresent() ? Optional.of(p.get().equals(q.get())) : Optional.empty();
                case EQUAL:
                    if (args.size() == 2 && args.get(0).equals(args.get(1))) return Optional.of(true);
                    return compare(args, c -> c == 0);
                case "!=":
                    return compare(args, c -> c != 0);
                case "<":
                    return compare(args, c -> c < 0);
                case ">":
                    return compare(args, c -> c > 0);
                case "<=":
                    return compare(args, c -> c <= 0);
                case ">=":
                    return compare(args, c -> c >= 0);
                default:
                    return Optional.empty();
            }
        }

        private Optional<Boolean> all(List<Term> args, boolean conjunction) {
            var unknown = false;
            for (var a : args) {
                var v = truth(a);
                if (v.isEmpty()) unknown = true;
                else if (v.get() != conjunction) return Optional.of(!conjunction);
            }
            return unknown ? Optional.empty() : Optional.of(conjunction);
        }

        private static Optional<Boolean> implies(Optional<Boolean> p, Optional<Boolean> q) {
            if (p.filter(v -> !v).isPresent() || q.filter(v -> v).isPresent()) return Optional.of(true);
            if (p.isPresent() && q.isPresent()) return Optional.of(false);
            return Optional.empty();
        }

        private Optional<Boolean> compare(List<Term> args, IntPredicate test) {
            if (args.size() != 2) return Optional.empty();
            var a = value(args.get(0));
            var b = value(args.get(1));
            return a.isPresent() && b.isPresent() ? Optional.of(test.test(a.get().compareTo(b.get()))) : Optional.empty();
        }

        private Optional<BigDecimal> value(Term t) {
            if (t instanceof Term.Atom a)
                return isNumeral(a.value()) ? Optional.of(new BigDecimal(a.value())) : Optional.empty();
            if (!(t instanceof Term.Lst l) || l.op().isEmpty() || l.args().isEmpty()) return Optional.empty();
            var args = l.args();
            switch (l.op().get()) {
                case "+":
                    return fold(args, BigDecimal::add);
                case "*":
                    return fold(args, BigDecimal::multiply);
                case "-":
                    if (args.size() == 1) return value(args.get(0)).map(BigDecimal::negate);
                    return fold(args, BigDecimal::subtract);
                default:
                    return Optional.empty();
            }
        }

        private Optional<BigDecimal> fold(List<Term> args, BinaryOperator<BigDecimal> op) {
            var values = new ArrayList<BigDecimal>(args.size());
            for (var a : args) {
                var v = value(a);
                if (v.isEmpty()) return Optional.empty();
                values.add(v.get());
            }
            return values.stream().reduce(op);
        }
    }
}
