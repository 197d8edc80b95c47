package dumb.tactic;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Antecedent formulas entail the disjunction of the succedent formulas.
 */
public record Sequent(@JsonProperty("ante") List<Term> ante, @JsonProperty("succ") List<Term> succ) {
    public Sequent {
        ante = List.copyOf(requireNonNull(ante));
        succ = List.copyOf(requireNonNull(succ));
    }

    public static Sequent of(Term succ) {
        return new Sequent(List.of(), List.of(succ));
    }

    public static Sequent of(List<Term> ante, Term... succ) {
        return new Sequent(ante, List.of(succ));
    }

    public Term ante(int i) {
        return ante.get(i);
    }

    public Term succ(int i) {
        return succ.get(i);
    }

    Sequent updateAnte(int i, List<Term> replacement) {
        return new Sequent(splice(ante, i, replacement), succ);
    }

    Sequent updateSucc(int i, List<Term> replacement) {
        return new Sequent(ante, splice(succ, i, replacement));
    }

    Sequent withAnte(Term t) {
        var a = new ArrayList<>(ante);
        a.add(t);
        return new Sequent(a, succ);
    }

    Sequent withSucc(Term t) {
        var s = new ArrayList<>(succ);
        s.add(t);
        return new Sequent(ante, s);
    }

    public Sequent replace(Term what, Term repl) {
        return new Sequent(
                ante.stream().map(t -> t.replace(what, repl)).toList(),
                succ.stream().map(t -> t.replace(what, repl)).toList());
    }

    public boolean contains(Term t) {
        return ante.stream().anyMatch(f -> f.contains(t)) || succ.stream().anyMatch(f -> f.contains(t));
    }

    private static List<Term> splice(List<Term> list, int i, List<Term> replacement) {
        var l = new ArrayList<Term>(list.size() - 1 + replacement.size());
        l.addAll(list.subList(0, i));
        l.addAll(replacement);
        l.addAll(list.subList(i + 1, list.size()));
        return l;
    }

    @Override
    public String toString() {
        var b = new StringBuilder();
        for (var i = 0; i < ante.size(); i++)
            b.append("   -").append(i + 1).append(":  ").append(ante.get(i).toKif()).append('\n');
        for (var i = 0; i < succ.size(); i++)
            b.append("==> ").append(i + 1).append(":  ").append(succ.get(i).toKif()).append('\n');
        if (succ.isEmpty()) b.append("==>\n");
        return b.substring(0, b.length() - 1);
    }
}
