package dumb.tactic;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Provenance of one open subgoal as a path of components, e.g. {@code indStep.cutShow}. Equality is on the full
 * path.
 */
public record Label(List<String> path) {
    public static final String SEPARATOR = ".";

    public static final Label initCase = of("Init");
    public static final Label indStep = of("Step");
    public static final Label baseCase = of("Base Case");
    public static final Label cutShow = of("Show");
    public static final Label cutUse = of("Use");

    public Label {
        path = List.copyOf(requireNonNull(path));
        if (path.isEmpty()) throw new IllegalArgumentException("Label path must not be empty");
        for (var c : path)
            if (c.isEmpty() || c.contains(SEPARATOR))
                throw new IllegalArgumentException("Invalid label component '" + c + "'");
    }

    public static Label of(String name) {
        return new Label(List.of(name));
    }

    /** Parses a {@value SEPARATOR}-separated path. */
    public static Label parse(String path) {
        return new Label(List.of(path.split("\\" + SEPARATOR)));
    }

    public Label append(String child) {
        var p = new ArrayList<>(path);
        p.add(requireNonNull(child));
        return new Label(p);
    }

    public Label append(Label child) {
        var p = new ArrayList<>(path);
        p.addAll(child.path);
        return new Label(p);
    }

    /** One label for each of the {@code n} subgoals a single labelled subgoal turned into. */
    public List<Label> split(int n) {
        return Collections.nCopies(n, this);
    }

    /** True if the last components of this path are {@code suffix}'s path. */
    public boolean endsWith(Label suffix) {
        var n = suffix.path.size();
        return n <= path.size() && path.subList(path.size() - n, path.size()).equals(suffix.path);
    }

    /** Root of the path: the branch this subgoal originally descends from. */
    public String top() {
        return path.get(0);
    }

    /** Most recently appended component. */
    public String leaf() {
        return path.get(path.size() - 1);
    }

    @JsonValue
    @Override
    public String toString() {
        return String.join(SEPARATOR, path);
    }
}
