package dumb.tactic;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A failed tactic application. Failures are values so that {@link Tactic.Either} and
 * {@link Tactic.TimeoutAlternatives} can recover from any of them.
 *
 * @param state snapshot of the proof state the failing frame was given, for diagnostics
 * @param trace tactic frames active at the point of failure, outermost first
 * @param left  first alternative's failure, for {@link Kind#COMPOUND}
 * @param right second alternative's failure, for {@link Kind#COMPOUND}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Failure(Kind kind, String message, @JsonIgnore @Nullable Provable state, List<String> trace,
                      @Nullable Failure left, @Nullable Failure right) implements Value {
    public static final String PREFIX = "[Tactic Runtime] ";

    public Failure {
        requireNonNull(kind);
        requireNonNull(message);
        trace = List.copyOf(requireNonNull(trace));
        if (kind == Kind.COMPOUND && (left == null || right == null))
            throw new IllegalArgumentException("Compound failure requires both alternatives");
    }

    public static Failure of(Kind kind, String message, @Nullable Provable state, String frame) {
        return new Failure(kind, message, state, List.of(frame), null, null);
    }

    public static Failure compound(Failure left, Failure right, @Nullable Provable state, String frame) {
        return new Failure(Kind.COMPOUND, "Left Message: " + left.render() + "\nRight Message: " + right.render(),
                state, List.of(frame), left, right);
    }

    /** Right-nested compound of all {@code failures}, in order; a single failure is returned as is. */
    static Failure combine(List<Failure> failures, @Nullable Provable state, String frame) {
        if (failures.isEmpty()) throw new IllegalArgumentException("Nothing to combine");
        var result = failures.get(failures.size() - 1);
        for (var i = failures.size() - 2; i >= 0; i--)
            result = compound(failures.get(i), result, state, frame);
        return result;
    }

    /** The same failure as seen from the enclosing {@code frame}. */
    public Failure within(String frame) {
        var t = new ArrayList<String>(trace.size() + 1);
        t.add(requireNonNull(frame));
        t.addAll(trace);
        return new Failure(kind, message, state, t, left, right);
    }

    Failure withState(@Nullable Provable state) {
        return new Failure(kind, message, state, trace, left, right);
    }

    /** True for errors that indicate a malformed tactic rather than an unsuccessful proof attempt. */
    @JsonIgnore
    public boolean isIllFormed() {
        return kind == Kind.SHAPE_MISMATCH || kind == Kind.UNDEFINED;
    }

    /** True if this failure, or any alternative it combines, has the given kind. */
    public boolean involves(Kind k) {
        return kind == k || (left != null && left.involves(k)) || (right != null && right.involves(k));
    }

    @JsonProperty("rendered")
    public String render() {
        var b = new StringBuilder(PREFIX).append(message);
        if (!trace.isEmpty()) b.append("\nin ").append(String.join(" / ", trace));
        if (state != null && kind != Kind.COMPOUND) b.append("\nThe error occurred on\n").append(state);
        return b.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    public enum Kind {
        /** Raised by an explicit {@code Fail} tactic. */
        USER,
        RULE_INAPPLICABLE,
        /** Tactic does not fit the shape of the proof state, e.g. wrong branch count. */
        SHAPE_MISMATCH,
        PATTERN_UNIFICATION,
        LET_INAPPLICABLE,
        COMPOUND,
        TIMEOUT,
        NO_PROGRESS,
        UNDEFINED,
        CANCELLED
    }
}
