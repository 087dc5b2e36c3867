package io.jiscodepoints.kernel;

import io.jiscodepoints.core.CodePointValidationException;
import io.jiscodepoints.core.ValidationError;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Membership of text in the union of several sets, checked per code point:
 * every code point must belong to at least one of the candidate sets.
 * <p>
 * The sets are only read, never copied or retained. Scanning is left to right,
 * so a reported failure is always the first uncovered code point.
 * <p>
 * An empty candidate list is handled differently by the two forms. The boolean
 * form answers {@code false} for any text, including the empty string. The
 * validating forms accept the empty string, since there is no offending code
 * point to report, and reject anything else at position 0.
 * <p>
 * A {@code null} list or entry is rejected before any text is scanned.
 */
public final class MultiSetMembership {

    private MultiSetMembership() {
    }

    public static boolean containsAllInAny(CharSequence text, CodePointSet... sets) {
        return containsAllInAny(text, List.of(sets));
    }

    /**
     * @return {@code false} if {@code sets} is empty, otherwise whether each code
     *         point of {@code text} is contained in at least one set
     */
    public static boolean containsAllInAny(CharSequence text, List<CodePointSet> sets) {
        Objects.requireNonNull(text, "text");
        requireSets(sets);
        if (sets.isEmpty()) {
            return false;
        }
        return firstUncovered(text, sets).isEmpty();
    }

    public static Optional<ValidationError> validateAllInAny(CharSequence text, CodePointSet... sets) {
        return validateAllInAny(text, List.of(sets));
    }

    /**
     * Returns the error for the first code point of {@code text} found in none of
     * {@code sets}, or empty when every code point is covered.
     */
    public static Optional<ValidationError> validateAllInAny(CharSequence text, List<CodePointSet> sets) {
        Objects.requireNonNull(text, "text");
        requireSets(sets);
        return firstUncovered(text, sets)
                .map(excluded -> ValidationError.of(excluded.codePoint(), excluded.position()));
    }

    /**
     * Throwing form of {@link #validateAllInAny(CharSequence, List)}.
     *
     * @throws CodePointValidationException on the first uncovered code point
     */
    public static void requireAllInAny(CharSequence text, List<CodePointSet> sets) {
        var error = validateAllInAny(text, sets);
        if (error.isPresent()) {
            throw new CodePointValidationException(error.get());
        }
    }

    public static void requireAllInAny(CharSequence text, CodePointSet... sets) {
        requireAllInAny(text, List.of(sets));
    }

    private static void requireSets(List<CodePointSet> sets) {
        Objects.requireNonNull(sets, "sets");
        for (var set : sets) {
            Objects.requireNonNull(set, "set");
        }
    }

    private static Optional<ExcludedCodePoint> firstUncovered(CharSequence text, List<CodePointSet> sets) {
        var length = text.length();
        var i = 0;
        var position = 0;
        while (i < length) {
            var codePoint = Character.codePointAt(text, i);
            if (!coveredByAny(codePoint, sets)) {
                return Optional.of(new ExcludedCodePoint(codePoint, position));
            }
            i += Character.charCount(codePoint);
            position++;
        }
        return Optional.empty();
    }

    private static boolean coveredByAny(int codePoint, List<CodePointSet> sets) {
        for (var set : sets) {
            if (set.containsCodePoint(codePoint)) {
                return true;
            }
        }
        return false;
    }
}
