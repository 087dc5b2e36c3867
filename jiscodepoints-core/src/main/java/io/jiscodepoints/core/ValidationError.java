package io.jiscodepoints.core;

import java.util.Locale;
import java.util.Objects;

/**
 * A failed validation: the offending code point, its zero-based character
 * index in the validated string and a human-readable message.
 * <p>
 * The position counts code points, not UTF-16 units, so a supplementary
 * character occupies a single position.
 *
 * @param codePoint the first code point not allowed
 * @param position  character index of that code point
 * @param message   description of the failure
 */
public record ValidationError(int codePoint, int position, String message) {

    private static final int REPLACEMENT_CHARACTER = 0xFFFD;

    public ValidationError {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + position);
        }
        Objects.requireNonNull(message, "message");
    }

    /**
     * Creates an error with the default message, e.g.
     * {@code invalid character 'う' (U+3046) at position 2}.
     */
    public static ValidationError of(int codePoint, int position) {
        return new ValidationError(codePoint, position, defaultMessage(codePoint, position));
    }

    /**
     * Creates an error with a caller supplied message.
     */
    public static ValidationError withMessage(int codePoint, int position, String message) {
        return new ValidationError(codePoint, position, message);
    }

    /**
     * Returns a copy of this error whose message is replaced.
     */
    public ValidationError withMessage(String newMessage) {
        return new ValidationError(codePoint, position, newMessage);
    }

    /**
     * Renders the code point as {@code U+XXXX}, at least four upper-case hex digits.
     */
    public static String formatCodePoint(int codePoint) {
        return String.format(Locale.ROOT, "U+%04X", codePoint);
    }

    private static String defaultMessage(int codePoint, int position) {
        return "invalid character '" + displayString(codePoint) + "' ("
                + formatCodePoint(codePoint) + ") at position " + position;
    }

    private static String displayString(int codePoint) {
        var scalar = Character.isValidCodePoint(codePoint)
                && !(codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE);
        return new String(Character.toChars(scalar ? codePoint : REPLACEMENT_CHARACTER));
    }

    @Override
    public String toString() {
        return message;
    }
}
