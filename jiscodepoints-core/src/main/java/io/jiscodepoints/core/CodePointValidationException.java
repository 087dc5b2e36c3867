package io.jiscodepoints.core;

import java.util.Objects;

/**
 * Thrown by the throwing validation forms when a string contains a code point
 * outside the allowed set.
 * <p>
 * The message is the carried {@link ValidationError}'s message.
 */
public class CodePointValidationException extends JisCodePointsException {

    private final ValidationError error;

    public CodePointValidationException(ValidationError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public ValidationError error() {
        return error;
    }

    public int codePoint() {
        return error.codePoint();
    }

    public int position() {
        return error.position();
    }
}
