package io.jiscodepoints.validation;

import io.jiscodepoints.charset.CharacterCategory;
import io.jiscodepoints.core.ValidationError;
import io.jiscodepoints.kernel.CodePointSet;
import io.jiscodepoints.kernel.MultiSetMembership;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ready-made checks for common Japanese input rules, over the cached
 * {@link CharacterCategory} sets. Each returns the first violation, or empty
 * when the text is acceptable.
 */
public final class JapaneseTextValidators {

    private JapaneseTextValidators() {
    }

    public static Optional<ValidationError> validateHiragana(CharSequence text) {
        return CharacterCategory.JISX0208_HIRAGANA.check(text);
    }

    public static Optional<ValidationError> validateKatakana(CharSequence text) {
        return CharacterCategory.JISX0208_KATAKANA.check(text);
    }

    /**
     * Each character must be JIS X 0208 hiragana or katakana.
     */
    public static Optional<ValidationError> validateJapaneseKana(CharSequence text) {
        return MultiSetMembership.validateAllInAny(text, List.of(
                CharacterCategory.JISX0208_HIRAGANA.codePoints(),
                CharacterCategory.JISX0208_KATAKANA.codePoints()));
    }

    /**
     * Each character must be JIS X 0208 hiragana, katakana or ASCII printable.
     */
    public static Optional<ValidationError> validateJapaneseMixed(CharSequence text) {
        return MultiSetMembership.validateAllInAny(text, List.of(
                CharacterCategory.JISX0208_HIRAGANA.codePoints(),
                CharacterCategory.JISX0208_KATAKANA.codePoints(),
                CodePointSet.asciiPrintableCached()));
    }

    public static Optional<ValidationError> validateJisX0201Katakana(CharSequence text) {
        return CharacterCategory.JISX0201_KATAKANA.check(text);
    }

    public static Optional<ValidationError> validateJisX0201Latin(CharSequence text) {
        return CharacterCategory.JISX0201_LATIN_LETTERS.check(text);
    }

    /**
     * Validates against {@code set}, replacing the default description with
     * {@code message}. Code point and position are kept.
     */
    public static Optional<ValidationError> validate(CharSequence text, CodePointSet set, String message) {
        Objects.requireNonNull(set, "set");
        Objects.requireNonNull(message, "message");
        return set.check(text).map(error -> error.withMessage(message));
    }
}
