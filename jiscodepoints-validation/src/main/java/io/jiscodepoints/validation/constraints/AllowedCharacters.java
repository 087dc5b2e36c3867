package io.jiscodepoints.validation.constraints;

import io.jiscodepoints.charset.CharacterCategory;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated {@link CharSequence} may only contain characters that belong
 * to at least one of the given categories or to {@link #codePoints()}.
 * <p>
 * {@code null} is valid. When {@link #message()} is left at its default the
 * violation names the offending character, its code point and its position.
 * The default template itself resolves, through
 * {@code ContributorValidationMessages}, to a generic description; that text is
 * what callers interpolating the constraint metadata see, never a violation.
 * <pre>
 * &#64;AllowedCharacters({CharacterCategory.JISX0208_HIRAGANA, CharacterCategory.JISX0208_KATAKANA})
 * private String furigana;
 * </pre>
 */
@Documented
@Constraint(validatedBy = AllowedCharactersValidator.class)
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.PARAMETER, ElementType.TYPE_USE,
        ElementType.ANNOTATION_TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface AllowedCharacters {

    String DEFAULT_MESSAGE = "{io.jiscodepoints.validation.constraints.AllowedCharacters.message}";

    CharacterCategory[] value() default {};

    /**
     * Extra characters allowed in addition to the categories.
     */
    String codePoints() default "";

    String message() default DEFAULT_MESSAGE;

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
