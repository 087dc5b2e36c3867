package io.jiscodepoints.validation.constraints;

import io.jiscodepoints.core.ValidationError;
import io.jiscodepoints.kernel.CodePointSet;
import io.jiscodepoints.kernel.MultiSetMembership;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validator for {@link AllowedCharacters}.
 */
public class AllowedCharactersValidator implements ConstraintValidator<AllowedCharacters, CharSequence> {

    private List<CodePointSet> sets = List.of();
    private boolean defaultMessage;

    @Override
    public void initialize(AllowedCharacters annotation) {
        var candidates = new ArrayList<CodePointSet>();
        for (var category : annotation.value()) {
            candidates.add(category.codePoints());
        }
        if (!annotation.codePoints().isEmpty()) {
            candidates.add(CodePointSet.fromString(annotation.codePoints()));
        }
        sets = List.copyOf(candidates);
        defaultMessage = AllowedCharacters.DEFAULT_MESSAGE.equals(annotation.message());
    }

    @Override
    public boolean isValid(CharSequence value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        Optional<ValidationError> error = MultiSetMembership.validateAllInAny(value, sets);
        if (error.isEmpty()) {
            return true;
        }
        if (defaultMessage) {
            context.disableDefaultConstraintViolation();
            context.buildConstraintViolationWithTemplate(escape(error.get().message()))
                    .addConstraintViolation();
        }
        return false;
    }

    // the reported text is literal, not a message template
    private static String escape(String message) {
        return message.replace("\\", "\\\\")
                .replace("{", "\\{")
                .replace("}", "\\}")
                .replace("$", "\\$");
    }
}
