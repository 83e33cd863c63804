package io.agency.server.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/// @see ValidId
public class ValidIdValidator implements ConstraintValidator<ValidId, String> {

    /// Null is rejected here rather than left to `@NotNull`, so a missing
    /// identifier gets the same message as a malformed one.
    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return InputValidator.isSafeId(value);
    }
}
