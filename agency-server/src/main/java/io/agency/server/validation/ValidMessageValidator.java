package io.agency.server.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/// Checks a message against {@link ValidMessage}, reporting each failed rule
/// with its own violation message.
///
/// @see InputValidator
public class ValidMessageValidator implements ConstraintValidator<ValidMessage, String> {

    private int maxBytes;

    @Override
    public void initialize(ValidMessage annotation) {
        this.maxBytes = annotation.maxBytes();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext ctx) {
        if (value == null || value.isBlank()) {
            return reject(ctx, "must not be blank");
        }
        if (InputValidator.exceedsSizeLimit(value, maxBytes)) {
            return reject(ctx, "must not exceed " + maxBytes + " bytes");
        }
        if (InputValidator.containsDangerousChars(value)) {
            return reject(ctx, "must not contain control characters");
        }
        return true;
    }

    private static boolean reject(ConstraintValidatorContext ctx, String message) {
        ctx.disableDefaultConstraintViolation();
        ctx.buildConstraintViolationWithTemplate(message).addConstraintViolation();
        return false;
    }
}
