package io.agency.server.validation;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.TYPE_USE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/// Marks a workflow or step identifier that must be safe to use as a path
/// segment, file name and database key.
///
/// ### Usage
/// ```java
/// @GET
/// @Path("/{workflowId}")
/// public WorkflowView get(@PathParam("workflowId") @ValidId String workflowId) { ... }
/// ```
///
/// @see ValidIdValidator
@Target({FIELD, PARAMETER, TYPE_USE})
@Retention(RUNTIME)
@Constraint(validatedBy = ValidIdValidator.class)
@Documented
public @interface ValidId {

    String message() default
            "must start with a letter or digit and contain only letters, digits, '.', '-' or '_'"
                    + " (at most 255 characters)";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
