package io.agency.core.workflow;

import java.util.Objects;

/// Immutable definition of one saga step.
///
/// A step without a compensation cannot undo itself. If it fails, the failure
/// is recorded on the step and earlier steps are still compensated.
///
/// @param name step label, unique within a workflow, not null
/// @param forward the action that performs the step, not null
/// @param compensation the action that undoes it, may be null
public record StepDescriptor(String name, StepAction forward, StepAction compensation) {

    public StepDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(forward, "forward must not be null");
    }

    public static StepDescriptor of(String name, StepAction forward) {
        return new StepDescriptor(name, forward, null);
    }

    public static StepDescriptor of(String name, StepAction forward, StepAction compensation) {
        return new StepDescriptor(name, forward, compensation);
    }

    public boolean hasCompensation() {
        return compensation != null;
    }
}
