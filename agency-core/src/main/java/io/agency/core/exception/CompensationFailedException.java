package io.agency.core.exception;

import java.io.Serial;

/// A compensation action failed and the workflow is now `Failed`.
///
/// Raised after the `Failed` snapshot has been committed. Carries enough detail
/// for an operator to find the step whose rollback did not complete.
public class CompensationFailedException extends AgencyException {

    @Serial private static final long serialVersionUID = -4068815525310741029L;

    private final String workflowId;
    private final int stepIndex;
    private final String stepName;

    public CompensationFailedException(
            String workflowId, int stepIndex, String stepName, String reason) {
        super(
                "Compensation failed for workflow '"
                        + workflowId
                        + "' at step "
                        + stepIndex
                        + " ("
                        + stepName
                        + "): "
                        + reason);
        this.workflowId = workflowId;
        this.stepIndex = stepIndex;
        this.stepName = stepName;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public String getStepName() {
        return stepName;
    }
}
