package certflow.services;

import certflow.model.FailureKind;

/**
 * Failure of a workflow step, classified where it was detected.
 */
public abstract class WorkflowStepException extends RuntimeException {

    private final FailureKind kind;

    protected WorkflowStepException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WorkflowStepException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
