package certflow.services;

import certflow.model.FailureKind;

/**
 * The request can't be served as configured, retrying won't change that.
 */
public class PreconditionException extends WorkflowStepException {

    public PreconditionException(String message) {
        super(FailureKind.PRECONDITION, message);
    }
}
