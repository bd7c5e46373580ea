package certflow.services;

import certflow.model.FailureKind;

/**
 * Something is not there yet: a proof not externally visible, an order still being validated.
 */
public class RetriableValidationException extends WorkflowStepException {

    public RetriableValidationException(String message) {
        super(FailureKind.RETRIABLE, message);
    }

    public RetriableValidationException(String message, Throwable cause) {
        super(FailureKind.RETRIABLE, message, cause);
    }
}
