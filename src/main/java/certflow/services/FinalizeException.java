package certflow.services;

import certflow.model.FailureKind;

public class FinalizeException extends WorkflowStepException {

    private FinalizeException(FailureKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public static FinalizeException stillProcessing(String orderUrl) {
        return new FinalizeException(FailureKind.RETRIABLE, "Order " + orderUrl + " is still processing", null);
    }

    public static FinalizeException fatal(String message) {
        return new FinalizeException(FailureKind.FATAL, message, null);
    }

    public static FinalizeException fatal(String message, Throwable cause) {
        return new FinalizeException(FailureKind.FATAL, message, cause);
    }

    /**
     * The certificate was issued but the key that belongs to it is gone, only a new order helps.
     */
    public static FinalizeException keyUnavailable(String message) {
        return new FinalizeException(FailureKind.RESTART_REQUIRED, message, null);
    }
}
