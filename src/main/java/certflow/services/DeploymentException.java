package certflow.services;

import certflow.model.FailureKind;
import java.net.URI;

public class DeploymentException extends WorkflowStepException {

    private final int statusCode;

    public DeploymentException(String method, URI target, int statusCode, long payloadSize, Throwable cause) {
        super(kindFor(statusCode),
            "Operation returned an invalid status code '%d'. %s '%s'. Payload length: %d".formatted(
                statusCode, method, target, payloadSize),
            cause
        );
        this.statusCode = statusCode;
    }

    /**
     * Server side and throttling responses fall under the generic transient retry, everything else is final.
     */
    static FailureKind kindFor(int statusCode) {
        return statusCode >= 500 || statusCode == 429 ? FailureKind.RETRIABLE : FailureKind.FATAL;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
