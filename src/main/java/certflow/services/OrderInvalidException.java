package certflow.services;

import certflow.model.FailureKind;
import java.net.URI;
import java.util.List;

/**
 * An invalid order can't be used again, the workflow has to start over with a new one.
 */
public class OrderInvalidException extends WorkflowStepException {

    private final List<String> challengeErrors;

    public OrderInvalidException(URI orderUrl, List<String> challengeErrors) {
        super(FailureKind.RESTART_REQUIRED,
            "ACME domain validation of order %s is invalid. Required retry at first. Errors = %s".formatted(
                orderUrl, challengeErrors)
        );
        this.challengeErrors = List.copyOf(challengeErrors);
    }

    public List<String> getChallengeErrors() {
        return challengeErrors;
    }
}
