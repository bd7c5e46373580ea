package certflow.services;

import certflow.model.FailureKind;

public class ChallengeTypeConflictException extends WorkflowStepException {

    public ChallengeTypeConflictException(String dnsName, String requiredType) {
        super(FailureKind.PRECONDITION,
            "Authorization of %s offers no %s challenge, mixing challenge types within one certificate is not allowed"
                .formatted(dnsName, requiredType)
        );
    }
}
