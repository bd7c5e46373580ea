package certflow.services;

import certflow.model.FailureKind;
import java.util.List;

public class DelegationMismatchException extends WorkflowStepException {

    public DelegationMismatchException(String zoneName, List<String> expected, List<String> actual) {
        super(FailureKind.PRECONDITION,
            "The delegated name server is not correct. DNS zone = %s, Expected = %s, Actual = %s".formatted(
                zoneName, String.join(",", expected), String.join(",", actual))
        );
    }
}
