package certflow.services;

import certflow.model.FailureKind;

/**
 * The resolver did not answer, as opposed to answering that a name has no records.
 */
public class DnsLookupException extends WorkflowStepException {

    public DnsLookupException(String name, String recordType, Throwable cause) {
        super(FailureKind.RETRIABLE, "%s lookup of %s failed: %s".formatted(recordType, name, cause.getMessage()), cause);
    }
}
