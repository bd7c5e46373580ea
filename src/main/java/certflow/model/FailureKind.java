package certflow.model;

/**
 * How a failed step affects the workflow.
 */
public enum FailureKind {
    /**
     * Transient, the step is retried with a fixed delay up to a bounded number of attempts.
     */
    RETRIABLE,
    /**
     * Configuration or environment problem that retrying cannot fix.
     */
    PRECONDITION,
    /**
     * The order can no longer be used, a new order has to be created.
     */
    RESTART_REQUIRED,
    FATAL
}
