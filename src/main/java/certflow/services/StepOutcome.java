package certflow.services;

import certflow.model.FailureKind;

/**
 * Result of one workflow step as consumed by the orchestrator's transition function.
 */
public sealed interface StepOutcome<T> {

    static <T> StepOutcome<T> completed(T value) {
        return new Completed<>(value);
    }

    static <T> StepOutcome<T> failed(FailureKind kind, String message, Throwable cause) {
        return new Failed<>(kind, message, cause);
    }

    record Completed<T>(T value) implements StepOutcome<T> {

    }

    record Failed<T>(FailureKind kind, String message, Throwable cause) implements StepOutcome<T> {

    }
}
