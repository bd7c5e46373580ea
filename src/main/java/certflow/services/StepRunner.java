package certflow.services;

import certflow.model.FailureKind;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Runs workflow steps, retrying the ones failing with {@link FailureKind#RETRIABLE} and turning every outcome into a
 * {@link StepOutcome} so that errors never escape a step unclassified.
 */
@Component
@Slf4j
public class StepRunner {

    /**
     * @param maxAttempts total attempts, including the first one
     */
    public <T> Mono<StepOutcome<T>> run(String workflowId, String step, Supplier<Mono<T>> action,
        long maxAttempts, Duration delay
    ) {
        return Mono.defer(action)
            .retryWhen(
                Retry.fixedDelay(Math.max(0, maxAttempts - 1), delay)
                    .filter(throwable -> classify(throwable) == FailureKind.RETRIABLE)
                    .doBeforeRetry(signal ->
                        log.debug("Retrying step={} of workflow={} after attempt={}: {}",
                            step, workflowId, signal.totalRetries() + 1, signal.failure().getMessage()
                        ))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure())
            )
            .map(StepOutcome::completed)
            .onErrorResume(throwable -> {
                final FailureKind kind = classify(throwable);
                log.warn("Step={} of workflow={} failed kind={}: {}", step, workflowId, kind, throwable.getMessage());
                log.debug("Failure details of step={}", step, throwable);
                return Mono.just(StepOutcome.failed(kind, describe(throwable), throwable));
            });
    }

    public static FailureKind classify(Throwable throwable) {
        if (throwable instanceof WorkflowStepException stepException) {
            return stepException.getKind();
        }
        if (throwable instanceof AcmeProblemException problemException) {
            return problemException.isTransient() ? FailureKind.RETRIABLE : FailureKind.FATAL;
        }
        if (throwable instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError()
                || responseException.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                ? FailureKind.RETRIABLE : FailureKind.FATAL;
        }
        if (throwable instanceof WebClientRequestException
            || throwable instanceof TimeoutException
            || throwable instanceof IOException) {
            return FailureKind.RETRIABLE;
        }
        return FailureKind.FATAL;
    }

    private static String describe(Throwable throwable) {
        return throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
    }
}
