package certflow.services;

import static org.assertj.core.api.Assertions.assertThat;

import certflow.model.FailureKind;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

class StepRunnerTest {

    private final StepRunner stepRunner = new StepRunner();

    @Test
    void retriesRetriableFailuresUntilSuccess() {
        final AtomicInteger attempts = new AtomicInteger();

        final StepOutcome<String> outcome = stepRunner.<String>run("wf", "step",
            () -> attempts.incrementAndGet() < 3
                ? Mono.error(new RetriableValidationException("not yet"))
                : Mono.just("done"),
            5, Duration.ofMillis(1)
        ).block();

        assertThat(outcome).isEqualTo(StepOutcome.completed("done"));
        assertThat(attempts).hasValue(3);
    }

    @Test
    void exhaustedRetriesKeepTheLastFailure() {
        final AtomicInteger attempts = new AtomicInteger();

        final StepOutcome<String> outcome = stepRunner.<String>run("wf", "step", () -> Mono.error(
            new RetriableValidationException("attempt " + attempts.incrementAndGet())), 3, Duration.ofMillis(1)
        ).block();

        assertThat(outcome).isInstanceOfSatisfying(StepOutcome.Failed.class, failed -> {
            assertThat(failed.kind()).isEqualTo(FailureKind.RETRIABLE);
            assertThat(failed.message()).isEqualTo("attempt 3");
        });
    }

    @Test
    void preconditionFailuresAreNotRetried() {
        final AtomicInteger attempts = new AtomicInteger();

        final StepOutcome<String> outcome = stepRunner.<String>run("wf", "step", () -> {
            attempts.incrementAndGet();
            return Mono.error(new ZoneNotFoundException(List.of("x.org")));
        }, 5, Duration.ofMillis(1)).block();

        assertThat(outcome).isInstanceOfSatisfying(StepOutcome.Failed.class,
            failed -> assertThat(failed.kind()).isEqualTo(FailureKind.PRECONDITION));
        assertThat(attempts).hasValue(1);
    }

    @Test
    void classifiesForeignErrors() {
        assertThat(StepRunner.classify(new IOException("reset"))).isEqualTo(FailureKind.RETRIABLE);
        assertThat(StepRunner.classify(WebClientResponseException.create(HttpStatus.BAD_GATEWAY.value(),
            "Bad Gateway", HttpHeaders.EMPTY, new byte[0], null))).isEqualTo(FailureKind.RETRIABLE);
        assertThat(StepRunner.classify(WebClientResponseException.create(HttpStatus.FORBIDDEN.value(),
            "Forbidden", HttpHeaders.EMPTY, new byte[0], null))).isEqualTo(FailureKind.FATAL);
        assertThat(StepRunner.classify(new IllegalStateException("bug"))).isEqualTo(FailureKind.FATAL);
        assertThat(StepRunner.classify(new DeploymentException("PUT", null, 503, 10, null)))
            .isEqualTo(FailureKind.RETRIABLE);
        assertThat(StepRunner.classify(new DeploymentException("PUT", null, 400, 10, null)))
            .isEqualTo(FailureKind.FATAL);
    }
}
