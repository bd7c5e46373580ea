package certflow.services;

import certflow.messages.OrderResponse;
import certflow.model.Challenge;
import certflow.model.ChallengeResult;
import java.net.URI;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Checks once whether the CA finished validating an order. The caller drives repetition.
 */
@Service
@Slf4j
public class ValidationPoller {

    private final AcmeClient acmeClient;

    public ValidationPoller(AcmeClient acmeClient) {
        this.acmeClient = acmeClient;
    }

    /**
     * @return the order once it is ready to be finalized, or already valid
     */
    public Mono<OrderResponse> checkOrder(URI orderUrl, List<ChallengeResult> results) {
        return acmeClient.getOrder(orderUrl)
            .flatMap(order -> {
                log.debug("Polling order={}, got status={}", orderUrl, order.status());
                if (order.hasStatus(OrderResponse.STATUS_PENDING) || order.hasStatus(OrderResponse.STATUS_PROCESSING)) {
                    return Mono.error(new RetriableValidationException(
                        "ACME domain validation is %s. It will retry automatically.".formatted(order.status())));
                }
                if (order.hasStatus(OrderResponse.STATUS_INVALID)) {
                    return collectChallengeErrors(results)
                        .flatMap(errors -> Mono.error(new OrderInvalidException(orderUrl, errors)));
                }
                if (order.hasStatus(OrderResponse.STATUS_READY) || order.hasStatus(OrderResponse.STATUS_VALID)) {
                    return Mono.just(order);
                }
                return Mono.error(new IllegalStateException(
                    "Order %s has unexpected status %s".formatted(orderUrl, order.status())));
            });
    }

    private Mono<List<String>> collectChallengeErrors(List<ChallengeResult> results) {
        return Flux.fromIterable(results)
            .concatMap(result -> acmeClient.getChallenge(result.challengeUrl())
                .onErrorResume(e -> {
                    log.warn("Unable to load challenge={} of invalid order: {}", result.challengeUrl(), e.getMessage());
                    return Mono.empty();
                })
            )
            .filter(Challenge::isInvalid)
            .map(ValidationPoller::describe)
            .doOnNext(error -> log.error("ACME domain validation error: {}", error))
            .collectList();
    }

    private static String describe(Challenge challenge) {
        if (challenge.error() == null) {
            return challenge.url() + " is invalid";
        }
        return "%s %s: %s".formatted(challenge.url(), challenge.error().type(), challenge.error().detail());
    }
}
