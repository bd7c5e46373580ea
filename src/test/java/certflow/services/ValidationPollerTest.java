package certflow.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import certflow.messages.OrderResponse;
import certflow.model.Challenge;
import certflow.model.ChallengeResult;
import certflow.model.DnsProof;
import certflow.model.FailureKind;
import certflow.model.Problem;
import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class ValidationPollerTest {

    private static final URI ORDER = URI.create("https://acme.test/order/1");
    private static final URI CHALLENGE_A = URI.create("https://acme.test/chall/a");
    private static final URI CHALLENGE_B = URI.create("https://acme.test/chall/b");
    private static final List<ChallengeResult> RESULTS = List.of(
        new ChallengeResult(CHALLENGE_A, DnsProof.forName("a.example.com", "va")),
        new ChallengeResult(CHALLENGE_B, DnsProof.forName("b.example.com", "vb"))
    );

    private final AcmeClient acmeClient = mock(AcmeClient.class);
    private final ValidationPoller poller = new ValidationPoller(acmeClient);

    @Test
    void pendingOrderIsRetriable() {
        when(acmeClient.getOrder(ORDER)).thenReturn(Mono.just(order(OrderResponse.STATUS_PENDING)));

        assertThatThrownBy(() -> poller.checkOrder(ORDER, RESULTS).block())
            .isInstanceOfSatisfying(RetriableValidationException.class,
                e -> assertThat(e.getKind()).isEqualTo(FailureKind.RETRIABLE))
            .hasMessage("ACME domain validation is pending. It will retry automatically.");
    }

    @Test
    void readyOrderProceeds() {
        when(acmeClient.getOrder(ORDER)).thenReturn(Mono.just(order(OrderResponse.STATUS_READY)));

        assertThat(poller.checkOrder(ORDER, RESULTS).block())
            .extracting(OrderResponse::status)
            .isEqualTo(OrderResponse.STATUS_READY);
    }

    @Test
    void invalidOrderCollectsErrorsOfInvalidChallenges() {
        when(acmeClient.getOrder(ORDER)).thenReturn(Mono.just(order(OrderResponse.STATUS_INVALID)));
        when(acmeClient.getChallenge(CHALLENGE_A)).thenReturn(Mono.just(new Challenge(Challenge.TYPE_DNS_01,
            CHALLENGE_A, "ta", "valid", null, null)));
        when(acmeClient.getChallenge(CHALLENGE_B)).thenReturn(Mono.just(new Challenge(Challenge.TYPE_DNS_01,
            CHALLENGE_B, "tb", Challenge.STATUS_INVALID, null,
            new Problem("urn:ietf:params:acme:error:dns", "NXDOMAIN looking up TXT", 400, null))));

        assertThatThrownBy(() -> poller.checkOrder(ORDER, RESULTS).block())
            .isInstanceOfSatisfying(OrderInvalidException.class, e -> {
                assertThat(e.getKind()).isEqualTo(FailureKind.RESTART_REQUIRED);
                assertThat(e.getChallengeErrors()).singleElement()
                    .asString()
                    .contains(CHALLENGE_B.toString(), "NXDOMAIN looking up TXT");
            });
    }

    private static OrderResponse order(String status) {
        return OrderResponse.builder()
            .status(status)
            .build();
    }
}
