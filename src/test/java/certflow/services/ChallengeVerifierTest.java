package certflow.services;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import certflow.model.ChallengeProof;
import certflow.model.ChallengeResult;
import certflow.model.DnsProof;
import certflow.model.HttpProof;
import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class ChallengeVerifierTest {

    private static final HttpProof HTTP_PROOF = HttpProof.forToken("www.example.com", "tok", "tok.thumb");
    private static final DnsProof DNS_PROOF = DnsProof.forName("*.example.com", "digest");

    private final DnsLookup dnsLookup = mock(DnsLookup.class);

    @Test
    void httpProofWithMatchingBody() {
        final ChallengeVerifier verifier = new ChallengeVerifier(respondingWith(HttpStatus.OK, "tok.thumb\n"),
            dnsLookup);

        assertThatCode(() -> verifier.verify(List.of(result(HTTP_PROOF))).block())
            .doesNotThrowAnyException();
    }

    @Test
    void httpProofWithWrongBodyIsRetriable() {
        final ChallengeVerifier verifier = new ChallengeVerifier(respondingWith(HttpStatus.OK, "something else"),
            dnsLookup);

        assertThatThrownBy(() -> verifier.verify(List.of(result(HTTP_PROOF))).block())
            .isInstanceOf(RetriableValidationException.class)
            .hasMessageContaining("is not correct")
            .hasMessageContaining("Expected: \"tok.thumb\"");
    }

    @Test
    void httpProofNotFoundIsRetriable() {
        final ChallengeVerifier verifier = new ChallengeVerifier(respondingWith(HttpStatus.NOT_FOUND, null),
            dnsLookup);

        assertThatThrownBy(() -> verifier.verify(List.of(result(HTTP_PROOF))).block())
            .isInstanceOf(RetriableValidationException.class)
            .hasMessage("http://www.example.com/.well-known/acme-challenge/tok is 404 status code.");
    }

    @Test
    void dnsProofFoundAmongOtherValues() {
        when(dnsLookup.lookupTxt("_acme-challenge.example.com"))
            .thenReturn(Mono.just(List.of("other", "digest")));
        final ChallengeVerifier verifier = new ChallengeVerifier(WebClient.create(), dnsLookup);

        assertThatCode(() -> verifier.verify(List.of(result(DNS_PROOF))).block())
            .doesNotThrowAnyException();
    }

    @Test
    void unresolvedDnsProofIsRetriable() {
        when(dnsLookup.lookupTxt("_acme-challenge.example.com")).thenReturn(Mono.just(List.of()));
        final ChallengeVerifier verifier = new ChallengeVerifier(WebClient.create(), dnsLookup);

        assertThatThrownBy(() -> verifier.verify(List.of(result(DNS_PROOF))).block())
            .isInstanceOf(RetriableValidationException.class)
            .hasMessage("_acme-challenge.example.com did not resolve.");
    }

    @Test
    void dnsLookupFailureIsRetriable() {
        when(dnsLookup.lookupTxt("_acme-challenge.example.com"))
            .thenReturn(Mono.error(new IllegalStateException("SERVFAIL")));
        final ChallengeVerifier verifier = new ChallengeVerifier(WebClient.create(), dnsLookup);

        assertThatThrownBy(() -> verifier.verify(List.of(result(DNS_PROOF))).block())
            .isInstanceOf(RetriableValidationException.class)
            .hasMessageContaining("bad response")
            .hasMessageContaining("SERVFAIL");
    }

    private static ChallengeResult result(ChallengeProof proof) {
        return new ChallengeResult(URI.create("https://acme.test/chall/1"), proof);
    }

    private static WebClient respondingWith(HttpStatus status, String body) {
        return WebClient.builder()
            .exchangeFunction(request -> {
                final ClientResponse.Builder response = ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE);
                return Mono.just(body != null ? response.body(body).build() : response.build());
            })
            .build();
    }
}
