package certflow.services;

import certflow.config.WebClientConfig;
import certflow.model.ChallengeProof;
import certflow.model.ChallengeResult;
import certflow.model.DnsProof;
import certflow.model.HttpProof;
import java.net.URI;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Confirms that published proofs are visible from outside before the CA is asked to look at them. A proof that is not
 * visible yet fails with {@link RetriableValidationException}.
 */
@Service
@Slf4j
public class ChallengeVerifier {

    private final WebClient webClient;
    private final DnsLookup dnsLookup;

    public ChallengeVerifier(@Qualifier(WebClientConfig.VERIFICATION_CLIENT) WebClient webClient,
        DnsLookup dnsLookup
    ) {
        this.webClient = webClient;
        this.dnsLookup = dnsLookup;
    }

    public Mono<Void> verify(List<ChallengeResult> results) {
        return Flux.fromIterable(results)
            .map(ChallengeResult::proof)
            .concatMap(proof -> proof.accept(new ChallengeProof.Visitor<Mono<Void>>() {
                @Override
                public Mono<Void> visitHttp(HttpProof httpProof) {
                    return checkHttp(httpProof);
                }

                @Override
                public Mono<Void> visitDns(DnsProof dnsProof) {
                    return checkDns(dnsProof);
                }
            }))
            .then();
    }

    Mono<Void> checkHttp(HttpProof proof) {
        final URI url = proof.resourceUrl();
        return webClient.get()
            .uri(url)
            .exchangeToMono(response -> {
                if (!response.statusCode().is2xxSuccessful()) {
                    return response.releaseBody()
                        .then(Mono.error(new RetriableValidationException(
                            "%s is %d status code.".formatted(url, response.statusCode().value()))));
                }
                return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(body -> {
                        if (!body.strip().equals(proof.value())) {
                            return Mono.error(new RetriableValidationException(
                                "%s is not correct. Expected: \"%s\", Actual: \"%s\"".formatted(
                                    url, proof.value(), body)));
                        }
                        log.debug("Verified HTTP proof at url={}", url);
                        return Mono.<Void>empty();
                    });
            })
            .onErrorMap(WebClientRequestException.class, e ->
                new RetriableValidationException("%s could not be fetched: %s".formatted(url, e.getMessage()), e));
    }

    Mono<Void> checkDns(DnsProof proof) {
        final String recordName = proof.recordName();
        return dnsLookup.lookupTxt(recordName)
            .onErrorMap(e -> !(e instanceof RetriableValidationException), e ->
                new RetriableValidationException(
                    "%s bad response. Message: \"%s\"".formatted(recordName, e.getMessage()), e))
            .flatMap(values -> {
                if (values.isEmpty()) {
                    return Mono.error(new RetriableValidationException("%s did not resolve.".formatted(recordName)));
                }
                if (!values.contains(proof.value())) {
                    return Mono.error(new RetriableValidationException(
                        "%s is not correct. Expected: \"%s\", Actual: \"%s\"".formatted(
                            recordName, proof.value(), String.join(",", values))));
                }
                log.debug("Verified DNS proof at record={}", recordName);
                return Mono.empty();
            });
    }
}
