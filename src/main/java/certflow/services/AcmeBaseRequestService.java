package certflow.services;

import certflow.model.Problem;
import certflow.model.SignableValue;
import com.nimbusds.jose.jwk.JWK;
import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClient.ResponseSpec;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

@Service
@Slf4j
public class AcmeBaseRequestService {

    /**
     * Retries of a request rejected for its nonce, each with the fresh nonce from the rejection
     */
    private static final int BAD_NONCE_RETRIES = 3;

    private final AcmeDirectoryService directoryService;
    private final WebClient webClient;

    public AcmeBaseRequestService(WebClient.Builder webClientBuilder, AcmeDirectoryService directoryService) {
        webClient = webClientBuilder
            .filter((request, next) -> {
                log.debug("Starting {} {}", request.method(), request.url());
                return next.exchange(request);
            })
            .build();
        this.directoryService = directoryService;
    }

    public <T> Mono<ResponseEntity<T>> request(JWK jwk, @Nullable String kid, URI requestUrl,
        @Nullable Object payload, Class<T> responseClass
    ) {
        log.debug("Creating POST to url={} payload={}", requestUrl, payload);

        return Mono.defer(() -> preEntityRequest(jwk, kid, requestUrl, payload)
                .toEntity(responseClass)
            )
            .retryWhen(Retry.max(BAD_NONCE_RETRIES)
                .filter(throwable -> throwable instanceof AcmeProblemException problem && problem.isBadNonce())
                .doBeforeRetry(signal -> log.debug("Retrying request to url={} after bad nonce", requestUrl))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure())
            )
            .doOnNext(directoryService.latchNonce())
            .doOnNext(entity -> log.debug("Response status={} from url={} body={}",
                entity.getStatusCode(), requestUrl, entity.getBody()
            ));
    }

    @NotNull
    private ResponseSpec preEntityRequest(JWK jwk, @Nullable String kid, URI requestUrl, @Nullable Object payload) {
        return webClient.post()
            .uri(requestUrl)
            .contentType(JwsMessageWriter.JOSE_JSON)
            .body(
                directoryService.nonce()
                    .map(nonce -> SignableValue.builder()
                        .jwk(jwk)
                        .kid(kid)
                        .nonce(nonce)
                        .requestUrl(requestUrl)
                        .value(payload)
                        .build()
                    ), SignableValue.class
            )
            .retrieve()
            .onStatus(HttpStatusCode::isError, clientResponse -> {
                directoryService.latchNonce(clientResponse.headers().asHttpHeaders());
                final int status = clientResponse.statusCode().value();
                return clientResponse.bodyToMono(Problem.class)
                    .onErrorResume(e -> {
                        log.debug("Error response from url={} is not a problem document: {}", requestUrl,
                            e.getMessage()
                        );
                        return Mono.empty();
                    })
                    .defaultIfEmpty(new Problem(null, "No problem document in response", status, null))
                    .flatMap(problem -> clientResponse.createException()
                        .map(e -> new AcmeProblemException(problem, e))
                        .doOnNext(
                            e -> log.warn("Failed response from url={} was problem={}", requestUrl, problem))
                    );
            });
    }

}
