package certflow.services;

import certflow.config.AppProperties;
import certflow.model.AcmeDirectory;
import java.net.URI;
import java.time.Duration;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Service
@Slf4j
public class AcmeDirectoryService {
    public static final String NONCE_HEADER = "Replay-Nonce";

    private final WebClient webClient;
    private final Mono<AcmeDirectory> directory;
    /**
     * Nonces handed out with earlier responses, shared by all concurrently running workflows
     */
    private final Deque<String> latchedNonces = new ConcurrentLinkedDeque<>();

    public AcmeDirectoryService(WebClient.Builder webClientBuilder, AppProperties appProperties) {
        webClient = webClientBuilder.build();
        final URI endpoint = appProperties.acme().endpoint();
        // failures are not cached so that the next workflow tries again
        directory = retrieveDirectory(endpoint)
            .doOnNext(loaded -> log.debug("Loaded directory={} from endpoint={}", loaded, endpoint))
            .cache(loaded -> Duration.ofMillis(Long.MAX_VALUE), throwable -> Duration.ZERO, () -> Duration.ZERO);
    }

    private Mono<AcmeDirectory> retrieveDirectory(URI directoryUrl) {
        return webClient
            .get()
            .uri(directoryUrl)
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(AcmeDirectory.class);
    }

    public Mono<AcmeDirectory> directory() {
        return directory;
    }

    public Mono<String> nonce() {
        final String nonce = latchedNonces.pollFirst();
        if (nonce != null) {
            return Mono.just(nonce);
        }
        return directory
            .flatMap(acmeDirectory -> webClient.head()
                .uri(acmeDirectory.newNonce())
                .retrieve()
                .toBodilessEntity())
            .mapNotNull(entity -> entity.getHeaders().getFirst(NONCE_HEADER));
    }

    /**
     * Call this method on a retrieved entity such as
     * {@snippet :
     *  webClient.post()
     *   // ...
     *   .retrieve()
     *   .toEntity(SomeResponse.class)
     *   .doOnNext(directoryService.latchNonce())
     *}
     */
    public <T> Consumer<ResponseEntity<T>> latchNonce() {
        return entity -> latchNonce(entity.getHeaders());
    }

    public void latchNonce(HttpHeaders headers) {
        final String nonce = headers.getFirst(NONCE_HEADER);
        if (nonce != null) {
            latchedNonces.offerLast(nonce);
        }
    }

}
