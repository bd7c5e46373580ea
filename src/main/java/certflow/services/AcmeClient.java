package certflow.services;

import certflow.messages.AuthzResponse;
import certflow.messages.FinalizeRequest;
import certflow.messages.OrderRequest;
import certflow.messages.OrderResponse;
import certflow.model.AcmeOrder;
import certflow.model.CertificateDownload;
import certflow.model.Challenge;
import certflow.model.DomainSet;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Certificate authority operations of one issuance, composing {@link AcmeBaseRequestService} by abstracting away the
 * account retrieval.
 */
@Service
@Slf4j
public class AcmeClient {

    /**
     * Empty JSON object, tells the server the client is ready for a challenge to be validated
     */
    private static final String READY_PAYLOAD = "{}";

    private static final Pattern ALTERNATE_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?alternate\"?");

    private final AcmeBaseRequestService baseRequestService;
    private final AcmeAccountService accountService;
    private final AcmeDirectoryService directoryService;

    public AcmeClient(AcmeBaseRequestService baseRequestService,
        AcmeAccountService accountService,
        AcmeDirectoryService directoryService
    ) {
        this.baseRequestService = baseRequestService;
        this.accountService = accountService;
        this.directoryService = directoryService;
    }

    @NonNull
    public <T> Mono<ResponseEntity<T>> requestEntity(URI requestUrl, Object payload, Class<T> responseClass) {
        return accountService.account()
            .flatMap(acmeAccount ->
                baseRequestService.request(acmeAccount.jwk(), acmeAccount.accountUri().toString(), requestUrl, payload,
                    responseClass
                ));
    }

    @NonNull
    public <T> Mono<T> request(URI requestUrl, Object payload, Class<T> responseClass) {
        return requestEntity(requestUrl, payload, responseClass)
            .mapNotNull(HttpEntity::getBody);
    }

    public Mono<AcmeOrder> createOrder(DomainSet domains) {
        return directoryService.directory()
            .flatMap(directory -> requestEntity(directory.newOrder(), OrderRequest.forDomains(domains),
                OrderResponse.class
            ))
            .map(entity -> {
                final URI location = entity.getHeaders().getLocation();
                if (location == null || entity.getBody() == null) {
                    throw new IllegalStateException("Order response for " + domains.names() + " lacks location or body");
                }
                log.debug("Created order={} with status={} for names={}", location, entity.getBody().status(),
                    domains.names()
                );
                return new AcmeOrder(location, entity.getBody());
            });
    }

    public Mono<OrderResponse> getOrder(URI orderUrl) {
        return request(orderUrl, null, OrderResponse.class);
    }

    public Mono<AuthzResponse> getAuthorization(URI authzUrl) {
        return request(authzUrl, null, AuthzResponse.class);
    }

    public Mono<Challenge> getChallenge(URI challengeUrl) {
        return request(challengeUrl, null, Challenge.class);
    }

    /**
     * Answering a challenge that is already processing or valid returns its current state, so this is safe to repeat.
     */
    public Mono<Challenge> answerChallenge(URI challengeUrl) {
        return request(challengeUrl, READY_PAYLOAD, Challenge.class)
            .doOnNext(challenge -> log.debug("Challenge validation requested, resp={}", challenge));
    }

    public Mono<OrderResponse> finalizeOrder(URI finalizeUrl, byte[] csrDer) {
        return request(finalizeUrl,
            FinalizeRequest.ofDer(csrDer),
            OrderResponse.class
        );
    }

    public Mono<CertificateDownload> downloadCertificate(URI certificateUrl) {
        return requestEntity(certificateUrl, null, String.class)
            .map(entity -> new CertificateDownload(entity.getBody(), alternateLinks(entity.getHeaders())));
    }

    public Mono<String> keyAuthorization(String token) {
        return accountService.buildKeyAuthorization(token);
    }

    /**
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.4.2">RFC 8555 7.4.2</a>
     */
    static List<URI> alternateLinks(HttpHeaders headers) {
        final List<String> links = headers.getOrEmpty(HttpHeaders.LINK);
        return links.stream()
            .flatMap(value -> {
                final Matcher matcher = ALTERNATE_LINK.matcher(value);
                final List<URI> found = new ArrayList<>();
                while (matcher.find()) {
                    found.add(URI.create(matcher.group(1)));
                }
                return found.stream();
            })
            .toList();
    }
}
