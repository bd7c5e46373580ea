package certflow.services;

import certflow.config.AppProperties;
import certflow.messages.CompletedEvent;
import certflow.model.DomainSet;
import certflow.model.SiteRef;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Posts a completion event to the configured webhook. Delivery failures are logged and never fail a workflow.
 */
@Service
@Slf4j
public class CompletionNotifier {

    private final WebClient webClient;
    private final AppProperties appProperties;

    public CompletionNotifier(WebClient.Builder webClientBuilder, AppProperties appProperties) {
        this.webClient = webClientBuilder.build();
        this.appProperties = appProperties;
    }

    public Mono<Void> notifyCompleted(SiteRef site, Instant expiration, DomainSet domains) {
        if (appProperties.webhookUrl() == null) {
            return Mono.empty();
        }
        return webClient.post()
            .uri(appProperties.webhookUrl())
            .bodyValue(CompletedEvent.builder()
                .appName(site.appName())
                .slotName(site.slotName())
                .expirationDate(expiration)
                .dnsNames(domains.names())
                .build()
            )
            .retrieve()
            .toBodilessEntity()
            .doOnNext(response -> log.debug("Delivered completion event for site={}", site))
            .then()
            .onErrorResume(throwable -> {
                log.warn("Failed to deliver completion event for site={}: {}", site, throwable.getMessage());
                return Mono.empty();
            });
    }
}
