package certflow.services;

import certflow.config.AppProperties;
import certflow.model.DnsZone;
import certflow.model.TxtRecordSet;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Talks to the DNS provider's REST API, where record sets are addressed as
 * <code>/zones/{zoneId}/txt/{label}</code>.
 */
@Service
@Slf4j
public class RestDnsProvider implements DnsProvider {

    private static final String RECORD_SET_PATH = "/zones/{zoneId}/txt/{label}";

    private final WebClient webClient;

    public RestDnsProvider(WebClient.Builder webClientBuilder, AppProperties appProperties) {
        final AppProperties.Dns dns = appProperties.dns();
        webClient = webClientBuilder.clone()
            .baseUrl(dns.baseUrl().toString())
            .defaultHeaders(headers -> {
                if (dns.accessToken() != null) {
                    headers.setBearerAuth(dns.accessToken());
                }
            })
            .build();
    }

    @Override
    public Mono<List<DnsZone>> listZones() {
        return webClient.get()
            .uri("/zones")
            .retrieve()
            .bodyToMono(new ParameterizedTypeReference<List<DnsZone>>() {})
            .defaultIfEmpty(List.of())
            .doOnNext(zones -> log.debug("Listed {} DNS zones", zones.size()));
    }

    @Override
    public Mono<TxtRecordSet> getTxtRecordSet(DnsZone zone, String label) {
        return webClient.get()
            .uri(RECORD_SET_PATH, zone.id(), label)
            .retrieve()
            .bodyToMono(TxtRecordSet.class)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
    }

    @Override
    public Mono<Void> upsertTxtRecordSet(DnsZone zone, TxtRecordSet recordSet) {
        log.debug("Upserting TXT record set label={} in zone={} values={}", recordSet.label(), zone.name(),
            recordSet.values()
        );
        return webClient.put()
            .uri(RECORD_SET_PATH, zone.id(), recordSet.label())
            .bodyValue(recordSet)
            .retrieve()
            .toBodilessEntity()
            .then();
    }

    @Override
    public Mono<Void> deleteTxtRecordSet(DnsZone zone, String label) {
        log.debug("Deleting TXT record set label={} in zone={}", label, zone.name());
        return webClient.delete()
            .uri(RECORD_SET_PATH, zone.id(), label)
            .retrieve()
            .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(), response -> Mono.empty())
            .toBodilessEntity()
            .then();
    }
}
