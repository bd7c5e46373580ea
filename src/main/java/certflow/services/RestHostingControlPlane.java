package certflow.services;

import certflow.config.AppProperties;
import certflow.messages.CertificateImportRequest;
import certflow.messages.HostNameBindingRequest;
import certflow.model.HostedCertificate;
import certflow.model.Site;
import certflow.model.SiteRef;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Talks to the hosting control plane's REST API. Sites are addressed as
 * <code>/resourceGroups/{rg}/sites/{app}[/slots/{slot}]</code>, certificates as
 * <code>/resourceGroups/{rg}/certificates/{name}</code>.
 */
@Service
@Slf4j
public class RestHostingControlPlane implements HostingControlPlane {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final AppProperties.Hosting hosting;

    public RestHostingControlPlane(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
        AppProperties appProperties
    ) {
        this.objectMapper = objectMapper;
        this.hosting = appProperties.hosting();
        webClient = webClientBuilder.clone()
            .defaultHeaders(headers -> {
                if (hosting.accessToken() != null) {
                    headers.setBearerAuth(hosting.accessToken());
                }
            })
            .build();
    }

    @Override
    public Mono<Site> getSite(SiteRef ref) {
        return webClient.get()
            .uri(sitePath(ref).build().toUri())
            .retrieve()
            .bodyToMono(SiteResource.class)
            .map(resource -> Site.builder()
                .ref(ref)
                .location(resource.location())
                .hostNames(resource.hostNames())
                .contentUrl(resource.contentUrl())
                .sslBindings(resource.sslBindings())
                .build()
            )
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
    }

    @Override
    public Flux<HostedCertificate> listCertificates(String issuerTag, Instant expiringBefore) {
        return webClient.get()
            .uri(base().path("/certificates").build().toUri())
            .retrieve()
            .bodyToMono(new ParameterizedTypeReference<List<HostedCertificate>>() {})
            .flatMapIterable(certificates -> certificates)
            .filter(certificate -> Objects.equals(certificate.tags().get(Metadata.ISSUER_TAG), issuerTag))
            .filter(certificate -> certificate.expirationDate() != null
                && certificate.expirationDate().isBefore(expiringBefore));
    }

    @Override
    public Mono<HostedCertificate> findCertificate(String resourceGroup, String name) {
        return webClient.get()
            .uri(certificateUri(resourceGroup, name))
            .retrieve()
            .bodyToMono(HostedCertificate.class)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
    }

    @Override
    public Mono<HostedCertificate> importCertificate(Site site, String name, byte[] pkcs12, String passphrase,
        Map<String, String> tags
    ) {
        final CertificateImportRequest request = CertificateImportRequest.builder()
            .location(site.location())
            .tags(tags)
            .properties(CertificateImportRequest.Properties.builder()
                .pfxBlob(Base64.getEncoder().encodeToString(pkcs12))
                .password(passphrase)
                .secretStoreUrl(hosting.secretStoreUrl() != null ? hosting.secretStoreUrl().toString() : null)
                .build()
            )
            .build();
        log.info("Importing certificate={} into resourceGroup={}", name, site.ref().resourceGroup());
        return put(certificateUri(site.ref().resourceGroup(), name), request, HostedCertificate.class);
    }

    @Override
    public Mono<Void> deleteCertificate(String resourceGroup, String name) {
        final URI target = certificateUri(resourceGroup, name);
        log.info("Deleting certificate={} from resourceGroup={}", name, resourceGroup);
        return webClient.delete()
            .uri(target)
            .retrieve()
            .toBodilessEntity()
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
            .onErrorMap(WebClientResponseException.class, e ->
                new DeploymentException("DELETE", target, e.getStatusCode().value(), 0, e))
            .then();
    }

    @Override
    public Mono<Void> updateHostNameBinding(Site site, String hostName, String thumbprint) {
        final URI target = sitePath(site.ref())
            .path("/hostNameBindings/{hostName}")
            .buildAndExpand(hostName)
            .encode()
            .toUri();
        log.info("Binding hostName={} of site={} to thumbprint={}", hostName, site.ref(), thumbprint);
        return put(target, HostNameBindingRequest.sni(thumbprint), String.class)
            .then();
    }

    @Override
    public Mono<Void> writeFile(Site site, String path, String content) {
        final URI target = site.contentUrl() != null
            ? UriComponentsBuilder.fromUri(site.contentUrl()).path("/" + path).build().toUri()
            : sitePath(site.ref()).path("/content/" + path).build().toUri();
        log.debug("Writing file={} of site={}", path, site.ref());
        return webClient.put()
            .uri(target)
            .contentType(MediaType.TEXT_PLAIN)
            .bodyValue(content)
            .retrieve()
            .toBodilessEntity()
            .onErrorMap(WebClientResponseException.class, e ->
                new DeploymentException("PUT", target, e.getStatusCode().value(), content.length(), e))
            .then();
    }

    private <T> Mono<T> put(URI target, Object body, Class<T> responseClass) {
        final byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException("Unable to serialize request to " + target, e));
        }
        return webClient.put()
            .uri(target)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .bodyToMono(responseClass)
            .onErrorMap(WebClientResponseException.class, e ->
                new DeploymentException("PUT", target, e.getStatusCode().value(), payload.length, e));
    }

    private URI certificateUri(String resourceGroup, String name) {
        return base()
            .path("/resourceGroups/{resourceGroup}/certificates/{name}")
            .buildAndExpand(resourceGroup, name)
            .encode()
            .toUri();
    }

    private UriComponentsBuilder sitePath(SiteRef ref) {
        final UriComponentsBuilder builder = base()
            .path("/resourceGroups/" + ref.resourceGroup() + "/sites/" + ref.appName());
        return ref.isProductionSlot() ? builder : builder.path("/slots/" + ref.slotName());
    }

    private UriComponentsBuilder base() {
        return UriComponentsBuilder.fromUri(hosting.baseUrl());
    }

    record SiteResource(
        String location,
        List<String> hostNames,
        URI contentUrl,
        List<HostNameSslState> hostNameSslStates
    ) {

        Map<String, String> sslBindings() {
            if (hostNameSslStates == null) {
                return Map.of();
            }
            return hostNameSslStates.stream()
                .filter(state -> state.thumbprint() != null && !HostNameSslState.DISABLED.equals(state.sslState()))
                .collect(Collectors.toMap(HostNameSslState::name, HostNameSslState::thumbprint,
                    (first, second) -> first
                ));
        }
    }

    record HostNameSslState(
        String name,
        String sslState,
        String thumbprint
    ) {

        static final String DISABLED = "Disabled";
    }
}
