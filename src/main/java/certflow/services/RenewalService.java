package certflow.services;

import certflow.config.AppProperties;
import certflow.model.ChallengeType;
import certflow.model.DomainSet;
import certflow.model.HostedCertificate;
import certflow.model.IssuanceRequest;
import certflow.model.SiteRef;
import certflow.model.WorkflowReport;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Finds certificates this service imported that are about to expire and issues their successors. Afterwards the
 * certificates left obsolete by that are deleted from the hosting control plane.
 */
@Service
@Slf4j
public class RenewalService {

    private final HostingControlPlane hostingControlPlane;
    private final CertificateOrchestrator orchestrator;
    private final AppProperties appProperties;

    public RenewalService(HostingControlPlane hostingControlPlane,
        CertificateOrchestrator orchestrator,
        AppProperties appProperties
    ) {
        this.hostingControlPlane = hostingControlPlane;
        this.orchestrator = orchestrator;
        this.appProperties = appProperties;
    }

    @Scheduled(cron = "${certflow.renewal.cron:0 0 0 * * *}")
    public void scheduledRenewal() {
        renewExpiring()
            .then(Mono.defer(() -> purgeObsolete().count()))
            .subscribe(purged -> log.debug("Purged {} obsolete certificate(s)", purged), throwable ->
                log.error("Issue while renewing certificates", throwable)
            );
    }

    public Flux<WorkflowReport> renewExpiring() {
        final AppProperties.Renewal renewal = appProperties.renewal();
        final Instant threshold = Instant.now().plus(renewal.renewBefore());
        return hostingControlPlane.listCertificates(renewal.issuerTag(), threshold)
            .filter(this::issuedByConfiguredEndpoint)
            .flatMapIterable(certificate -> toRequest(certificate).stream().toList())
            .distinct(IssuanceRequest::workflowId)
            .collectList()
            .flatMapMany(requests -> {
                log.info("Found {} certificate(s) expiring before {}", requests.size(), threshold);
                if (appProperties.dryRun()) {
                    requests.forEach(request -> log.info("Dry run: would renew site={} names={}",
                        request.site(), request.domains().names()
                    ));
                    return Flux.empty();
                }
                return orchestrator.runAll(requests);
            })
            .doOnNext(report -> {
                if (!report.succeeded()) {
                    log.warn("Renewal of site={} names={} failed kind={}: {}", report.site(),
                        report.domains().names(), report.failureKind(), report.error()
                    );
                }
            });
    }

    /**
     * Deletes certificates carrying the issuer tag that expired, or that a later certificate for the same site and
     * names replaced and no host name of the site is bound to any more.
     */
    public Flux<HostedCertificate> purgeObsolete() {
        final Instant now = Instant.now();
        return hostingControlPlane.listCertificates(appProperties.renewal().issuerTag(), Instant.MAX)
            .filter(this::issuedByConfiguredEndpoint)
            .collectList()
            .flatMapMany(certificates -> Flux.fromIterable(certificates)
                .filterWhen(certificate -> isObsolete(certificate, certificates, now))
            )
            .concatMap(certificate -> {
                if (appProperties.dryRun()) {
                    log.info("Dry run: would delete certificate={} expiring={}", certificate.name(),
                        certificate.expirationDate()
                    );
                    return Mono.empty();
                }
                log.info("Deleting obsolete certificate={} expiring={}", certificate.name(),
                    certificate.expirationDate()
                );
                return hostingControlPlane.deleteCertificate(certificate.resourceGroup(), certificate.name())
                    .thenReturn(certificate)
                    .onErrorResume(throwable -> {
                        log.warn("Unable to delete certificate={}: {}", certificate.name(), throwable.getMessage());
                        return Mono.empty();
                    });
            });
    }

    private Mono<Boolean> isObsolete(HostedCertificate certificate, List<HostedCertificate> certificates,
        Instant now
    ) {
        final Instant expiration = certificate.expirationDate();
        if (expiration == null) {
            return Mono.just(false);
        }
        if (!expiration.isAfter(now)) {
            return Mono.just(true);
        }
        final boolean superseded = certificates.stream()
            .anyMatch(other -> other != certificate
                && other.expirationDate() != null
                && other.expirationDate().isAfter(expiration)
                && sameSiteAndNames(other, certificate)
            );
        if (!superseded) {
            return Mono.just(false);
        }
        final String site = certificate.tags().get(Metadata.SITE_TAG);
        if (site == null) {
            return Mono.just(false);
        }
        final SiteRef siteRef;
        try {
            siteRef = SiteRef.parse(site);
        } catch (IllegalArgumentException e) {
            log.debug("Certificate={} has malformed site tag={}, keeping it", certificate.name(), site);
            return Mono.just(false);
        }
        return hostingControlPlane.getSite(siteRef)
            .map(hostedSite -> !hostedSite.isBound(certificate.thumbprint()))
            .defaultIfEmpty(true);
    }

    private static boolean sameSiteAndNames(HostedCertificate a, HostedCertificate b) {
        return Objects.equals(a.tags().get(Metadata.SITE_TAG), b.tags().get(Metadata.SITE_TAG))
            && normalizedNames(a).equals(normalizedNames(b));
    }

    private static Set<String> normalizedNames(HostedCertificate certificate) {
        return certificate.hostNames().stream()
            .map(dnsName -> dnsName.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    }

    private boolean issuedByConfiguredEndpoint(HostedCertificate certificate) {
        final String endpoint = certificate.tags().get(Metadata.ENDPOINT_TAG);
        return endpoint == null || endpoint.equalsIgnoreCase(appProperties.acme().endpoint().getHost());
    }

    /**
     * Platform managed names are dropped, a certificate left with none is not renewed.
     */
    Optional<IssuanceRequest> toRequest(HostedCertificate certificate) {
        final String site = certificate.tags().get(Metadata.SITE_TAG);
        if (site == null) {
            log.debug("Certificate={} carries no site tag, not renewing", certificate.name());
            return Optional.empty();
        }
        final List<String> names = certificate.hostNames().stream()
            .filter(dnsName -> !appProperties.hosting().isPlatformName(dnsName))
            .toList();
        if (names.isEmpty()) {
            log.debug("Certificate={} covers no custom names, not renewing", certificate.name());
            return Optional.empty();
        }
        final SiteRef siteRef;
        try {
            siteRef = SiteRef.parse(site);
        } catch (IllegalArgumentException e) {
            log.warn("Certificate={} has malformed site tag={}", certificate.name(), site);
            return Optional.empty();
        }
        return Optional.of(IssuanceRequest.builder()
            .site(siteRef)
            .domains(DomainSet.of(names))
            .forceDns01(ChallengeType.DNS_01.wireName().equals(certificate.tags().get(Metadata.CHALLENGE_TAG)))
            .build());
    }
}
