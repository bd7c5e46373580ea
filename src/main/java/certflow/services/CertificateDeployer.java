package certflow.services;

import certflow.config.AppProperties;
import certflow.model.ChallengeType;
import certflow.model.DomainSet;
import certflow.model.HostedCertificate;
import certflow.model.IssuedCertificate;
import certflow.model.Site;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Imports issued certificates into the hosting control plane and binds them to the site's host names.
 */
@Service
@Slf4j
public class CertificateDeployer {

    private final HostingControlPlane hostingControlPlane;
    private final AppProperties appProperties;

    public CertificateDeployer(HostingControlPlane hostingControlPlane, AppProperties appProperties) {
        this.hostingControlPlane = hostingControlPlane;
        this.appProperties = appProperties;
    }

    /**
     * Importing a certificate the control plane already holds with the same thumbprint is a no-op.
     */
    public Mono<HostedCertificate> upload(Site site, IssuedCertificate certificate, ChallengeType challengeType) {
        final String name = certificate.certificateName();
        return findImported(site, certificate.domains(), certificate.thumbprint())
            .doOnNext(existing -> log.info("Certificate={} is already imported, skipping upload", name))
            .switchIfEmpty(Mono.defer(() -> hostingControlPlane.importCertificate(site, name,
                certificate.pkcs12(), certificate.passphrase(), tags(site, challengeType)
            )));
    }

    public Mono<HostedCertificate> findImported(Site site, DomainSet domains, String thumbprint) {
        return hostingControlPlane.findCertificate(site.ref().resourceGroup(),
                IssuedCertificate.certificateName(domains, thumbprint)
            )
            .filter(existing -> thumbprint.equalsIgnoreCase(existing.thumbprint()));
    }

    /**
     * Binds every name of the set that is a host name of the site. Wildcards and names served elsewhere are skipped.
     */
    public Mono<Void> bind(Site site, DomainSet domains, String thumbprint) {
        return Flux.fromIterable(domains.names())
            .filter(dnsName -> {
                if (site.hasHostName(dnsName)) {
                    return true;
                }
                log.debug("Name={} is not a host name of site={}, not binding", dnsName, site.ref());
                return false;
            })
            .concatMap(hostName -> hostingControlPlane.updateHostNameBinding(site, hostName, thumbprint))
            .then();
    }

    Map<String, String> tags(Site site, ChallengeType challengeType) {
        final Map<String, String> tags = new LinkedHashMap<>();
        tags.put(Metadata.ISSUER_TAG, appProperties.renewal().issuerTag());
        tags.put(Metadata.ENDPOINT_TAG, appProperties.acme().endpoint().getHost());
        tags.put(Metadata.SITE_TAG, site.ref().toString());
        tags.put(Metadata.CHALLENGE_TAG, challengeType.wireName());
        return tags;
    }
}
