package certflow.services;

import certflow.model.HostedCertificate;
import certflow.model.Site;
import certflow.model.SiteRef;
import java.time.Instant;
import java.util.Map;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Management API of the platform hosting the sites that certificates are issued for.
 */
public interface HostingControlPlane {

    /**
     * @return the site, empty when it doesn't exist
     */
    Mono<Site> getSite(SiteRef ref);

    /**
     * @return certificates carrying the issuer tag with the given value that expire before the given instant
     */
    Flux<HostedCertificate> listCertificates(String issuerTag, Instant expiringBefore);

    /**
     * @return the certificate, empty when there is none with that name
     */
    Mono<HostedCertificate> findCertificate(String resourceGroup, String name);

    Mono<HostedCertificate> importCertificate(Site site, String name, byte[] pkcs12, String passphrase,
        Map<String, String> tags
    );

    /**
     * Deleting a certificate that doesn't exist succeeds.
     */
    Mono<Void> deleteCertificate(String resourceGroup, String name);

    Mono<Void> updateHostNameBinding(Site site, String hostName, String thumbprint);

    /**
     * Writes a file below the site's content root, replacing any existing one.
     */
    Mono<Void> writeFile(Site site, String path, String content);
}
