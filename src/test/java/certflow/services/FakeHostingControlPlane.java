package certflow.services;

import certflow.model.HostedCertificate;
import certflow.model.Site;
import certflow.model.SiteRef;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

class FakeHostingControlPlane implements HostingControlPlane {

    final Map<SiteRef, Site> sites = new ConcurrentHashMap<>();
    final Map<String/*name*/, HostedCertificate> certificates = new ConcurrentHashMap<>();
    final Map<String/*path*/, String> files = new ConcurrentHashMap<>();
    final Map<String/*host name*/, String/*thumbprint*/> bindings = new ConcurrentHashMap<>();
    final List<String> imported = new ArrayList<>();
    final List<String> deleted = new ArrayList<>();

    FakeHostingControlPlane(Site... sites) {
        for (Site site : sites) {
            this.sites.put(site.ref(), site);
        }
    }

    @Override
    public Mono<Site> getSite(SiteRef ref) {
        return Mono.justOrEmpty(sites.get(ref))
            .map(site -> Site.builder()
                .ref(site.ref())
                .location(site.location())
                .hostNames(site.hostNames())
                .contentUrl(site.contentUrl())
                .sslBindings(Map.copyOf(bindings))
                .build());
    }

    @Override
    public Flux<HostedCertificate> listCertificates(String issuerTag, Instant expiringBefore) {
        return Flux.fromIterable(certificates.values())
            .filter(certificate -> issuerTag.equals(certificate.tags().get(Metadata.ISSUER_TAG)))
            .filter(certificate -> certificate.expirationDate().isBefore(expiringBefore));
    }

    @Override
    public Mono<HostedCertificate> findCertificate(String resourceGroup, String name) {
        return Mono.justOrEmpty(certificates.get(name));
    }

    @Override
    public Mono<HostedCertificate> importCertificate(Site site, String name, byte[] pkcs12, String passphrase,
        Map<String, String> tags
    ) {
        return Mono.fromCallable(() -> {
            imported.add(name);
            final HostedCertificate certificate = HostedCertificate.builder()
                .name(name)
                .resourceGroup(site.ref().resourceGroup())
                .thumbprint(name.substring(name.lastIndexOf('-') + 1))
                .tags(tags)
                .build();
            certificates.put(name, certificate);
            return certificate;
        });
    }

    @Override
    public Mono<Void> deleteCertificate(String resourceGroup, String name) {
        return Mono.fromRunnable(() -> {
            deleted.add(name);
            certificates.remove(name);
        });
    }

    @Override
    public Mono<Void> updateHostNameBinding(Site site, String hostName, String thumbprint) {
        return Mono.fromRunnable(() -> bindings.put(hostName, thumbprint));
    }

    @Override
    public Mono<Void> writeFile(Site site, String path, String content) {
        return Mono.fromRunnable(() -> files.put(path, content));
    }
}
