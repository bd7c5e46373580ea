package certflow.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import certflow.TestProperties;
import certflow.model.DomainSet;
import certflow.model.HostedCertificate;
import certflow.model.IssuanceRequest;
import certflow.model.Site;
import certflow.model.SiteRef;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;

class RenewalServiceTest {

    private final FakeHostingControlPlane hosting = new FakeHostingControlPlane();
    private final CertificateOrchestrator orchestrator = mock(CertificateOrchestrator.class);

    @Test
    @SuppressWarnings("unchecked")
    void renewsOwnCertificatesCloseToExpiry() {
        hosting.certificates.put("expiring", certificate("expiring", Duration.ofDays(10), Map.of(
            Metadata.ISSUER_TAG, "certflow",
            Metadata.ENDPOINT_TAG, "acme.test",
            Metadata.SITE_TAG, "rg/shop/production",
            Metadata.CHALLENGE_TAG, "dns-01"
        ), "example.com", "shop.azurewebsites.net"));
        hosting.certificates.put("fresh", certificate("fresh", Duration.ofDays(80), Map.of(
            Metadata.ISSUER_TAG, "certflow",
            Metadata.SITE_TAG, "rg/shop/production"
        ), "www.example.com"));
        hosting.certificates.put("foreign", certificate("foreign", Duration.ofDays(5), Map.of(
            Metadata.ISSUER_TAG, "someone-else",
            Metadata.SITE_TAG, "rg/shop/production"
        ), "api.example.com"));
        hosting.certificates.put("other-ca", certificate("other-ca", Duration.ofDays(5), Map.of(
            Metadata.ISSUER_TAG, "certflow",
            Metadata.ENDPOINT_TAG, "acme.other",
            Metadata.SITE_TAG, "rg/shop/production"
        ), "old.example.com"));
        when(orchestrator.runAll(anyList())).thenReturn(Flux.empty());

        new RenewalService(hosting, orchestrator, TestProperties.create()).renewExpiring().blockLast();

        final ArgumentCaptor<List<IssuanceRequest>> requests = ArgumentCaptor.forClass(List.class);
        verify(orchestrator).runAll(requests.capture());
        assertThat(requests.getValue()).containsExactly(IssuanceRequest.builder()
            .site(new SiteRef("rg", "shop", null))
            .domains(DomainSet.of("example.com"))
            .forceDns01(true)
            .build());
    }

    @Test
    void dryRunOnlyReports() {
        hosting.certificates.put("expiring", certificate("expiring", Duration.ofDays(10), Map.of(
            Metadata.ISSUER_TAG, "certflow",
            Metadata.SITE_TAG, "rg/shop/production"
        ), "example.com"));

        new RenewalService(hosting, orchestrator, TestProperties.create(2, null, true)).renewExpiring().blockLast();

        verify(orchestrator, never()).runAll(anyList());
    }

    @Test
    void purgesExpiredAndReplacedUnboundCertificates() {
        final SiteRef shop = new SiteRef("rg", "shop", null);
        hosting.sites.put(shop, Site.builder()
            .ref(shop)
            .hostNames(List.of("example.com", "www.example.com"))
            .build());
        hosting.bindings.put("example.com", "NEW");
        hosting.bindings.put("www.example.com", "WWW1");
        final Map<String, String> ownTags = Map.of(
            Metadata.ISSUER_TAG, "certflow",
            Metadata.SITE_TAG, "rg/shop/production"
        );
        hosting.certificates.put("replaced", certificate("replaced", "OLD", Duration.ofDays(20), ownTags,
            "example.com"));
        hosting.certificates.put("current", certificate("current", "NEW", Duration.ofDays(90), ownTags,
            "Example.com"));
        hosting.certificates.put("expired", certificate("expired", "EXP", Duration.ofDays(-1), ownTags,
            "api.example.com"));
        hosting.certificates.put("foreign", certificate("foreign", "FOR", Duration.ofDays(-1), Map.of(
            Metadata.ISSUER_TAG, "someone-else",
            Metadata.SITE_TAG, "rg/shop/production"
        ), "old.example.com"));
        hosting.certificates.put("replaced-but-bound", certificate("replaced-but-bound", "WWW1",
            Duration.ofDays(20), ownTags, "www.example.com"));
        hosting.certificates.put("www-successor", certificate("www-successor", "WWW2", Duration.ofDays(90),
            ownTags, "www.example.com"));

        final List<HostedCertificate> purged = new RenewalService(hosting, orchestrator, TestProperties.create())
            .purgeObsolete()
            .collectList()
            .block();

        assertThat(purged).extracting(HostedCertificate::name).containsExactlyInAnyOrder("replaced", "expired");
        assertThat(hosting.deleted).containsExactlyInAnyOrder("replaced", "expired");
        assertThat(hosting.certificates).containsKeys("current", "foreign", "replaced-but-bound", "www-successor");
    }

    @Test
    void dryRunKeepsObsoleteCertificates() {
        hosting.certificates.put("expired", certificate("expired", "EXP", Duration.ofDays(-1), Map.of(
            Metadata.ISSUER_TAG, "certflow",
            Metadata.SITE_TAG, "rg/shop/production"
        ), "api.example.com"));

        final List<HostedCertificate> purged =
            new RenewalService(hosting, orchestrator, TestProperties.create(2, null, true))
                .purgeObsolete()
                .collectList()
                .block();

        assertThat(purged).isEmpty();
        assertThat(hosting.deleted).isEmpty();
    }

    private static HostedCertificate certificate(String name, Duration expiresIn, Map<String, String> tags,
        String... hostNames
    ) {
        return certificate(name, "ABCD", expiresIn, tags, hostNames);
    }

    private static HostedCertificate certificate(String name, String thumbprint, Duration expiresIn,
        Map<String, String> tags, String... hostNames
    ) {
        return HostedCertificate.builder()
            .name(name)
            .resourceGroup("rg")
            .thumbprint(thumbprint)
            .expirationDate(Instant.now().plus(expiresIn))
            .hostNames(List.of(hostNames))
            .tags(tags)
            .build();
    }
}
