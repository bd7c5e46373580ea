package certflow.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import certflow.model.ChallengeResult;
import certflow.model.DnsProof;
import certflow.model.DnsZone;
import certflow.model.HttpProof;
import certflow.model.TxtRecordSet;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DnsChallengePublisherTest {

    private static final DnsZone ZONE = new DnsZone("z1", "example.com", List.of());

    @Test
    void groupsValuesByRecordName() {
        final Map<String, List<String>> grouped = DnsChallengePublisher.groupByRecordName(List.of(
            dns("example.com", "v1"),
            dns("*.example.com", "v2"),
            dns("www.example.com", "v3"),
            dns("Example.com", "v1"),
            new ChallengeResult(URI.create("https://acme.test/chall/h"),
                HttpProof.forToken("h.example.com", "t", "t.k"))
        ));

        assertThat(grouped).containsExactly(
            Map.entry("_acme-challenge.example.com", List.of("v1", "v2")),
            Map.entry("_acme-challenge.www.example.com", List.of("v3"))
        );
    }

    @Test
    void replacesExistingValuesWithShortTtl() {
        final FakeDnsProvider dnsProvider = new FakeDnsProvider(ZONE);
        dnsProvider.recordSets.put("_acme-challenge.example.com",
            new TxtRecordSet("_acme-challenge", 3600, List.of("stale")));

        new DnsChallengePublisher(dnsProvider)
            .publish(List.of(dns("example.com", "v1"), dns("*.example.com", "v2")), List.of(ZONE))
            .block();

        assertThat(dnsProvider.recordSets.get("_acme-challenge.example.com"))
            .isEqualTo(new TxtRecordSet("_acme-challenge", DnsChallengePublisher.CHALLENGE_TTL, List.of("v1", "v2")));
    }

    @Test
    void cleanupDeletesEachRecordSetOnce() {
        final FakeDnsProvider dnsProvider = new FakeDnsProvider(ZONE);
        final DnsChallengePublisher publisher = new DnsChallengePublisher(dnsProvider);
        final List<ChallengeResult> results = List.of(dns("example.com", "v1"), dns("*.example.com", "v2"));
        publisher.publish(results, List.of(ZONE)).block();

        publisher.cleanup(results, List.of(ZONE)).block();

        assertThat(dnsProvider.deleted).containsExactly("_acme-challenge.example.com");
        assertThat(dnsProvider.recordSets).isEmpty();
    }

    @Test
    void publishingOutsideKnownZonesFails() {
        final FakeDnsProvider dnsProvider = new FakeDnsProvider(ZONE);

        assertThatThrownBy(() -> new DnsChallengePublisher(dnsProvider)
            .publish(List.of(dns("other.org", "v1")), List.of(ZONE))
            .block()
        )
            .isInstanceOf(ZoneNotFoundException.class);
        assertThat(dnsProvider.upserted).isEmpty();
    }

    private static ChallengeResult dns(String dnsName, String value) {
        return new ChallengeResult(URI.create("https://acme.test/chall/" + value), DnsProof.forName(dnsName, value));
    }
}
