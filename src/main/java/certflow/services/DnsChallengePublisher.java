package certflow.services;

import certflow.model.ChallengeProof;
import certflow.model.ChallengeResult;
import certflow.model.DnsProof;
import certflow.model.DnsZone;
import certflow.model.HttpProof;
import certflow.model.TxtRecordSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Publishes DNS-01 proofs as TXT record sets and removes them again. Proofs sharing a record name, such as those of
 * <code>example.com</code> and <code>*.example.com</code>, end up as values of one record set.
 */
@Service
@Slf4j
public class DnsChallengePublisher {

    /**
     * Seconds, short so that stale values of an earlier attempt disappear from resolvers quickly
     */
    public static final long CHALLENGE_TTL = 60;

    private static final ChallengeProof.Visitor<DnsProof> DNS_PROOFS = new ChallengeProof.Visitor<>() {
        @Override
        public DnsProof visitHttp(HttpProof proof) {
            return null;
        }

        @Override
        public DnsProof visitDns(DnsProof proof) {
            return proof;
        }
    };

    private final DnsProvider dnsProvider;

    public DnsChallengePublisher(DnsProvider dnsProvider) {
        this.dnsProvider = dnsProvider;
    }

    /**
     * Replaces the values of each affected record set with the values of the given proofs.
     */
    public Mono<Void> publish(List<ChallengeResult> results, List<DnsZone> zones) {
        return Mono.fromCallable(() -> groupByRecordName(results))
            .flatMapMany(grouped -> {
                final Map<String, DnsZone> zoneByRecord = DnsZoneMatcher.matchAll(grouped.keySet(), zones);
                return Flux.fromIterable(grouped.entrySet())
                    .concatMap(entry -> upsert(zoneByRecord.get(entry.getKey()), entry.getKey(), entry.getValue()));
            })
            .then();
    }

    public Mono<Void> cleanup(List<ChallengeResult> results, List<DnsZone> zones) {
        return Mono.fromCallable(() -> groupByRecordName(results))
            .flatMapMany(grouped -> {
                final Map<String, DnsZone> zoneByRecord = DnsZoneMatcher.matchAll(grouped.keySet(), zones);
                return Flux.fromIterable(grouped.keySet())
                    .concatMap(recordName -> {
                        final DnsZone zone = zoneByRecord.get(recordName);
                        return dnsProvider.deleteTxtRecordSet(zone, zone.relativeLabel(recordName));
                    });
            })
            .then();
    }

    private Mono<Void> upsert(DnsZone zone, String recordName, List<String> values) {
        final String label = zone.relativeLabel(recordName);
        return dnsProvider.getTxtRecordSet(zone, label)
            .defaultIfEmpty(TxtRecordSet.empty(label))
            .map(existing -> existing.toBuilder()
                .label(label)
                .ttl(CHALLENGE_TTL)
                .values(values)
                .build()
            )
            .flatMap(recordSet -> dnsProvider.upsertTxtRecordSet(zone, recordSet))
            .doOnSuccess(unused -> log.info("Published TXT record={} in zone={} with {} value(s)",
                recordName, zone.name(), values.size()
            ));
    }

    /**
     * @return distinct proof values per lower-cased record name, in order of first appearance
     */
    static Map<String, List<String>> groupByRecordName(List<ChallengeResult> results) {
        final Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (final ChallengeResult result : results) {
            final DnsProof proof = result.proof().accept(DNS_PROOFS);
            if (proof == null) {
                continue;
            }
            final List<String> values = grouped.computeIfAbsent(
                proof.recordName().toLowerCase(Locale.ROOT), recordName -> new ArrayList<>());
            if (!values.contains(proof.value())) {
                values.add(proof.value());
            }
        }
        return grouped;
    }
}
