package certflow.services;

import certflow.model.DnsZone;
import certflow.model.TxtRecordSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import reactor.core.publisher.Mono;

/**
 * Keeps record sets in memory; {@link #lookupTxt(String)} plays the part of the public resolver.
 */
class FakeDnsProvider implements DnsProvider {

    final List<DnsZone> zones = new ArrayList<>();
    final Map<String/*fqdn*/, TxtRecordSet> recordSets = new ConcurrentHashMap<>();
    final List<String> upserted = new ArrayList<>();
    final List<String> deleted = new ArrayList<>();

    FakeDnsProvider(DnsZone... zones) {
        this.zones.addAll(List.of(zones));
    }

    @Override
    public Mono<List<DnsZone>> listZones() {
        return Mono.just(List.copyOf(zones));
    }

    @Override
    public Mono<TxtRecordSet> getTxtRecordSet(DnsZone zone, String label) {
        return Mono.justOrEmpty(recordSets.get(fqdn(zone, label)));
    }

    @Override
    public Mono<Void> upsertTxtRecordSet(DnsZone zone, TxtRecordSet recordSet) {
        return Mono.fromRunnable(() -> {
            final String name = fqdn(zone, recordSet.label());
            upserted.add(name);
            recordSets.put(name, recordSet);
        });
    }

    @Override
    public Mono<Void> deleteTxtRecordSet(DnsZone zone, String label) {
        return Mono.fromRunnable(() -> {
            final String name = fqdn(zone, label);
            deleted.add(name);
            recordSets.remove(name);
        });
    }

    Mono<List<String>> lookupTxt(String recordName) {
        final TxtRecordSet recordSet = recordSets.get(recordName);
        return Mono.just(recordSet != null ? recordSet.values() : List.of());
    }

    private static String fqdn(DnsZone zone, String label) {
        return "@".equals(label) ? zone.name() : label + "." + zone.name();
    }
}
