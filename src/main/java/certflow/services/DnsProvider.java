package certflow.services;

import certflow.model.DnsZone;
import certflow.model.TxtRecordSet;
import java.util.List;
import reactor.core.publisher.Mono;

/**
 * Management API of the DNS provider hosting the zones of DNS-01 validated names.
 */
public interface DnsProvider {

    Mono<List<DnsZone>> listZones();

    /**
     * @return the record set, empty when there is none with that label
     */
    Mono<TxtRecordSet> getTxtRecordSet(DnsZone zone, String label);

    Mono<Void> upsertTxtRecordSet(DnsZone zone, TxtRecordSet recordSet);

    /**
     * Deleting a record set that doesn't exist succeeds.
     */
    Mono<Void> deleteTxtRecordSet(DnsZone zone, String label);
}
