package certflow.services;

import java.util.List;
import reactor.core.publisher.Mono;

/**
 * Observes DNS the way the outside world sees it, bypassing the DNS provider's API.
 */
public interface DnsLookup {

    /**
     * @return host names of the zone's NS records, empty when the zone doesn't resolve
     */
    Mono<List<String>> lookupNameServers(String zoneName);

    /**
     * @return every character-string of the name's TXT records, empty when the name doesn't resolve
     */
    Mono<List<String>> lookupTxt(String recordName);
}
