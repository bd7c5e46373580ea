package certflow.services;

import certflow.model.DnsZone;
import certflow.model.DomainSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Maps names onto the DNS provider's zones and confirms that those zones are actually delegated to the provider.
 */
@Service
@Slf4j
public class DnsZoneMatcher {

    private static final Comparator<DnsZone> MOST_SPECIFIC_FIRST =
        Comparator.comparingInt((DnsZone zone) -> zone.name().length()).reversed()
            .thenComparing(DnsZone::name)
            .thenComparing(DnsZone::id);

    private final DnsLookup dnsLookup;

    public DnsZoneMatcher(DnsLookup dnsLookup) {
        this.dnsLookup = dnsLookup;
    }

    /**
     * @return the zone with the longest name that contains the given name
     */
    public static Optional<DnsZone> findZone(String dnsName, Collection<DnsZone> zones) {
        return zones.stream()
            .filter(zone -> zone.contains(dnsName))
            .min(MOST_SPECIFIC_FIRST);
    }

    /**
     * @return zone of each name, in the order of the given names
     * @throws ZoneNotFoundException naming every name without a zone
     */
    public static Map<String, DnsZone> matchAll(Collection<String> dnsNames, Collection<DnsZone> zones) {
        final Map<String, DnsZone> matched = new LinkedHashMap<>();
        final List<String> unmatched = new ArrayList<>();
        for (final String dnsName : dnsNames) {
            findZone(dnsName, zones).ifPresentOrElse(
                zone -> matched.put(dnsName, zone),
                () -> unmatched.add(dnsName)
            );
        }
        if (!unmatched.isEmpty()) {
            throw new ZoneNotFoundException(unmatched);
        }
        return matched;
    }

    /**
     * Fails when a zone's public delegation shares no name server with the servers the provider expects. Zones the
     * provider reports no name servers for are not checked.
     */
    public Mono<Void> verifyDelegation(DnsZone zone) {
        if (zone.nameServers().isEmpty()) {
            return Mono.empty();
        }
        final Set<String> expected = normalize(zone.nameServers());
        return dnsLookup.lookupNameServers(zone.name())
            .flatMap(actual -> {
                final Set<String> delegated = normalize(actual);
                if (delegated.stream().noneMatch(expected::contains)) {
                    return Mono.error(new DelegationMismatchException(zone.name(),
                        List.copyOf(expected), List.copyOf(delegated)
                    ));
                }
                log.debug("Zone={} is delegated to={}", zone.name(), delegated);
                return Mono.empty();
            });
    }

    /**
     * Everything DNS-01 issuance for the domain set needs before an order is placed.
     */
    public Mono<Map<String, DnsZone>> checkPreconditions(DomainSet domains, List<DnsZone> zones) {
        return Mono.fromCallable(() -> matchAll(domains.names(), zones))
            .flatMap(matched ->
                Flux.fromIterable(Set.copyOf(matched.values()))
                    .concatMap(this::verifyDelegation)
                    .then(Mono.just(matched))
            );
    }

    private static Set<String> normalize(Collection<String> nameServers) {
        return nameServers.stream()
            .map(NettyDnsLookup::trimTrailingDot)
            .map(name -> name.toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(TreeSet::new));
    }
}
