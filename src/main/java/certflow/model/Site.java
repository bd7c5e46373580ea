package certflow.model;

import java.net.URI;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * @param ref
 * @param location    region used when importing certificates next to the site
 * @param hostNames   custom host names bound to the site
 * @param contentUrl  base URL of the site's content-root file API, used to deliver HTTP-01 proofs
 * @param sslBindings thumbprint of the certificate each host name is TLS bound to
 */
@Builder
public record Site(
    SiteRef ref,
    String location,
    List<String> hostNames,
    URI contentUrl,
    Map<String/*host name*/, String/*thumbprint*/> sslBindings
) {

    public Site {
        hostNames = hostNames != null ? List.copyOf(hostNames) : List.of();
        sslBindings = sslBindings != null ? Map.copyOf(sslBindings) : Map.of();
    }

    public boolean hasHostName(String dnsName) {
        return hostNames.stream().anyMatch(dnsName::equalsIgnoreCase);
    }

    public boolean isBound(String thumbprint) {
        return sslBindings.values().stream().anyMatch(thumbprint::equalsIgnoreCase);
    }
}
