package certflow.model;

import java.util.List;
import java.util.Locale;

/**
 * @param id          provider resource identity
 * @param name        zone apex, such as <code>example.com</code>
 * @param nameServers servers the provider expects the zone to be delegated to, may be empty
 */
public record DnsZone(
    String id,
    String name,
    List<String> nameServers
) {

    public DnsZone {
        nameServers = nameServers != null ? List.copyOf(nameServers) : List.of();
    }

    public boolean contains(String dnsName) {
        return dnsName.equalsIgnoreCase(name)
            || dnsName.toLowerCase(Locale.ROOT).endsWith("." + name.toLowerCase(Locale.ROOT));
    }

    /**
     * @return the zone-relative label of a name inside this zone, <code>@</code> for the apex
     */
    public String relativeLabel(String dnsName) {
        if (dnsName.equalsIgnoreCase(name)) {
            return "@";
        }
        return dnsName.substring(0, dnsName.length() - name.length() - 1);
    }
}
