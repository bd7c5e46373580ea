package certflow.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * A certificate as known to the hosting control plane.
 */
@Builder
public record HostedCertificate(
    String name,
    String resourceGroup,
    String thumbprint,
    Instant expirationDate,
    List<String> hostNames,
    Map<String, String> tags
) {

    public HostedCertificate {
        hostNames = hostNames != null ? List.copyOf(hostNames) : List.of();
        tags = tags != null ? Map.copyOf(tags) : Map.of();
    }
}
