package certflow.model;

import java.net.URI;
import java.util.List;

/**
 * @param pemChain   leaf first
 * @param alternates other chains the CA offers for the same certificate
 */
public record CertificateDownload(
    String pemChain,
    List<URI> alternates
) {

    public CertificateDownload {
        alternates = alternates != null ? List.copyOf(alternates) : List.of();
    }
}
