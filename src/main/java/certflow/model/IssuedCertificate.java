package certflow.model;

import java.time.Instant;
import lombok.Builder;

/**
 * Certificate chain with its private key, exported as a passphrase protected PKCS#12 bundle. Only ever held in memory
 * between finalization and deployment.
 *
 * @param thumbprint upper-case hex SHA-1 of the leaf certificate
 * @param pkcs12     bundle bytes
 * @param passphrase transport passphrase of the bundle
 */
@Builder
public record IssuedCertificate(
    DomainSet domains,
    String thumbprint,
    Instant notBefore,
    Instant notAfter,
    byte[] pkcs12,
    String passphrase
) {

    /**
     * Deterministic per names and thumbprint, which makes re-importing an identical certificate a no-op.
     */
    public String certificateName() {
        return certificateName(domains, thumbprint);
    }

    public static String certificateName(DomainSet domains, String thumbprint) {
        return domains.primaryName().replace("*", "wildcard") + "-" + thumbprint;
    }

    @Override
    public String toString() {
        return "IssuedCertificate[domains=%s, thumbprint=%s, notAfter=%s, bundle=%d bytes]".formatted(
            domains.names(), thumbprint, notAfter, pkcs12 != null ? pkcs12.length : 0);
    }
}
