package certflow.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import lombok.Builder;

/**
 * One certificate to issue and deploy for a site.
 */
@Builder
public record IssuanceRequest(
    SiteRef site,
    DomainSet domains,
    boolean forceDns01
) {

    public ChallengeType challengeType() {
        return ChallengeType.select(domains, forceDns01);
    }

    /**
     * Stable across runs so that an interrupted workflow is found again and resumed rather than started over.
     */
    public String workflowId() {
        final List<String> sorted = domains.names().stream().sorted().toList();
        final String key = site + "|" + String.join(",", sorted);
        try {
            final byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return site.appName().toLowerCase(Locale.ROOT) + "-" + HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
