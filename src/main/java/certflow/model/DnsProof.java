package certflow.model;

/**
 * @param recordName fully qualified TXT record name, such as <code>_acme-challenge.example.com</code>
 * @param value      base64url SHA-256 digest of the key authorization
 */
public record DnsProof(
    String recordName,
    String value
) implements ChallengeProof {

    public static final String RECORD_PREFIX = "_acme-challenge.";

    public static DnsProof forName(String dnsName, String digest) {
        final String baseName = dnsName.startsWith("*.") ? dnsName.substring(2) : dnsName;
        return new DnsProof(RECORD_PREFIX + baseName, digest);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDns(this);
    }
}
