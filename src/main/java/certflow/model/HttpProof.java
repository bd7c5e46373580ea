package certflow.model;

import java.net.URI;

/**
 * @param dnsName name being validated
 * @param path    content-root relative path, such as <code>.well-known/acme-challenge/{token}</code>
 * @param value   key authorization to serve at the path
 */
public record HttpProof(
    String dnsName,
    String path,
    String value
) implements ChallengeProof {

    public static final String WELL_KNOWN_PATH = ".well-known/acme-challenge/";

    public static HttpProof forToken(String dnsName, String token, String keyAuthorization) {
        return new HttpProof(dnsName, WELL_KNOWN_PATH + token, keyAuthorization);
    }

    public URI resourceUrl() {
        return URI.create("http://" + dnsName + "/" + path);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitHttp(this);
    }
}
