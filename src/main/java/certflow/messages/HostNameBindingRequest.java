package certflow.messages;

/**
 * Body of the hosting control plane's host name binding update.
 */
public record HostNameBindingRequest(
    Properties properties
) {

    public static final String SSL_STATE_SNI = "SniEnabled";

    public static HostNameBindingRequest sni(String thumbprint) {
        return new HostNameBindingRequest(new Properties(SSL_STATE_SNI, thumbprint));
    }

    public record Properties(
        String sslState,
        String thumbprint
    ) {

    }
}
