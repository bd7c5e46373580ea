package certflow.model;

import java.util.Locale;

/**
 * ACME identifier. DNS values are kept lower-case so that proofs derived from them match the names of the
 * {@link DomainSet}.
 */
public record Identifier(
    String type,
    String value
) {

    public static final String TYPE_DNS = "dns";

    public Identifier {
        if (TYPE_DNS.equals(type) && value != null) {
            value = value.toLowerCase(Locale.ROOT);
        }
    }

    public static Identifier dns(String host) {
        return new Identifier(TYPE_DNS, host);
    }
}
