package certflow.model;

import java.net.URI;
import java.time.Instant;

/**
 *
 * @param type
 * @param url challenge resource, also used to tell the server we're ready
 * @param token
 * @param status pending, processing, valid, invalid <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.6">RFC</a>
 * @param validated
 * @param error present when status is invalid
 */
public record Challenge(
    String type,
    URI url,
    String token,
    String status,
    Instant validated,
    Problem error
) {

    public static final String TYPE_HTTP_01 = "http-01";
    public static final String TYPE_DNS_01 = "dns-01";

    public static final String STATUS_INVALID = "invalid";

    public boolean isInvalid() {
        return STATUS_INVALID.equals(status);
    }
}
