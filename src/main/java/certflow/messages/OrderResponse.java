package certflow.messages;

import certflow.model.Identifier;
import certflow.model.Problem;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import lombok.Builder;

/**
 * Also returned by finalize requests, where {@link #certificate()} is set once the status is valid.
 *
 * @param status pending, ready, processing, valid, invalid <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.6">See</a>
 * @param expires
 * @param identifiers
 * @param authorizations
 * @param finalizeUri
 * @param certificate
 * @param error
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(Include.NON_NULL)
public record OrderResponse(
    String status,
    Instant expires,
    List<Identifier> identifiers,
    List<URI> authorizations,
    @JsonProperty("finalize")
    URI finalizeUri,
    URI certificate,
    Problem error
) {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_READY = "ready";
    public static final String STATUS_PROCESSING = "processing";
    public static final String STATUS_VALID = "valid";
    public static final String STATUS_INVALID = "invalid";

    public boolean hasStatus(String expected) {
        return Objects.equals(status, expected);
    }
}
