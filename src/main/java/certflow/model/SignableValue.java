package certflow.model;

import com.nimbusds.jose.jwk.JWK;
import java.net.URI;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * A request body waiting for its JWS envelope.
 *
 * @param kid   account URL, absent only while registering the account, which then embeds the public {@code jwk}
 * @param value payload, absent for POST-as-GET
 */
@Builder
public record SignableValue(
    JWK jwk,
    @Nullable
    String kid,
    String nonce,
    URI requestUrl,
    @Nullable
    Object value
) {

    public boolean isPostAsGet() {
        return value == null;
    }
}
