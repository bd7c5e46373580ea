package certflow.model;

import com.nimbusds.jose.jwk.JWK;
import java.net.URI;
import lombok.Builder;

/**
 * @param accountUri used as <code>kid</code> of every request after registration
 * @param jwk        account key, RSA or EC
 */
@Builder
public record AcmeAccount(
    URI accountUri,
    JWK jwk
) {

    @Override
    public String toString() {
        return "AcmeAccount[accountUri=" + accountUri + ", keyId=" + jwk.getKeyID() + "]";
    }
}
