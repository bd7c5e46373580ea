package certflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.URI;

/**
 * Entry points advertised by the CA's directory. Only the resources this client calls are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AcmeDirectory(
    URI newNonce,
    URI newAccount,
    URI newOrder,
    Meta meta
) {

    /**
     * @param termsOfService current terms the account registration agrees to
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Meta(
        URI termsOfService,
        boolean externalAccountRequired
    ) {

    }
}
