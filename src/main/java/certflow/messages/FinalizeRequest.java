package certflow.messages;

import java.util.Base64;

/**
 * @param csr base64url encoded DER of the CSR, without padding
 */
public record FinalizeRequest(
    String csr
) {

    public static FinalizeRequest ofDer(byte[] csrDer) {
        return new FinalizeRequest(Base64.getUrlEncoder().withoutPadding().encodeToString(csrDer));
    }
}
