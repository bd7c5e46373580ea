package certflow.messages;

import java.util.Map;
import lombok.Builder;

/**
 * Body of the hosting control plane's certificate import.
 */
@Builder
public record CertificateImportRequest(
    String location,
    Map<String, String> tags,
    Properties properties
) {

    /**
     * @param pfxBlob  base64 PKCS#12 bundle
     * @param password transport passphrase of the bundle
     * @param secretStoreUrl where the control plane keeps the imported key, opaque to this service
     */
    @Builder
    public record Properties(
        String pfxBlob,
        String password,
        String secretStoreUrl
    ) {

    }
}
