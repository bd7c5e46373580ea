package certflow.messages;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Body of <code>POST /api/certificates</code>.
 */
public record IssueCertificateRequest(
    @NotBlank
    String resourceGroup,
    @NotBlank
    String appName,
    String slotName,
    @NotEmpty
    List<@NotBlank String> dnsNames,
    boolean forceDns01
) {

}
