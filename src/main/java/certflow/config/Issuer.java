package certflow.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param endpoint        ACME directory URL
 * @param emails          account contacts
 * @param preferredChain  common name of the root the downloaded chain should end at, when the CA offers alternates
 * @param accountKeyPath  JWK file holding the account key, created on first use
 */
public record Issuer(
    @NotNull
    URI endpoint,

    @NotEmpty
    List<@NotBlank String> emails,

    @AssertTrue
    boolean termsOfServiceAgreed,

    String preferredChain,

    @DefaultValue("state/account-key.json") @NotNull
    Path accountKeyPath
) {

}
