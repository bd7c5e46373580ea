package certflow.messages;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Collection;
import java.util.List;

/**
 * New account payload. The CA answers it with the existing account when the signing key is already registered, which
 * is how a persisted account key finds its account again.
 *
 * @param contact {@code mailto:} URIs
 */
@JsonInclude(Include.NON_EMPTY)
public record AccountRequest(
    List<String> contact,
    boolean termsOfServiceAgreed
) {

    public static AccountRequest forContacts(Collection<String> emails, boolean termsOfServiceAgreed) {
        return new AccountRequest(
            emails.stream()
                .map(email -> email.startsWith("mailto:") ? email : "mailto:" + email)
                .toList(),
            termsOfServiceAgreed
        );
    }
}
