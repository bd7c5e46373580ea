package certflow.messages;

import certflow.model.Challenge;
import certflow.model.Identifier;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 *
 * @param status pending, valid, invalid, revoked, deactivated, expired <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.6">See</a>
 * @param expires
 * @param identifier the base domain, without the <code>*.</code> of a wildcard order
 * @param challenges
 * @param wildcard true when the identifier was ordered as a wildcard
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthzResponse(
    String status,
    Instant expires,
    Identifier identifier,
    List<Challenge> challenges,
    boolean wildcard
) {

    public Optional<Challenge> challengeOfType(String type) {
        return challenges == null ? Optional.empty()
            : challenges.stream()
                .filter(challenge -> type.equals(challenge.type()))
                .findFirst();
    }

    public String dnsName() {
        return wildcard ? "*." + identifier.value() : identifier.value();
    }
}
