package certflow.messages;

import certflow.model.DomainSet;
import certflow.model.Identifier;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

@Builder
@JsonInclude(Include.NON_NULL)
public record OrderRequest(
    List<Identifier> identifiers,
    Instant notBefore,
    Instant notAfter
) {

    public static OrderRequest forDomains(DomainSet domains) {
        return OrderRequest.builder()
            .identifiers(domains.names().stream()
                .map(Identifier::dns)
                .toList())
            .build();
    }
}
