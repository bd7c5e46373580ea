package certflow.messages;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

@Builder
public record CompletedEvent(
    String appName,
    String slotName,
    Instant expirationDate,
    List<String> dnsNames
) {

}
