package certflow.model;

import java.util.List;
import lombok.Builder;

/**
 * @param label  zone-relative record name
 * @param ttl    seconds
 * @param values one entry per TXT record
 */
@Builder(toBuilder = true)
public record TxtRecordSet(
    String label,
    long ttl,
    List<String> values
) {

    public TxtRecordSet {
        values = values != null ? List.copyOf(values) : List.of();
    }

    public static TxtRecordSet empty(String label) {
        return new TxtRecordSet(label, 0, List.of());
    }
}
