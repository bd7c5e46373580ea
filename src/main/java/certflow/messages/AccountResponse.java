package certflow.messages;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * @param status  valid, deactivated or revoked. Only a valid account may place orders.
 * @param contact as registered, which for an existing account can differ from the configured emails
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountResponse(
    String status,
    List<String> contact
) {

    public static final String STATUS_VALID = "valid";

    public boolean isValid() {
        return STATUS_VALID.equals(status);
    }
}
