package certflow.model;

import certflow.messages.OrderResponse;
import java.net.URI;

/**
 * @param location order URL from the creation response, needed to poll the order later
 * @param order
 */
public record AcmeOrder(
    URI location,
    OrderResponse order
) {

}
