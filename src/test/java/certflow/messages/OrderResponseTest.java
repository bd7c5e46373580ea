package certflow.messages;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.net.URI;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;
import org.springframework.boot.test.json.JacksonTester;

@JsonTest
class OrderResponseTest {

    @Autowired
    private JacksonTester<OrderResponse> json;

    @Test
    void parsesServerOrder() throws IOException {
        final OrderResponse order = json.parseObject("""
            {
              "status": "invalid",
              "expires": "2026-01-08T00:00:00Z",
              "identifiers": [{"type": "dns", "value": "example.com"}],
              "authorizations": ["https://acme.test/authz/1"],
              "finalize": "https://acme.test/finalize/1",
              "error": {"type": "urn:ietf:params:acme:error:unauthorized", "detail": "Incorrect TXT record"},
              "replaces": "unknown-to-us"
            }
            """);

        assertThat(order.hasStatus(OrderResponse.STATUS_INVALID)).isTrue();
        assertThat(order.finalizeUri()).isEqualTo(URI.create("https://acme.test/finalize/1"));
        assertThat(order.error().detail()).isEqualTo("Incorrect TXT record");
    }
}
