package certflow.messages;

import static org.assertj.core.api.Assertions.assertThat;

import certflow.model.DomainSet;
import certflow.model.Identifier;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.skyscreamer.jsonassert.JSONCompareMode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;
import org.springframework.boot.test.json.JacksonTester;

@JsonTest
class OrderRequestTest {

    @Autowired
    private JacksonTester<OrderRequest> json;

    @Test
    void serializeWithTimeframe() throws IOException {
        final OrderRequest request = OrderRequest.builder()
            .identifiers(List.of(Identifier.dns("Example.COM")))
            .notBefore(Instant.ofEpochSecond(1654908327))
            .notAfter(Instant.ofEpochSecond(1654994727))
            .build();

        assertThat(json.write(request))
            .isEqualToJson("""
                {
                    "identifiers": [{"type":"dns","value":"example.com"}],
                    "notBefore": "2022-06-11T00:45:27Z",
                    "notAfter": "2022-06-12T00:45:27Z"
                }
                """, JSONCompareMode.STRICT);
    }

    @Test
    void serializeForDomainSet() throws IOException {
        final OrderRequest request = OrderRequest.forDomains(DomainSet.of("example.com", "*.example.com"));

        assertThat(json.write(request))
            .isEqualToJson("""
                {
                    "identifiers": [
                        {"type":"dns","value":"example.com"},
                        {"type":"dns","value":"*.example.com"}
                    ]
                }
                """, JSONCompareMode.STRICT);
    }
}
