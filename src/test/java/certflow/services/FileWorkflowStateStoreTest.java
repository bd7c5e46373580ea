package certflow.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import certflow.TestProperties;
import certflow.config.AppProperties;
import certflow.messages.OrderResponse;
import certflow.model.ChallengeResult;
import certflow.model.DnsProof;
import certflow.model.DomainSet;
import certflow.model.HttpProof;
import certflow.model.IssuanceRequest;
import certflow.model.SiteRef;
import certflow.model.WorkflowStage;
import certflow.model.WorkflowState;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

class FileWorkflowStateStoreTest {

    @TempDir
    Path stateDirectory;

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();

    @Test
    void savedStateIsLoadedBack() {
        final FileWorkflowStateStore store = store();
        final WorkflowState state = WorkflowState.start(IssuanceRequest.builder()
                .site(SiteRef.parse("rg/shop/staging"))
                .domains(DomainSet.of("example.com", "*.example.com"))
                .build())
            .toBuilder()
            .orderUrl(URI.create("https://acme.test/order/1"))
            .order(OrderResponse.builder()
                .status(OrderResponse.STATUS_PENDING)
                .authorizations(List.of(URI.create("https://acme.test/authz/1")))
                .finalizeUri(URI.create("https://acme.test/finalize/1"))
                .build())
            .challengeResults(List.of(
                new ChallengeResult(URI.create("https://acme.test/chall/1"), DnsProof.forName("*.example.com", "v1")),
                new ChallengeResult(URI.create("https://acme.test/chall/2"),
                    HttpProof.forToken("example.com", "tok", "tok.thumb"))
            ))
            .updated(Instant.parse("2026-03-01T10:15:30Z"))
            .build()
            .advanceTo(WorkflowStage.CHALLENGES_PREPARED);

        store.save(state).block();

        assertThat(Files.exists(stateDirectory.resolve(state.workflowId() + ".json"))).isTrue();
        assertThat(store.load(state.workflowId()).block()).isEqualTo(state);
    }

    @Test
    void unknownWorkflowIsEmpty() {
        assertThat(store().load("shop-0011223344556677").block()).isNull();
    }

    @Test
    void rejectsIdsThatEscapeTheDirectory() {
        assertThatThrownBy(() -> store().load("../secrets").block())
            .isInstanceOf(IllegalArgumentException.class);
    }

    private FileWorkflowStateStore store() {
        final AppProperties properties = TestProperties.create(Duration.ofSeconds(30),
            TestProperties.create().authFinalize(), stateDirectory
        );
        return new FileWorkflowStateStore(objectMapper, properties);
    }
}
