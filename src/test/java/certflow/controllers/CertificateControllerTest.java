package certflow.controllers;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import certflow.model.DomainSet;
import certflow.model.IssuanceRequest;
import certflow.model.SiteRef;
import certflow.model.WorkflowStage;
import certflow.model.WorkflowState;
import certflow.services.CertificateOrchestrator;
import certflow.services.WorkflowStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

class CertificateControllerTest {

    private final CertificateOrchestrator orchestrator = mock(CertificateOrchestrator.class);
    private final WorkflowStateStore stateStore = mock(WorkflowStateStore.class);
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new CertificateController(orchestrator, stateStore)).build();
    }

    @Test
    void issueStartsWorkflow() {
        when(orchestrator.run(any())).thenReturn(Mono.empty());
        final IssuanceRequest expected = IssuanceRequest.builder()
            .site(new SiteRef("rg", "shop", null))
            .domains(DomainSet.of("example.com", "*.example.com"))
            .forceDns01(false)
            .build();

        client.post().uri(CertificateController.BASE_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"resourceGroup": "rg", "appName": "shop", "dnsNames": ["example.com", "*.example.com"]}
                """)
            .exchange()
            .expectStatus().isAccepted()
            .expectBody()
            .jsonPath("$.workflowId").isEqualTo(expected.workflowId());

        verify(orchestrator).run(expected);
    }

    @Test
    void issueRequiresNames() {
        client.post().uri(CertificateController.BASE_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"resourceGroup": "rg", "appName": "shop", "dnsNames": []}
                """)
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void workflowStateIsReported() {
        final WorkflowState state = WorkflowState.start(IssuanceRequest.builder()
                .site(new SiteRef("rg", "shop", null))
                .domains(DomainSet.of("example.com"))
                .build())
            .advanceTo(WorkflowStage.ORDER_CREATED);
        when(stateStore.load(state.workflowId())).thenReturn(Mono.just(state));

        client.get().uri(CertificateController.BASE_PATH + "/{id}", state.workflowId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.stage").isEqualTo("ORDER_CREATED")
            .jsonPath("$.domains[0]").isEqualTo("example.com")
            .jsonPath("$.site.appName").isEqualTo("shop")
            .jsonPath("$.site.slotName").isEqualTo("production");
    }

    @Test
    void unknownWorkflowIsNotFound() {
        when(stateStore.load("shop-0000000000000000")).thenReturn(Mono.empty());

        client.get().uri(CertificateController.BASE_PATH + "/shop-0000000000000000")
            .exchange()
            .expectStatus().isNotFound();
    }
}
