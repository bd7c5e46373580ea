package certflow.controllers;

import certflow.messages.IssueCertificateRequest;
import certflow.messages.IssueCertificateResponse;
import certflow.model.DomainSet;
import certflow.model.IssuanceRequest;
import certflow.model.SiteRef;
import certflow.model.WorkflowState;
import certflow.services.CertificateOrchestrator;
import certflow.services.WorkflowStateStore;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping(CertificateController.BASE_PATH)
@Slf4j
public class CertificateController {

    public static final String BASE_PATH = "/api/certificates";

    private final CertificateOrchestrator orchestrator;
    private final WorkflowStateStore stateStore;

    public CertificateController(CertificateOrchestrator orchestrator, WorkflowStateStore stateStore) {
        this.orchestrator = orchestrator;
        this.stateStore = stateStore;
    }

    /**
     * Starts issuance in the background, its progress is available at the returned workflow id.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public IssueCertificateResponse issue(@Valid @RequestBody IssueCertificateRequest body) {
        final IssuanceRequest request = IssuanceRequest.builder()
            .site(new SiteRef(body.resourceGroup(), body.appName(), body.slotName()))
            .domains(DomainSet.of(body.dnsNames()))
            .forceDns01(body.forceDns01())
            .build();
        log.info("Requested certificate for site={} names={}", request.site(), request.domains().names());

        orchestrator.run(request)
            .subscribe(report -> log.info("Workflow={} ended at stage={}", report.workflowId(), report.stage()),
                throwable -> log.error("Issue while processing workflow={}", request.workflowId(), throwable)
            );
        return new IssueCertificateResponse(request.workflowId());
    }

    @GetMapping("{workflowId}")
    public Mono<WorkflowState> workflow(@PathVariable String workflowId) {
        return stateStore.load(workflowId)
            .onErrorMap(IllegalArgumentException.class, e -> new WorkflowNotFound(workflowId))
            .switchIfEmpty(Mono.error(() -> new WorkflowNotFound(workflowId)));
    }
}
