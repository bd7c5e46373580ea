package certflow.model;

import java.time.Instant;
import lombok.Builder;

/**
 * Outcome of one domain set within a run.
 */
@Builder
public record WorkflowReport(
    String workflowId,
    SiteRef site,
    DomainSet domains,
    WorkflowStage stage,
    int restarts,
    FailureKind failureKind,
    String error,
    String thumbprint,
    Instant expiration
) {

    public static WorkflowReport of(WorkflowState state) {
        return WorkflowReport.builder()
            .workflowId(state.workflowId())
            .site(state.site())
            .domains(state.domains())
            .stage(state.stage())
            .restarts(state.restarts())
            .failureKind(state.failureKind())
            .error(state.lastError())
            .thumbprint(state.thumbprint())
            .expiration(state.expiration())
            .build();
    }

    public boolean succeeded() {
        return stage == WorkflowStage.COMPLETED;
    }
}
