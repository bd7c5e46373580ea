package certflow.model;

import certflow.messages.OrderResponse;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * Checkpoint of one issuance workflow, written after every stage transition. Holds nothing secret: the certificate's
 * private key never enters this record.
 *
 * @param restarts         number of times the order was abandoned and re-created
 * @param orderUrl         location of the current order
 * @param order            last observed order resource
 * @param challengeResults proofs published for the current order
 * @param thumbprint       set once the certificate was finalized
 * @param expiration       not-after of the issued certificate
 */
@Builder(toBuilder = true)
@JsonInclude(Include.NON_NULL)
public record WorkflowState(
    String workflowId,
    SiteRef site,
    DomainSet domains,
    ChallengeType challengeType,
    WorkflowStage stage,
    int restarts,
    URI orderUrl,
    OrderResponse order,
    List<ChallengeResult> challengeResults,
    String thumbprint,
    Instant expiration,
    FailureKind failureKind,
    String lastError,
    Instant updated
) {

    public static WorkflowState start(IssuanceRequest request) {
        return WorkflowState.builder()
            .workflowId(request.workflowId())
            .site(request.site())
            .domains(request.domains())
            .challengeType(request.challengeType())
            .stage(WorkflowStage.DISCOVERED)
            .build();
    }

    public WorkflowState advanceTo(WorkflowStage next) {
        return toBuilder()
            .stage(next)
            .failureKind(null)
            .lastError(null)
            .build();
    }

    /**
     * Abandons the current order and everything derived from it.
     */
    public WorkflowState restart(String reason) {
        return toBuilder()
            .stage(WorkflowStage.DISCOVERED)
            .restarts(restarts + 1)
            .orderUrl(null)
            .order(null)
            .challengeResults(null)
            .thumbprint(null)
            .expiration(null)
            .failureKind(null)
            .lastError(reason)
            .build();
    }

    public WorkflowState fail(FailureKind kind, String reason) {
        return toBuilder()
            .stage(WorkflowStage.FAILED)
            .failureKind(kind)
            .lastError(reason)
            .build();
    }

    public List<ChallengeResult> challengeResultsOrEmpty() {
        return challengeResults != null ? challengeResults : List.of();
    }

    public String certificateName() {
        return IssuedCertificate.certificateName(domains, thumbprint);
    }
}
