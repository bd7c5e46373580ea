package certflow.services;

import certflow.model.WorkflowState;
import reactor.core.publisher.Mono;

/**
 * Durable checkpoints of issuance workflows, keyed by workflow id.
 */
public interface WorkflowStateStore {

    /**
     * @return the last saved state, empty when the workflow is unknown
     */
    Mono<WorkflowState> load(String workflowId);

    Mono<WorkflowState> save(WorkflowState state);
}
