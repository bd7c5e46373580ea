package certflow.model;

public enum WorkflowStage {
    DISCOVERED,
    ORDER_CREATED,
    CHALLENGES_PREPARED,
    CHALLENGES_VERIFIED,
    CHALLENGES_ANSWERED,
    VALIDATED,
    FINALIZED,
    DEPLOYED,
    CLEANED_UP,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
