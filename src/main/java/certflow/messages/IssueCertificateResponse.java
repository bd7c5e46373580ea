package certflow.messages;

public record IssueCertificateResponse(
    String workflowId
) {

}
