package certflow.controllers;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class WorkflowNotFound extends RuntimeException {

    private final String workflowId;

    public WorkflowNotFound(String workflowId) {
        super("No workflow with id " + workflowId);
        this.workflowId = workflowId;
    }

    public String getWorkflowId() {
        return workflowId;
    }
}
