package io.agentrelay.workflow;

import java.util.concurrent.TimeoutException;

/**
 * Raised when a workflow does not finish within its wait budget. Tasks already submitted
 * keep running; the attached summary shows where each step stood.
 */
public final class WorkflowTimeoutException extends TimeoutException {
    private final transient WorkflowSummary summary;

    public WorkflowTimeoutException(String message, WorkflowSummary summary) {
        super(message);
        this.summary = summary;
    }

    public WorkflowSummary summary() {
        return summary;
    }
}
