package io.agentrelay.workflow;

public enum StepState {
    NOT_READY,
    READY,
    SUBMITTED,
    COMPLETED,
    FAILED,
    SKIPPED
}
