package io.agentrelay.runtime;

/**
 * What a single worker iteration did.
 */
public record WorkerOutcome(boolean processed, String taskId, String agentType, Kind kind, String message) {
    public enum Kind { IDLE, COMPLETED, RETRY_SCHEDULED, FAILED, LOST }

    static WorkerOutcome idle(String agentType) {
        return new WorkerOutcome(false, null, agentType, Kind.IDLE, "No pending tasks");
    }
}
