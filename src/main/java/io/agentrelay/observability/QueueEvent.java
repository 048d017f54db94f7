package io.agentrelay.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Lifecycle notification emitted by the queue, the worker pool and the workflow engine.
 */
public record QueueEvent(
        String type,
        String taskId,
        String agentType,
        String operation,
        String message,
        Map<String, Object> details,
        Instant at
) {
    public static final String TASK_SUBMITTED = "task.submitted";
    public static final String TASK_BATCH_SUBMITTED = "task.batch_submitted";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_RETRY_SCHEDULED = "task.retry_scheduled";
    public static final String TASK_RECOVERED = "task.recovered";
    public static final String TASK_CANCELLED = "task.cancelled";
    public static final String WORKFLOW_STARTED = "workflow.started";
    public static final String WORKFLOW_STEP_SUBMITTED = "workflow.step_submitted";
    public static final String WORKFLOW_STEP_COMPLETED = "workflow.step_completed";
    public static final String WORKFLOW_STEP_FAILED = "workflow.step_failed";
    public static final String WORKFLOW_STEP_SKIPPED = "workflow.step_skipped";
    public static final String WORKFLOW_FINISHED = "workflow.finished";

    public QueueEvent {
        details = details == null ? Map.of() : details;
    }

    public static QueueEvent of(
            String type,
            String taskId,
            String agentType,
            String operation,
            String message,
            Map<String, Object> details,
            Instant at
    ) {
        return new QueueEvent(type, taskId, agentType, operation, message, details, at);
    }
}
