package io.agentrelay.queue;

import io.agentrelay.model.TaskPriority;

import java.util.Map;

/**
 * Submission form of a task. A null {@code maxRetries} takes the configured default.
 */
public record TaskRequest(
        String targetAgent,
        String operation,
        Map<String, ?> parameters,
        TaskPriority priority,
        String sourceAgent,
        Integer maxRetries
) {
    public TaskRequest {
        parameters = parameters == null ? Map.of() : parameters;
        priority = priority == null ? TaskPriority.NORMAL : priority;
    }

    public static TaskRequest of(String targetAgent, String operation, Map<String, ?> parameters) {
        return new TaskRequest(targetAgent, operation, parameters, TaskPriority.NORMAL, null, null);
    }

    public TaskRequest withPriority(TaskPriority value) {
        return new TaskRequest(targetAgent, operation, parameters, value, sourceAgent, maxRetries);
    }

    public TaskRequest withSourceAgent(String value) {
        return new TaskRequest(targetAgent, operation, parameters, priority, value, maxRetries);
    }

    public TaskRequest withMaxRetries(int value) {
        return new TaskRequest(targetAgent, operation, parameters, priority, sourceAgent, value);
    }
}
