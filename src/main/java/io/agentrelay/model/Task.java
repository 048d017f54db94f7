package io.agentrelay.model;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time snapshot of one queued unit of work.
 *
 * <p>{@code result} is only present once the task is {@link TaskStatus#COMPLETED}.
 * {@code workerId} and {@code processId} identify the current claim owner and are
 * cleared whenever the task leaves {@link TaskStatus#PROCESSING}.
 */
public record Task(
        String id,
        String sourceAgent,
        String targetAgent,
        String operation,
        Map<String, Object> parameters,
        TaskStatus status,
        TaskPriority priority,
        Map<String, Object> result,
        String errorMessage,
        int retryCount,
        int maxRetries,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant availableAt,
        String workerId,
        Long processId
) {
    public boolean terminal() {
        return status.terminal();
    }
}
