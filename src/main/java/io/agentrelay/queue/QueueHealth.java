package io.agentrelay.queue;

import io.agentrelay.model.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record QueueHealth(
        Map<TaskStatus, Integer> statusCounts,
        int activeTasks,
        int stuckTasks,
        Duration stuckTimeout,
        Instant oldestActiveCreatedAt,
        Instant newestActiveCreatedAt,
        boolean healthy
) {
}
