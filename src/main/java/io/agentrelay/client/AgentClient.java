package io.agentrelay.client;

import io.agentrelay.model.Task;
import io.agentrelay.model.TaskPriority;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.queue.QueueManager;
import io.agentrelay.queue.TaskRequest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Submission and waiting helpers for code acting on behalf of one agent type.
 *
 * <p>A detached client has no queue: submissions return empty and lookups find nothing,
 * so agent code can run standalone without branching on whether a queue is present.
 */
public final class AgentClient {
    private final QueueManager queueManager;
    private final String agentType;
    private final Duration pollInterval;

    public AgentClient(QueueManager queueManager, String agentType, Duration pollInterval) {
        if (agentType == null || agentType.isBlank()) {
            throw new IllegalArgumentException("agentType must not be blank");
        }
        this.queueManager = queueManager;
        this.agentType = agentType.trim();
        this.pollInterval = pollInterval == null ? Duration.ofMillis(100) : pollInterval;
    }

    public static AgentClient detached(String agentType) {
        return new AgentClient(null, agentType, null);
    }

    public String agentType() {
        return agentType;
    }

    public boolean attached() {
        return queueManager != null;
    }

    public Optional<String> submit(String operation, Map<String, ?> parameters) {
        return submit(operation, parameters, null, TaskPriority.NORMAL);
    }

    public Optional<String> submit(String operation, Map<String, ?> parameters, String targetAgent, TaskPriority priority) {
        if (queueManager == null) {
            return Optional.empty();
        }
        return Optional.of(queueManager.enqueue(new TaskRequest(
                target(targetAgent), operation, parameters, priority, agentType, null)));
    }

    public Optional<List<String>> submitBatch(String operation, List<? extends Map<String, ?>> parameterList) {
        return submitBatch(operation, parameterList, null, TaskPriority.NORMAL);
    }

    public Optional<List<String>> submitBatch(
            String operation,
            List<? extends Map<String, ?>> parameterList,
            String targetAgent,
            TaskPriority priority
    ) {
        if (queueManager == null) {
            return Optional.empty();
        }
        List<TaskRequest> requests = new ArrayList<>();
        for (Map<String, ?> parameters : parameterList) {
            requests.add(new TaskRequest(target(targetAgent), operation, parameters, priority, agentType, null));
        }
        return Optional.of(queueManager.enqueueBatch(requests));
    }

    /**
     * Polls until every id is terminal or {@code timeout} elapses and returns the latest
     * snapshot either way. A null timeout waits without limit. Unknown ids are left out.
     * Waiting never affects the tasks.
     */
    public Map<String, Task> waitForCompletion(Collection<String> taskIds, Duration timeout) throws InterruptedException {
        long deadline = timeout == null ? 0L : System.nanoTime() + timeout.toNanos();
        while (true) {
            Map<String, Task> snapshot = snapshot(taskIds);
            if (allTerminal(snapshot)) {
                return snapshot;
            }
            long sleepMs = pollInterval.toMillis();
            if (timeout != null) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMs <= 0L) {
                    return snapshot;
                }
                sleepMs = Math.min(sleepMs, remainingMs);
            }
            Thread.sleep(Math.max(1L, sleepMs));
        }
    }

    /**
     * Like {@link #waitForCompletion(Collection, Duration)} but fails when any task is
     * still open at the deadline.
     */
    public Map<String, Task> awaitCompletion(Collection<String> taskIds, Duration timeout)
            throws InterruptedException, TimeoutException {
        Map<String, Task> snapshot = waitForCompletion(taskIds, timeout);
        if (!allTerminal(snapshot)) {
            long open = snapshot.values().stream().filter(t -> !t.terminal()).count();
            throw new TimeoutException(open + " task(s) still open after " + timeout);
        }
        return snapshot;
    }

    public Optional<Task> status(String taskId) {
        if (queueManager == null) {
            return Optional.empty();
        }
        return queueManager.get(taskId);
    }

    public Optional<Map<TaskStatus, Integer>> stats() {
        if (queueManager == null) {
            return Optional.empty();
        }
        return Optional.of(queueManager.stats(agentType));
    }

    private Map<String, Task> snapshot(Collection<String> taskIds) {
        Map<String, Task> out = new LinkedHashMap<>();
        if (queueManager == null) {
            return out;
        }
        for (String id : taskIds) {
            queueManager.get(id).ifPresent(task -> out.put(id, task));
        }
        return out;
    }

    private static boolean allTerminal(Map<String, Task> snapshot) {
        for (Task task : snapshot.values()) {
            if (!task.terminal()) {
                return false;
            }
        }
        return true;
    }

    private String target(String targetAgent) {
        return targetAgent == null || targetAgent.isBlank() ? agentType : targetAgent;
    }
}
