package io.agentrelay.queue;

import io.agentrelay.config.QueueSettings;
import io.agentrelay.model.Task;
import io.agentrelay.model.TaskPriority;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.observability.QueueEvent;
import io.agentrelay.observability.QueueEventListener;
import io.agentrelay.storage.TaskStore;
import io.agentrelay.storage.TaskStore.FailureOutcome;
import io.agentrelay.storage.TaskStore.FailureResolution;
import io.agentrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Task lifecycle API on top of {@link TaskStore}: submission, claim, completion, retry
 * policy and the recovery sweeps.
 *
 * <p>Each manager stamps its claims with its own {@link WorkerIdentity}. Closing the manager
 * releases that identity, after which any task it still holds is eligible for
 * {@link #recoverOrphaned()}.
 */
public final class QueueManager implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(QueueManager.class);

    private final TaskStore taskStore;
    private final QueueSettings settings;
    private final QueueEventListener listener;
    private final Clock clock;
    private final TaskStore.RetryPolicy retryPolicy;
    private final WorkerIdentity identity;

    public QueueManager(TaskStore taskStore, QueueSettings settings, QueueEventListener listener) {
        this(taskStore, settings, listener, Clock.systemUTC());
    }

    public QueueManager(TaskStore taskStore, QueueSettings settings, QueueEventListener listener, Clock clock) {
        this.taskStore = taskStore;
        this.settings = settings;
        this.listener = listener == null ? event -> { } : listener;
        this.clock = clock;
        this.retryPolicy = new TaskStore.RetryPolicy(settings.baseBackoffMs(), settings.maxBackoffMs());
        this.identity = WorkerIdentity.register();
    }

    public String enqueue(String targetAgent, String operation, Map<String, ?> parameters) {
        return enqueue(TaskRequest.of(targetAgent, operation, parameters));
    }

    public String enqueue(
            String targetAgent,
            String operation,
            Map<String, ?> parameters,
            TaskPriority priority,
            String sourceAgent,
            Integer maxRetries
    ) {
        return enqueue(new TaskRequest(targetAgent, operation, parameters, priority, sourceAgent, maxRetries));
    }

    public String enqueue(TaskRequest request) {
        TaskStore.NewTask task = toNewTask(request);
        String id = taskStore.insert(task, nowMs());
        emit(QueueEvent.TASK_SUBMITTED, id, task.targetAgent(), task.operation(), "Task submitted",
                Map.of("priority", task.priority().name(), "max_retries", task.maxRetries()));
        return id;
    }

    public List<String> enqueueBatch(
            String targetAgent,
            String operation,
            List<? extends Map<String, ?>> parameterList,
            TaskPriority priority,
            String sourceAgent,
            Integer maxRetries
    ) {
        List<TaskRequest> requests = new ArrayList<>();
        for (Map<String, ?> parameters : parameterList) {
            requests.add(new TaskRequest(targetAgent, operation, parameters, priority, sourceAgent, maxRetries));
        }
        return enqueueBatch(requests);
    }

    /**
     * Inserts every request in one transaction; nothing is stored when any request is invalid
     * or the write fails.
     */
    public List<String> enqueueBatch(List<TaskRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        List<TaskStore.NewTask> tasks = new ArrayList<>(requests.size());
        for (TaskRequest request : requests) {
            tasks.add(toNewTask(request));
        }
        List<String> ids = taskStore.insertBatch(tasks, nowMs());
        TaskStore.NewTask first = tasks.get(0);
        emit(QueueEvent.TASK_BATCH_SUBMITTED, null, first.targetAgent(), first.operation(), "Batch submitted",
                Map.of("count", ids.size(), "task_ids", ids));
        return ids;
    }

    public Optional<Task> claim(String targetAgent) {
        requireText(targetAgent, "targetAgent");
        Optional<Task> claimed = taskStore.claimNext(targetAgent, identity.instanceId(), identity.pid(), nowMs());
        claimed.ifPresent(task -> emit(QueueEvent.TASK_STARTED, task.id(), task.targetAgent(), task.operation(),
                "Task claimed", Map.of("retry_count", task.retryCount(), "worker_id", identity.instanceId())));
        return claimed;
    }

    /**
     * Stores the result and moves the task to {@code COMPLETED}.
     *
     * @return false when the task was not {@code PROCESSING}; the stored state is left as is
     */
    public boolean complete(String taskId, Map<String, ?> result) {
        String resultJson = Jsons.toCompactJson(result == null ? Map.of() : result);
        boolean completed = taskStore.markCompleted(taskId, resultJson, nowMs());
        if (completed) {
            emit(QueueEvent.TASK_COMPLETED, taskId, null, null, "Task completed", Map.of());
        } else {
            LOG.debug("Ignoring completion of task {}: not processing", taskId);
        }
        return completed;
    }

    public FailureResolution fail(String taskId, String errorMessage, boolean retry) {
        String error = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        FailureResolution resolution = taskStore.recordFailure(taskId, error, retry, retryPolicy, nowMs());
        if (resolution.outcome() == FailureOutcome.RETRY_SCHEDULED) {
            LOG.warn("Task {} failed, retry {} scheduled: {}", taskId, resolution.retryCount(), error);
            emit(QueueEvent.TASK_RETRY_SCHEDULED, taskId, null, null, error, Map.of(
                    "retry_count", resolution.retryCount(),
                    "available_at", Instant.ofEpochMilli(resolution.availableAtMs()).toString()
            ));
        } else if (resolution.outcome() == FailureOutcome.FAILED) {
            LOG.warn("Task {} failed permanently after {} retries: {}", taskId, resolution.retryCount(), error);
            emit(QueueEvent.TASK_FAILED, taskId, null, null, error, Map.of("retry_count", resolution.retryCount()));
        } else {
            LOG.debug("Ignoring failure of task {}: not processing", taskId);
        }
        return resolution;
    }

    public Optional<Task> get(String taskId) {
        return taskStore.get(taskId);
    }

    public List<Task> list(TaskStatus status, String targetAgent, int limit) {
        return taskStore.list(status, targetAgent, limit);
    }

    public Map<TaskStatus, Integer> stats() {
        return taskStore.countByStatus(null);
    }

    public Map<TaskStatus, Integer> stats(String targetAgent) {
        return taskStore.countByStatus(targetAgent);
    }

    public int cleanup(Duration olderThan) {
        long cutoff = nowMs() - Math.max(0L, olderThan.toMillis());
        int purged = taskStore.purgeTerminalOlderThan(cutoff);
        if (purged > 0) {
            LOG.info("Purged {} terminal task(s) finished before {}", purged, Instant.ofEpochMilli(cutoff));
        }
        return purged;
    }

    /**
     * Cancels pending tasks, optionally restricted to one target and/or source agent.
     * Tasks already claimed are left to finish.
     */
    public List<String> cancel(String targetAgent, String sourceAgent) {
        List<String> cancelled = taskStore.cancelPending(blankToNull(targetAgent), blankToNull(sourceAgent), nowMs());
        for (String id : cancelled) {
            emit(QueueEvent.TASK_CANCELLED, id, targetAgent, null, "Task cancelled", Map.of());
        }
        if (!cancelled.isEmpty()) {
            LOG.info("Cancelled {} pending task(s)", cancelled.size());
        }
        return cancelled;
    }

    /**
     * Returns every {@code PROCESSING} task whose owner is no longer alive to {@code PENDING}.
     */
    public RecoveryOutcome recoverOrphaned() {
        List<TaskStore.ProcessingClaim> claims = taskStore.listProcessing();
        List<String> reset = new ArrayList<>();
        long now = nowMs();
        for (TaskStore.ProcessingClaim claim : claims) {
            if (WorkerIdentity.isLive(claim.workerId(), claim.processId())) {
                continue;
            }
            if (taskStore.resetToPending(claim.taskId(), now)) {
                reset.add(claim.taskId());
                emit(QueueEvent.TASK_RECOVERED, claim.taskId(), claim.targetAgent(), null,
                        "Owner no longer alive", ownerDetails(claim));
            }
        }
        if (!reset.isEmpty()) {
            LOG.info("Recovered {} orphaned task(s) of {} in flight", reset.size(), claims.size());
        }
        return new RecoveryOutcome(claims.size(), reset, List.of());
    }

    /**
     * Resets, or fails when {@code markFailed} is set, every {@code PROCESSING} task claimed
     * longer than {@code timeout} ago, whether or not its owner is alive.
     */
    public RecoveryOutcome recoverStuck(Duration timeout, boolean markFailed) {
        long now = nowMs();
        long cutoff = now - Math.max(0L, timeout.toMillis());
        List<TaskStore.ProcessingClaim> claims = taskStore.listProcessing();
        List<String> reset = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (TaskStore.ProcessingClaim claim : claims) {
            if (claim.startedAtMs() >= cutoff) {
                continue;
            }
            if (markFailed) {
                String error = "Task stuck in PROCESSING for more than " + timeout.toSeconds() + "s";
                if (taskStore.markStuckFailed(claim.taskId(), error, now)) {
                    failed.add(claim.taskId());
                    emit(QueueEvent.TASK_FAILED, claim.taskId(), claim.targetAgent(), null, error, ownerDetails(claim));
                }
            } else if (taskStore.resetToPending(claim.taskId(), now)) {
                reset.add(claim.taskId());
                emit(QueueEvent.TASK_RECOVERED, claim.taskId(), claim.targetAgent(), null,
                        "Stuck task reset", ownerDetails(claim));
            }
        }
        if (!reset.isEmpty() || !failed.isEmpty()) {
            LOG.info("Stuck task sweep: {} reset, {} failed", reset.size(), failed.size());
        }
        return new RecoveryOutcome(claims.size(), reset, failed);
    }

    public QueueHealth health() {
        Duration stuckTimeout = settings.stuckTimeout();
        TaskStore.HealthRow row = taskStore.health(nowMs() - stuckTimeout.toMillis());
        return new QueueHealth(
                row.statusCounts(),
                row.activeTasks(),
                row.stuckTasks(),
                stuckTimeout,
                row.oldestActiveCreatedAtMs() == null ? null : Instant.ofEpochMilli(row.oldestActiveCreatedAtMs()),
                row.newestActiveCreatedAtMs() == null ? null : Instant.ofEpochMilli(row.newestActiveCreatedAtMs()),
                row.stuckTasks() == 0
        );
    }

    /**
     * Claims pending tasks for one agent in groups of up to {@code batchSize}. Iteration ends
     * at the first empty claim; every returned task is owned by this manager.
     */
    public Iterable<List<Task>> pendingBatches(String targetAgent, int batchSize) {
        requireText(targetAgent, "targetAgent");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        return () -> new Iterator<>() {
            private List<Task> next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    List<Task> batch = new ArrayList<>(batchSize);
                    while (batch.size() < batchSize) {
                        Optional<Task> task = claim(targetAgent);
                        if (task.isEmpty()) {
                            break;
                        }
                        batch.add(task.get());
                    }
                    next = batch;
                }
                return !next.isEmpty();
            }

            @Override
            public List<Task> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                List<Task> out = next;
                next = null;
                return out;
            }
        };
    }

    public WorkerIdentity identity() {
        return identity;
    }

    public QueueSettings settings() {
        return settings;
    }

    public Clock clock() {
        return clock;
    }

    @Override
    public void close() {
        identity.release();
    }

    private TaskStore.NewTask toNewTask(TaskRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        requireText(request.targetAgent(), "targetAgent");
        requireText(request.operation(), "operation");
        int maxRetries = request.maxRetries() == null ? settings.defaultMaxRetries() : request.maxRetries();
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        String parametersJson = Jsons.toCompactJson(request.parameters());
        return new TaskStore.NewTask(
                UUID.randomUUID().toString(),
                blankToNull(request.sourceAgent()),
                request.targetAgent().trim(),
                request.operation().trim(),
                parametersJson,
                request.priority(),
                maxRetries
        );
    }

    private void emit(String type, String taskId, String agentType, String operation, String message, Map<String, Object> details) {
        listener.onEvent(QueueEvent.of(type, taskId, agentType, operation, message, details, clock.instant()));
    }

    private static Map<String, Object> ownerDetails(TaskStore.ProcessingClaim claim) {
        return Map.of(
                "worker_id", claim.workerId() == null ? "" : claim.workerId(),
                "process_id", claim.processId() == null ? -1L : claim.processId()
        );
    }

    private long nowMs() {
        return clock.millis();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record RecoveryOutcome(int inFlight, List<String> resetTaskIds, List<String> failedTaskIds) {
        public int recovered() {
            return resetTaskIds.size() + failedTaskIds.size();
        }
    }
}
