package io.agentrelay.workflow;

import io.agentrelay.model.Task;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.observability.QueueEvent;
import io.agentrelay.observability.QueueEventListener;
import io.agentrelay.queue.QueueManager;
import io.agentrelay.queue.TaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one {@link Workflow} through the queue.
 *
 * <p>A step is submitted as a single task once all of its dependencies have completed and
 * is never submitted twice. Each submitted step receives the initial parameters, its own
 * parameters, and the result of every dependency under {@code <dependency>_result}. A step
 * task ending {@code FAILED} or {@code CANCELLED} fails the step, and everything downstream
 * of it is skipped.
 */
public final class WorkflowEngine {
    private static final Logger LOG = LoggerFactory.getLogger(WorkflowEngine.class);
    static final String RESULT_SUFFIX = "_result";

    private final QueueManager queueManager;
    private final Workflow workflow;
    private final Map<String, Object> initialParameters;
    private final QueueEventListener listener;
    private final Map<String, String> submittedTaskIds = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> stepResults = new LinkedHashMap<>();
    private final Map<String, String> stepErrors = new LinkedHashMap<>();
    private boolean started;
    private boolean finishedReported;

    public WorkflowEngine(QueueManager queueManager, Workflow workflow) {
        this(queueManager, workflow, Map.of(), null);
    }

    public WorkflowEngine(
            QueueManager queueManager,
            Workflow workflow,
            Map<String, Object> initialParameters,
            QueueEventListener listener
    ) {
        this.queueManager = queueManager;
        this.workflow = workflow;
        this.initialParameters = initialParameters == null ? Map.of() : new LinkedHashMap<>(initialParameters);
        this.listener = listener == null ? event -> { } : listener;
    }

    public Workflow workflow() {
        return workflow;
    }

    /**
     * Ready steps that have not been submitted yet.
     */
    public synchronized List<String> readySteps() {
        List<String> out = new ArrayList<>();
        for (String stepName : workflow.readySteps()) {
            if (!submittedTaskIds.containsKey(stepName)) {
                out.add(stepName);
            }
        }
        return out;
    }

    /**
     * Picks up finished step tasks and submits every newly ready step, repeating until a pass
     * changes nothing. Never blocks on task execution.
     *
     * @return names of the steps submitted by this call
     */
    public synchronized List<String> advance() {
        if (!started) {
            started = true;
            emit(QueueEvent.WORKFLOW_STARTED, null, null, "Workflow started", Map.of("steps", workflow.steps().size()));
        }
        List<String> submitted = new ArrayList<>();
        boolean changed = true;
        while (changed) {
            changed = refreshOutstanding();
            for (String stepName : readySteps()) {
                submit(stepName);
                submitted.add(stepName);
                changed = true;
            }
        }
        if (workflow.isFinished() && !finishedReported) {
            finishedReported = true;
            reportFinished();
        }
        return submitted;
    }

    /**
     * Advances the workflow until every step is completed, failed or skipped.
     *
     * @throws WorkflowTimeoutException when {@code timeout} elapses first; submitted tasks are not cancelled
     */
    public WorkflowSummary runToCompletion(Duration pollInterval, Duration timeout)
            throws WorkflowTimeoutException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            advance();
            if (workflow.isFinished()) {
                return summary();
            }
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0L) {
                WorkflowSummary partial = summary();
                throw new WorkflowTimeoutException(
                        "Workflow '" + workflow.name() + "' did not finish within " + timeout, partial);
            }
            Thread.sleep(Math.max(1L, Math.min(pollInterval.toMillis(), remainingMs)));
        }
    }

    public synchronized WorkflowSummary summary() {
        Set<String> skipped = workflow.skippedSteps();
        Set<String> completed = workflow.completedSteps();
        Set<String> failed = workflow.failedSteps();
        List<String> ready = workflow.readySteps();
        List<WorkflowSummary.StepReport> reports = new ArrayList<>();
        for (String stepName : workflow.steps().keySet()) {
            StepState state;
            List<String> blockedBy = List.of();
            if (completed.contains(stepName)) {
                state = StepState.COMPLETED;
            } else if (failed.contains(stepName)) {
                state = StepState.FAILED;
            } else if (skipped.contains(stepName)) {
                state = StepState.SKIPPED;
                blockedBy = workflow.failedAncestors(stepName);
            } else if (submittedTaskIds.containsKey(stepName)) {
                state = StepState.SUBMITTED;
            } else if (ready.contains(stepName)) {
                state = StepState.READY;
            } else {
                state = StepState.NOT_READY;
            }
            reports.add(new WorkflowSummary.StepReport(
                    stepName,
                    state,
                    submittedTaskIds.get(stepName),
                    stepResults.get(stepName),
                    stepErrors.get(stepName),
                    blockedBy
            ));
        }
        return new WorkflowSummary(workflow.name(), workflow.isFinished(), reports);
    }

    private boolean refreshOutstanding() {
        boolean changed = false;
        Set<String> completed = workflow.completedSteps();
        Set<String> failed = workflow.failedSteps();
        for (Map.Entry<String, String> entry : submittedTaskIds.entrySet()) {
            String stepName = entry.getKey();
            if (completed.contains(stepName) || failed.contains(stepName)) {
                continue;
            }
            String taskId = entry.getValue();
            Optional<Task> task = queueManager.get(taskId);
            if (task.isEmpty()) {
                stepFailed(stepName, taskId, "Task " + taskId + " no longer exists");
                changed = true;
                continue;
            }
            TaskStatus status = task.get().status();
            if (status == TaskStatus.COMPLETED) {
                stepResults.put(stepName, task.get().result());
                workflow.markCompleted(stepName);
                emit(QueueEvent.WORKFLOW_STEP_COMPLETED, taskId, stepName, "Step completed", Map.of());
                changed = true;
            } else if (status == TaskStatus.FAILED || status == TaskStatus.CANCELLED) {
                String error = task.get().errorMessage() == null ? "Task " + status.name().toLowerCase(Locale.ROOT) : task.get().errorMessage();
                stepFailed(stepName, taskId, error);
                changed = true;
            }
        }
        return changed;
    }

    private void submit(String stepName) {
        WorkflowStep step = workflow.steps().get(stepName);
        Map<String, Object> parameters = new LinkedHashMap<>(initialParameters);
        parameters.putAll(step.parameters());
        for (String dep : step.dependsOn()) {
            parameters.put(dep + RESULT_SUFFIX, stepResults.get(dep));
        }
        String taskId = queueManager.enqueue(new TaskRequest(
                step.targetAgent(),
                step.operation(),
                parameters,
                step.priority(),
                "workflow:" + workflow.name(),
                step.maxRetries()
        ));
        submittedTaskIds.put(stepName, taskId);
        emit(QueueEvent.WORKFLOW_STEP_SUBMITTED, taskId, stepName, "Step submitted",
                Map.of("target_agent", step.targetAgent(), "operation", step.operation()));
    }

    private void stepFailed(String stepName, String taskId, String error) {
        stepErrors.put(stepName, error);
        workflow.markFailed(stepName);
        LOG.warn("Workflow '{}' step '{}' failed: {}", workflow.name(), stepName, error);
        emit(QueueEvent.WORKFLOW_STEP_FAILED, taskId, stepName, error, Map.of());
    }

    private void reportFinished() {
        for (String stepName : workflow.skippedSteps()) {
            emit(QueueEvent.WORKFLOW_STEP_SKIPPED, null, stepName, "Step skipped",
                    Map.of("blocked_by", workflow.failedAncestors(stepName)));
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("completed", workflow.completedSteps().size());
        details.put("failed", workflow.failedSteps().size());
        details.put("skipped", workflow.skippedSteps().size());
        LOG.info("Workflow '{}' finished: {}", workflow.name(), details);
        emit(QueueEvent.WORKFLOW_FINISHED, null, null, "Workflow finished", details);
    }

    private void emit(String type, String taskId, String stepName, String message, Map<String, Object> details) {
        Map<String, Object> withWorkflow = new LinkedHashMap<>();
        withWorkflow.put("workflow", workflow.name());
        if (stepName != null) {
            withWorkflow.put("step", stepName);
        }
        withWorkflow.putAll(details);
        listener.onEvent(QueueEvent.of(type, taskId, null, null, message, withWorkflow, queueManager.clock().instant()));
    }
}
