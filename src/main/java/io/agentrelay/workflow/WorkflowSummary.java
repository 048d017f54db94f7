package io.agentrelay.workflow;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record WorkflowSummary(String workflowName, boolean finished, List<StepReport> steps) {
    public WorkflowSummary {
        steps = List.copyOf(steps);
    }

    public Optional<StepReport> step(String name) {
        return steps.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public List<String> namesIn(StepState state) {
        return steps.stream().filter(s -> s.state() == state).map(StepReport::name).toList();
    }

    public boolean succeeded() {
        return finished && steps.stream().allMatch(s -> s.state() == StepState.COMPLETED);
    }

    /**
     * Final view of one step. For a skipped step {@code blockedBy} names the failed upstream
     * steps that prevented it from running.
     */
    public record StepReport(
            String name,
            StepState state,
            String taskId,
            Map<String, Object> result,
            String error,
            List<String> blockedBy
    ) {
    }
}
