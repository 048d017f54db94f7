package io.agentrelay.workflow;

import io.agentrelay.model.TaskPriority;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of a workflow. {@code maxRetries} may be null to use the queue default.
 */
public record WorkflowStep(
        String name,
        String targetAgent,
        String operation,
        Map<String, Object> parameters,
        List<String> dependsOn,
        TaskPriority priority,
        Integer maxRetries
) {
    public WorkflowStep {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        priority = priority == null ? TaskPriority.NORMAL : priority;
    }

    public static WorkflowStep of(String name, String targetAgent, String operation, Map<String, Object> parameters,
                                  String... dependsOn) {
        return new WorkflowStep(name, targetAgent, operation, parameters, List.of(dependsOn), TaskPriority.NORMAL, null);
    }

    public WorkflowStep withPriority(TaskPriority value) {
        return new WorkflowStep(name, targetAgent, operation, parameters, dependsOn, value, maxRetries);
    }

    public WorkflowStep withMaxRetries(int value) {
        return new WorkflowStep(name, targetAgent, operation, parameters, dependsOn, priority, value);
    }
}
