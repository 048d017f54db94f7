package io.agentrelay.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A named, acyclic graph of {@link WorkflowStep}s.
 *
 * <p>Structure is fixed at {@link Builder#build()}. The completed and failed sets are
 * disjoint and only move forward; {@link WorkflowEngine} is their only writer. Workflow
 * state lives in memory only.
 */
public final class Workflow {
    private final String name;
    private final Map<String, WorkflowStep> steps;
    private final List<String> topologicalOrder;
    private final Set<String> completedSteps = new LinkedHashSet<>();
    private final Set<String> failedSteps = new LinkedHashSet<>();

    private Workflow(String name, Map<String, WorkflowStep> steps, List<String> topologicalOrder) {
        this.name = name;
        this.steps = Collections.unmodifiableMap(steps);
        this.topologicalOrder = List.copyOf(topologicalOrder);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public Map<String, WorkflowStep> steps() {
        return steps;
    }

    public synchronized Set<String> completedSteps() {
        return Set.copyOf(completedSteps);
    }

    public synchronized Set<String> failedSteps() {
        return Set.copyOf(failedSteps);
    }

    /**
     * Steps not yet resolved whose every dependency has completed, in declaration order.
     */
    public synchronized List<String> readySteps() {
        List<String> out = new ArrayList<>();
        for (WorkflowStep step : steps.values()) {
            if (completedSteps.contains(step.name()) || failedSteps.contains(step.name())) {
                continue;
            }
            if (completedSteps.containsAll(step.dependsOn())) {
                out.add(step.name());
            }
        }
        return out;
    }

    /**
     * Steps that can never run because a dependency failed, directly or transitively.
     */
    public synchronized Set<String> skippedSteps() {
        Set<String> skipped = new LinkedHashSet<>();
        for (String stepName : topologicalOrder) {
            if (completedSteps.contains(stepName) || failedSteps.contains(stepName)) {
                continue;
            }
            for (String dep : steps.get(stepName).dependsOn()) {
                if (failedSteps.contains(dep) || skipped.contains(dep)) {
                    skipped.add(stepName);
                    break;
                }
            }
        }
        return skipped;
    }

    public synchronized boolean isFinished() {
        Set<String> skipped = skippedSteps();
        for (String stepName : steps.keySet()) {
            if (!completedSteps.contains(stepName) && !failedSteps.contains(stepName) && !skipped.contains(stepName)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Failed steps upstream of {@code stepName}, nearest first.
     */
    public synchronized List<String> failedAncestors(String stepName) {
        Set<String> out = new LinkedHashSet<>();
        Set<String> visited = new LinkedHashSet<>();
        collectFailedAncestors(stepName, out, visited);
        return new ArrayList<>(out);
    }

    synchronized void markCompleted(String stepName) {
        requireStep(stepName);
        if (failedSteps.contains(stepName)) {
            throw new IllegalStateException("Step already failed: " + stepName);
        }
        completedSteps.add(stepName);
    }

    synchronized void markFailed(String stepName) {
        requireStep(stepName);
        if (completedSteps.contains(stepName)) {
            throw new IllegalStateException("Step already completed: " + stepName);
        }
        failedSteps.add(stepName);
    }

    private void collectFailedAncestors(String stepName, Set<String> out, Set<String> visited) {
        for (String dep : steps.get(stepName).dependsOn()) {
            if (!visited.add(dep)) {
                continue;
            }
            if (failedSteps.contains(dep)) {
                out.add(dep);
            } else {
                collectFailedAncestors(dep, out, visited);
            }
        }
    }

    private void requireStep(String stepName) {
        if (!steps.containsKey(stepName)) {
            throw new IllegalArgumentException("Unknown step: " + stepName);
        }
    }

    public static final class Builder {
        private final String name;
        private final List<WorkflowStep> steps = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder step(WorkflowStep step) {
            steps.add(step);
            return this;
        }

        public Builder step(String stepName, String targetAgent, String operation, Map<String, Object> parameters,
                            String... dependsOn) {
            return step(WorkflowStep.of(stepName, targetAgent, operation, parameters, dependsOn));
        }

        /**
         * @throws IllegalArgumentException on blank fields, duplicate step names, unknown
         *                                  dependencies or a dependency cycle
         */
        public Workflow build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Workflow name must not be blank");
            }
            if (steps.isEmpty()) {
                throw new IllegalArgumentException("Workflow '" + name + "' has no steps");
            }
            Map<String, WorkflowStep> byName = new LinkedHashMap<>();
            for (WorkflowStep step : steps) {
                if (step == null || step.name() == null || step.name().isBlank()) {
                    throw new IllegalArgumentException("Step name must not be blank");
                }
                if (step.targetAgent() == null || step.targetAgent().isBlank()) {
                    throw new IllegalArgumentException("Step '" + step.name() + "' has no target agent");
                }
                if (step.operation() == null || step.operation().isBlank()) {
                    throw new IllegalArgumentException("Step '" + step.name() + "' has no operation");
                }
                if (byName.putIfAbsent(step.name(), step) != null) {
                    throw new IllegalArgumentException("Duplicate step name: " + step.name());
                }
            }
            for (WorkflowStep step : byName.values()) {
                for (String dep : step.dependsOn()) {
                    if (!byName.containsKey(dep)) {
                        throw new IllegalArgumentException(
                                "Step '" + step.name() + "' depends on unknown step '" + dep + "'");
                    }
                }
            }
            return new Workflow(name, byName, topologicalOrder(byName));
        }

        private static List<String> topologicalOrder(Map<String, WorkflowStep> byName) {
            List<String> order = new ArrayList<>();
            Map<String, Integer> marks = new HashMap<>();
            for (String stepName : byName.keySet()) {
                visit(stepName, byName, marks, new ArrayList<>(), order);
            }
            return order;
        }

        // 1 = on the current path, 2 = done
        private static void visit(String stepName, Map<String, WorkflowStep> byName, Map<String, Integer> marks,
                                  List<String> path, List<String> order) {
            Integer mark = marks.get(stepName);
            if (mark != null && mark == 2) {
                return;
            }
            if (mark != null && mark == 1) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(stepName), path.size()));
                cycle.add(stepName);
                throw new IllegalArgumentException("Workflow has a dependency cycle: " + String.join(" -> ", cycle));
            }
            marks.put(stepName, 1);
            path.add(stepName);
            for (String dep : byName.get(stepName).dependsOn()) {
                visit(dep, byName, marks, path, order);
            }
            path.remove(path.size() - 1);
            marks.put(stepName, 2);
            order.add(stepName);
        }
    }
}
