package io.agentrelay.workflow;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class WorkflowTest {

    @Test
    void readyStepsFollowDependencies() {
        Workflow wf = chain();
        Assertions.assertEquals(List.of("A"), wf.readySteps());
        wf.markCompleted("A");
        Assertions.assertEquals(List.of("B"), wf.readySteps());
        wf.markFailed("B");
        Assertions.assertEquals(List.of(), wf.readySteps());
        Assertions.assertEquals(Set.of("C"), wf.skippedSteps());
        Assertions.assertEquals(List.of("B"), wf.failedAncestors("C"));
        Assertions.assertTrue(wf.isFinished());
    }

    @Test
    void skipPropagatesTransitivelyButSparesIndependentBranches() {
        Workflow wf = Workflow.builder("literature-review")
                .step("queries", "query-agent", "generate", Map.of())
                .step("search", "search-agent", "search", Map.of(), "queries")
                .step("score", "scorer", "score", Map.of(), "search")
                .step("report", "report-agent", "write", Map.of(), "score")
                .step("stats", "stats-agent", "summarise", Map.of(), "queries")
                .build();
        wf.markCompleted("queries");
        wf.markFailed("search");
        Assertions.assertEquals(Set.of("score", "report"), wf.skippedSteps());
        Assertions.assertEquals(List.of("search"), wf.failedAncestors("report"));
        Assertions.assertEquals(List.of("stats"), wf.readySteps());
        Assertions.assertFalse(wf.isFinished());
        wf.markCompleted("stats");
        Assertions.assertTrue(wf.isFinished());
    }

    @Test
    void completedAndFailedStayDisjoint() {
        Workflow wf = chain();
        wf.markCompleted("A");
        Assertions.assertThrows(IllegalStateException.class, () -> wf.markFailed("A"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> wf.markCompleted("Z"));
    }

    @Test
    void stepParametersAreCopiedAtDefinition() {
        Map<String, Object> params = new HashMap<>();
        params.put("count", 2);
        Workflow wf = Workflow.builder("copy")
                .step("A", "query-agent", "generate", params)
                .build();
        params.put("count", 99);
        params.put("extra", true);

        Map<String, Object> stored = wf.steps().get("A").parameters();
        Assertions.assertEquals(Map.of("count", 2), stored);
        Assertions.assertThrows(UnsupportedOperationException.class, () -> stored.put("count", 3));
    }

    @Test
    void buildRejectsCycles() {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class, () ->
                Workflow.builder("loop")
                        .step("A", "a", "op", Map.of(), "C")
                        .step("B", "b", "op", Map.of(), "A")
                        .step("C", "c", "op", Map.of(), "B")
                        .build());
        Assertions.assertTrue(e.getMessage().contains("cycle"), e.getMessage());
        Assertions.assertTrue(e.getMessage().contains("A -> C -> B -> A"), e.getMessage());

        Assertions.assertThrows(IllegalArgumentException.class, () ->
                Workflow.builder("self").step("A", "a", "op", Map.of(), "A").build());
    }

    @Test
    void buildRejectsUnknownDependenciesAndDuplicates() {
        IllegalArgumentException unknown = Assertions.assertThrows(IllegalArgumentException.class, () ->
                Workflow.builder("wf").step("A", "a", "op", Map.of(), "missing").build());
        Assertions.assertTrue(unknown.getMessage().contains("missing"));

        Assertions.assertThrows(IllegalArgumentException.class, () ->
                Workflow.builder("wf")
                        .step("A", "a", "op", Map.of())
                        .step("A", "b", "op", Map.of())
                        .build());
        Assertions.assertThrows(IllegalArgumentException.class, () -> Workflow.builder("empty").build());
        Assertions.assertThrows(IllegalArgumentException.class, () ->
                Workflow.builder("wf").step("A", " ", "op", Map.of()).build());
    }

    private static Workflow chain() {
        return Workflow.builder("chain")
                .step("A", "a", "op", Map.of())
                .step("B", "b", "op", Map.of(), "A")
                .step("C", "c", "op", Map.of(), "B")
                .build();
    }
}
