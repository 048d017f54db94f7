package io.agentrelay.runtime;

import io.agentrelay.agent.AgentRegistry;
import io.agentrelay.agent.OperationTable;
import io.agentrelay.model.Task;
import io.agentrelay.model.TaskPriority;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.queue.QueueManager;
import io.agentrelay.storage.Database;
import io.agentrelay.storage.TaskStore;
import io.agentrelay.testing.TempRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class WorkerPoolTest {

    @Test
    void scorerDrainCompletesEveryTask() throws Exception {
        Path root = TempRoots.create("pool-scorer");
        try (QueueManager queue = openQueue(root)) {
            List<String> ids = queue.enqueueBatch("scorer", "score",
                    List.of(Map.of("doc_id", 1), Map.of("doc_id", 2), Map.of("doc_id", 3)),
                    TaskPriority.NORMAL, null, null);
            WorkerPool pool = new WorkerPool(queue, registryWithScorer(), Duration.ofMillis(20));

            Assertions.assertEquals(3, pool.drain("scorer"));

            Map<TaskStatus, Integer> stats = queue.stats("scorer");
            Assertions.assertEquals(3, stats.get(TaskStatus.COMPLETED));
            Assertions.assertEquals(0, stats.get(TaskStatus.PENDING));
            for (int i = 0; i < ids.size(); i++) {
                Task task = queue.get(ids.get(i)).orElseThrow();
                Assertions.assertEquals(Map.of("score", (i + 1) * 10), task.result());
            }
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void unknownOperationFailsWithoutRetry() throws Exception {
        Path root = TempRoots.create("pool-unknown");
        try (QueueManager queue = openQueue(root)) {
            String id = queue.enqueue("scorer", "rank", Map.of("doc_id", 1));
            WorkerPool pool = new WorkerPool(queue, registryWithScorer(), Duration.ofMillis(20));

            WorkerOutcome outcome = pool.runOnce("scorer");
            Assertions.assertTrue(outcome.processed());
            Assertions.assertEquals(WorkerOutcome.Kind.FAILED, outcome.kind());

            Task task = queue.get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, task.status());
            Assertions.assertEquals(0, task.retryCount());
            Assertions.assertTrue(task.errorMessage().contains("not found"), task.errorMessage());
            Assertions.assertFalse(pool.runOnce("scorer").processed());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void handlerFailuresAreRetriedThenFailed() throws Exception {
        Path root = TempRoots.create("pool-retry");
        try (QueueManager queue = openQueue(root)) {
            AtomicInteger calls = new AtomicInteger();
            AgentRegistry registry = new AgentRegistry();
            registry.register("citations", OperationTable.builder()
                    .operation("extract", params -> {
                        calls.incrementAndGet();
                        throw new IllegalStateException("parser crashed");
                    })
                    .build());
            String id = queue.enqueue("citations", "extract", Map.of(), TaskPriority.NORMAL, null, 2);
            WorkerPool pool = new WorkerPool(queue, registry, Duration.ofMillis(20));

            Assertions.assertEquals(WorkerOutcome.Kind.RETRY_SCHEDULED, pool.runOnce("citations").kind());
            Assertions.assertEquals(2, pool.drain("citations"));

            Task task = queue.get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, task.status());
            Assertions.assertEquals(2, task.retryCount());
            Assertions.assertEquals("parser crashed", task.errorMessage());
            Assertions.assertEquals(3, calls.get());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void backgroundLoopsProcessUntilStopped() throws Exception {
        Path root = TempRoots.create("pool-loop");
        try (QueueManager queue = openQueue(root)) {
            AgentRegistry registry = registryWithScorer();
            registry.register("flaky", OperationTable.builder()
                    .operation("score", params -> {
                        throw new RuntimeException("always");
                    })
                    .build());
            WorkerPool pool = new WorkerPool(queue, registry, Duration.ofMillis(20));
            pool.start();
            try {
                Assertions.assertTrue(pool.isRunning());
                String flaky = queue.enqueue("flaky", "score", Map.of(), TaskPriority.NORMAL, null, 0);
                String good = queue.enqueue("scorer", "score", Map.of("doc_id", 5));

                long deadline = System.currentTimeMillis() + 10_000L;
                while (System.currentTimeMillis() < deadline
                        && !(queue.get(good).orElseThrow().terminal() && queue.get(flaky).orElseThrow().terminal())) {
                    Thread.sleep(20);
                }
                Assertions.assertEquals(TaskStatus.COMPLETED, queue.get(good).orElseThrow().status());
                Assertions.assertEquals(TaskStatus.FAILED, queue.get(flaky).orElseThrow().status());

                String later = queue.enqueue("scorer", "score", Map.of("doc_id", 6));
                deadline = System.currentTimeMillis() + 10_000L;
                while (System.currentTimeMillis() < deadline && !queue.get(later).orElseThrow().terminal()) {
                    Thread.sleep(20);
                }
                Assertions.assertEquals(Map.of("score", 60), queue.get(later).orElseThrow().result());
            } finally {
                Assertions.assertTrue(pool.stop(Duration.ofSeconds(5)));
            }
            Assertions.assertFalse(pool.isRunning());

            String afterStop = queue.enqueue("scorer", "score", Map.of("doc_id", 7));
            Thread.sleep(100);
            Assertions.assertEquals(TaskStatus.PENDING, queue.get(afterStop).orElseThrow().status());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void handlerErrorFailsTheTaskAndTheLoopKeepsRunning() throws Exception {
        Path root = TempRoots.create("pool-error");
        try (QueueManager queue = openQueue(root)) {
            AgentRegistry registry = new AgentRegistry();
            registry.register("citations", OperationTable.builder()
                    .operation("extract", params -> {
                        if (Boolean.TRUE.equals(params.get("broken"))) {
                            throw new AssertionError("bad doc");
                        }
                        return Map.of("citations", 2);
                    })
                    .build());
            WorkerPool pool = new WorkerPool(queue, registry, Duration.ofMillis(20));
            pool.start();
            try {
                String bad = queue.enqueue("citations", "extract", Map.of("broken", true), TaskPriority.NORMAL, null, 0);
                String good = queue.enqueue("citations", "extract", Map.of("broken", false));

                long deadline = System.currentTimeMillis() + 10_000L;
                while (System.currentTimeMillis() < deadline
                        && !(queue.get(bad).orElseThrow().terminal() && queue.get(good).orElseThrow().terminal())) {
                    Thread.sleep(20);
                }
                Task failed = queue.get(bad).orElseThrow();
                Assertions.assertEquals(TaskStatus.FAILED, failed.status());
                Assertions.assertEquals("bad doc", failed.errorMessage());
                Assertions.assertEquals(Map.of("citations", 2), queue.get(good).orElseThrow().result());
            } finally {
                pool.stop(Duration.ofSeconds(5));
            }
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void stopLetsAnInFlightTaskFinish() throws Exception {
        Path root = TempRoots.create("pool-stop");
        try (QueueManager queue = openQueue(root)) {
            CountDownLatch entered = new CountDownLatch(1);
            AgentRegistry registry = new AgentRegistry();
            registry.register("slow", OperationTable.builder()
                    .operation("work", params -> {
                        entered.countDown();
                        Thread.sleep(500);
                        return Map.of("done", true);
                    })
                    .build());
            String id = queue.enqueue("slow", "work", Map.of());
            WorkerPool pool = new WorkerPool(queue, registry, Duration.ofMillis(20));
            pool.start();
            Assertions.assertTrue(entered.await(10, TimeUnit.SECONDS));

            Assertions.assertFalse(pool.stop(Duration.ofMillis(50)));
            Assertions.assertFalse(pool.isRunning());

            long deadline = System.currentTimeMillis() + 10_000L;
            while (System.currentTimeMillis() < deadline && !queue.get(id).orElseThrow().terminal()) {
                Thread.sleep(20);
            }
            Task task = queue.get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, task.status());
            Assertions.assertEquals(0, task.retryCount());
            Assertions.assertNull(task.errorMessage());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void startRecoversTasksOrphanedByAPreviousRun() throws Exception {
        Path root = TempRoots.create("pool-recover");
        try {
            Database db = new Database(TempRoots.config(root));
            db.init();
            TaskStore store = new TaskStore(db);
            String id;
            try (QueueManager previous = new QueueManager(store, TempRoots.fastSettings(), null)) {
                id = previous.enqueue("scorer", "score", Map.of("doc_id", 9));
                previous.claim("scorer").orElseThrow();
            }
            try (QueueManager queue = new QueueManager(store, TempRoots.fastSettings(), null)) {
                WorkerPool pool = new WorkerPool(queue, registryWithScorer(), Duration.ofMillis(20));
                pool.start();
                try {
                    long deadline = System.currentTimeMillis() + 10_000L;
                    while (System.currentTimeMillis() < deadline && !queue.get(id).orElseThrow().terminal()) {
                        Thread.sleep(20);
                    }
                } finally {
                    pool.stop(Duration.ofSeconds(5));
                }
                Task task = queue.get(id).orElseThrow();
                Assertions.assertEquals(TaskStatus.COMPLETED, task.status());
                Assertions.assertEquals(Map.of("score", 90), task.result());
            }
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void runOnceRejectsUnregisteredAgentType() throws Exception {
        Path root = TempRoots.create("pool-unregistered");
        try (QueueManager queue = openQueue(root)) {
            WorkerPool pool = new WorkerPool(queue, new AgentRegistry(), Duration.ofMillis(20));
            Assertions.assertThrows(IllegalArgumentException.class, () -> pool.runOnce("ghost"));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    private static AgentRegistry registryWithScorer() {
        AgentRegistry registry = new AgentRegistry();
        registry.register("scorer", OperationTable.builder()
                .operation("score", params -> Map.of("score", ((Number) params.get("doc_id")).intValue() * 10))
                .build());
        return registry;
    }

    private static QueueManager openQueue(Path root) {
        Database db = new Database(TempRoots.config(root));
        db.init();
        return new QueueManager(new TaskStore(db), TempRoots.fastSettings(), null);
    }
}
