package io.agentrelay.runtime;

import io.agentrelay.agent.AgentHandler;
import io.agentrelay.agent.AgentRegistry;
import io.agentrelay.agent.OperationInvoker;
import io.agentrelay.agent.OperationOutcome;
import io.agentrelay.model.Task;
import io.agentrelay.queue.QueueManager;
import io.agentrelay.storage.StorageException;
import io.agentrelay.storage.TaskStore.FailureOutcome;
import io.agentrelay.storage.TaskStore.FailureResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One polling thread per registered agent type.
 *
 * <p>A loop keeps running through handler failures and store errors; only {@link #stop(Duration)}
 * ends it. Threads are started for the agent types registered at {@link #start()} time.
 */
public final class WorkerPool {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerPool.class);

    private final QueueManager queueManager;
    private final AgentRegistry registry;
    private final Duration pollInterval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    private final List<Thread> threads = new ArrayList<>();

    public WorkerPool(QueueManager queueManager, AgentRegistry registry, Duration pollInterval) {
        this.queueManager = queueManager;
        this.registry = registry;
        this.pollInterval = pollInterval;
    }

    public synchronized void start() {
        if (running.get()) {
            return;
        }
        QueueManager.RecoveryOutcome recovery = queueManager.recoverOrphaned();
        if (recovery.recovered() > 0) {
            LOG.info("Startup recovery returned {} task(s) to the queue", recovery.recovered());
        }
        long current = generation.incrementAndGet();
        running.set(true);
        threads.clear();
        for (String agentType : registry.agentTypes()) {
            Thread thread = new Thread(() -> loop(agentType, current), "agentrelay-worker-" + agentType);
            thread.setDaemon(true);
            threads.add(thread);
            thread.start();
        }
        LOG.info("Worker pool started for agent types {}", registry.agentTypes());
    }

    /**
     * Signals every loop to exit and waits up to {@code timeout} for them. A loop still busy
     * after the timeout is left to finish its current task and exit on its own.
     *
     * @return true when every worker thread has exited
     */
    public synchronized boolean stop(Duration timeout) {
        if (!running.getAndSet(false)) {
            return true;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean allStopped = true;
        for (Thread thread : threads) {
            long remainingMs = Math.max(0L, (deadline - System.nanoTime()) / 1_000_000L);
            try {
                thread.join(Math.max(1L, remainingMs));
                if (thread.isAlive()) {
                    LOG.warn("Worker {} still busy after {}, leaving it to finish its task", thread.getName(), timeout);
                    allStopped = false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                allStopped = false;
                break;
            }
        }
        threads.clear();
        LOG.info("Worker pool stopped");
        return allStopped;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Claims and executes at most one task for {@code agentType}.
     */
    public WorkerOutcome runOnce(String agentType) {
        AgentHandler handler = registry.find(agentType)
                .orElseThrow(() -> new IllegalArgumentException("No agent registered for type: " + agentType));
        Optional<Task> claimed = queueManager.claim(agentType);
        if (claimed.isEmpty()) {
            return WorkerOutcome.idle(agentType);
        }
        Task task = claimed.get();
        OperationOutcome outcome = OperationInvoker.invoke(agentType, handler, task);
        if (outcome.success()) {
            if (queueManager.complete(task.id(), outcome.result())) {
                return new WorkerOutcome(true, task.id(), agentType, WorkerOutcome.Kind.COMPLETED, "Task completed");
            }
            return new WorkerOutcome(true, task.id(), agentType, WorkerOutcome.Kind.LOST,
                    "Task was no longer processing when it completed");
        }
        FailureResolution resolution = queueManager.fail(task.id(), outcome.error(), outcome.retryable());
        if (resolution.outcome() == FailureOutcome.RETRY_SCHEDULED) {
            return new WorkerOutcome(true, task.id(), agentType, WorkerOutcome.Kind.RETRY_SCHEDULED, outcome.error());
        }
        if (resolution.outcome() == FailureOutcome.FAILED) {
            return new WorkerOutcome(true, task.id(), agentType, WorkerOutcome.Kind.FAILED, outcome.error());
        }
        return new WorkerOutcome(true, task.id(), agentType, WorkerOutcome.Kind.LOST,
                "Task was no longer processing when it failed: " + outcome.error());
    }

    /**
     * Runs {@link #runOnce(String)} until no task is claimable right now.
     *
     * @return number of tasks processed
     */
    public int drain(String agentType) {
        int processed = 0;
        while (runOnce(agentType).processed()) {
            processed++;
        }
        return processed;
    }

    // A loop left busy by stop() must not be revived by a later start().
    private void loop(String agentType, long startedIn) {
        LOG.info("Worker for agent type '{}' started", agentType);
        while (running.get() && generation.get() == startedIn) {
            long sleepMs;
            try {
                sleepMs = runOnce(agentType).processed() ? 0L : pollInterval.toMillis();
            } catch (StorageException e) {
                LOG.error("Store error in worker for '{}': {}", agentType, e.getMessage(), e);
                sleepMs = pollInterval.toMillis() * 2L;
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                LOG.error("Unexpected error in worker for '{}'", agentType, e);
                sleepMs = pollInterval.toMillis();
            }
            if (sleepMs > 0L && !pause(sleepMs)) {
                break;
            }
        }
        LOG.info("Worker for agent type '{}' stopped", agentType);
    }

    private boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
