package io.agentrelay.runtime;

import io.agentrelay.agent.AgentHandler;
import io.agentrelay.agent.AgentRegistry;
import io.agentrelay.client.AgentClient;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.config.QueueSettings;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.observability.AuditLogger;
import io.agentrelay.observability.QueueEventListener;
import io.agentrelay.observability.QueueEvents;
import io.agentrelay.queue.QueueHealth;
import io.agentrelay.queue.QueueManager;
import io.agentrelay.storage.Database;
import io.agentrelay.storage.TaskStore;
import io.agentrelay.workflow.Workflow;
import io.agentrelay.workflow.WorkflowEngine;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Wires storage, queue, agent registry, worker pool and audit log under one root directory.
 */
public final class AgentRelayRuntime implements AutoCloseable {
    private final AgentRelayConfig config;
    private final QueueSettings settings;
    private final Database database;
    private final QueueEvents events = new QueueEvents();
    private final AuditLogger auditLogger;
    private final QueueManager queueManager;
    private final AgentRegistry registry = new AgentRegistry();
    private final WorkerPool workerPool;

    public AgentRelayRuntime(AgentRelayConfig config) {
        this(config, QueueSettings.load(config));
    }

    public AgentRelayRuntime(AgentRelayConfig config, QueueSettings settings) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        this.auditLogger = new AuditLogger(config.auditFile());
        this.events.add(auditLogger);
        this.queueManager = new QueueManager(new TaskStore(database), settings, events);
        this.workerPool = new WorkerPool(queueManager, registry, settings.pollInterval());
    }

    public void init() {
        database.init();
    }

    public void registerAgent(String agentType, AgentHandler handler) {
        registry.register(agentType, handler);
    }

    public void addListener(QueueEventListener listener) {
        events.add(listener);
    }

    public void start() {
        workerPool.start();
    }

    public boolean stop() {
        return workerPool.stop(settings.stopTimeout());
    }

    public AgentClient client(String agentType) {
        return new AgentClient(queueManager, agentType, settings.pollInterval());
    }

    public WorkflowEngine workflowEngine(Workflow workflow, Map<String, Object> initialParameters) {
        return new WorkflowEngine(queueManager, workflow, initialParameters, events);
    }

    public Map<TaskStatus, Integer> stats(String targetAgent) {
        return queueManager.stats(targetAgent);
    }

    public QueueHealth health() {
        return queueManager.health();
    }

    public int cleanup() {
        return cleanup(settings.retentionHours());
    }

    public int cleanup(long olderThanHours) {
        return queueManager.cleanup(Duration.ofHours(Math.max(0L, olderThanHours)));
    }

    public QueueManager.RecoveryOutcome recoverOrphaned() {
        return queueManager.recoverOrphaned();
    }

    public QueueManager.RecoveryOutcome recoverStuck(boolean markFailed) {
        return queueManager.recoverStuck(settings.stuckTimeout(), markFailed);
    }

    public List<String> cancel(String targetAgent, String sourceAgent) {
        return queueManager.cancel(targetAgent, sourceAgent);
    }

    public AgentRelayConfig config() {
        return config;
    }

    public QueueSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public QueueManager queue() {
        return queueManager;
    }

    public AgentRegistry registry() {
        return registry;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    @Override
    public void close() {
        try {
            stop();
        } finally {
            queueManager.close();
        }
    }
}
