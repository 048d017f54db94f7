package io.agentrelay.cli;

import io.agentrelay.agent.EchoAgent;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.model.Task;
import io.agentrelay.model.TaskPriority;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.queue.QueueManager;
import io.agentrelay.queue.TaskRequest;
import io.agentrelay.runtime.AgentRelayRuntime;
import io.agentrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "agentrelay",
        mixinStandardHelpOptions = true,
        description = "AgentRelay task queue CLI",
        subcommands = {
                AgentRelayCommand.InitCommand.class,
                AgentRelayCommand.SubmitCommand.class,
                AgentRelayCommand.TaskCommand.class,
                AgentRelayCommand.TasksCommand.class,
                AgentRelayCommand.StatsCommand.class,
                AgentRelayCommand.HealthCommand.class,
                AgentRelayCommand.CleanupCommand.class,
                AgentRelayCommand.RecoverCommand.class,
                AgentRelayCommand.CancelCommand.class,
                AgentRelayCommand.WorkerCommand.class
        }
)
public final class AgentRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = AgentRelayConfig.DEFAULT_ROOT)
    String root;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        out().println("Use subcommands: init | submit | task | tasks | stats | health | cleanup | recover | cancel | worker");
    }

    AgentRelayRuntime runtime() {
        AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    void printJson(Object value) {
        PrintWriter out = out();
        out.println(Jsons.toJson(value));
        out.flush();
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                parent.printJson(Map.of(
                        "root", runtime.config().rootDir().toString(),
                        "database", runtime.config().dbFile().toString()
                ));
            }
            return 0;
        }
    }

    @Command(name = "submit", description = "Enqueue a task for an agent")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Target agent type")
        String agent;

        @Option(names = {"--operation"}, required = true, description = "Operation name on the agent")
        String operation;

        @Option(names = {"--params"}, defaultValue = "{}", description = "Parameters as a JSON object")
        String params;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "Priority: low|normal|high|urgent")
        String priority;

        @Option(names = {"--source"}, description = "Submitting agent, informational")
        String source;

        @Option(names = {"--max-retries"}, description = "Retry ceiling; defaults to the configured value")
        Integer maxRetries;

        @Override
        public Integer call() {
            Map<String, Object> parameters;
            TaskPriority taskPriority;
            try {
                parameters = Jsons.readMap(params);
                taskPriority = TaskPriority.fromString(priority);
            } catch (IllegalArgumentException e) {
                parent.printJson(Map.of("error", "invalid input: " + e.getMessage()));
                return 2;
            }
            try (AgentRelayRuntime runtime = parent.runtime()) {
                String id = runtime.queue().enqueue(new TaskRequest(
                        agent,
                        operation,
                        parameters,
                        taskPriority,
                        source,
                        maxRetries
                ));
                parent.printJson(Map.of("task_id", id));
            } catch (IllegalArgumentException e) {
                parent.printJson(Map.of("error", "invalid input: " + e.getMessage()));
                return 2;
            }
            return 0;
        }
    }

    @Command(name = "task", description = "Show one task by id")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                Optional<Task> task = runtime.queue().get(taskId);
                if (task.isEmpty()) {
                    parent.printJson(Map.of("error", "task not found", "task_id", taskId));
                    return 1;
                }
                parent.printJson(task.get());
            }
            return 0;
        }
    }

    @Command(name = "tasks", description = "List recent tasks with optional filters")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--status"}, description = "Filter by task status")
        String status;

        @Option(names = {"--agent"}, description = "Filter by target agent")
        String agent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            TaskStatus filter = status == null || status.isBlank() ? null : TaskStatus.fromString(status);
            try (AgentRelayRuntime runtime = parent.runtime()) {
                parent.printJson(runtime.queue().list(filter, agent, limit));
            }
            return 0;
        }
    }

    @Command(name = "stats", description = "Show task counts by status")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--agent"}, description = "Restrict counts to one target agent")
        String agent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                parent.printJson(runtime.stats(agent));
            }
            return 0;
        }
    }

    @Command(name = "health", description = "Show queue health: stuck tasks and backlog age")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                var health = runtime.health();
                parent.printJson(health);
                return health.healthy() ? 0 : 2;
            }
        }
    }

    @Command(name = "cleanup", description = "Purge finished tasks older than the retention window")
    static final class CleanupCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--older-than-hours"}, description = "Retention window; defaults to the configured value")
        Long olderThanHours;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                int purged = olderThanHours == null ? runtime.cleanup() : runtime.cleanup(olderThanHours);
                parent.printJson(Map.of("purged", purged));
            }
            return 0;
        }
    }

    @Command(name = "recover", description = "Return orphaned or stuck PROCESSING tasks to the queue")
    static final class RecoverCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--stuck"}, defaultValue = "false",
                description = "Also sweep tasks running longer than the stuck timeout, live owner or not")
        boolean stuck;

        @Option(names = {"--mark-failed"}, defaultValue = "false", description = "Fail stuck tasks instead of resetting them")
        boolean markFailed;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("orphaned", runtime.recoverOrphaned());
                if (stuck) {
                    QueueManager.RecoveryOutcome stuckOutcome = runtime.recoverStuck(markFailed);
                    out.put("stuck", stuckOutcome);
                }
                parent.printJson(out);
            }
            return 0;
        }
    }

    @Command(name = "cancel", description = "Cancel pending tasks by target and/or source agent")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--agent"}, description = "Target agent filter")
        String agent;

        @Option(names = {"--source"}, description = "Source agent filter")
        String source;

        @Option(names = {"--all"}, defaultValue = "false", description = "Required to cancel without any filter")
        boolean all;

        @Override
        public Integer call() {
            if (!all && isBlank(agent) && isBlank(source)) {
                parent.printJson(Map.of("error", "pass --agent, --source or --all"));
                return 1;
            }
            try (AgentRelayRuntime runtime = parent.runtime()) {
                List<String> cancelled = runtime.cancel(agent, source);
                parent.printJson(Map.of("cancelled", cancelled.size(), "task_ids", cancelled));
            }
            return 0;
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }

    @Command(name = "worker", description = "Run the built-in echo agent")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Drain currently claimable tasks and exit")
        boolean once;

        @Override
        public Integer call() throws Exception {
            AgentRelayRuntime runtime = parent.runtime();
            runtime.registerAgent(EchoAgent.AGENT_TYPE, new EchoAgent());
            if (once) {
                try (runtime) {
                    QueueManager.RecoveryOutcome recovery = runtime.recoverOrphaned();
                    int processed = runtime.workerPool().drain(EchoAgent.AGENT_TYPE);
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("agent", EchoAgent.AGENT_TYPE);
                    out.put("recovered", recovery.recovered());
                    out.put("processed", processed);
                    out.put("stats", runtime.stats(EchoAgent.AGENT_TYPE));
                    parent.printJson(out);
                }
                return 0;
            }
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                runtime.close();
                stopped.countDown();
            }, "agentrelay-shutdown-hook"));
            runtime.start();
            stopped.await();
            return 0;
        }
    }
}
