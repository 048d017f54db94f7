package io.agentrelay.cli;

import io.agentrelay.testing.TempRoots;
import io.agentrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class AgentRelayCommandTest {

    @Test
    void initCreatesTheDatabase() throws Exception {
        Path root = TempRoots.create("cli-init");
        try {
            Result result = run(root, "init");
            Assertions.assertEquals(0, result.code());
            Assertions.assertTrue(Files.exists(root.resolve("agentrelay.db")));
            Assertions.assertEquals(root.resolve("agentrelay.db").toAbsolutePath().normalize().toString(),
                    result.json().get("database"));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void submitThenWorkerOnceCompletesEchoTasks() throws Exception {
        Path root = TempRoots.create("cli-worker");
        try {
            Result submitted = run(root, "submit", "--agent", "echo", "--operation", "echo",
                    "--params", "{\"q\":\"crispr\"}", "--priority", "high", "--source", "cli-test");
            Assertions.assertEquals(0, submitted.code());
            String taskId = (String) submitted.json().get("task_id");
            Assertions.assertNotNull(taskId);

            Result stats = run(root, "stats", "--agent", "echo");
            Assertions.assertEquals(1, stats.json().get("PENDING"));

            Result worker = run(root, "worker", "--once");
            Assertions.assertEquals(0, worker.code());
            Assertions.assertEquals(1, worker.json().get("processed"));

            Result task = run(root, "task", taskId);
            Assertions.assertEquals(0, task.code());
            Assertions.assertEquals("COMPLETED", task.json().get("status"));
            Assertions.assertEquals("HIGH", task.json().get("priority"));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void malformedSubmitInputExitsWithTwo() throws Exception {
        Path root = TempRoots.create("cli-bad-input");
        try {
            Result badJson = run(root, "submit", "--agent", "echo", "--operation", "echo", "--params", "{not json");
            Assertions.assertEquals(2, badJson.code());
            Assertions.assertTrue(((String) badJson.json().get("error")).startsWith("invalid input"));

            Result notAnObject = run(root, "submit", "--agent", "echo", "--operation", "echo", "--params", "[1,2]");
            Assertions.assertEquals(2, notAnObject.code());

            Result badPriority = run(root, "submit", "--agent", "echo", "--operation", "echo", "--priority", "asap");
            Assertions.assertEquals(2, badPriority.code());

            Result negativeRetries = run(root, "submit", "--agent", "echo", "--operation", "echo", "--max-retries", "-1");
            Assertions.assertEquals(2, negativeRetries.code());
            Assertions.assertEquals(0, run(root, "stats").json().get("PENDING"));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void unknownTaskExitsWithOne() throws Exception {
        Path root = TempRoots.create("cli-missing");
        try {
            Result result = run(root, "task", "no-such-task");
            Assertions.assertEquals(1, result.code());
            Assertions.assertEquals("task not found", result.json().get("error"));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void cancelRequiresAFilter() throws Exception {
        Path root = TempRoots.create("cli-cancel");
        try {
            Assertions.assertEquals(1, run(root, "cancel").code());

            run(root, "submit", "--agent", "echo", "--operation", "echo");
            run(root, "submit", "--agent", "echo", "--operation", "echo");
            Result cancelled = run(root, "cancel", "--agent", "echo");
            Assertions.assertEquals(0, cancelled.code());
            Assertions.assertEquals(2, cancelled.json().get("cancelled"));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void healthyQueueExitsWithZero() throws Exception {
        Path root = TempRoots.create("cli-health");
        try {
            Result result = run(root, "health");
            Assertions.assertEquals(0, result.code());
            Assertions.assertEquals(Boolean.TRUE, result.json().get("healthy"));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    private static Result run(Path root, String... args) {
        StringWriter out = new StringWriter();
        CommandLine cmd = new CommandLine(new AgentRelayCommand());
        cmd.setOut(new PrintWriter(out));
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        int code = cmd.execute(full);
        return new Result(code, out.toString());
    }

    private record Result(int code, String output) {
        Map<String, Object> json() {
            return Jsons.readMap(output);
        }
    }
}
