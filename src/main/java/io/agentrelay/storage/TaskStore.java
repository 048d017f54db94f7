package io.agentrelay.storage;

import io.agentrelay.model.Task;
import io.agentrelay.model.TaskPriority;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Authoritative persistence for {@link Task} rows.
 *
 * <p>Every state change is a single transaction guarded by the expected current status,
 * so concurrent callers observe compare-and-set semantics: a claim, completion or failure
 * either applies to a row in the expected state or reports that nothing changed.
 */
public final class TaskStore {
    private static final String TASK_COLUMNS = """
            task_id,source_agent,target_agent,operation,parameters_json,status,priority,result_json,error_message,
            retry_count,max_retries,created_at_ms,started_at_ms,completed_at_ms,available_at_ms,worker_id,process_id
            """;
    private static final String INSERT_SQL = """
            INSERT INTO tasks(task_id,source_agent,target_agent,operation,parameters_json,status,priority,retry_count,max_retries,
                              enqueue_seq,created_at_ms,available_at_ms,updated_at_ms)
            VALUES(?,?,?,?,?,?,?,0,?,(SELECT COALESCE(MAX(enqueue_seq),0)+1 FROM tasks),?,?,?)
            """;

    private final Database database;

    public TaskStore(Database database) {
        this.database = database;
    }

    public String insert(NewTask task, long nowMs) {
        return insertBatch(List.of(task), nowMs).get(0);
    }

    public List<String> insertBatch(List<NewTask> tasks, long nowMs) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(INSERT_SQL)) {
                List<String> ids = new ArrayList<>(tasks.size());
                for (NewTask t : tasks) {
                    ps.setString(1, t.id());
                    ps.setString(2, t.sourceAgent());
                    ps.setString(3, t.targetAgent());
                    ps.setString(4, t.operation());
                    ps.setString(5, t.parametersJson());
                    ps.setString(6, TaskStatus.PENDING.name());
                    ps.setInt(7, t.priority().level());
                    ps.setInt(8, t.maxRetries());
                    ps.setLong(9, nowMs);
                    ps.setLong(10, nowMs);
                    ps.setLong(11, nowMs);
                    ps.executeUpdate();
                    ids.add(t.id());
                }
                c.commit();
                return ids;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to insert " + tasks.size() + " task(s)", e);
        }
    }

    public Optional<Task> claimNext(String targetAgent, String workerId, long processId, long nowMs) {
        String select = """
                SELECT task_id FROM tasks
                WHERE target_agent=? AND status=? AND available_at_ms<=?
                ORDER BY priority DESC, created_at_ms ASC, enqueue_seq ASC
                LIMIT 1
                """;
        String claim = """
                UPDATE tasks SET status=?,started_at_ms=?,worker_id=?,process_id=?,updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psSelect = c.prepareStatement(select);
                 PreparedStatement psClaim = c.prepareStatement(claim)) {
                psSelect.setString(1, targetAgent);
                psSelect.setString(2, TaskStatus.PENDING.name());
                psSelect.setLong(3, nowMs);
                String taskId;
                try (ResultSet rs = psSelect.executeQuery()) {
                    if (!rs.next()) {
                        c.commit();
                        return Optional.empty();
                    }
                    taskId = rs.getString("task_id");
                }
                psClaim.setString(1, TaskStatus.PROCESSING.name());
                psClaim.setLong(2, nowMs);
                psClaim.setString(3, workerId);
                psClaim.setLong(4, processId);
                psClaim.setLong(5, nowMs);
                psClaim.setString(6, taskId);
                psClaim.setString(7, TaskStatus.PENDING.name());
                if (psClaim.executeUpdate() == 0) {
                    c.rollback();
                    return Optional.empty();
                }
                Optional<Task> claimed = readTask(c, taskId);
                c.commit();
                return claimed;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to claim next task for agent " + targetAgent, e);
        }
    }

    public boolean markCompleted(String taskId, String resultJson, long nowMs) {
        String sql = """
                UPDATE tasks SET status=?,result_json=?,completed_at_ms=?,worker_id=NULL,process_id=NULL,updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.COMPLETED.name());
            ps.setString(2, resultJson);
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.setString(5, taskId);
            ps.setString(6, TaskStatus.PROCESSING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageException("Failed to complete task " + taskId, e);
        }
    }

    public FailureResolution recordFailure(String taskId, String error, boolean retry, RetryPolicy policy, long nowMs) {
        String read = "SELECT status,retry_count,max_retries FROM tasks WHERE task_id=?";
        String setRetry = """
                UPDATE tasks SET status=?,retry_count=?,error_message=?,available_at_ms=?,worker_id=NULL,process_id=NULL,updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        String setFailed = """
                UPDATE tasks SET status=?,error_message=?,completed_at_ms=?,worker_id=NULL,process_id=NULL,updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psRead = c.prepareStatement(read);
                 PreparedStatement psRetry = c.prepareStatement(setRetry);
                 PreparedStatement psFailed = c.prepareStatement(setFailed)) {
                psRead.setString(1, taskId);
                String status;
                int retryCount;
                int maxRetries;
                try (ResultSet rs = psRead.executeQuery()) {
                    if (!rs.next()) {
                        c.commit();
                        return FailureResolution.notProcessing(0);
                    }
                    status = rs.getString("status");
                    retryCount = rs.getInt("retry_count");
                    maxRetries = rs.getInt("max_retries");
                }
                if (!TaskStatus.PROCESSING.name().equals(status)) {
                    c.commit();
                    return FailureResolution.notProcessing(retryCount);
                }
                if (retry && retryCount < maxRetries) {
                    int next = retryCount + 1;
                    long availableAtMs = nowMs + policy.backoffMs(next);
                    psRetry.setString(1, TaskStatus.PENDING.name());
                    psRetry.setInt(2, next);
                    psRetry.setString(3, error);
                    psRetry.setLong(4, availableAtMs);
                    psRetry.setLong(5, nowMs);
                    psRetry.setString(6, taskId);
                    psRetry.setString(7, TaskStatus.PROCESSING.name());
                    psRetry.executeUpdate();
                    c.commit();
                    return FailureResolution.retryScheduled(next, availableAtMs);
                }
                psFailed.setString(1, TaskStatus.FAILED.name());
                psFailed.setString(2, error);
                psFailed.setLong(3, nowMs);
                psFailed.setLong(4, nowMs);
                psFailed.setString(5, taskId);
                psFailed.setString(6, TaskStatus.PROCESSING.name());
                psFailed.executeUpdate();
                c.commit();
                return FailureResolution.failed(retryCount);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to record failure for task " + taskId, e);
        }
    }

    public Optional<Task> get(String taskId) {
        try (Connection c = database.openConnection()) {
            return readTask(c, taskId);
        } catch (SQLException e) {
            throw new StorageException("Failed to read task " + taskId, e);
        }
    }

    public List<Task> list(TaskStatus status, String targetAgent, int limit) {
        StringBuilder sql = new StringBuilder("SELECT ").append(TASK_COLUMNS).append(" FROM tasks WHERE 1=1");
        if (status != null) {
            sql.append(" AND status=?");
        }
        if (targetAgent != null) {
            sql.append(" AND target_agent=?");
        }
        sql.append(" ORDER BY created_at_ms DESC, enqueue_seq DESC LIMIT ?");
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            if (status != null) {
                ps.setString(i++, status.name());
            }
            if (targetAgent != null) {
                ps.setString(i++, targetAgent);
            }
            ps.setInt(i, Math.max(1, limit));
            List<Task> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapTask(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list tasks", e);
        }
    }

    public Map<TaskStatus, Integer> countByStatus(String targetAgent) {
        String sql = targetAgent == null
                ? "SELECT status, COUNT(1) FROM tasks GROUP BY status"
                : "SELECT status, COUNT(1) FROM tasks WHERE target_agent=? GROUP BY status";
        Map<TaskStatus, Integer> out = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            out.put(status, 0);
        }
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (targetAgent != null) {
                ps.setString(1, targetAgent);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(TaskStatus.fromString(rs.getString(1)), rs.getInt(2));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to collect task stats", e);
        }
    }

    public int purgeTerminalOlderThan(long cutoffMs) {
        String sql = "DELETE FROM tasks WHERE status IN (?,?,?) AND completed_at_ms IS NOT NULL AND completed_at_ms < ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.COMPLETED.name());
            ps.setString(2, TaskStatus.FAILED.name());
            ps.setString(3, TaskStatus.CANCELLED.name());
            ps.setLong(4, cutoffMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to purge terminal tasks", e);
        }
    }

    public List<String> cancelPending(String targetAgent, String sourceAgent, long nowMs) {
        StringBuilder where = new StringBuilder(" WHERE status=?");
        if (targetAgent != null) {
            where.append(" AND target_agent=?");
        }
        if (sourceAgent != null) {
            where.append(" AND source_agent=?");
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement select = c.prepareStatement("SELECT task_id FROM tasks" + where + " ORDER BY enqueue_seq ASC");
                 PreparedStatement update = c.prepareStatement(
                         "UPDATE tasks SET status=?,completed_at_ms=?,updated_at_ms=? WHERE task_id=? AND status=?")) {
                int i = 1;
                select.setString(i++, TaskStatus.PENDING.name());
                if (targetAgent != null) {
                    select.setString(i++, targetAgent);
                }
                if (sourceAgent != null) {
                    select.setString(i, sourceAgent);
                }
                List<String> ids = new ArrayList<>();
                try (ResultSet rs = select.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString(1));
                    }
                }
                for (String id : ids) {
                    update.setString(1, TaskStatus.CANCELLED.name());
                    update.setLong(2, nowMs);
                    update.setLong(3, nowMs);
                    update.setString(4, id);
                    update.setString(5, TaskStatus.PENDING.name());
                    update.executeUpdate();
                }
                c.commit();
                return ids;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to cancel pending tasks", e);
        }
    }

    public List<ProcessingClaim> listProcessing() {
        String sql = "SELECT task_id,target_agent,worker_id,process_id,started_at_ms FROM tasks WHERE status=? ORDER BY started_at_ms ASC";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.PROCESSING.name());
            List<ProcessingClaim> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long pid = rs.getLong("process_id");
                    Long processId = rs.wasNull() ? null : pid;
                    long started = rs.getLong("started_at_ms");
                    out.add(new ProcessingClaim(
                            rs.getString("task_id"),
                            rs.getString("target_agent"),
                            rs.getString("worker_id"),
                            processId,
                            rs.wasNull() ? 0L : started
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list processing tasks", e);
        }
    }

    public boolean resetToPending(String taskId, long nowMs) {
        String sql = """
                UPDATE tasks SET status=?,available_at_ms=?,worker_id=NULL,process_id=NULL,updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.PENDING.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, taskId);
            ps.setString(5, TaskStatus.PROCESSING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageException("Failed to reset task " + taskId, e);
        }
    }

    public boolean markStuckFailed(String taskId, String error, long nowMs) {
        String sql = """
                UPDATE tasks SET status=?,error_message=?,completed_at_ms=?,worker_id=NULL,process_id=NULL,updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.FAILED.name());
            ps.setString(2, error);
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.setString(5, taskId);
            ps.setString(6, TaskStatus.PROCESSING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageException("Failed to mark task " + taskId + " failed", e);
        }
    }

    public HealthRow health(long stuckCutoffMs) {
        String stuckSql = "SELECT COUNT(1) FROM tasks WHERE status=? AND started_at_ms < ?";
        String ageSql = "SELECT MIN(created_at_ms), MAX(created_at_ms), COUNT(1) FROM tasks WHERE status IN (?,?)";
        Map<TaskStatus, Integer> counts = countByStatus(null);
        try (Connection c = database.openConnection();
             PreparedStatement psStuck = c.prepareStatement(stuckSql);
             PreparedStatement psAge = c.prepareStatement(ageSql)) {
            psStuck.setString(1, TaskStatus.PROCESSING.name());
            psStuck.setLong(2, stuckCutoffMs);
            int stuck;
            try (ResultSet rs = psStuck.executeQuery()) {
                rs.next();
                stuck = rs.getInt(1);
            }
            psAge.setString(1, TaskStatus.PENDING.name());
            psAge.setString(2, TaskStatus.PROCESSING.name());
            try (ResultSet rs = psAge.executeQuery()) {
                rs.next();
                long oldest = rs.getLong(1);
                Long oldestMs = rs.wasNull() ? null : oldest;
                long newest = rs.getLong(2);
                Long newestMs = rs.wasNull() ? null : newest;
                return new HealthRow(counts, stuck, oldestMs, newestMs, rs.getInt(3));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read queue health", e);
        }
    }

    private Optional<Task> readTask(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + TASK_COLUMNS + " FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapTask(rs));
            }
        }
    }

    private Task mapTask(ResultSet rs) throws SQLException {
        return new Task(
                rs.getString("task_id"),
                rs.getString("source_agent"),
                rs.getString("target_agent"),
                rs.getString("operation"),
                Jsons.readMap(rs.getString("parameters_json")),
                TaskStatus.fromString(rs.getString("status")),
                TaskPriority.fromLevel(rs.getInt("priority")),
                Jsons.readMap(rs.getString("result_json")),
                rs.getString("error_message"),
                rs.getInt("retry_count"),
                rs.getInt("max_retries"),
                instantOrNull(rs, "created_at_ms"),
                instantOrNull(rs, "started_at_ms"),
                instantOrNull(rs, "completed_at_ms"),
                instantOrNull(rs, "available_at_ms"),
                rs.getString("worker_id"),
                longOrNull(rs, "process_id")
        );
    }

    private static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private static Long longOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    public record NewTask(
            String id,
            String sourceAgent,
            String targetAgent,
            String operation,
            String parametersJson,
            TaskPriority priority,
            int maxRetries
    ) {
    }

    /**
     * Bounded exponential backoff applied before a failed task becomes claimable again.
     * A zero base disables the delay entirely.
     */
    public record RetryPolicy(long baseBackoffMs, long maxBackoffMs) {
        public static RetryPolicy immediate() {
            return new RetryPolicy(0L, 0L);
        }

        public long backoffMs(int retryNumber) {
            if (baseBackoffMs <= 0L) {
                return 0L;
            }
            long backoff = baseBackoffMs;
            for (int i = 1; i < retryNumber; i++) {
                if (backoff >= maxBackoffMs / 2L) {
                    backoff = maxBackoffMs;
                    break;
                }
                backoff *= 2L;
            }
            backoff = Math.min(backoff, maxBackoffMs);
            long jitter = ThreadLocalRandom.current().nextLong(0L, 251L);
            return Math.min(maxBackoffMs, backoff + jitter);
        }
    }

    public enum FailureOutcome { RETRY_SCHEDULED, FAILED, NOT_PROCESSING }

    public record FailureResolution(FailureOutcome outcome, int retryCount, Long availableAtMs) {
        public static FailureResolution retryScheduled(int retryCount, long availableAtMs) {
            return new FailureResolution(FailureOutcome.RETRY_SCHEDULED, retryCount, availableAtMs);
        }

        public static FailureResolution failed(int retryCount) {
            return new FailureResolution(FailureOutcome.FAILED, retryCount, null);
        }

        public static FailureResolution notProcessing(int retryCount) {
            return new FailureResolution(FailureOutcome.NOT_PROCESSING, retryCount, null);
        }
    }

    public record ProcessingClaim(String taskId, String targetAgent, String workerId, Long processId, long startedAtMs) {}

    public record HealthRow(Map<TaskStatus, Integer> statusCounts, int stuckTasks, Long oldestActiveCreatedAtMs,
                            Long newestActiveCreatedAtMs, int activeTasks) {}
}
