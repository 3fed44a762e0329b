package io.bankseed.storage;

import io.bankseed.error.ConflictException;
import io.bankseed.error.PersistenceException;
import io.bankseed.model.ScheduleKind;
import io.bankseed.model.TaskKind;
import io.bankseed.model.TaskStatus;
import io.bankseed.model.TaskView;
import io.bankseed.model.TimeWindow;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@code gen_tasks}. Every state change is a conditional UPDATE keyed on the
 * expected source status, so a lost race shows up as {@code false} instead of a silent overwrite.
 */
public final class TaskStore {
    public static final String CONTROL_PAUSE = "PAUSE";

    private static final String COLUMNS = "task_id,kind,status,schedule_kind,lineage_key,lineage_tag,"
            + "window_start_ms,window_end_ms,data_horizon_ms,start_time_ms,end_time_ms,current_stage,"
            + "next_scheduled_at_ms,last_successful_at_ms,last_error,attempt,needs_attention,control_request,"
            + "created_at_ms,updated_at_ms";

    private final Database database;

    public TaskStore(Database database) {
        this.database = database;
    }

    /**
     * Inserts a PENDING task unless a task of the same kind is RUNNING. The check and the insert
     * are one statement.
     */
    public TaskView insertTask(NewTask t) {
        String sql = "INSERT INTO gen_tasks(task_id,kind,status,schedule_kind,lineage_key,lineage_tag,"
                + "window_start_ms,window_end_ms,data_horizon_ms,attempt,needs_attention,created_at_ms,updated_at_ms) "
                + "SELECT ?,?,?,?,?,?,?,?,?,0,0,?,? "
                + "WHERE NOT EXISTS (SELECT 1 FROM gen_tasks WHERE kind=? AND status=?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, t.taskId());
            ps.setString(2, t.kind().name());
            ps.setString(3, TaskStatus.PENDING.name());
            ps.setString(4, t.scheduleKind().name());
            ps.setString(5, t.lineageKey());
            ps.setString(6, t.lineageTag());
            ps.setLong(7, t.window().startMs());
            ps.setLong(8, t.window().endMs());
            ps.setLong(9, t.dataHorizonMs());
            ps.setLong(10, t.nowMs());
            ps.setLong(11, t.nowMs());
            ps.setString(12, t.kind().name());
            ps.setString(13, TaskStatus.RUNNING.name());
            if (ps.executeUpdate() == 0) {
                throw new ConflictException("A " + t.kind().key() + " task is already running");
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to insert task " + t.taskId(), e);
        }
        return getTask(t.taskId())
                .orElseThrow(() -> new PersistenceException("Inserted task vanished: " + t.taskId()));
    }

    public Optional<TaskView> getTask(String taskId) {
        String sql = "SELECT " + COLUMNS + " FROM gen_tasks WHERE task_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read task " + taskId, e);
        }
    }

    public List<TaskView> listTasks(TaskStatus status, int limit) {
        String base = "SELECT " + COLUMNS + " FROM gen_tasks";
        String sql = status == null
                ? base + " ORDER BY created_at_ms DESC, task_id DESC LIMIT ?"
                : base + " WHERE status=? ORDER BY created_at_ms DESC, task_id DESC LIMIT ?";
        List<TaskView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            int i = 1;
            if (status != null) {
                ps.setString(i++, status.name());
            }
            ps.setInt(i, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list tasks", e);
        }
    }

    /**
     * Most recently created task of the kind, whatever its status.
     */
    public Optional<TaskView> latestTask(TaskKind kind) {
        String sql = "SELECT " + COLUMNS + " FROM gen_tasks WHERE kind=? ORDER BY created_at_ms DESC, rowid DESC LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, kind.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read latest " + kind.key() + " task", e);
        }
    }

    public List<TaskView> listLineage(String lineageKey) {
        String sql = "SELECT " + COLUMNS + " FROM gen_tasks WHERE lineage_key=? ORDER BY created_at_ms ASC, rowid ASC";
        List<TaskView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, lineageKey);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list tasks of lineage " + lineageKey, e);
        }
    }

    public int countRunning(TaskKind kind) {
        String sql = "SELECT COUNT(*) FROM gen_tasks WHERE kind=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, kind.name());
            ps.setString(2, TaskStatus.RUNNING.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to count running tasks", e);
        }
    }

    /**
     * Moves {@code from} to RUNNING when no other task of the same kind is RUNNING.
     * {@code countAttempt} is true for fresh starts and false for resumption from PAUSED.
     */
    public boolean tryMarkRunning(String taskId, TaskStatus from, boolean countAttempt, long nowMs) {
        String sql = "UPDATE gen_tasks SET status=?, attempt=attempt+?, start_time_ms=COALESCE(start_time_ms, ?), "
                + "end_time_ms=NULL, next_scheduled_at_ms=NULL, control_request=NULL, updated_at_ms=? "
                + "WHERE task_id=? AND status=? "
                + "AND NOT EXISTS (SELECT 1 FROM gen_tasks o WHERE o.kind=gen_tasks.kind AND o.status=? AND o.task_id<>gen_tasks.task_id)";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, TaskStatus.RUNNING.name());
            ps.setInt(2, countAttempt ? 1 : 0);
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.setString(5, taskId);
            ps.setString(6, from.name());
            ps.setString(7, TaskStatus.RUNNING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to mark task running: " + taskId, e);
        }
    }

    public boolean markCompleted(String taskId, long lastSuccessfulAtMs, long nowMs) {
        String sql = "UPDATE gen_tasks SET status=?, end_time_ms=?, last_successful_at_ms=?, last_error=NULL, "
                + "needs_attention=0, control_request=NULL, current_stage=?, updated_at_ms=? WHERE task_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, TaskStatus.COMPLETED.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, lastSuccessfulAtMs);
            ps.setString(4, "done");
            ps.setLong(5, nowMs);
            ps.setString(6, taskId);
            ps.setString(7, TaskStatus.RUNNING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to complete task: " + taskId, e);
        }
    }

    public boolean markFailed(String taskId, String error, boolean needsAttention, long nowMs) {
        String sql = "UPDATE gen_tasks SET status=?, end_time_ms=?, last_error=?, needs_attention=?, "
                + "control_request=NULL, updated_at_ms=? WHERE task_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, TaskStatus.FAILED.name());
            ps.setLong(2, nowMs);
            ps.setString(3, error);
            ps.setInt(4, needsAttention ? 1 : 0);
            ps.setLong(5, nowMs);
            ps.setString(6, taskId);
            ps.setString(7, TaskStatus.RUNNING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to mark task failed: " + taskId, e);
        }
    }

    public boolean markPaused(String taskId, long nowMs) {
        String sql = "UPDATE gen_tasks SET status=?, control_request=NULL, updated_at_ms=? WHERE task_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, TaskStatus.PAUSED.name());
            ps.setLong(2, nowMs);
            ps.setString(3, taskId);
            ps.setString(4, TaskStatus.RUNNING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to pause task: " + taskId, e);
        }
    }

    public boolean markCancelled(String taskId, String reason, long nowMs) {
        String sql = "UPDATE gen_tasks SET status=?, end_time_ms=?, last_error=?, next_scheduled_at_ms=NULL, "
                + "control_request=NULL, updated_at_ms=? WHERE task_id=? AND status IN (?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, TaskStatus.CANCELLED.name());
            ps.setLong(2, nowMs);
            ps.setString(3, reason);
            ps.setLong(4, nowMs);
            ps.setString(5, taskId);
            ps.setString(6, TaskStatus.PENDING.name());
            ps.setString(7, TaskStatus.RUNNING.name());
            ps.setString(8, TaskStatus.PAUSED.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to cancel task: " + taskId, e);
        }
    }

    /**
     * FAILED back to PENDING with the time the retry becomes due.
     */
    public boolean scheduleRetry(String taskId, long nextScheduledAtMs, long nowMs) {
        String sql = "UPDATE gen_tasks SET status=?, next_scheduled_at_ms=?, updated_at_ms=? WHERE task_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, TaskStatus.PENDING.name());
            ps.setLong(2, nextScheduledAtMs);
            ps.setLong(3, nowMs);
            ps.setString(4, taskId);
            ps.setString(5, TaskStatus.FAILED.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to schedule retry: " + taskId, e);
        }
    }

    public void updateStage(String taskId, String stage, long nowMs) {
        String sql = "UPDATE gen_tasks SET current_stage=?, updated_at_ms=? WHERE task_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, stage);
            ps.setLong(2, nowMs);
            ps.setString(3, taskId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to update stage: " + taskId, e);
        }
    }

    /**
     * Records a control request for the process executing the task; only RUNNING tasks accept one.
     */
    public boolean requestControl(String taskId, String request, long nowMs) {
        String sql = "UPDATE gen_tasks SET control_request=?, updated_at_ms=? WHERE task_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, request);
            ps.setLong(2, nowMs);
            ps.setString(3, taskId);
            ps.setString(4, TaskStatus.RUNNING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to record control request: " + taskId, e);
        }
    }

    public Optional<Long> lastSuccessfulHorizon(TaskKind kind) {
        return maxLong("SELECT MAX(last_successful_at_ms) FROM gen_tasks WHERE kind=? AND status='COMPLETED'", kind);
    }

    public Optional<Long> firstSuccessfulHorizon(TaskKind kind) {
        return maxLong("SELECT MIN(last_successful_at_ms) FROM gen_tasks WHERE kind=? AND status='COMPLETED'", kind);
    }

    /**
     * Tasks of the kind whose window ends after {@code sinceMs}, newest first.
     */
    public List<TaskView> listEndingAfter(TaskKind kind, long sinceMs) {
        String sql = "SELECT " + COLUMNS + " FROM gen_tasks WHERE kind=? AND window_end_ms>? "
                + "ORDER BY created_at_ms DESC, rowid DESC";
        List<TaskView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, kind.name());
            ps.setLong(2, sinceMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list " + kind.key() + " tasks", e);
        }
    }

    private Optional<Long> maxLong(String sql, TaskKind kind) {
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, kind.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                long value = rs.getLong(1);
                return rs.wasNull() ? Optional.empty() : Optional.of(value);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read horizon for " + kind.key(), e);
        }
    }

    /**
     * RUNNING rows left behind by a dead process go back to PENDING and give back the attempt
     * they consumed.
     */
    public List<String> resetOrphanedRunning(long nowMs) {
        String select = "SELECT task_id FROM gen_tasks WHERE status=?";
        String update = "UPDATE gen_tasks SET status=?, attempt=MAX(0, attempt-1), control_request=NULL, "
                + "updated_at_ms=? WHERE task_id=? AND status=?";
        List<String> reset = new ArrayList<>();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psSelect = database.prepare(c, select);
                 PreparedStatement psUpdate = database.prepare(c, update)) {
                psSelect.setString(1, TaskStatus.RUNNING.name());
                List<String> candidates = new ArrayList<>();
                try (ResultSet rs = psSelect.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getString("task_id"));
                    }
                }
                for (String taskId : candidates) {
                    psUpdate.setString(1, TaskStatus.PENDING.name());
                    psUpdate.setLong(2, nowMs);
                    psUpdate.setString(3, taskId);
                    psUpdate.setString(4, TaskStatus.RUNNING.name());
                    if (psUpdate.executeUpdate() == 1) {
                        reset.add(taskId);
                    }
                }
                c.commit();
                return reset;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to reset orphaned tasks", e);
        }
    }

    public List<TaskView> listScheduledRetries() {
        String sql = "SELECT " + COLUMNS + " FROM gen_tasks WHERE status=? AND next_scheduled_at_ms IS NOT NULL "
                + "ORDER BY next_scheduled_at_ms ASC";
        List<TaskView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, TaskStatus.PENDING.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list scheduled retries", e);
        }
    }

    private static TaskView map(ResultSet rs) throws SQLException {
        return new TaskView(
                rs.getString("task_id"),
                TaskKind.fromString(rs.getString("kind")),
                TaskStatus.fromString(rs.getString("status")),
                ScheduleKind.valueOf(rs.getString("schedule_kind")),
                rs.getString("lineage_key"),
                rs.getString("lineage_tag"),
                rs.getLong("window_start_ms"),
                rs.getLong("window_end_ms"),
                rs.getLong("data_horizon_ms"),
                nullableLong(rs, "start_time_ms"),
                nullableLong(rs, "end_time_ms"),
                rs.getString("current_stage"),
                nullableLong(rs, "next_scheduled_at_ms"),
                nullableLong(rs, "last_successful_at_ms"),
                rs.getString("last_error"),
                rs.getInt("attempt"),
                rs.getInt("needs_attention") == 1,
                rs.getString("control_request"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    public record NewTask(
            String taskId,
            TaskKind kind,
            ScheduleKind scheduleKind,
            String lineageKey,
            String lineageTag,
            TimeWindow window,
            long dataHorizonMs,
            long nowMs
    ) {
    }
}
