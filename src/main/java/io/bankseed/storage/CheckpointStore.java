package io.bankseed.storage;

import io.bankseed.error.PersistenceException;
import io.bankseed.model.Checkpoint;
import io.bankseed.model.CheckpointPayload;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only checkpoint log per lineage. Rows are never updated; the row with the highest
 * {@code seq} for a lineage is the resume point for every task of that lineage.
 */
public final class CheckpointStore {
    private final Database database;

    public CheckpointStore(Database database) {
        this.database = database;
    }

    public Checkpoint save(String taskId, String lineageKey, CheckpointPayload payload) {
        long nowMs = System.currentTimeMillis();
        String insert = "INSERT INTO task_checkpoints(task_id,lineage_key,seq,created_at_ms,payload) "
                + "SELECT ?,?,COALESCE(MAX(seq),0)+1,?,? FROM task_checkpoints WHERE lineage_key=?";
        String readBack = "SELECT checkpoint_id,seq FROM task_checkpoints WHERE checkpoint_id=last_insert_rowid()";
        String json = payload.toJson();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = database.prepare(c, insert);
                 PreparedStatement rb = database.prepare(c, readBack)) {
                ps.setString(1, taskId);
                ps.setString(2, lineageKey);
                ps.setLong(3, nowMs);
                ps.setString(4, json);
                ps.setString(5, lineageKey);
                ps.executeUpdate();
                long id;
                long seq;
                try (ResultSet rs = rb.executeQuery()) {
                    if (!rs.next()) {
                        throw new SQLException("Checkpoint row not visible after insert");
                    }
                    id = rs.getLong("checkpoint_id");
                    seq = rs.getLong("seq");
                }
                c.commit();
                return new Checkpoint(id, taskId, lineageKey, seq, nowMs, payload);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save checkpoint for lineage " + lineageKey, e);
        }
    }

    public Optional<Checkpoint> latest(String lineageKey) {
        List<Checkpoint> rows = list(lineageKey, 1);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Newest first.
     */
    public List<Checkpoint> list(String lineageKey, int limit) {
        String sql = "SELECT checkpoint_id,task_id,lineage_key,seq,created_at_ms,payload FROM task_checkpoints "
                + "WHERE lineage_key=? ORDER BY seq DESC LIMIT ?";
        List<Checkpoint> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, lineageKey);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Checkpoint(
                            rs.getLong("checkpoint_id"),
                            rs.getString("task_id"),
                            rs.getString("lineage_key"),
                            rs.getLong("seq"),
                            rs.getLong("created_at_ms"),
                            CheckpointPayload.fromJson(rs.getString("payload"))
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read checkpoints for lineage " + lineageKey, e);
        }
    }

    public int prune(String lineageKey, int keep) {
        String sql = "DELETE FROM task_checkpoints WHERE lineage_key=? AND checkpoint_id NOT IN ("
                + "SELECT checkpoint_id FROM task_checkpoints WHERE lineage_key=? ORDER BY seq DESC LIMIT ?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, lineageKey);
            ps.setString(2, lineageKey);
            ps.setInt(3, Math.max(1, keep));
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to prune checkpoints for lineage " + lineageKey, e);
        }
    }
}
