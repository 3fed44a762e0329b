package io.bankseed.storage;

import io.bankseed.error.PersistenceException;
import io.bankseed.model.EntityType;
import io.bankseed.model.GeneratedRecord;
import io.bankseed.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores every entity type in {@code generated_records}, keeping the catalog table name
 * alongside each row.
 */
public final class SqliteRecordSink implements RecordSink {
    private final Database database;

    public SqliteRecordSink(Database database) {
        this.database = database;
    }

    @Override
    public int append(String taskId, String lineageKey, List<GeneratedRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        String sql = "INSERT INTO generated_records(record_id,entity_type,target_table,lineage_key,task_id,seq,base_id,"
                + "logical_time_ms,payload,created_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?) ON CONFLICT(record_id) DO NOTHING";
        long nowMs = System.currentTimeMillis();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = database.prepare(c, sql)) {
                for (GeneratedRecord r : records) {
                    ps.setString(1, r.recordId());
                    ps.setString(2, r.type().key());
                    ps.setString(3, r.type().table());
                    ps.setString(4, lineageKey);
                    ps.setString(5, taskId);
                    ps.setLong(6, r.sequence());
                    ps.setString(7, r.baseId());
                    ps.setLong(8, r.logicalTimeMs());
                    ps.setString(9, payload(r));
                    ps.setLong(10, nowMs);
                    ps.addBatch();
                }
                int inserted = 0;
                for (int n : ps.executeBatch()) {
                    if (n > 0) {
                        inserted += n;
                    }
                }
                c.commit();
                return inserted;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to persist " + records.size() + " records for task " + taskId, e);
        }
    }

    @Override
    public List<StoredIdentifier> loadIdentifiers(String lineageKey, EntityType type, long limit) {
        String sql = "SELECT record_id,base_id,seq FROM generated_records WHERE lineage_key=? AND entity_type=? "
                + "ORDER BY seq ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, lineageKey);
            ps.setString(2, type.key());
            ps.setLong(3, Math.max(0L, limit));
            return readIdentifiers(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load " + type.key() + " identifiers for " + lineageKey, e);
        }
    }

    @Override
    public List<StoredIdentifier> loadIdentifiers(EntityType type) {
        String sql = "SELECT record_id,base_id,seq FROM generated_records WHERE entity_type=? ORDER BY lineage_key ASC, seq ASC";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, type.key());
            return readIdentifiers(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load " + type.key() + " identifiers", e);
        }
    }

    @Override
    public long count(EntityType type) {
        String sql = "SELECT COUNT(*) FROM generated_records WHERE entity_type=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, type.key());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to count " + type.key() + " records", e);
        }
    }

    private static List<StoredIdentifier> readIdentifiers(PreparedStatement ps) throws SQLException {
        List<StoredIdentifier> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new StoredIdentifier(rs.getString("record_id"), rs.getString("base_id"), rs.getLong("seq")));
            }
        }
        return out;
    }

    private static String payload(GeneratedRecord r) {
        Map<String, Object> row = new LinkedHashMap<>(r.fields());
        Map<String, String> refs = new LinkedHashMap<>();
        r.references().forEach((type, id) -> refs.put(type.key(), id));
        if (!refs.isEmpty()) {
            row.put("refs", refs);
        }
        return Jsons.toCompactJson(row);
    }
}
