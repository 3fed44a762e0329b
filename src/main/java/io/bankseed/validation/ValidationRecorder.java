package io.bankseed.validation;

import com.fasterxml.jackson.core.type.TypeReference;
import io.bankseed.config.GenerationSettings;
import io.bankseed.error.PersistenceException;
import io.bankseed.model.EntityType;
import io.bankseed.storage.Database;
import io.bankseed.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only log of per-batch validation outcomes. Writes never fail the caller: a lost
 * validation row is logged and generation continues.
 */
public final class ValidationRecorder {
    private static final Logger logger = LogManager.getLogger(ValidationRecorder.class);
    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> SAMPLES_TYPE = new TypeReference<>() {
    };

    private final Database database;
    private final GenerationSettings settings;

    public ValidationRecorder(Database database, GenerationSettings settings) {
        this.database = database;
        this.settings = settings;
    }

    public void recordBatch(
            String taskId,
            EntityType entityType,
            long total,
            long passed,
            long failed,
            Map<String, Object> details,
            List<String> errorSamples
    ) {
        String sql = "INSERT INTO validation_results(task_id,entity_type,recorded_at_ms,total_count,passed_count,"
                + "failed_count,details,error_samples) VALUES(?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, taskId);
            ps.setString(2, entityType.key());
            ps.setLong(3, System.currentTimeMillis());
            ps.setLong(4, total);
            ps.setLong(5, passed);
            ps.setLong(6, failed);
            ps.setString(7, Jsons.toCompactJson(details == null ? Map.of() : details));
            ps.setString(8, Jsons.toCompactJson(errorSamples == null ? List.of() : errorSamples));
            ps.executeUpdate();
        } catch (SQLException | RuntimeException e) {
            logger.warn("Dropped validation result for task {} type {}: {}", taskId, entityType.key(), e.getMessage());
        }
    }

    public void recordBatch(String taskId, EntityType entityType, RecordValidator.BatchValidation result) {
        recordBatch(taskId, entityType, result.total(), result.passed(), result.failed(),
                result.details(), result.errorSamples());
    }

    public List<ValidationRecord> list(String taskId, int limit) {
        String sql = "SELECT result_id,task_id,entity_type,recorded_at_ms,total_count,passed_count,failed_count,"
                + "details,error_samples FROM validation_results WHERE task_id=? ORDER BY result_id DESC LIMIT ?";
        List<ValidationRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, taskId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Optional<EntityType> type = EntityType.fromKey(rs.getString("entity_type"));
                    if (type.isEmpty()) {
                        continue;
                    }
                    out.add(new ValidationRecord(
                            rs.getLong("result_id"),
                            rs.getString("task_id"),
                            type.get(),
                            rs.getLong("recorded_at_ms"),
                            rs.getLong("total_count"),
                            rs.getLong("passed_count"),
                            rs.getLong("failed_count"),
                            readJson(rs.getString("details"), DETAILS_TYPE, Map.of()),
                            readJson(rs.getString("error_samples"), SAMPLES_TYPE, List.of())
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list validation results for task " + taskId, e);
        }
    }

    public List<ValidationWarning> warnings(String taskId) {
        String sql = "SELECT entity_type, SUM(total_count) AS total, SUM(failed_count) AS failed "
                + "FROM validation_results WHERE task_id=? GROUP BY entity_type ORDER BY entity_type";
        List<ValidationWarning> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = database.prepare(c, sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Optional<EntityType> type = EntityType.fromKey(rs.getString("entity_type"));
                    long total = rs.getLong("total");
                    long failed = rs.getLong("failed");
                    if (type.isEmpty() || total <= 0) {
                        continue;
                    }
                    double rate = (double) failed / (double) total;
                    double threshold = settings.failureRateThreshold(type.get());
                    if (rate > threshold) {
                        out.add(new ValidationWarning(taskId, type.get(), total, failed, rate, threshold));
                    }
                }
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to compute validation warnings for task " + taskId, e);
        }
    }

    private static <T> T readJson(String raw, TypeReference<T> type, T fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Jsons.mapper().readValue(raw, type);
        } catch (IOException e) {
            logger.debug("Unreadable validation column: {}", e.getMessage());
            return fallback;
        }
    }
}
