package io.bankseed;

import io.bankseed.config.BankSeedConfig;
import io.bankseed.config.CatchUpPolicy;
import io.bankseed.config.GenerationSettings;
import io.bankseed.model.EntityType;
import io.bankseed.storage.Database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Shared fixtures: temporary data roots and small, fast settings.
 */
public final class TestSupport {
    private TestSupport() {
    }

    public static Path tempRoot(String prefix) throws IOException {
        return Files.createTempDirectory("bankseed-test-" + prefix + "-");
    }

    public static BankSeedConfig config(Path root) {
        return BankSeedConfig.fromRoot(root.toString());
    }

    /**
     * UTC, two days of history before {@code today}, a few dozen records per type, batches of
     * ten, a checkpoint after every batch and millisecond backoffs.
     */
    public static GenerationSettings smallSettings(LocalDate today) {
        Map<EntityType, Long> fixed = new EnumMap<>(EntityType.class);
        fixed.put(EntityType.CUSTOMER, 30L);
        fixed.put(EntityType.MANAGER, 5L);
        fixed.put(EntityType.PRODUCT, 6L);
        fixed.put(EntityType.DEPOSIT_TYPE, 3L);
        fixed.put(EntityType.BRANCH, 4L);
        fixed.put(EntityType.ACCOUNT, 40L);
        Map<EntityType, Long> daily = new EnumMap<>(EntityType.class);
        daily.put(EntityType.TRANSACTION, 24L);
        daily.put(EntityType.LOAN_APPLICATION, 4L);
        daily.put(EntityType.INVESTMENT_ORDER, 8L);
        daily.put(EntityType.CUSTOMER_EVENT, 12L);
        daily.put(EntityType.APP_EVENT, 12L);
        daily.put(EntityType.WEB_EVENT, 12L);
        return new GenerationSettings(
                ZoneOffset.UTC,
                7L,
                10,
                1,
                1_000,
                today.minusDays(2),
                2,
                3,
                10L,
                40L,
                2,
                0L,
                5_000L,
                10L,
                CatchUpPolicy.COLLAPSE,
                14,
                0.05d,
                Map.of(),
                fixed,
                daily
        );
    }

    public static GenerationSettings smallSettings() {
        return smallSettings(LocalDate.now(ZoneOffset.UTC));
    }

    /**
     * {@code record_id -> payload} for every stored record of a lineage.
     */
    public static Map<String, String> storedRecords(Database database, String lineageKey) throws SQLException {
        Map<String, String> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT record_id,payload FROM generated_records WHERE lineage_key=? ORDER BY record_id")) {
            ps.setString(1, lineageKey);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString(1), rs.getString(2));
                }
            }
        }
        return out;
    }

    public static long countRows(Database database, String table) throws SQLException {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM " + table);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
