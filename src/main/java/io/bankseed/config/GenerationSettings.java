package io.bankseed.config;

import io.bankseed.model.EntityType;
import io.bankseed.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved generation tunables. Every field is sanitized: values below their minimum are
 * clamped and absent values fall back to {@link #defaults()}.
 */
public record GenerationSettings(
        ZoneId zone,
        long randomSeed,
        int batchSize,
        int checkpointEveryBatches,
        int checkpointKeep,
        LocalDate historicalStartDate,
        int workerThreads,
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        int batchMaxAttempts,
        long batchRetryDelayMs,
        long storageTimeoutMs,
        long controlPollMs,
        CatchUpPolicy catchUpPolicy,
        int maxCatchUpTriggers,
        double defaultFailureRateThreshold,
        Map<EntityType, Double> failureRateThresholds,
        Map<EntityType, Long> fixedVolumes,
        Map<EntityType, Long> dailyVolumes
) {
    private static final Logger logger = LogManager.getLogger(GenerationSettings.class);

    public static final long DEFAULT_RANDOM_SEED = 42L;
    public static final int DEFAULT_BATCH_SIZE = 1_000;
    public static final int DEFAULT_CHECKPOINT_EVERY_BATCHES = 5;
    public static final int DEFAULT_CHECKPOINT_KEEP = 20;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 30_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 15L * 60L * 1000L;
    public static final int DEFAULT_BATCH_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BATCH_RETRY_DELAY_MS = 200L;
    public static final long DEFAULT_STORAGE_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_CONTROL_POLL_MS = 1_000L;
    public static final int DEFAULT_MAX_CATCH_UP_TRIGGERS = 14;
    public static final double DEFAULT_FAILURE_RATE_THRESHOLD = 0.05d;

    public GenerationSettings {
        failureRateThresholds = Collections.unmodifiableMap(copy(failureRateThresholds));
        fixedVolumes = Collections.unmodifiableMap(copy(fixedVolumes));
        dailyVolumes = Collections.unmodifiableMap(copy(dailyVolumes));
    }

    public static GenerationSettings defaults() {
        Map<EntityType, Long> fixed = new EnumMap<>(EntityType.class);
        fixed.put(EntityType.CUSTOMER, 10_000L);
        fixed.put(EntityType.MANAGER, 100L);
        fixed.put(EntityType.PRODUCT, 50L);
        fixed.put(EntityType.DEPOSIT_TYPE, 8L);
        fixed.put(EntityType.BRANCH, 30L);
        fixed.put(EntityType.ACCOUNT, 22_000L);
        Map<EntityType, Long> daily = new EnumMap<>(EntityType.class);
        daily.put(EntityType.TRANSACTION, 5_000L);
        daily.put(EntityType.LOAN_APPLICATION, 50L);
        daily.put(EntityType.INVESTMENT_ORDER, 200L);
        daily.put(EntityType.CUSTOMER_EVENT, 2_000L);
        daily.put(EntityType.APP_EVENT, 4_000L);
        daily.put(EntityType.WEB_EVENT, 2_500L);
        return new GenerationSettings(
                ZoneId.systemDefault(),
                DEFAULT_RANDOM_SEED,
                DEFAULT_BATCH_SIZE,
                DEFAULT_CHECKPOINT_EVERY_BATCHES,
                DEFAULT_CHECKPOINT_KEEP,
                null,
                DEFAULT_WORKER_THREADS,
                DEFAULT_MAX_ATTEMPTS,
                DEFAULT_BASE_BACKOFF_MS,
                DEFAULT_MAX_BACKOFF_MS,
                DEFAULT_BATCH_MAX_ATTEMPTS,
                DEFAULT_BATCH_RETRY_DELAY_MS,
                DEFAULT_STORAGE_TIMEOUT_MS,
                DEFAULT_CONTROL_POLL_MS,
                CatchUpPolicy.COLLAPSE,
                DEFAULT_MAX_CATCH_UP_TRIGGERS,
                DEFAULT_FAILURE_RATE_THRESHOLD,
                Map.of(),
                fixed,
                daily
        );
    }

    public static GenerationSettings load(BankSeedConfig config) {
        return load(config.settingsFile());
    }

    public static GenerationSettings load(Path settingsFile) {
        GenerationSettings defaults = defaults();
        if (!Files.exists(settingsFile)) {
            logger.debug("No settings file at {}, using defaults", settingsFile);
            return defaults;
        }
        try {
            GenerationSettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), GenerationSettingsFile.class);
            GenerationSettings resolved = fromFile(file, defaults);
            logger.info("Loaded generation settings from {}", settingsFile);
            return resolved;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + settingsFile, e);
        }
    }

    public static GenerationSettings fromFile(GenerationSettingsFile file, GenerationSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        return new GenerationSettings(
                sanitizeZone(file.zone(), defaults.zone()),
                file.randomSeed() == null ? defaults.randomSeed() : file.randomSeed(),
                sanitizeInt(file.batchSize(), defaults.batchSize(), 1),
                sanitizeInt(file.checkpointEveryBatches(), defaults.checkpointEveryBatches(), 1),
                sanitizeInt(file.checkpointKeep(), defaults.checkpointKeep(), 1),
                sanitizeDate(file.historicalStartDate(), defaults.historicalStartDate()),
                sanitizeInt(file.workerThreads(), defaults.workerThreads(), 1),
                sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1),
                baseBackoff,
                maxBackoff,
                sanitizeInt(file.batchMaxAttempts(), defaults.batchMaxAttempts(), 1),
                sanitizeLong(file.batchRetryDelayMs(), defaults.batchRetryDelayMs(), 0L),
                sanitizeLong(file.storageTimeoutMs(), defaults.storageTimeoutMs(), 1_000L),
                sanitizeLong(file.controlPollMs(), defaults.controlPollMs(), 10L),
                sanitizePolicy(file.catchUpPolicy(), defaults.catchUpPolicy()),
                sanitizeInt(file.maxCatchUpTriggers(), defaults.maxCatchUpTriggers(), 1),
                sanitizeRate(file.defaultFailureRateThreshold(), defaults.defaultFailureRateThreshold()),
                mergeRates(file.failureRateThresholds(), defaults.failureRateThresholds()),
                mergeVolumes(file.fixedVolumes(), defaults.fixedVolumes()),
                mergeVolumes(file.dailyVolumes(), defaults.dailyVolumes())
        );
    }

    public double failureRateThreshold(EntityType type) {
        return failureRateThresholds.getOrDefault(type, defaultFailureRateThreshold);
    }

    public long fixedVolume(EntityType type) {
        return fixedVolumes.getOrDefault(type, 0L);
    }

    public long dailyVolume(EntityType type) {
        return dailyVolumes.getOrDefault(type, 0L);
    }

    private static <V> Map<EntityType, V> copy(Map<EntityType, V> source) {
        Map<EntityType, V> out = new EnumMap<>(EntityType.class);
        if (source != null) {
            out.putAll(source);
        }
        return out;
    }

    private static Map<EntityType, Long> mergeVolumes(Map<String, Long> raw, Map<EntityType, Long> fallback) {
        Map<EntityType, Long> out = new EnumMap<>(EntityType.class);
        out.putAll(fallback);
        if (raw == null) {
            return out;
        }
        for (Map.Entry<String, Long> e : raw.entrySet()) {
            Optional<EntityType> type = EntityType.fromKey(e.getKey());
            if (type.isEmpty()) {
                logger.warn("Ignoring volume for unknown entity type '{}'", e.getKey());
                continue;
            }
            out.put(type.get(), e.getValue() == null ? 0L : Math.max(0L, e.getValue()));
        }
        return out;
    }

    private static Map<EntityType, Double> mergeRates(Map<String, Double> raw, Map<EntityType, Double> fallback) {
        Map<EntityType, Double> out = new EnumMap<>(EntityType.class);
        out.putAll(fallback);
        if (raw == null) {
            return out;
        }
        for (Map.Entry<String, Double> e : raw.entrySet()) {
            Optional<EntityType> type = EntityType.fromKey(e.getKey());
            if (type.isEmpty() || e.getValue() == null) {
                logger.warn("Ignoring failure-rate threshold for '{}'", e.getKey());
                continue;
            }
            out.put(type.get(), sanitizeRate(e.getValue(), DEFAULT_FAILURE_RATE_THRESHOLD));
        }
        return out;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static double sanitizeRate(Double raw, double fallback) {
        if (raw == null || raw.isNaN()) {
            return fallback;
        }
        return Math.min(1.0d, Math.max(0.0d, raw));
    }

    private static ZoneId sanitizeZone(String raw, ZoneId fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            logger.warn("Invalid zone '{}', using {}", raw, fallback);
            return fallback;
        }
    }

    private static LocalDate sanitizeDate(String raw, LocalDate fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            logger.warn("Invalid historicalStartDate '{}', using default", raw);
            return fallback;
        }
    }

    private static CatchUpPolicy sanitizePolicy(String raw, CatchUpPolicy fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return CatchUpPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown catchUpPolicy '{}', using {}", raw, fallback);
            return fallback;
        }
    }

    /**
     * On-disk shape of {@code bankseed-settings.json}; every field is optional.
     */
    public record GenerationSettingsFile(
            String zone,
            Long randomSeed,
            Integer batchSize,
            Integer checkpointEveryBatches,
            Integer checkpointKeep,
            String historicalStartDate,
            Integer workerThreads,
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Integer batchMaxAttempts,
            Long batchRetryDelayMs,
            Long storageTimeoutMs,
            Long controlPollMs,
            String catchUpPolicy,
            Integer maxCatchUpTriggers,
            Double defaultFailureRateThreshold,
            Map<String, Double> failureRateThresholds,
            Map<String, Long> fixedVolumes,
            Map<String, Long> dailyVolumes
    ) {
    }
}
