package io.bankseed.validation;

import io.bankseed.model.GeneratedRecord;
import io.bankseed.model.Paradigm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-level checks applied to every generated batch. Failing records are counted, not
 * rejected.
 */
public final class RecordValidator {
    public static final int MAX_ERROR_SAMPLES = 5;
    public static final double MIN_AMOUNT = 0.01d;

    private static final long MIN_EPOCH_MS = 1_000_000_000_000L;
    private static final long MAX_EPOCH_MS = 9_999_999_999_999L;
    private static final List<String> COMMON_FIELDS = List.of("pt", "base_id");
    private static final List<String> DOCUMENT_FIELDS = List.of("detail_id", "detail_time");
    private static final List<String> EVENT_FIELDS = List.of("event_id", "event", "event_time", "event_property");

    public BatchValidation validate(List<GeneratedRecord> records) {
        int passed = 0;
        int failed = 0;
        Map<String, Integer> ruleCounts = new LinkedHashMap<>();
        List<String> samples = new ArrayList<>();
        for (GeneratedRecord record : records) {
            List<String> problems = check(record);
            if (problems.isEmpty()) {
                passed++;
                continue;
            }
            failed++;
            for (String problem : problems) {
                ruleCounts.merge(problem.substring(0, problem.indexOf(':')), 1, Integer::sum);
            }
            if (samples.size() < MAX_ERROR_SAMPLES) {
                samples.add(record.recordId() + " " + String.join("; ", problems));
            }
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rules", ruleCounts);
        return new BatchValidation(records.size(), passed, failed, details, samples);
    }

    List<String> check(GeneratedRecord record) {
        List<String> problems = new ArrayList<>();
        Map<String, Object> fields = record.fields();
        requireAll(fields, COMMON_FIELDS, problems);
        Paradigm paradigm = record.type().paradigm();
        if (paradigm == Paradigm.DOCUMENT) {
            requireAll(fields, DOCUMENT_FIELDS, problems);
            Object amount = fields.get("amount");
            if (amount instanceof Number n && n.doubleValue() < MIN_AMOUNT) {
                problems.add("amount_below_min: amount=" + n);
            } else if (amount != null && !(amount instanceof Number)) {
                problems.add("amount_not_numeric: amount=" + amount);
            }
        } else if (paradigm == Paradigm.EVENT) {
            requireAll(fields, EVENT_FIELDS, problems);
        }
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            if (e.getKey().endsWith("_time") && e.getValue() instanceof Number n && !isEpochMillis(n.longValue())) {
                problems.add("bad_timestamp: " + e.getKey() + "=" + n);
            }
        }
        return problems;
    }

    private static void requireAll(Map<String, Object> fields, List<String> names, List<String> problems) {
        for (String name : names) {
            Object value = fields.get(name);
            if (value == null || (value instanceof String s && s.isBlank())) {
                problems.add("missing_field: " + name);
            }
        }
    }

    private static boolean isEpochMillis(long value) {
        return value >= MIN_EPOCH_MS && value <= MAX_EPOCH_MS;
    }

    public record BatchValidation(
            int total,
            int passed,
            int failed,
            Map<String, Object> details,
            List<String> errorSamples
    ) {
    }
}
