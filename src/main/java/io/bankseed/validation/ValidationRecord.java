package io.bankseed.validation;

import io.bankseed.model.EntityType;

import java.util.List;
import java.util.Map;

public record ValidationRecord(
        long resultId,
        String taskId,
        EntityType entityType,
        long recordedAtMs,
        long total,
        long passed,
        long failed,
        Map<String, Object> details,
        List<String> errorSamples
) {
}
