package io.bankseed.validation;

import io.bankseed.model.EntityType;

/**
 * Cumulative failure rate of one entity type in one task exceeded its threshold. Informational.
 */
public record ValidationWarning(
        String taskId,
        EntityType entityType,
        long total,
        long failed,
        double failureRate,
        double threshold
) {
}
