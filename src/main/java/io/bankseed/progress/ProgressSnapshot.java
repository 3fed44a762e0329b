package io.bankseed.progress;

import io.bankseed.model.EntityType;
import io.bankseed.model.TaskStatus;

import java.util.List;

public record ProgressSnapshot(
        String taskId,
        TaskStatus status,
        boolean live,
        long produced,
        long planned,
        double percentComplete,
        double recordsPerSecond,
        Double etaSeconds,
        List<EntityProgress> entities
) {
    public ProgressSnapshot {
        entities = List.copyOf(entities);
    }

    public record EntityProgress(
            EntityType entityType,
            long completed,
            long total,
            double percentage,
            double ratePerSecond
    ) {
    }
}
