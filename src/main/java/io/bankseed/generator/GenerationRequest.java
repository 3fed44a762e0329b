package io.bankseed.generator;

import io.bankseed.model.Cursor;
import io.bankseed.model.EntityType;
import io.bankseed.model.TimeWindow;

public record GenerationRequest(
        EntityType type,
        Cursor cursor,
        int count,
        TimeWindow window,
        RegistryView registry,
        long seed,
        String lineageTag,
        long plannedVolume
) {
    public GenerationRequest {
        if (count <= 0) {
            throw new IllegalArgumentException("Batch count must be positive");
        }
    }
}
