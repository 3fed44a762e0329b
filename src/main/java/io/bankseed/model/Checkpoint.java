package io.bankseed.model;

public record Checkpoint(
        long checkpointId,
        String taskId,
        String lineageKey,
        long sequence,
        long createdAtMs,
        CheckpointPayload payload
) {
}
