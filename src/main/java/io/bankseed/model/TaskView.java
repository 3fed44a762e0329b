package io.bankseed.model;

public record TaskView(
        String taskId,
        TaskKind kind,
        TaskStatus status,
        ScheduleKind scheduleKind,
        String lineageKey,
        String lineageTag,
        long windowStartMs,
        long windowEndMs,
        long dataHorizonMs,
        Long startTimeMs,
        Long endTimeMs,
        String currentStage,
        Long nextScheduledAtMs,
        Long lastSuccessfulAtMs,
        String lastError,
        int attempt,
        boolean needsAttention,
        String controlRequest,
        long createdAtMs,
        long updatedAtMs
) {
    public TimeWindow window() {
        return new TimeWindow(windowStartMs, windowEndMs);
    }
}
