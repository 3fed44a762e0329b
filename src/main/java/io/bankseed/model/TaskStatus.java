package io.bankseed.model;

import java.util.Locale;

public enum TaskStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status is required");
        }
        return TaskStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
