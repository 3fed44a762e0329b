package io.bankseed.model;

import java.util.Locale;

public enum TaskKind {
    HISTORICAL('H'),
    REALTIME('R');

    private final char tagLetter;

    TaskKind(char tagLetter) {
        this.tagLetter = tagLetter;
    }

    public char tagLetter() {
        return tagLetter;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task kind is required");
        }
        for (TaskKind value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task kind: " + raw);
    }
}
