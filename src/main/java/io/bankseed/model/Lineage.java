package io.bankseed.model;

import java.util.Locale;

/**
 * Lineage identity of a task. Retries and resumptions of the same kind and window share a
 * lineage and therefore share checkpoints and record identifiers.
 */
public final class Lineage {
    private static final long HOUR_MS = 3_600_000L;

    private Lineage() {
    }

    public static String key(TaskKind kind, TimeWindow window) {
        return kind.key() + ":" + window.startMs() + "-" + window.endMs();
    }

    public static String tag(TaskKind kind, TimeWindow window) {
        return kind.tagLetter()
                + Long.toString(Math.floorDiv(window.startMs(), HOUR_MS), 36).toUpperCase(Locale.ROOT)
                + "-"
                + Long.toString(Math.floorDiv(window.endMs(), HOUR_MS), 36).toUpperCase(Locale.ROOT);
    }

    public static String recordId(EntityType type, String tag, long sequence) {
        return type.prefix() + tag + "-" + String.format(Locale.ROOT, "%07d", sequence + 1);
    }
}
