package io.bankseed.model;

/**
 * Per-type resume position. {@code produced} counts records durably written; the next record
 * to generate has sequence {@code produced}.
 */
public record Cursor(
        long produced,
        String lastId,
        long lastLogicalTimeMs,
        long streamPosition
) {
    public static final Cursor START = new Cursor(0L, null, 0L, 0L);

    public Cursor {
        if (produced < 0 || streamPosition < 0) {
            throw new IllegalArgumentException("Cursor positions must be non-negative");
        }
    }

    public boolean isStarted() {
        return produced > 0;
    }

    public Cursor advance(long count, String lastId, long lastLogicalTimeMs) {
        return new Cursor(produced + count, lastId, lastLogicalTimeMs, streamPosition + count);
    }
}
