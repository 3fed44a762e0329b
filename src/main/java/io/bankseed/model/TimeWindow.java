package io.bankseed.model;

import java.time.Instant;

/**
 * Half-open interval {@code [startMs, endMs)} of logical time.
 */
public record TimeWindow(long startMs, long endMs) {
    public TimeWindow {
        if (endMs <= startMs) {
            throw new IllegalArgumentException("Window end must be after start: " + startMs + " >= " + endMs);
        }
    }

    public static TimeWindow of(Instant start, Instant end) {
        return new TimeWindow(start.toEpochMilli(), end.toEpochMilli());
    }

    public long lengthMs() {
        return endMs - startMs;
    }

    public double lengthDays() {
        return lengthMs() / 86_400_000.0d;
    }

    public boolean contains(long timeMs) {
        return timeMs >= startMs && timeMs < endMs;
    }

    public TimeWindow span(TimeWindow other) {
        return new TimeWindow(Math.min(startMs, other.startMs), Math.max(endMs, other.endMs));
    }

    @Override
    public String toString() {
        return "[" + Instant.ofEpochMilli(startMs) + ", " + Instant.ofEpochMilli(endMs) + ")";
    }
}
