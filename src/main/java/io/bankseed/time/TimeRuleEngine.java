package io.bankseed.time;

import io.bankseed.config.GenerationSettings;
import io.bankseed.model.TimeWindow;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Trigger calendar for realtime generation. Two triggers fire per local day, at 01:00 and
 * 13:00; each trigger owns the half-open window of logical time that ended at the previous
 * day boundary or at 13:00, so consecutive windows tile the timeline.
 */
public final class TimeRuleEngine {
    public static final LocalTime EARLY_TRIGGER = LocalTime.of(1, 0);
    public static final LocalTime MIDDAY_TRIGGER = LocalTime.of(13, 0);
    public static final int DEFAULT_HISTORY_DAYS = 365;

    private final ZoneId zone;
    private final int maxCatchUpTriggers;

    public TimeRuleEngine(ZoneId zone, int maxCatchUpTriggers) {
        this.zone = zone;
        this.maxCatchUpTriggers = Math.max(1, maxCatchUpTriggers);
    }

    public static TimeRuleEngine fromSettings(GenerationSettings settings) {
        return new TimeRuleEngine(settings.zone(), settings.maxCatchUpTriggers());
    }

    public ZoneId zone() {
        return zone;
    }

    public Instant nextTrigger(Instant now) {
        LocalDate day = LocalDate.ofInstant(now, zone);
        for (int offset = 0; offset <= 1; offset++) {
            LocalDate d = day.plusDays(offset);
            Instant early = at(d, EARLY_TRIGGER);
            if (early.isAfter(now)) {
                return early;
            }
            Instant midday = at(d, MIDDAY_TRIGGER);
            if (midday.isAfter(now)) {
                return midday;
            }
        }
        return at(day.plusDays(2), EARLY_TRIGGER);
    }

    public Instant previousTrigger(Instant now) {
        LocalDate day = LocalDate.ofInstant(now, zone);
        for (int offset = 0; offset <= 1; offset++) {
            LocalDate d = day.minusDays(offset);
            Instant midday = at(d, MIDDAY_TRIGGER);
            if (!midday.isAfter(now)) {
                return midday;
            }
            Instant early = at(d, EARLY_TRIGGER);
            if (!early.isAfter(now)) {
                return early;
            }
        }
        return at(day.minusDays(2), MIDDAY_TRIGGER);
    }

    /**
     * Triggers in {@code (lastSuccessful, now]}, oldest first. Only the most recent
     * {@code maxCatchUpTriggers} are returned. No prior success means nothing is owed.
     */
    public List<Instant> missedTriggers(Instant lastSuccessful, Instant now) {
        if (lastSuccessful == null || !lastSuccessful.isBefore(now)) {
            return List.of();
        }
        Deque<Instant> window = new ArrayDeque<>();
        Instant t = nextTrigger(lastSuccessful);
        while (!t.isAfter(now)) {
            window.addLast(t);
            if (window.size() > maxCatchUpTriggers) {
                window.removeFirst();
            }
            t = nextTrigger(t);
        }
        return new ArrayList<>(window);
    }

    public boolean isCatchUpNeeded(Instant lastSuccessful, Instant now) {
        return !missedTriggers(lastSuccessful, now).isEmpty();
    }

    /**
     * {@code [start 00:00, today 00:00)}. A start on or after today is moved to yesterday so
     * the window never reaches into the current day.
     */
    public TimeWindow historicalWindow(LocalDate configuredStart, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        LocalDate start = configuredStart == null ? today.minusDays(DEFAULT_HISTORY_DAYS) : configuredStart;
        if (!start.isBefore(today)) {
            start = today.minusDays(1);
        }
        return TimeWindow.of(start.atStartOfDay(zone).toInstant(), today.atStartOfDay(zone).toInstant());
    }

    public TimeWindow historicalWindow(GenerationSettings settings, Instant now) {
        return historicalWindow(settings.historicalStartDate(), now);
    }

    public TimeWindow realtimeWindow(Instant trigger) {
        ZonedDateTime local = trigger.atZone(zone);
        LocalDate day = local.toLocalDate();
        if (trigger.equals(at(day, MIDDAY_TRIGGER))) {
            return TimeWindow.of(day.atStartOfDay(zone).toInstant(), trigger);
        }
        if (trigger.equals(at(day, EARLY_TRIGGER))) {
            return TimeWindow.of(at(day.minusDays(1), MIDDAY_TRIGGER), day.atStartOfDay(zone).toInstant());
        }
        throw new IllegalArgumentException("Not a trigger instant: " + local);
    }

    /**
     * Union of the windows of consecutive triggers. The windows tile, so the span has no gaps.
     */
    public TimeWindow realtimeWindow(List<Instant> triggers) {
        if (triggers == null || triggers.isEmpty()) {
            throw new IllegalArgumentException("At least one trigger is required");
        }
        TimeWindow window = realtimeWindow(triggers.get(0));
        for (int i = 1; i < triggers.size(); i++) {
            window = window.span(realtimeWindow(triggers.get(i)));
        }
        return window;
    }

    public boolean isTrigger(Instant instant) {
        LocalDate day = LocalDate.ofInstant(instant, zone);
        return instant.equals(at(day, EARLY_TRIGGER)) || instant.equals(at(day, MIDDAY_TRIGGER));
    }

    private Instant at(LocalDate day, LocalTime time) {
        return ZonedDateTime.of(day, time, zone).toInstant();
    }
}
