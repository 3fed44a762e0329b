package io.bankseed.model;

/**
 * How a task came to exist: the timer firing on time, an operator request, or a catch-up
 * for triggers that were missed while nothing was running.
 */
public enum ScheduleKind {
    FIXED_TIME,
    MANUAL,
    MANUAL_CATCHUP
}
