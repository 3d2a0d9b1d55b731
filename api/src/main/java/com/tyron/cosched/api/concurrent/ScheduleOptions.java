package com.tyron.cosched.api.concurrent;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable options for {@link Scheduler#scheduleCallback(PriorityLevel, Work, ScheduleOptions)}.
 */
public final class ScheduleOptions {

    private static final ScheduleOptions NONE = new ScheduleOptions(0L);

    private final long delayMillis;

    private ScheduleOptions(long delayMillis) {
        this.delayMillis = delayMillis;
    }

    public static ScheduleOptions none() {
        return NONE;
    }

    /**
     * Negative delays are clamped to zero.
     */
    public static ScheduleOptions withDelay(long delayMillis) {
        if (delayMillis <= 0) return NONE;
        return new ScheduleOptions(delayMillis);
    }

    public static ScheduleOptions withDelay(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) return NONE;
        try {
            return withDelay(delay.toMillis());
        } catch (ArithmeticException e) {
            // longer than Long.MAX_VALUE milliseconds
            return withDelay(Long.MAX_VALUE);
        }
    }

    public long delayMillis() {
        return delayMillis;
    }

    @Override
    public String toString() {
        return "ScheduleOptions[delayMillis=" + delayMillis + "]";
    }
}
