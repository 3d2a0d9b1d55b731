package com.tyron.cosched.api.host;

/**
 * Monotonic time source, in milliseconds.
 * <p>
 * Values are only meaningful relative to each other; they must never go backwards.
 */
@FunctionalInterface
public interface SchedulerClock {

    long nowMillis();
}
