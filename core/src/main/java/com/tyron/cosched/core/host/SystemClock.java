package com.tyron.cosched.core.host;

import com.tyron.cosched.api.host.SchedulerClock;

import java.util.concurrent.TimeUnit;

/**
 * {@link System#nanoTime()} based clock, in milliseconds since the clock was created.
 */
public final class SystemClock implements SchedulerClock {

    private final long originNanos = System.nanoTime();

    @Override
    public long nowMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - originNanos);
    }
}
