package com.tyron.cosched.core.host;

import com.tyron.cosched.api.host.HostBridge;
import com.tyron.cosched.api.host.SchedulerClock;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Slice bookkeeping shared by host bridges.
 * <p>
 * Subclasses wrap every soon callback in {@link #runSlice(Runnable)}; the slice budget, paint
 * requests and the pending-input signal are then handled here.
 */
public abstract class AbstractHostBridge implements HostBridge {

    private static final Logger LOG = Logger.getLogger(AbstractHostBridge.class.getName());

    public static final int MAX_FRAME_RATE = 125;

    private final SchedulerClock clock;
    private final long defaultFrameIntervalMillis;

    private volatile long frameIntervalMillis;
    private volatile long sliceStartMillis = -1;
    private volatile boolean needsPaint;
    private volatile boolean inputPending;

    protected AbstractHostBridge(SchedulerClock clock, long frameIntervalMillis) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (frameIntervalMillis <= 0) {
            throw new IllegalArgumentException("frameIntervalMillis must be > 0");
        }
        this.defaultFrameIntervalMillis = frameIntervalMillis;
        this.frameIntervalMillis = frameIntervalMillis;
    }

    @Override
    public long now() {
        return clock.nowMillis();
    }

    public SchedulerClock clock() {
        return clock;
    }

    @Override
    public boolean shouldYieldNow() {
        if (needsPaint || inputPending) {
            return true;
        }
        long start = sliceStartMillis;
        if (start < 0) {
            // not inside a slice
            return false;
        }
        return clock.nowMillis() - start >= frameIntervalMillis;
    }

    @Override
    public void requestPaint() {
        needsPaint = true;
    }

    /**
     * Signals that the host has input waiting. The running slice yields at its next check.
     */
    public void notifyPendingInput() {
        inputPending = true;
    }

    @Override
    public void forceFrameRate(int fps) {
        if (fps < 0 || fps > MAX_FRAME_RATE) {
            LOG.severe("forceFrameRate takes a positive int between 0 and " + MAX_FRAME_RATE
                    + ", forcing frame rates higher than " + MAX_FRAME_RATE + " fps is not supported; got " + fps);
            return;
        }
        frameIntervalMillis = fps > 0 ? 1000 / fps : defaultFrameIntervalMillis;
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Frame interval set to " + frameIntervalMillis + "ms (fps=" + fps + ")");
        }
    }

    public long frameIntervalMillis() {
        return frameIntervalMillis;
    }

    /**
     * Runs one slice: resets the budget, the paint request and the input signal, then runs
     * {@code callback}.
     */
    protected final void runSlice(Runnable callback) {
        sliceStartMillis = clock.nowMillis();
        needsPaint = false;
        inputPending = false;
        try {
            callback.run();
        } finally {
            sliceStartMillis = -1;
        }
    }
}
