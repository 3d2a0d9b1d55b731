package com.tyron.cosched.api.host;

import com.tyron.cosched.api.service.Disposable;

/**
 * The narrow surface a {@link com.tyron.cosched.api.concurrent.Scheduler} needs from the
 * environment it is embedded in (an event loop, a UI thread, a test harness).
 *
 * Threading contract:
 * - Callbacks are invoked on the host's single logical thread, never concurrently with each other.
 * - {@link #shouldYieldNow()} and {@link #now()} are called from that same thread.
 * - Implementations must eventually invoke every requested callback that is not cancelled.
 */
public interface HostBridge extends Disposable {

    /**
     * Invoke {@code callback} at the next opportunity the host has to give control back
     * (the next turn of the event loop, before the next paint, ...).
     * Each invocation starts a new execution slice.
     */
    Cancellable requestSoonCallback(Runnable callback);

    /**
     * Invoke {@code callback} no earlier than {@code delayMillis} from now.
     */
    Cancellable requestDelayedCallback(Runnable callback, long delayMillis);

    /**
     * @return true if the current slice has used up its time budget, a paint was requested,
     * or the host has pending input that should be handled first.
     */
    boolean shouldYieldNow();

    /**
     * @return the host's monotonic time in milliseconds.
     */
    long now();

    /**
     * Ask the host to yield at the next opportunity so that it can paint.
     */
    void requestPaint();

    /**
     * Changes the slice budget to match the given frame rate.
     * <p>
     * {@code 0} restores the configured budget. Values outside {@code [0, 125]} are ignored.
     */
    void forceFrameRate(int fps);
}
