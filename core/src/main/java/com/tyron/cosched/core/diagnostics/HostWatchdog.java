package com.tyron.cosched.core.diagnostics;

import com.tyron.cosched.api.diagnostics.HostStall;
import com.tyron.cosched.api.diagnostics.SchedulerListener;
import com.tyron.cosched.api.service.Disposable;
import com.tyron.cosched.core.concurrent.SchedulerImpl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Notices host callbacks that were requested but never delivered.
 * <p>
 * A soon callback is stalled once it has been pending for longer than the threshold, a delayed
 * callback once it is that far past its due time. Each request is reported at most once; requests
 * are told apart by the scheduler's request counters, not by their timestamps.
 */
public final class HostWatchdog implements Disposable {

    private static final Logger LOG = Logger.getLogger(HostWatchdog.class.getName());

    private final SchedulerImpl scheduler;
    private final long stallThresholdMillis;
    private final SchedulerListener sink;

    private volatile long reportedSoonRequest = -1;
    private volatile long reportedDelayedRequest = -1;

    private ScheduledExecutorService timer;

    public HostWatchdog(SchedulerImpl scheduler, long stallThresholdMillis, SchedulerListener sink) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (stallThresholdMillis <= 0) {
            throw new IllegalArgumentException("stallThresholdMillis must be > 0");
        }
        this.stallThresholdMillis = stallThresholdMillis;
    }

    /**
     * Checks the scheduler's pending host requests once.
     *
     * @return the stalls found by this check that had not been reported before.
     */
    public List<HostStall> check() {
        List<HostStall> stalls = new ArrayList<>(2);
        long now = scheduler.now();

        long soonRequest = scheduler.hostCallbackRequestCount();
        long soonSince = scheduler.pendingHostCallbackSince();
        if (soonSince >= 0 && soonRequest != reportedSoonRequest && now - soonSince > stallThresholdMillis
                && soonRequest == scheduler.hostCallbackRequestCount()) {
            reportedSoonRequest = soonRequest;
            stalls.add(new HostStall(HostStall.Kind.SOON_CALLBACK, soonSince, now - soonSince));
        }

        long delayedRequest = scheduler.hostTimeoutRequestCount();
        long delayedDue = scheduler.pendingHostTimeoutDueAt();
        if (delayedDue >= 0 && delayedRequest != reportedDelayedRequest && now - delayedDue > stallThresholdMillis
                && delayedRequest == scheduler.hostTimeoutRequestCount()) {
            reportedDelayedRequest = delayedRequest;
            stalls.add(new HostStall(HostStall.Kind.DELAYED_CALLBACK, delayedDue, now - delayedDue));
        }

        for (HostStall stall : stalls) {
            LOG.warning("Host did not deliver a " + stall.kind() + " expected at t=" + stall.expectedAtMillis()
                    + " (" + stall.overdueMillis() + "ms overdue)");
            sink.onHostStall(stall);
        }
        return stalls;
    }

    /**
     * Runs {@link #check()} every {@code intervalMillis} on a daemon thread until disposed.
     */
    public synchronized void start(long intervalMillis) {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("intervalMillis must be > 0");
        }
        if (timer != null) {
            throw new IllegalStateException("Watchdog already started");
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cosched-watchdog");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleWithFixedDelay(this::checkSafely, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Watchdog started, threshold " + stallThresholdMillis + "ms, interval " + intervalMillis + "ms");
        }
    }

    private void checkSafely() {
        try {
            check();
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            LOG.log(Level.WARNING, "Watchdog check failed", e);
        }
    }

    public synchronized boolean isRunning() {
        return timer != null && !timer.isShutdown();
    }

    @Override
    public synchronized void dispose() {
        if (timer != null) {
            timer.shutdownNow();
        }
    }
}
