package com.tyron.cosched.core.host;

import com.tyron.cosched.api.host.Cancellable;
import com.tyron.cosched.api.host.SchedulerClock;

import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Host bridge backed by a single daemon thread acting as the event loop.
 * <p>
 * Soon callbacks are queued to the loop thread, delayed callbacks go through its timer. Code that
 * talks to a scheduler bound to this host must run on the loop thread; use {@link #execute(Runnable)}
 * to get there.
 */
public final class EventLoopHostBridge extends AbstractHostBridge {

    private static final Logger LOG = Logger.getLogger(EventLoopHostBridge.class.getName());

    private final String name;
    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread loopThread;

    public EventLoopHostBridge(long frameIntervalMillis) {
        this("cosched-host", new SystemClock(), frameIntervalMillis);
    }

    public EventLoopHostBridge(String name, SchedulerClock clock, long frameIntervalMillis) {
        super(clock, frameIntervalMillis);
        this.name = Objects.requireNonNull(name, "name");
        this.executor = new ScheduledThreadPoolExecutor(1, createThreadFactory(name));
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    private ThreadFactory createThreadFactory(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            loopThread = t;
            return t;
        };
    }

    @Override
    public Cancellable requestSoonCallback(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        return submit(() -> runSlice(callback), 0L);
    }

    @Override
    public Cancellable requestDelayedCallback(Runnable callback, long delayMillis) {
        Objects.requireNonNull(callback, "callback");
        return submit(callback, Math.max(0L, delayMillis));
    }

    /**
     * Runs {@code runnable} on the loop thread, outside of any slice.
     */
    public void execute(Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        submit(runnable, 0L);
    }

    /**
     * @return true if the caller is running on this host's loop thread.
     */
    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    public boolean isDisposed() {
        return executor.isShutdown();
    }

    private Cancellable submit(Runnable runnable, long delayMillis) {
        Runnable guarded = () -> {
            try {
                runnable.run();
            } catch (Throwable t) {
                LOG.log(Level.SEVERE, "Unexpected error on host thread " + name, t);
            }
        };

        Future<?> future;
        try {
            if (delayMillis > 0) {
                future = executor.schedule(guarded, delayMillis, TimeUnit.MILLISECONDS);
            } else {
                future = executor.submit(guarded);
            }
        } catch (RejectedExecutionException e) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Host " + name + " is disposed; dropping callback");
            }
            return Cancellable.NOOP;
        }
        return () -> future.cancel(false);
    }

    @Override
    public void dispose() {
        if (executor.isShutdown()) {
            return;
        }
        executor.shutdownNow();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Host " + name + " disposed");
        }
    }

    /**
     * Waits for the loop thread to finish after {@link #dispose()}.
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }
}
