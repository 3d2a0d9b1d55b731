package com.tyron.cosched.core.concurrent;

import com.tyron.cosched.api.concurrent.PriorityLevel;
import com.tyron.cosched.api.concurrent.ScheduleOptions;
import com.tyron.cosched.api.concurrent.Scheduler;
import com.tyron.cosched.api.concurrent.TaskHandle;
import com.tyron.cosched.api.concurrent.TaskState;
import com.tyron.cosched.api.concurrent.Work;
import com.tyron.cosched.api.diagnostics.SchedulerListener;
import com.tyron.cosched.api.host.Cancellable;
import com.tyron.cosched.api.host.HostBridge;
import com.tyron.cosched.core.config.SchedulerConfiguration;
import com.tyron.cosched.core.diagnostics.HostWatchdog;
import com.tyron.cosched.core.diagnostics.SchedulerListeners;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.TestOnly;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link Scheduler}.
 * <p>
 * Owns the task queues and the work loop; everything host-specific goes through the injected
 * {@link HostBridge}. At most one soon callback and one delayed callback are requested from the
 * host at any time.
 */
public final class SchedulerImpl implements Scheduler {

    private static final Logger LOG = Logger.getLogger(SchedulerImpl.class.getName());

    private final HostBridge host;
    private final SchedulerConfiguration configuration;
    private final boolean ownsHost;

    private final TaskQueues queues = new TaskQueues();
    private final ExecutionState state = new ExecutionState();
    private final SchedulerListeners listeners = new SchedulerListeners();
    private final WorkLoop workLoop;

    private long nextTaskId = 1;

    private boolean hostCallbackScheduled;
    private Cancellable hostCallback = Cancellable.NOOP;
    private volatile long hostCallbackRequestedAt = -1;
    private volatile long hostCallbackRequests;

    private boolean hostTimeoutScheduled;
    private Cancellable hostTimeout = Cancellable.NOOP;
    private volatile long hostTimeoutDueAt = -1;
    private volatile long hostTimeoutRequests;

    private final HostWatchdog watchdog;
    private volatile boolean disposed;

    public SchedulerImpl(HostBridge host) {
        this(host, SchedulerConfiguration.defaults(), false);
    }

    public SchedulerImpl(HostBridge host, SchedulerConfiguration configuration) {
        this(host, configuration, false);
    }

    /**
     * @param ownsHost if true, {@link #dispose()} also disposes {@code host}.
     */
    public SchedulerImpl(HostBridge host, SchedulerConfiguration configuration, boolean ownsHost) {
        this.host = Objects.requireNonNull(host, "host");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.ownsHost = ownsHost;
        this.workLoop = new WorkLoop(queues, host, state, listeners, new PriorityAging(configuration));

        if (configuration.watchdogEnabled()) {
            this.watchdog = new HostWatchdog(this, configuration.stallThresholdMillis(), listeners);
            this.watchdog.start(configuration.watchdogIntervalMillis());
        } else {
            this.watchdog = null;
        }
    }

    public SchedulerConfiguration getConfiguration() {
        return configuration;
    }

    public HostBridge getHost() {
        return host;
    }

    @Override
    public TaskHandle scheduleCallback(@Nullable PriorityLevel priority, Work work, ScheduleOptions options) {
        Objects.requireNonNull(work, "work");
        checkNotDisposed();

        PriorityLevel level = PriorityLevel.normalize(priority);
        long delay = options != null ? Math.max(0L, options.delayMillis()) : 0L;

        long currentTime = host.now();
        long startTime = ScheduledTask.addSaturated(currentTime, delay);
        long expirationTime = ScheduledTask.addSaturated(startTime, configuration.timeoutFor(level));

        ScheduledTask task = new ScheduledTask(this, nextTaskId++, work, level, startTime, expirationTime);

        if (startTime > currentTime) {
            queues.pushTimer(task);
            if (queues.isReadyEmpty() && queues.peekTimer() == task) {
                cancelHostTimeout();
                requestHostTimeout(startTime - currentTime);
            }
        } else {
            queues.pushReady(task);
            if (!hostCallbackScheduled && !state.performingWork) {
                requestHostCallback();
            }
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Scheduled " + task + (delay > 0 ? " with delay " + delay + "ms" : ""));
        }
        listeners.onTaskScheduled(task);
        return task;
    }

    @Override
    public void cancelCallback(@Nullable TaskHandle handle) {
        if (!(handle instanceof ScheduledTask task) || !task.isOwnedBy(this)) {
            return;
        }
        TaskState current = task.state();
        if (current.isTerminal() || task.isWorkCancelled()) {
            return;
        }

        task.setWork(ScheduledTask.CANCELLED);
        if (current == TaskState.RUNNING) {
            // the running invocation finishes; the work loop drops any continuation it returns
            return;
        }
        task.setState(TaskState.CANCELLED);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Cancelled " + task);
        }
        listeners.onTaskCancelled(task);
    }

    @Override
    public boolean shouldYield() {
        return host.shouldYieldNow();
    }

    @Override
    public PriorityLevel getCurrentPriorityLevel() {
        return state.currentPriorityLevel;
    }

    @Override
    public <T> T runWithPriority(@Nullable PriorityLevel priority, Callable<T> callable) throws Exception {
        Objects.requireNonNull(callable, "callable");
        PriorityLevel previous = state.currentPriorityLevel;
        state.currentPriorityLevel = PriorityLevel.normalize(priority);
        try {
            return callable.call();
        } finally {
            state.currentPriorityLevel = previous;
        }
    }

    @Override
    public void runWithPriority(@Nullable PriorityLevel priority, Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        PriorityLevel previous = state.currentPriorityLevel;
        state.currentPriorityLevel = PriorityLevel.normalize(priority);
        try {
            runnable.run();
        } finally {
            state.currentPriorityLevel = previous;
        }
    }

    @Override
    public <T> T next(Callable<T> callable) throws Exception {
        return runWithPriority(priorityForNext(), callable);
    }

    @Override
    public void next(Runnable runnable) {
        runWithPriority(priorityForNext(), runnable);
    }

    private PriorityLevel priorityForNext() {
        PriorityLevel current = state.currentPriorityLevel;
        switch (current) {
            case IMMEDIATE:
            case USER_BLOCKING:
            case NORMAL:
                return PriorityLevel.NORMAL;
            default:
                return current;
        }
    }

    @Override
    public Runnable wrapCallback(Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        PriorityLevel captured = state.currentPriorityLevel;
        return () -> runWithPriority(captured, runnable);
    }

    @Override
    public <T> Callable<T> wrapCallback(Callable<T> callable) {
        Objects.requireNonNull(callable, "callable");
        PriorityLevel captured = state.currentPriorityLevel;
        return () -> runWithPriority(captured, callable);
    }

    @Override
    public @Nullable TaskHandle getFirstCallbackNode() {
        return queues.peekReady();
    }

    @Override
    public void pauseExecution() {
        state.paused = true;
    }

    @Override
    public void continueExecution() {
        state.paused = false;
        if (disposed) {
            return;
        }
        if (!hostCallbackScheduled && !state.performingWork) {
            requestHostCallback();
        }
    }

    public boolean isPaused() {
        return state.paused;
    }

    @Override
    public void requestPaint() {
        host.requestPaint();
    }

    @Override
    public void forceFrameRate(int fps) {
        host.forceFrameRate(fps);
    }

    @Override
    public long now() {
        return host.now();
    }

    @Override
    public void addListener(SchedulerListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(SchedulerListener listener) {
        listeners.remove(listener);
    }

    /**
     * @return the time the pending soon callback was requested, or -1 if none is pending.
     */
    public long pendingHostCallbackSince() {
        return hostCallbackRequestedAt;
    }

    /**
     * @return the time the pending delayed callback is due, or -1 if none is pending.
     */
    public long pendingHostTimeoutDueAt() {
        return hostTimeoutDueAt;
    }

    /**
     * @return how many soon callbacks have been requested so far; identifies the pending one.
     */
    public long hostCallbackRequestCount() {
        return hostCallbackRequests;
    }

    /**
     * @return how many delayed callbacks have been requested so far; identifies the pending one.
     */
    public long hostTimeoutRequestCount() {
        return hostTimeoutRequests;
    }

    @TestOnly
    public int readyTaskCount() {
        return queues.readySize();
    }

    @TestOnly
    public int pendingTimerCount() {
        return queues.timerSize();
    }

    // --- Host callbacks ---

    private void performWorkUntilDeadline() {
        hostCallbackScheduled = false;
        hostCallback = Cancellable.NOOP;
        hostCallbackRequestedAt = -1;
        if (disposed) {
            return;
        }

        // the loop matures timers itself and re-arms the wake-up when it goes idle
        cancelHostTimeout();

        long initialTime = host.now();
        PriorityLevel previousPriority = state.currentPriorityLevel;
        state.performingWork = true;
        WorkLoop.FlushResult result;
        try {
            result = workLoop.flush(initialTime);
        } finally {
            state.currentTask = null;
            state.currentPriorityLevel = previousPriority;
            state.performingWork = false;
        }

        if (disposed) {
            return;
        }
        switch (result) {
            case MORE_WORK:
                if (!hostCallbackScheduled) {
                    requestHostCallback();
                }
                break;
            case IDLE:
                armTimerWakeUp();
                break;
            case PAUSED:
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Work loop paused with " + queues.readySize() + " ready task(s)");
                }
                break;
            case DISPOSED:
                break;
        }
    }

    private void handleTimeout() {
        hostTimeoutScheduled = false;
        hostTimeout = Cancellable.NOOP;
        hostTimeoutDueAt = -1;
        if (disposed || state.performingWork) {
            return;
        }

        queues.advanceTimers(host.now());
        if (!hostCallbackScheduled) {
            if (!queues.isReadyEmpty()) {
                requestHostCallback();
            } else {
                armTimerWakeUp();
            }
        }
    }

    private void armTimerWakeUp() {
        cancelHostTimeout();
        ScheduledTask firstTimer = queues.firstLiveTimer();
        if (firstTimer != null) {
            requestHostTimeout(Math.max(0L, firstTimer.startTime() - host.now()));
        }
    }

    private void requestHostCallback() {
        hostCallbackScheduled = true;
        hostCallbackRequests++;
        hostCallbackRequestedAt = host.now();
        hostCallback = host.requestSoonCallback(this::performWorkUntilDeadline);
    }

    private void requestHostTimeout(long delayMillis) {
        hostTimeoutScheduled = true;
        hostTimeoutRequests++;
        hostTimeoutDueAt = ScheduledTask.addSaturated(host.now(), delayMillis);
        hostTimeout = host.requestDelayedCallback(this::handleTimeout, delayMillis);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Requested host wake-up in " + delayMillis + "ms");
        }
    }

    private void cancelHostTimeout() {
        if (hostTimeoutScheduled) {
            hostTimeout.cancel();
        }
        hostTimeoutScheduled = false;
        hostTimeout = Cancellable.NOOP;
        hostTimeoutDueAt = -1;
    }

    private void checkNotDisposed() {
        if (disposed) {
            throw new IllegalStateException("Scheduler is disposed");
        }
    }

    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        state.disposed = true;

        ScheduledTask running = state.currentTask;
        if (running != null) {
            running.setWork(ScheduledTask.CANCELLED);
        }

        if (hostCallbackScheduled) {
            hostCallback.cancel();
        }
        hostCallbackScheduled = false;
        hostCallback = Cancellable.NOOP;
        hostCallbackRequestedAt = -1;
        cancelHostTimeout();

        for (ScheduledTask task : queues.drainAll()) {
            if (!task.state().isTerminal()) {
                task.setWork(ScheduledTask.CANCELLED);
                task.setState(TaskState.CANCELLED);
            }
        }

        if (watchdog != null) {
            watchdog.dispose();
        }
        listeners.clear();

        if (ownsHost) {
            host.dispose();
        }
    }

    public boolean isDisposed() {
        return disposed;
    }
}
