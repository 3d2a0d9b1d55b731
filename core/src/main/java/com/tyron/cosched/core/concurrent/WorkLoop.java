package com.tyron.cosched.core.concurrent;

import com.tyron.cosched.api.concurrent.TaskState;
import com.tyron.cosched.api.concurrent.Work;
import com.tyron.cosched.api.concurrent.WorkResult;
import com.tyron.cosched.api.host.HostBridge;
import com.tyron.cosched.core.diagnostics.SchedulerListeners;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs ready tasks in expiration order for one host slice.
 * <p>
 * Between tasks the loop asks the host whether it should yield. It only ignores that request for
 * tasks that have already expired, which bounds how long any ready task can be postponed by its
 * level's timeout.
 */
final class WorkLoop {

    private static final Logger LOG = Logger.getLogger(WorkLoop.class.getName());

    enum FlushResult {
        /** The ready queue is empty. Timers may still be pending. */
        IDLE,
        /** The loop yielded to the host with ready work left. */
        MORE_WORK,
        /** Execution is paused; ready work is left untouched. */
        PAUSED,
        /** The scheduler was disposed during the slice. */
        DISPOSED
    }

    private final TaskQueues queues;
    private final HostBridge host;
    private final ExecutionState state;
    private final SchedulerListeners listeners;
    private final PriorityAging aging;

    WorkLoop(TaskQueues queues, HostBridge host, ExecutionState state,
             SchedulerListeners listeners, PriorityAging aging) {
        this.queues = Objects.requireNonNull(queues, "queues");
        this.host = Objects.requireNonNull(host, "host");
        this.state = Objects.requireNonNull(state, "state");
        this.listeners = Objects.requireNonNull(listeners, "listeners");
        this.aging = Objects.requireNonNull(aging, "aging");
    }

    FlushResult flush(long initialTime) {
        long currentTime = initialTime;
        advance(currentTime);

        ScheduledTask task = queues.peekReady();
        while (task != null) {
            if (state.disposed) {
                return FlushResult.DISPOSED;
            }
            if (state.paused) {
                return FlushResult.PAUSED;
            }

            if (task.isWorkCancelled()) {
                queues.popReady();
                task = queues.peekReady();
                continue;
            }

            if (task.expirationTime() > currentTime && host.shouldYieldNow()) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Yielding to host at t=" + currentTime + ", next " + task);
                }
                return FlushResult.MORE_WORK;
            }

            queues.popReady();
            currentTime = run(task, currentTime);
            advance(currentTime);

            task = queues.peekReady();
        }
        return FlushResult.IDLE;
    }

    /**
     * @return the time after the task ran.
     */
    private long run(ScheduledTask task, long currentTime) {
        Work work = task.work();
        boolean didTimeout = task.expirationTime() <= currentTime;

        task.setState(TaskState.RUNNING);
        state.currentTask = task;
        state.currentPriorityLevel = task.priorityLevel();
        listeners.onTaskStarted(task, didTimeout);

        WorkResult result;
        try {
            result = work.perform(didTimeout);
        } catch (Throwable t) {
            task.setState(TaskState.FAILED);
            LOG.log(Level.WARNING, "Work of " + task + " threw; dropping the task", t);
            listeners.onTaskFailed(task, t);
            return host.now();
        } finally {
            state.currentTask = null;
        }

        long now = host.now();
        Work continuation = result != null ? result.continuation() : null;

        if (continuation == null) {
            task.setState(TaskState.COMPLETED);
            listeners.onTaskCompleted(task);
        } else if (task.isWorkCancelled() || state.disposed) {
            // cancelled or disposed while running: the continuation must never run
            task.setState(TaskState.CANCELLED);
            listeners.onTaskCancelled(task);
        } else {
            task.setWork(continuation);
            queues.requeueContinuation(task);
            listeners.onTaskYielded(task);
        }
        return now;
    }

    private void advance(long currentTime) {
        queues.advanceTimers(currentTime);
        aging.maybeAge(queues, currentTime);
    }
}
