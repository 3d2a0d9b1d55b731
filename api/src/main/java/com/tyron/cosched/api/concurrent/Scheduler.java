package com.tyron.cosched.api.concurrent;

import com.tyron.cosched.api.diagnostics.SchedulerListener;
import com.tyron.cosched.api.service.Disposable;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.Callable;

/**
 * Cooperative, priority-ordered scheduler for work running on a single logical thread.
 *
 * Threading contract:
 * - All methods must be called from the host's thread (the thread the host bridge runs its
 *   callbacks on). Calls made from inside running work are fine.
 * - Nothing here blocks; work that needs to wait returns a continuation or schedules a delayed task.
 *
 * Ordering:
 * - Ready tasks run in order of expiration time ({@code startTime + timeout(priority)}), ties in
 *   submission order.
 * - Between tasks the scheduler yields to the host when asked to, unless the next task has expired.
 */
public interface Scheduler extends Disposable {

    /**
     * Schedules {@code work} at the given priority. A {@code null} priority is treated as
     * {@link PriorityLevel#NORMAL}; a negative delay as no delay.
     *
     * @return the handle to cancel the task with.
     */
    TaskHandle scheduleCallback(@Nullable PriorityLevel priority, Work work, ScheduleOptions options);

    default TaskHandle scheduleCallback(@Nullable PriorityLevel priority, Work work) {
        return scheduleCallback(priority, work, ScheduleOptions.none());
    }

    /**
     * Raw numeric priorities (1..5). Unknown values fall back to {@link PriorityLevel#NORMAL}.
     */
    default TaskHandle scheduleCallback(int priority, Work work, ScheduleOptions options) {
        return scheduleCallback(PriorityLevel.fromValue(priority), work, options);
    }

    /**
     * Schedules {@code work} at the current priority (see {@link #runWithPriority}).
     */
    default TaskHandle scheduleCallback(Work work) {
        return scheduleCallback(getCurrentPriorityLevel(), work, ScheduleOptions.none());
    }

    /**
     * Prevents any future invocation of the task, including resumption of a continuation.
     * Work that is already executing is not interrupted.
     * Cancelling twice, or cancelling a finished task, does nothing.
     */
    void cancelCallback(@Nullable TaskHandle handle);

    /**
     * @return true if running work should return a continuation and let the host breathe.
     */
    boolean shouldYield();

    /**
     * @return the priority of the task currently executing, the priority set by an enclosing
     * {@link #runWithPriority} call, or {@link PriorityLevel#NORMAL}.
     */
    PriorityLevel getCurrentPriorityLevel();

    /**
     * Runs {@code callable} synchronously with the current priority set to {@code priority},
     * restoring the previous priority afterwards.
     */
    <T> T runWithPriority(@Nullable PriorityLevel priority, Callable<T> callable) throws Exception;

    void runWithPriority(@Nullable PriorityLevel priority, Runnable runnable);

    /**
     * Runs {@code callable} at a priority no more urgent than {@link PriorityLevel#NORMAL}.
     */
    <T> T next(Callable<T> callable) throws Exception;

    void next(Runnable runnable);

    /**
     * @return a runnable that, whenever invoked, runs {@code runnable} at the priority that is
     * current now.
     */
    Runnable wrapCallback(Runnable runnable);

    <T> Callable<T> wrapCallback(Callable<T> callable);

    /**
     * @return the ready task that would run next, or {@code null}.
     */
    @Nullable TaskHandle getFirstCallbackNode();

    /**
     * Stops running tasks until {@link #continueExecution()}. Scheduling still works.
     */
    void pauseExecution();

    void continueExecution();

    /**
     * Asks the host to yield soon so it can paint.
     */
    void requestPaint();

    /**
     * @see com.tyron.cosched.api.host.HostBridge#forceFrameRate(int)
     */
    void forceFrameRate(int fps);

    /**
     * @return the scheduler's current time in milliseconds.
     */
    long now();

    void addListener(SchedulerListener listener);

    void removeListener(SchedulerListener listener);
}
