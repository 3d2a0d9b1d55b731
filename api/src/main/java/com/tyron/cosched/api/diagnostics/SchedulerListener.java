package com.tyron.cosched.api.diagnostics;

import com.tyron.cosched.api.concurrent.TaskHandle;

/**
 * Listener for task lifecycle and host health events.
 *
 * <p>Callbacks run on the scheduler's thread, except {@link #onHostStall(HostStall)} which runs on
 * the watchdog's timer thread. Exceptions thrown by listeners are logged and otherwise ignored.
 */
public interface SchedulerListener {

    default void onTaskScheduled(TaskHandle task) {
    }

    /** Called right before the task's work is invoked. */
    default void onTaskStarted(TaskHandle task, boolean didTimeout) {
    }

    /** The work returned a continuation and the task went back to the ready queue. */
    default void onTaskYielded(TaskHandle task) {
    }

    default void onTaskCompleted(TaskHandle task) {
    }

    default void onTaskCancelled(TaskHandle task) {
    }

    /** The work threw. The task is dropped and the work loop carries on with the next task. */
    default void onTaskFailed(TaskHandle task, Throwable error) {
    }

    default void onHostStall(HostStall stall) {
    }
}
