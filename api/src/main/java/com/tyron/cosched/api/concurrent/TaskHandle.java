package com.tyron.cosched.api.concurrent;

/**
 * Opaque handle for a scheduled task. Pass it to {@link Scheduler#cancelCallback(TaskHandle)}.
 */
public interface TaskHandle {

    /**
     * @return insertion-order id, unique within the scheduler that created the task.
     */
    long id();

    PriorityLevel priorityLevel();

    /**
     * @return time (scheduler clock, ms) at which the task became or becomes eligible to run.
     */
    long startTime();

    /**
     * @return time (scheduler clock, ms) after which the task runs even if the host wants to yield.
     */
    long expirationTime();

    TaskState state();

    default boolean isCancelled() {
        return state() == TaskState.CANCELLED;
    }
}
