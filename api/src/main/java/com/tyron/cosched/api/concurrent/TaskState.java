package com.tyron.cosched.api.concurrent;

/**
 * Lifecycle of a scheduled task.
 */
public enum TaskState {
    /** In the timer queue, start time still in the future. */
    PENDING,
    /** In the ready queue. A task that yielded with a continuation is back in this state. */
    READY,
    /** Its work is executing right now. */
    RUNNING,
    COMPLETED,
    CANCELLED,
    /** Its work threw; the error was reported to listeners. */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
