package com.tyron.cosched.core.concurrent;

import com.tyron.cosched.api.concurrent.PriorityLevel;
import com.tyron.cosched.api.concurrent.TaskHandle;
import com.tyron.cosched.api.concurrent.TaskState;
import com.tyron.cosched.api.concurrent.Work;
import com.tyron.cosched.api.concurrent.WorkResult;
import com.tyron.cosched.core.heap.PriorityHeap;

import java.util.Objects;

/**
 * A task owned by a {@link SchedulerImpl}. Callers only ever see it as a {@link TaskHandle}.
 * <p>
 * {@code sortIndex} is the start time while the task sits in the timer queue and the expiration
 * time while it sits in the ready queue. It is only written by {@link TaskQueues} when the task is
 * outside both heaps.
 */
final class ScheduledTask implements TaskHandle, PriorityHeap.Node {

    /**
     * Replaces the work of a cancelled task.
     */
    static final Work CANCELLED = didTimeout -> WorkResult.done();

    private final Object owner;
    private final long id;
    private final long startTime;

    private PriorityLevel priorityLevel;
    private long expirationTime;
    private long sortIndex;
    private Work work;
    private volatile TaskState state;

    ScheduledTask(Object owner, long id, Work work, PriorityLevel priorityLevel,
                  long startTime, long expirationTime) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.id = id;
        this.work = Objects.requireNonNull(work, "work");
        this.priorityLevel = Objects.requireNonNull(priorityLevel, "priorityLevel");
        this.startTime = startTime;
        this.expirationTime = expirationTime;
        this.sortIndex = startTime;
        this.state = TaskState.PENDING;
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public long sortIndex() {
        return sortIndex;
    }

    /**
     * {@code time + delta}, clamped to the {@code long} range.
     */
    static long addSaturated(long time, long delta) {
        try {
            return Math.addExact(time, delta);
        } catch (ArithmeticException e) {
            return delta > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }

    void setSortIndex(long sortIndex) {
        this.sortIndex = sortIndex;
    }

    @Override
    public PriorityLevel priorityLevel() {
        return priorityLevel;
    }

    @Override
    public long startTime() {
        return startTime;
    }

    @Override
    public long expirationTime() {
        return expirationTime;
    }

    /**
     * Used by priority aging only.
     */
    void boost(PriorityLevel level, long expirationTime) {
        this.priorityLevel = level;
        this.expirationTime = Math.min(this.expirationTime, expirationTime);
    }

    @Override
    public TaskState state() {
        return state;
    }

    void setState(TaskState state) {
        this.state = state;
    }

    Work work() {
        return work;
    }

    void setWork(Work work) {
        this.work = Objects.requireNonNull(work, "work");
    }

    /**
     * @return true if the work was replaced by {@link #CANCELLED}.
     */
    boolean isWorkCancelled() {
        return work == CANCELLED;
    }

    boolean isOwnedBy(Object scheduler) {
        return owner == scheduler;
    }

    @Override
    public String toString() {
        return "Task#" + id + "[" + priorityLevel + ", " + state
                + ", start=" + startTime + ", expires=" + expirationTime + "]";
    }
}
