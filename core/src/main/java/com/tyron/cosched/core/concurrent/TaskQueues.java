package com.tyron.cosched.core.concurrent;

import com.tyron.cosched.api.concurrent.TaskState;
import com.tyron.cosched.core.heap.PriorityHeap;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * The ready queue (eligible tasks, keyed by expiration time) and the timer queue (delayed tasks,
 * keyed by start time).
 * <p>
 * A live task is in at most one of the two heaps. Cancelled tasks are not searched for; they are
 * dropped when they reach the top of a heap.
 */
final class TaskQueues {

    private final PriorityHeap<ScheduledTask> readyQueue = new PriorityHeap<>();
    private final PriorityHeap<ScheduledTask> timerQueue = new PriorityHeap<>();

    void pushReady(ScheduledTask task) {
        task.setSortIndex(task.expirationTime());
        task.setState(TaskState.READY);
        readyQueue.push(task);
    }

    void pushTimer(ScheduledTask task) {
        task.setSortIndex(task.startTime());
        task.setState(TaskState.PENDING);
        timerQueue.push(task);
    }

    /**
     * Puts a task that yielded back into the ready queue without touching its sort index, so it
     * keeps its place relative to tasks scheduled after it.
     */
    void requeueContinuation(ScheduledTask task) {
        task.setState(TaskState.READY);
        readyQueue.push(task);
    }

    @Nullable ScheduledTask peekReady() {
        return readyQueue.peek();
    }

    @Nullable ScheduledTask popReady() {
        return readyQueue.pop();
    }

    @Nullable ScheduledTask peekTimer() {
        return timerQueue.peek();
    }

    boolean isReadyEmpty() {
        return readyQueue.isEmpty();
    }

    boolean isTimerEmpty() {
        return timerQueue.isEmpty();
    }

    int readySize() {
        return readyQueue.size();
    }

    int timerSize() {
        return timerQueue.size();
    }

    /**
     * Moves every timer whose start time has passed into the ready queue and discards cancelled
     * timers found on the way.
     *
     * @return the number of tasks that became ready.
     */
    int advanceTimers(long now) {
        int matured = 0;
        ScheduledTask timer = timerQueue.peek();
        while (timer != null) {
            if (timer.isWorkCancelled()) {
                timerQueue.pop();
            } else if (timer.startTime() <= now) {
                timerQueue.pop();
                pushReady(timer);
                matured++;
            } else {
                return matured;
            }
            timer = timerQueue.peek();
        }
        return matured;
    }

    /**
     * @return the earliest timer that has not been cancelled, dropping cancelled ones in front of it.
     */
    @Nullable ScheduledTask firstLiveTimer() {
        ScheduledTask timer = timerQueue.peek();
        while (timer != null && timer.isWorkCancelled()) {
            timerQueue.pop();
            timer = timerQueue.peek();
        }
        return timer;
    }

    boolean anyReady(Predicate<ScheduledTask> predicate) {
        return readyQueue.anyMatch(predicate);
    }

    /**
     * Lets {@code adjust} rewrite every ready task's priority and expiration, then rebuilds the
     * ready heap. Cancelled tasks are dropped along the way.
     */
    void rebuildReady(Consumer<ScheduledTask> adjust) {
        List<ScheduledTask> all = readyQueue.drain();
        for (ScheduledTask task : all) {
            if (task.isWorkCancelled()) {
                continue;
            }
            adjust.accept(task);
            pushReady(task);
        }
    }

    /**
     * Empties both queues.
     *
     * @return every task that was queued, ready ones first.
     */
    List<ScheduledTask> drainAll() {
        List<ScheduledTask> all = new ArrayList<>(readyQueue.drain());
        all.addAll(timerQueue.drain());
        return all;
    }
}
