package com.tyron.cosched.core.concurrent;

import com.tyron.cosched.api.concurrent.PriorityLevel;
import com.tyron.cosched.api.concurrent.TaskState;
import com.tyron.cosched.api.concurrent.Work;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TaskQueuesTest {

    private final Object owner = new Object();
    private long nextId = 1;

    private ScheduledTask task(PriorityLevel level, long startTime) {
        return new ScheduledTask(owner, nextId++, Work.of(() -> { }), level,
                startTime, startTime + level.defaultTimeoutMillis());
    }

    @Test
    public void testReadyQueueOrdersByExpiration() {
        TaskQueues queues = new TaskQueues();
        ScheduledTask low = task(PriorityLevel.LOW, 0);
        ScheduledTask normal = task(PriorityLevel.NORMAL, 0);
        ScheduledTask immediate = task(PriorityLevel.IMMEDIATE, 0);
        queues.pushReady(low);
        queues.pushReady(normal);
        queues.pushReady(immediate);

        Assertions.assertEquals(TaskState.READY, low.state());
        Assertions.assertSame(immediate, queues.popReady());
        Assertions.assertSame(normal, queues.popReady());
        Assertions.assertSame(low, queues.popReady());
        Assertions.assertTrue(queues.isReadyEmpty());
    }

    @Test
    public void testTimerMaturesOnlyAfterStartTime() {
        TaskQueues queues = new TaskQueues();
        ScheduledTask delayed = task(PriorityLevel.NORMAL, 50);
        queues.pushTimer(delayed);
        Assertions.assertEquals(TaskState.PENDING, delayed.state());

        Assertions.assertEquals(0, queues.advanceTimers(30));
        Assertions.assertTrue(queues.isReadyEmpty());
        Assertions.assertEquals(1, queues.timerSize());

        Assertions.assertEquals(1, queues.advanceTimers(60));
        Assertions.assertTrue(queues.isTimerEmpty());
        Assertions.assertSame(delayed, queues.peekReady());
        Assertions.assertEquals(TaskState.READY, delayed.state());
        Assertions.assertEquals(delayed.expirationTime(), delayed.sortIndex());
    }

    @Test
    public void testCancelledTimersAreDropped() {
        TaskQueues queues = new TaskQueues();
        ScheduledTask first = task(PriorityLevel.NORMAL, 10);
        ScheduledTask second = task(PriorityLevel.NORMAL, 20);
        queues.pushTimer(first);
        queues.pushTimer(second);
        first.setWork(ScheduledTask.CANCELLED);

        Assertions.assertSame(second, queues.firstLiveTimer());
        Assertions.assertEquals(1, queues.timerSize());

        second.setWork(ScheduledTask.CANCELLED);
        Assertions.assertEquals(0, queues.advanceTimers(100));
        Assertions.assertTrue(queues.isTimerEmpty());
        Assertions.assertTrue(queues.isReadyEmpty());
    }

    @Test
    public void testContinuationKeepsItsPlace() {
        TaskQueues queues = new TaskQueues();
        ScheduledTask first = task(PriorityLevel.NORMAL, 0);
        ScheduledTask second = task(PriorityLevel.NORMAL, 0);
        queues.pushReady(first);
        queues.pushReady(second);

        Assertions.assertSame(first, queues.popReady());
        queues.requeueContinuation(first);
        Assertions.assertSame(first, queues.popReady());
        Assertions.assertSame(second, queues.popReady());
    }

    @Test
    public void testRebuildReadyDropsCancelledAndReorders() {
        TaskQueues queues = new TaskQueues();
        ScheduledTask low = task(PriorityLevel.LOW, 0);
        ScheduledTask normal = task(PriorityLevel.NORMAL, 0);
        ScheduledTask cancelled = task(PriorityLevel.USER_BLOCKING, 0);
        queues.pushReady(low);
        queues.pushReady(normal);
        queues.pushReady(cancelled);
        cancelled.setWork(ScheduledTask.CANCELLED);

        queues.rebuildReady(t -> {
            if (t == low) {
                t.boost(PriorityLevel.USER_BLOCKING, 100);
            }
        });

        Assertions.assertEquals(2, queues.readySize());
        Assertions.assertSame(low, queues.popReady());
        Assertions.assertEquals(PriorityLevel.USER_BLOCKING, low.priorityLevel());
        Assertions.assertSame(normal, queues.popReady());
    }

    @Test
    public void testDrainAllEmptiesBothQueues() {
        TaskQueues queues = new TaskQueues();
        queues.pushReady(task(PriorityLevel.NORMAL, 0));
        queues.pushTimer(task(PriorityLevel.NORMAL, 100));

        Assertions.assertEquals(2, queues.drainAll().size());
        Assertions.assertTrue(queues.isReadyEmpty());
        Assertions.assertTrue(queues.isTimerEmpty());
    }
}
