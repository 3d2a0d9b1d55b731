package com.tyron.cosched.core.diagnostics;

import com.tyron.cosched.api.concurrent.TaskHandle;
import com.tyron.cosched.api.diagnostics.HostStall;
import com.tyron.cosched.api.diagnostics.SchedulerListener;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans events out to registered listeners. A listener that throws is logged and skipped; it never
 * interrupts the scheduler or the other listeners.
 */
public final class SchedulerListeners implements SchedulerListener {

    private static final Logger LOG = Logger.getLogger(SchedulerListeners.class.getName());

    private final List<SchedulerListener> listeners = new CopyOnWriteArrayList<>();

    public void add(SchedulerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void remove(SchedulerListener listener) {
        listeners.remove(listener);
    }

    public boolean isEmpty() {
        return listeners.isEmpty();
    }

    public void clear() {
        listeners.clear();
    }

    @Override
    public void onTaskScheduled(TaskHandle task) {
        dispatch("onTaskScheduled", l -> l.onTaskScheduled(task));
    }

    @Override
    public void onTaskStarted(TaskHandle task, boolean didTimeout) {
        dispatch("onTaskStarted", l -> l.onTaskStarted(task, didTimeout));
    }

    @Override
    public void onTaskYielded(TaskHandle task) {
        dispatch("onTaskYielded", l -> l.onTaskYielded(task));
    }

    @Override
    public void onTaskCompleted(TaskHandle task) {
        dispatch("onTaskCompleted", l -> l.onTaskCompleted(task));
    }

    @Override
    public void onTaskCancelled(TaskHandle task) {
        dispatch("onTaskCancelled", l -> l.onTaskCancelled(task));
    }

    @Override
    public void onTaskFailed(TaskHandle task, Throwable error) {
        dispatch("onTaskFailed", l -> l.onTaskFailed(task, error));
    }

    @Override
    public void onHostStall(HostStall stall) {
        dispatch("onHostStall", l -> l.onHostStall(stall));
    }

    private void dispatch(String event, Consumer<SchedulerListener> call) {
        for (SchedulerListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (Throwable t) {
                LOG.log(Level.WARNING, "Listener " + listener.getClass().getName() + " failed in " + event, t);
            }
        }
    }
}
