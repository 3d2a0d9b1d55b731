package com.tyron.cosched.core.concurrent;

import com.tyron.cosched.api.concurrent.PriorityLevel;
import com.tyron.cosched.core.config.SchedulerConfiguration;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Optional starvation guard on top of expiration ordering.
 * <p>
 * Every ready task that has been eligible for at least the configured threshold moves one level
 * up ({@link PriorityLevel#boosted()}) and its expiration time shrinks to what the new level allows.
 * The pass runs at most once per configured interval and rebuilds the ready heap only when some
 * task is boosted.
 */
final class PriorityAging {

    private static final Logger LOG = Logger.getLogger(PriorityAging.class.getName());

    private final SchedulerConfiguration configuration;
    private long lastPassAt = Long.MIN_VALUE;

    PriorityAging(SchedulerConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    boolean isEnabled() {
        return configuration.agingEnabled();
    }

    /**
     * @return the number of tasks boosted.
     */
    int maybeAge(TaskQueues queues, long now) {
        if (!isEnabled() || queues.isReadyEmpty()) {
            return 0;
        }
        if (lastPassAt != Long.MIN_VALUE && now - lastPassAt < configuration.agingIntervalMillis()) {
            return 0;
        }
        lastPassAt = now;

        if (!queues.anyReady(task -> isDue(task, now))) {
            return 0;
        }

        int[] boosted = {0};
        queues.rebuildReady(task -> {
            if (!isDue(task, now)) {
                return;
            }
            PriorityLevel next = task.priorityLevel().boosted();
            task.boost(next, ScheduledTask.addSaturated(task.startTime(), configuration.timeoutFor(next)));
            boosted[0]++;
        });

        if (boosted[0] > 0 && LOG.isLoggable(Level.FINE)) {
            LOG.fine("Aging boosted " + boosted[0] + " ready task(s) at t=" + now);
        }
        return boosted[0];
    }

    private boolean isDue(ScheduledTask task, long now) {
        return !task.isWorkCancelled()
                && now - task.startTime() >= configuration.agingThresholdMillis()
                && task.priorityLevel().boosted() != task.priorityLevel();
    }
}
