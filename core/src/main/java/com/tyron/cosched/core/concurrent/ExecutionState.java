package com.tyron.cosched.core.concurrent;

import com.tyron.cosched.api.concurrent.PriorityLevel;
import org.jetbrains.annotations.Nullable;

/**
 * Mutable state shared by {@link SchedulerImpl} and {@link WorkLoop}: what is running, at which
 * priority, and whether execution is paused or the scheduler disposed.
 */
final class ExecutionState {

    @Nullable ScheduledTask currentTask;
    PriorityLevel currentPriorityLevel = PriorityLevel.NORMAL;
    boolean paused;
    boolean performingWork;
    boolean disposed;
}
