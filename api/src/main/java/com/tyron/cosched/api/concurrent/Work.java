package com.tyron.cosched.api.concurrent;

import java.util.Objects;

/**
 * A unit of schedulable work.
 * <p>
 * Long-running work should check {@link Scheduler#shouldYield()} and, when asked to yield, return
 * {@link WorkResult#continueWith(Work)} with a continuation that picks up where it left off.
 */
@FunctionalInterface
public interface Work {

    /**
     * @param didTimeout true if the task is running because its expiration time has passed.
     * @return {@link WorkResult#done()} when finished, or a continuation. {@code null} counts as done.
     */
    WorkResult perform(boolean didTimeout) throws Exception;

    /**
     * Adapts a runnable into work that always finishes in one invocation.
     */
    static Work of(Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        return didTimeout -> {
            runnable.run();
            return WorkResult.done();
        };
    }
}
