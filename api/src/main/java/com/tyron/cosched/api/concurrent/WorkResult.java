package com.tyron.cosched.api.concurrent;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Outcome of a single {@link Work#perform(boolean)} invocation: either done, or not finished with
 * the work to resume next.
 */
public final class WorkResult {

    private static final WorkResult DONE = new WorkResult(null);

    private final Work continuation;

    private WorkResult(Work continuation) {
        this.continuation = continuation;
    }

    public static WorkResult done() {
        return DONE;
    }

    public static WorkResult continueWith(Work next) {
        return new WorkResult(Objects.requireNonNull(next, "next"));
    }

    public boolean isDone() {
        return continuation == null;
    }

    public @Nullable Work continuation() {
        return continuation;
    }

    @Override
    public String toString() {
        return isDone() ? "WorkResult[done]" : "WorkResult[continue]";
    }
}
