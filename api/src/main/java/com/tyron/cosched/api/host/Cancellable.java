package com.tyron.cosched.api.host;

/**
 * Cancellation handle for a callback requested from a {@link HostBridge}.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * A handle that has nothing to cancel.
     */
    Cancellable NOOP = () -> false;

    /**
     * Attempt to cancel the requested callback.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the callback already ran
     *         or was previously cancelled.
     */
    boolean cancel();
}
