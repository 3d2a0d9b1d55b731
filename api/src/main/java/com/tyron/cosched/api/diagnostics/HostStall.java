package com.tyron.cosched.api.diagnostics;

import java.util.Objects;

/**
 * A host callback the scheduler asked for but has not received in time.
 *
 * @param kind            which host request stalled
 * @param expectedAtMillis when the callback was expected (request time for soon callbacks, due
 *                        time for delayed callbacks)
 * @param overdueMillis   how long past {@code expectedAtMillis} the watchdog noticed it
 */
public record HostStall(Kind kind, long expectedAtMillis, long overdueMillis) {

    public enum Kind {
        SOON_CALLBACK,
        DELAYED_CALLBACK
    }

    public HostStall {
        Objects.requireNonNull(kind, "kind");
    }
}
