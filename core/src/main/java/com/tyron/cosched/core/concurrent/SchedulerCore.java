package com.tyron.cosched.core.concurrent;

import com.tyron.cosched.core.config.SchedulerConfiguration;
import com.tyron.cosched.core.config.SchedulerConfigurationLoader;
import com.tyron.cosched.core.host.EventLoopHostBridge;

/**
 * Convenience factories for a scheduler running on its own event-loop thread.
 */
public final class SchedulerCore {

    private SchedulerCore() {
    }

    /**
     * Uses the configuration from {@link SchedulerConfigurationLoader#load()}.
     */
    public static SchedulerImpl createEventLoopScheduler() {
        return createEventLoopScheduler(SchedulerConfigurationLoader.load());
    }

    /**
     * The returned scheduler owns its host; disposing it stops the loop thread.
     */
    public static SchedulerImpl createEventLoopScheduler(SchedulerConfiguration configuration) {
        EventLoopHostBridge host = new EventLoopHostBridge(configuration.frameIntervalMillis());
        return new SchedulerImpl(host, configuration, true);
    }
}
