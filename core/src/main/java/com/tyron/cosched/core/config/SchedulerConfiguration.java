package com.tyron.cosched.core.config;

import com.tyron.cosched.api.concurrent.PriorityLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable scheduler settings: the priority timeout table, the slice budget and the optional
 * aging and watchdog extensions.
 */
public final class SchedulerConfiguration {

    public static final long DEFAULT_FRAME_INTERVAL_MS = 5L;
    public static final long DEFAULT_AGING_THRESHOLD_MS = 2_000L;
    public static final long DEFAULT_AGING_INTERVAL_MS = 100L;
    public static final long DEFAULT_STALL_THRESHOLD_MS = 1_000L;
    public static final long DEFAULT_WATCHDOG_INTERVAL_MS = 250L;

    private static final SchedulerConfiguration DEFAULTS = builder().build();

    private final Map<PriorityLevel, Long> timeouts;
    private final long frameIntervalMillis;
    private final boolean agingEnabled;
    private final long agingThresholdMillis;
    private final long agingIntervalMillis;
    private final boolean watchdogEnabled;
    private final long stallThresholdMillis;
    private final long watchdogIntervalMillis;

    private SchedulerConfiguration(Builder builder) {
        this.timeouts = Collections.unmodifiableMap(new EnumMap<>(builder.timeouts));
        this.frameIntervalMillis = builder.frameIntervalMillis;
        this.agingEnabled = builder.agingEnabled;
        this.agingThresholdMillis = builder.agingThresholdMillis;
        this.agingIntervalMillis = builder.agingIntervalMillis;
        this.watchdogEnabled = builder.watchdogEnabled;
        this.stallThresholdMillis = builder.stallThresholdMillis;
        this.watchdogIntervalMillis = builder.watchdogIntervalMillis;
    }

    public static SchedulerConfiguration defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.timeouts.putAll(timeouts);
        b.frameIntervalMillis = frameIntervalMillis;
        b.agingEnabled = agingEnabled;
        b.agingThresholdMillis = agingThresholdMillis;
        b.agingIntervalMillis = agingIntervalMillis;
        b.watchdogEnabled = watchdogEnabled;
        b.stallThresholdMillis = stallThresholdMillis;
        b.watchdogIntervalMillis = watchdogIntervalMillis;
        return b;
    }

    public long timeoutFor(PriorityLevel level) {
        return timeouts.get(PriorityLevel.normalize(level));
    }

    public Map<PriorityLevel, Long> timeouts() {
        return timeouts;
    }

    public long frameIntervalMillis() {
        return frameIntervalMillis;
    }

    public boolean agingEnabled() {
        return agingEnabled;
    }

    public long agingThresholdMillis() {
        return agingThresholdMillis;
    }

    public long agingIntervalMillis() {
        return agingIntervalMillis;
    }

    public boolean watchdogEnabled() {
        return watchdogEnabled;
    }

    public long stallThresholdMillis() {
        return stallThresholdMillis;
    }

    public long watchdogIntervalMillis() {
        return watchdogIntervalMillis;
    }

    @Override
    public String toString() {
        return "SchedulerConfiguration{"
                + "timeouts=" + timeouts
                + ", frameIntervalMillis=" + frameIntervalMillis
                + ", agingEnabled=" + agingEnabled
                + ", agingThresholdMillis=" + agingThresholdMillis
                + ", agingIntervalMillis=" + agingIntervalMillis
                + ", watchdogEnabled=" + watchdogEnabled
                + ", stallThresholdMillis=" + stallThresholdMillis
                + ", watchdogIntervalMillis=" + watchdogIntervalMillis
                + '}';
    }

    public static final class Builder {

        private final Map<PriorityLevel, Long> timeouts = new EnumMap<>(PriorityLevel.class);
        private long frameIntervalMillis = DEFAULT_FRAME_INTERVAL_MS;
        private boolean agingEnabled;
        private long agingThresholdMillis = DEFAULT_AGING_THRESHOLD_MS;
        private long agingIntervalMillis = DEFAULT_AGING_INTERVAL_MS;
        private boolean watchdogEnabled;
        private long stallThresholdMillis = DEFAULT_STALL_THRESHOLD_MS;
        private long watchdogIntervalMillis = DEFAULT_WATCHDOG_INTERVAL_MS;

        private Builder() {
            for (PriorityLevel level : PriorityLevel.values()) {
                timeouts.put(level, level.defaultTimeoutMillis());
            }
        }

        public Builder timeout(PriorityLevel level, long timeoutMillis) {
            timeouts.put(Objects.requireNonNull(level, "level"), timeoutMillis);
            return this;
        }

        public Builder frameIntervalMillis(long frameIntervalMillis) {
            this.frameIntervalMillis = frameIntervalMillis;
            return this;
        }

        public Builder agingEnabled(boolean agingEnabled) {
            this.agingEnabled = agingEnabled;
            return this;
        }

        public Builder agingThresholdMillis(long agingThresholdMillis) {
            this.agingThresholdMillis = agingThresholdMillis;
            return this;
        }

        public Builder agingIntervalMillis(long agingIntervalMillis) {
            this.agingIntervalMillis = agingIntervalMillis;
            return this;
        }

        public Builder watchdogEnabled(boolean watchdogEnabled) {
            this.watchdogEnabled = watchdogEnabled;
            return this;
        }

        public Builder stallThresholdMillis(long stallThresholdMillis) {
            this.stallThresholdMillis = stallThresholdMillis;
            return this;
        }

        public Builder watchdogIntervalMillis(long watchdogIntervalMillis) {
            this.watchdogIntervalMillis = watchdogIntervalMillis;
            return this;
        }

        public SchedulerConfiguration build() {
            if (frameIntervalMillis <= 0) {
                throw new SchedulerConfigurationException("frameIntervalMs must be > 0, was " + frameIntervalMillis);
            }

            PriorityLevel previous = null;
            for (PriorityLevel level : PriorityLevel.values()) {
                if (previous != null && timeouts.get(level) < timeouts.get(previous)) {
                    throw new SchedulerConfigurationException("timeout for " + level.configKey()
                            + " (" + timeouts.get(level) + "ms) is shorter than for "
                            + previous.configKey() + " (" + timeouts.get(previous) + "ms)");
                }
                previous = level;
            }

            requirePositive("aging.thresholdMs", agingThresholdMillis);
            requirePositive("aging.intervalMs", agingIntervalMillis);
            requirePositive("watchdog.stallThresholdMs", stallThresholdMillis);
            requirePositive("watchdog.checkIntervalMs", watchdogIntervalMillis);

            return new SchedulerConfiguration(this);
        }

        private static void requirePositive(String key, long value) {
            if (value <= 0) {
                throw new SchedulerConfigurationException(key + " must be > 0, was " + value);
            }
        }
    }
}
