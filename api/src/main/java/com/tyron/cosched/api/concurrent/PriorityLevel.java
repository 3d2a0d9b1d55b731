package com.tyron.cosched.api.concurrent;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Scheduling priority for cooperative tasks.
 * <p>
 * Each level maps to a timeout: the maximum time a task may wait once eligible before it is
 * considered expired. Expired tasks run even when the host asks the scheduler to yield, so the
 * timeout doubles as the level's starvation bound.
 */
public enum PriorityLevel {

    /**
     * Synchronous / critical work. Already expired at submission.
     */
    IMMEDIATE(1, "immediate", -1L),

    /**
     * Direct response to user interaction (e.g. typing, clicking).
     */
    USER_BLOCKING(2, "userBlocking", 250L),

    /**
     * Default priority.
     */
    NORMAL(3, "normal", 5_000L),

    /**
     * Deferrable work (e.g. analytics, prefetching).
     */
    LOW(4, "low", 10_000L),

    /**
     * Work that is never urgent.
     */
    IDLE(5, "idle", 1_073_741_823L);

    private final int value;
    private final String configKey;
    private final long defaultTimeoutMillis;

    PriorityLevel(int value, String configKey, long defaultTimeoutMillis) {
        this.value = value;
        this.configKey = configKey;
        this.defaultTimeoutMillis = defaultTimeoutMillis;
    }

    /**
     * @return the ordinal value, 1 (most urgent) to 5 (least urgent).
     */
    public int value() {
        return value;
    }

    /**
     * @return the key used for this level in configuration files and system properties.
     */
    public String configKey() {
        return configKey;
    }

    public long defaultTimeoutMillis() {
        return defaultTimeoutMillis;
    }

    /**
     * @return the next more urgent level, stopping at {@link #USER_BLOCKING}.
     * {@link #IMMEDIATE} is never reached by boosting.
     */
    public PriorityLevel boosted() {
        switch (this) {
            case IDLE:
                return LOW;
            case LOW:
                return NORMAL;
            case NORMAL:
                return USER_BLOCKING;
            default:
                return this;
        }
    }

    /**
     * Priority is a hint, so unknown values fall back to {@link #NORMAL} instead of failing.
     */
    public static @NotNull PriorityLevel fromValue(int value) {
        for (PriorityLevel level : values()) {
            if (level.value == value) {
                return level;
            }
        }
        return NORMAL;
    }

    public static @NotNull PriorityLevel normalize(@Nullable PriorityLevel level) {
        return level != null ? level : NORMAL;
    }

    public static @Nullable PriorityLevel fromConfigKey(String key) {
        if (key == null) return null;
        for (PriorityLevel level : values()) {
            if (level.configKey.equalsIgnoreCase(key) || level.name().equalsIgnoreCase(key)) {
                return level;
            }
        }
        return null;
    }
}
