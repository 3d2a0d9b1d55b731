package com.tyron.cosched.core.config;

/**
 * Thrown when scheduler configuration cannot be read or holds invalid values.
 */
public class SchedulerConfigurationException extends RuntimeException {

    public SchedulerConfigurationException(String message) {
        super(message);
    }

    public SchedulerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
