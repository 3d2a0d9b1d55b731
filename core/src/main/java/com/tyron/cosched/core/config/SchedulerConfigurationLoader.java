package com.tyron.cosched.core.config;

import com.tyron.cosched.api.concurrent.PriorityLevel;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads {@link SchedulerConfiguration} from YAML (cosched.yaml) and system properties.
 *
 * <pre>
 * scheduler:
 *   frameIntervalMs: 5
 *   timeouts:
 *     immediate: -1
 *     userBlocking: 250
 *     normal: 5000
 *     low: 10000
 *     idle: 1073741823
 *   aging:
 *     enabled: false
 *     thresholdMs: 2000
 *     intervalMs: 100
 *   watchdog:
 *     enabled: false
 *     stallThresholdMs: 1000
 *     checkIntervalMs: 250
 * </pre>
 *
 * Every key is optional. System properties prefixed with {@code cosched.} override the file.
 */
public final class SchedulerConfigurationLoader {

    private static final Logger LOG = Logger.getLogger(SchedulerConfigurationLoader.class.getName());

    public static final String RESOURCE_NAME = "cosched.yaml";

    public static final String FRAME_INTERVAL_KEY = "cosched.frameIntervalMs";
    public static final String TIMEOUT_KEY_PREFIX = "cosched.timeout.";
    public static final String AGING_ENABLED_KEY = "cosched.aging.enabled";
    public static final String AGING_THRESHOLD_KEY = "cosched.aging.thresholdMs";
    public static final String AGING_INTERVAL_KEY = "cosched.aging.intervalMs";
    public static final String WATCHDOG_ENABLED_KEY = "cosched.watchdog.enabled";
    public static final String WATCHDOG_STALL_KEY = "cosched.watchdog.stallThresholdMs";
    public static final String WATCHDOG_INTERVAL_KEY = "cosched.watchdog.checkIntervalMs";

    private SchedulerConfigurationLoader() {
    }

    /**
     * Loads {@value #RESOURCE_NAME} from the classpath if present, then applies system property
     * overrides.
     */
    public static SchedulerConfiguration load() {
        SchedulerConfiguration.Builder builder = SchedulerConfiguration.builder();

        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SchedulerConfigurationLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                if (LOG.isLoggable(Level.INFO)) {
                    LOG.info("Loading scheduler configuration from classpath resource " + RESOURCE_NAME);
                }
                applyYaml(builder, in, RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new SchedulerConfigurationException("Failed to read " + RESOURCE_NAME, e);
        }

        applyOverrides(builder, System.getProperties());
        return builder.build();
    }

    /**
     * Loads the given YAML file, then applies system property overrides.
     */
    public static SchedulerConfiguration load(Path file) {
        Objects.requireNonNull(file, "file");
        SchedulerConfiguration.Builder builder = SchedulerConfiguration.builder();
        try (InputStream in = Files.newInputStream(file)) {
            if (LOG.isLoggable(Level.INFO)) {
                LOG.info("Loading scheduler configuration from " + file);
            }
            applyYaml(builder, in, file.toString());
        } catch (IOException e) {
            throw new SchedulerConfigurationException("Failed to read " + file, e);
        }
        applyOverrides(builder, System.getProperties());
        return builder.build();
    }

    /**
     * Parses YAML only; no system properties involved.
     */
    public static SchedulerConfiguration parse(InputStream in) {
        Objects.requireNonNull(in, "in");
        SchedulerConfiguration.Builder builder = SchedulerConfiguration.builder();
        applyYaml(builder, in, "<stream>");
        return builder.build();
    }

    static void applyYaml(SchedulerConfiguration.Builder builder, InputStream in, String source) {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new SchedulerConfigurationException("Malformed YAML in " + source, e);
        }
        if (doc == null) return;
        if (!(doc instanceof Map<?, ?> root)) {
            throw new SchedulerConfigurationException("Expected a mapping at the top of " + source);
        }

        Object section = root.get("scheduler");
        if (section == null) return;
        if (!(section instanceof Map<?, ?> map)) {
            throw new SchedulerConfigurationException("'scheduler' must be a mapping in " + source);
        }

        Object frame = map.get("frameIntervalMs");
        if (frame != null) {
            builder.frameIntervalMillis(toLong("scheduler.frameIntervalMs", frame));
        }

        Map<?, ?> timeouts = subsection(map, "timeouts", source);
        if (timeouts != null) {
            for (Map.Entry<?, ?> e : timeouts.entrySet()) {
                String key = String.valueOf(e.getKey());
                PriorityLevel level = PriorityLevel.fromConfigKey(key);
                if (level == null) {
                    throw new SchedulerConfigurationException("Unknown priority level '" + key + "' in scheduler.timeouts");
                }
                builder.timeout(level, toLong("scheduler.timeouts." + key, e.getValue()));
            }
        }

        Map<?, ?> aging = subsection(map, "aging", source);
        if (aging != null) {
            Object enabled = aging.get("enabled");
            if (enabled != null) builder.agingEnabled(toBoolean("scheduler.aging.enabled", enabled));
            Object threshold = aging.get("thresholdMs");
            if (threshold != null) builder.agingThresholdMillis(toLong("scheduler.aging.thresholdMs", threshold));
            Object interval = aging.get("intervalMs");
            if (interval != null) builder.agingIntervalMillis(toLong("scheduler.aging.intervalMs", interval));
        }

        Map<?, ?> watchdog = subsection(map, "watchdog", source);
        if (watchdog != null) {
            Object enabled = watchdog.get("enabled");
            if (enabled != null) builder.watchdogEnabled(toBoolean("scheduler.watchdog.enabled", enabled));
            Object stall = watchdog.get("stallThresholdMs");
            if (stall != null) builder.stallThresholdMillis(toLong("scheduler.watchdog.stallThresholdMs", stall));
            Object interval = watchdog.get("checkIntervalMs");
            if (interval != null) builder.watchdogIntervalMillis(toLong("scheduler.watchdog.checkIntervalMs", interval));
        }
    }

    static void applyOverrides(SchedulerConfiguration.Builder builder, Properties props) {
        String frame = props.getProperty(FRAME_INTERVAL_KEY);
        if (frame != null) builder.frameIntervalMillis(toLong(FRAME_INTERVAL_KEY, frame));

        for (PriorityLevel level : PriorityLevel.values()) {
            String key = TIMEOUT_KEY_PREFIX + level.configKey();
            String v = props.getProperty(key);
            if (v != null) builder.timeout(level, toLong(key, v));
        }

        String agingEnabled = props.getProperty(AGING_ENABLED_KEY);
        if (agingEnabled != null) builder.agingEnabled(toBoolean(AGING_ENABLED_KEY, agingEnabled));
        String agingThreshold = props.getProperty(AGING_THRESHOLD_KEY);
        if (agingThreshold != null) builder.agingThresholdMillis(toLong(AGING_THRESHOLD_KEY, agingThreshold));
        String agingInterval = props.getProperty(AGING_INTERVAL_KEY);
        if (agingInterval != null) builder.agingIntervalMillis(toLong(AGING_INTERVAL_KEY, agingInterval));

        String watchdogEnabled = props.getProperty(WATCHDOG_ENABLED_KEY);
        if (watchdogEnabled != null) builder.watchdogEnabled(toBoolean(WATCHDOG_ENABLED_KEY, watchdogEnabled));
        String stall = props.getProperty(WATCHDOG_STALL_KEY);
        if (stall != null) builder.stallThresholdMillis(toLong(WATCHDOG_STALL_KEY, stall));
        String watchdogInterval = props.getProperty(WATCHDOG_INTERVAL_KEY);
        if (watchdogInterval != null) builder.watchdogIntervalMillis(toLong(WATCHDOG_INTERVAL_KEY, watchdogInterval));
    }

    private static Map<?, ?> subsection(Map<?, ?> parent, String name, String source) {
        Object value = parent.get(name);
        if (value == null) return null;
        if (!(value instanceof Map<?, ?> map)) {
            throw new SchedulerConfigurationException("'scheduler." + name + "' must be a mapping in " + source);
        }
        return map;
    }

    private static long toLong(String key, Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new SchedulerConfigurationException("'" + key + "' must be a whole number of milliseconds, was '" + value + "'", e);
        }
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String s = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(s)) return true;
        if ("false".equalsIgnoreCase(s)) return false;
        throw new SchedulerConfigurationException("'" + key + "' must be true or false, was '" + value + "'");
    }
}
