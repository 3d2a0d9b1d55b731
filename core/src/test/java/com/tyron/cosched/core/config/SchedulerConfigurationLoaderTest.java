package com.tyron.cosched.core.config;

import com.google.common.truth.Truth;
import com.tyron.cosched.api.concurrent.PriorityLevel;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

public class SchedulerConfigurationLoaderTest {

    @TempDir
    public Path tempDir;

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testDefaults() {
        SchedulerConfiguration config = SchedulerConfiguration.defaults();
        Assertions.assertEquals(5, config.frameIntervalMillis());
        for (PriorityLevel level : PriorityLevel.values()) {
            Assertions.assertEquals(level.defaultTimeoutMillis(), config.timeoutFor(level));
        }
        Assertions.assertFalse(config.agingEnabled());
        Assertions.assertFalse(config.watchdogEnabled());
    }

    @Test
    public void testParseFullDocument() {
        SchedulerConfiguration config = SchedulerConfigurationLoader.parse(yaml(
                "scheduler:\n"
                        + "  frameIntervalMs: 16\n"
                        + "  timeouts:\n"
                        + "    immediate: 0\n"
                        + "    USER_BLOCKING: 100\n"
                        + "    normal: '2000'\n"
                        + "  aging:\n"
                        + "    enabled: true\n"
                        + "    thresholdMs: 500\n"
                        + "    intervalMs: 20\n"
                        + "  watchdog:\n"
                        + "    enabled: 'true'\n"
                        + "    stallThresholdMs: 400\n"
                        + "    checkIntervalMs: 50\n"));

        Assertions.assertEquals(16, config.frameIntervalMillis());
        Assertions.assertEquals(0, config.timeoutFor(PriorityLevel.IMMEDIATE));
        Assertions.assertEquals(100, config.timeoutFor(PriorityLevel.USER_BLOCKING));
        Assertions.assertEquals(2_000, config.timeoutFor(PriorityLevel.NORMAL));
        Assertions.assertEquals(10_000, config.timeoutFor(PriorityLevel.LOW));
        Assertions.assertTrue(config.agingEnabled());
        Assertions.assertEquals(500, config.agingThresholdMillis());
        Assertions.assertEquals(20, config.agingIntervalMillis());
        Assertions.assertTrue(config.watchdogEnabled());
        Assertions.assertEquals(400, config.stallThresholdMillis());
        Assertions.assertEquals(50, config.watchdogIntervalMillis());
    }

    @Test
    public void testUnboundedIdleTimeout() {
        SchedulerConfiguration config = SchedulerConfigurationLoader.parse(yaml(
                "scheduler:\n  timeouts:\n    idle: 9223372036854775807\n"));
        Assertions.assertEquals(Long.MAX_VALUE, config.timeoutFor(PriorityLevel.IDLE));
        Assertions.assertEquals(10_000, config.timeoutFor(PriorityLevel.LOW));
    }

    @Test
    public void testEmptyDocumentGivesDefaults() {
        SchedulerConfiguration config = SchedulerConfigurationLoader.parse(yaml(""));
        Truth.assertThat(config.timeouts()).isEqualTo(SchedulerConfiguration.defaults().timeouts());
        Assertions.assertEquals(5, config.frameIntervalMillis());
    }

    @Test
    public void testInvalidDocuments() {
        assertRejected("scheduler: [1, 2]\n", "must be a mapping");
        assertRejected("scheduler:\n  timeouts:\n    urgent: 10\n", "Unknown priority level 'urgent'");
        assertRejected("scheduler:\n  frameIntervalMs: fast\n", "whole number");
        assertRejected("scheduler:\n  frameIntervalMs: 0\n", "frameIntervalMs must be > 0");
        assertRejected("scheduler:\n  timeouts:\n    low: 100\n", "shorter than");
        assertRejected("scheduler:\n  aging:\n    enabled: maybe\n", "true or false");
        assertRejected("scheduler: {frameIntervalMs: 5\n", "Malformed YAML");
        assertRejected("- just\n- a list\n", "top of");
    }

    private static void assertRejected(String document, String messagePart) {
        SchedulerConfigurationException e = Assertions.assertThrows(SchedulerConfigurationException.class,
                () -> SchedulerConfigurationLoader.parse(yaml(document)));
        Truth.assertThat(e).hasMessageThat().contains(messagePart);
    }

    @Test
    public void testPropertiesOverrideYaml() {
        SchedulerConfiguration.Builder builder = SchedulerConfiguration.builder();
        SchedulerConfigurationLoader.applyYaml(builder, yaml("scheduler:\n  frameIntervalMs: 16\n"), "test");

        Properties props = new Properties();
        props.setProperty(SchedulerConfigurationLoader.FRAME_INTERVAL_KEY, "10");
        props.setProperty(SchedulerConfigurationLoader.TIMEOUT_KEY_PREFIX + "userBlocking", "400");
        props.setProperty(SchedulerConfigurationLoader.WATCHDOG_ENABLED_KEY, "TRUE");
        SchedulerConfigurationLoader.applyOverrides(builder, props);

        SchedulerConfiguration config = builder.build();
        Assertions.assertEquals(10, config.frameIntervalMillis());
        Assertions.assertEquals(400, config.timeoutFor(PriorityLevel.USER_BLOCKING));
        Assertions.assertTrue(config.watchdogEnabled());
    }

    @Test
    public void testLoadFromClasspathResource() {
        SchedulerConfiguration config = SchedulerConfigurationLoader.load();
        Assertions.assertEquals(8, config.frameIntervalMillis());
        Assertions.assertEquals(300, config.timeoutFor(PriorityLevel.USER_BLOCKING));
        Assertions.assertEquals(20_000, config.timeoutFor(PriorityLevel.LOW));
        Assertions.assertTrue(config.agingEnabled());
        Assertions.assertEquals(1_500, config.agingThresholdMillis());
    }

    @Test
    public void testLoadFromFile() throws Exception {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, "scheduler:\n  watchdog:\n    enabled: true\n    stallThresholdMs: 750\n");

        SchedulerConfiguration config = SchedulerConfigurationLoader.load(file);
        Assertions.assertTrue(config.watchdogEnabled());
        Assertions.assertEquals(750, config.stallThresholdMillis());

        Assertions.assertThrows(SchedulerConfigurationException.class,
                () -> SchedulerConfigurationLoader.load(tempDir.resolve("missing.yaml")));
    }

    @Test
    public void testToBuilderKeepsValues() {
        SchedulerConfiguration base = SchedulerConfiguration.builder().frameIntervalMillis(12).build();
        SchedulerConfiguration copy = base.toBuilder().agingEnabled(true).build();
        Assertions.assertEquals(12, copy.frameIntervalMillis());
        Assertions.assertTrue(copy.agingEnabled());
        Assertions.assertFalse(base.agingEnabled());
    }
}
