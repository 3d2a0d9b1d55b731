package com.tyron.cosched.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup.
 *
 * Controls java.util.logging output via system property:
 * - cosched.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE
 *
 * Tests that assert on log output use {@link #capture(Class)}.
 */
public final class TestLogging {

    private static final String BASE_LOGGER = "com.tyron.cosched";

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty("cosched.test.logLevel", "INFO"));
        Formatter formatter = new CompactTestLogFormatter();

        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(formatter);
            }
        }
        Logger.getLogger(BASE_LOGGER).setLevel(level);

        root.log(Level.INFO, "testLogging configured level=" + level.getName());
    }

    /**
     * Starts recording everything logged by {@code owner}'s logger at FINE or above, regardless of
     * the configured console level. Close the returned capture to stop.
     */
    public static CapturedLogs capture(Class<?> owner) {
        return new CapturedLogs(Logger.getLogger(owner.getName()));
    }

    public static final class CapturedLogs extends Handler implements AutoCloseable {

        private final Logger logger;
        private final Level previousLevel;
        private final List<LogRecord> records = new ArrayList<>();

        private CapturedLogs(Logger logger) {
            this.logger = logger;
            this.previousLevel = logger.getLevel();
            setLevel(Level.FINE);
            logger.setLevel(Level.FINE);
            logger.addHandler(this);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            if (isLoggable(record)) {
                records.add(record);
            }
        }

        public synchronized List<LogRecord> records() {
            return List.copyOf(records);
        }

        public synchronized List<LogRecord> atLevel(Level level) {
            List<LogRecord> out = new ArrayList<>();
            for (LogRecord r : records) {
                if (r.getLevel().equals(level)) out.add(r);
            }
            return out;
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
            logger.removeHandler(this);
            logger.setLevel(previousLevel);
        }
    }

    private static final class CompactTestLogFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(128);
            out.append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ')
                    .append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName())).append(' ')
                    .append('[').append(Thread.currentThread().getName()).append("] ")
                    .append(simpleName(record.getLoggerName())).append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            Throwable t = record.getThrown();
            if (t != null) {
                StringWriter sw = new StringWriter();
                t.printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            return loggerName.substring(loggerName.lastIndexOf('.') + 1);
        }
    }

    private static Level parseLevel(String raw) {
        if (raw == null) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }
}
