/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins;

import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.core.EventSink;
import com.intuitivedesigns.telemetrykernel.core.JsonSupport;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.telemetrykernel.spi.PluginContext;
import com.intuitivedesigns.telemetrykernel.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Sink that logs each record. Default dead-letter target and handy for development.
 */
public final class LogSinkPlugin implements SinkPlugin {

    private static final Logger log = LoggerFactory.getLogger(LogSinkPlugin.class);

    public static final String ID = "LOG";

    // Config keys
    private static final String CFG_MAX_LOG_CHARS = "sink.log.max.chars";
    private static final String CFG_LOG_LEVEL = "sink.log.level";
    private static final String CFG_LOG_PAYLOAD = "sink.log.payload.enabled";

    // Defaults
    private static final int DEFAULT_MAX_LOG_CHARS = 1024;
    private static final String DEFAULT_LOG_LEVEL = "WARN";
    private static final boolean DEFAULT_LOG_PAYLOAD = true;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventSink create(PluginContext context) {
        final PipelineConfig config = context.config();

        final int maxChars = clampInt(config.getInt(CFG_MAX_LOG_CHARS, DEFAULT_MAX_LOG_CHARS), 0, 1_048_576);
        final String level = config.getString(CFG_LOG_LEVEL, DEFAULT_LOG_LEVEL).toUpperCase(Locale.ROOT);
        final boolean logPayload = config.getBoolean(CFG_LOG_PAYLOAD, DEFAULT_LOG_PAYLOAD);

        log.info("Initialized LOG sink (level={}, maxChars={})", level, maxChars);
        return new LogSink(level, maxChars, logPayload, context.metrics());
    }

    static final class LogSink implements EventSink {

        private final String level;
        private final int maxChars;
        private final boolean logPayload;
        private final MetricsRuntime metrics;

        LogSink(String level, int maxChars, boolean logPayload, MetricsRuntime metrics) {
            this.level = level;
            this.maxChars = maxChars;
            this.logPayload = logPayload;
            this.metrics = metrics;
        }

        @Override
        public void write(EventRecord record) {
            if (record == null) return;

            metrics.counter("sink.log.written");

            if (!shouldLog(level)) return;

            logAtLevel(level, "[{}] id={} metadata={} body={}", ID, record.id(), record.metadata(), render(record));
        }

        String render(EventRecord record) {
            if (!logPayload) return "[payload logging disabled]";
            if (!record.isWellFormed()) return "[malformed]";

            final String raw = JsonSupport.toCompactString(record.body());
            return (raw.length() > maxChars)
                    ? raw.substring(0, maxChars) + "... [TRUNCATED]"
                    : raw;
        }

        @Override
        public String id() {
            return ID;
        }

        @Override
        public void close() {
            // nothing buffered
        }
    }

    // --- Helpers ---

    private static boolean shouldLog(String level) {
        return switch (level) {
            case "ERROR" -> log.isErrorEnabled();
            case "INFO"  -> log.isInfoEnabled();
            case "DEBUG" -> log.isDebugEnabled();
            case "TRACE" -> log.isTraceEnabled();
            case "OFF"   -> false;
            default      -> log.isWarnEnabled();
        };
    }

    private static void logAtLevel(String level, String fmt, Object... args) {
        switch (level) {
            case "ERROR" -> log.error(fmt, args);
            case "INFO"  -> log.info(fmt, args);
            case "DEBUG" -> log.debug(fmt, args);
            case "TRACE" -> log.trace(fmt, args);
            case "OFF"   -> { /* no-op */ }
            default      -> log.warn(fmt, args);
        }
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
