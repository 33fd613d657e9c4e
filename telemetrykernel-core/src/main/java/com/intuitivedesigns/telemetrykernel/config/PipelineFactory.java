/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.config;

import com.intuitivedesigns.telemetrykernel.core.EventSink;
import com.intuitivedesigns.telemetrykernel.core.EventSource;
import com.intuitivedesigns.telemetrykernel.core.TransformUnit;
import com.intuitivedesigns.telemetrykernel.spi.PipelinePlugin;
import com.intuitivedesigns.telemetrykernel.spi.PluginCatalog;
import com.intuitivedesigns.telemetrykernel.spi.PluginContext;
import com.intuitivedesigns.telemetrykernel.spi.SinkPlugin;
import com.intuitivedesigns.telemetrykernel.spi.SourcePlugin;
import com.intuitivedesigns.telemetrykernel.spi.UnitPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Resolves configured plugin ids against the classpath catalog and builds the components.
 */
public final class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    // Config keys
    public static final String KEY_SOURCE_TYPE = "source.type";
    public static final String KEY_SINK_TYPE = "sink.type";
    public static final String KEY_DLQ_TYPE = "dlq.type";
    public static final String KEY_CHAIN_UNITS = "chain.units";

    private static final String DLQ_PREFIX = "dlq.";
    private static final String SINK_PREFIX = "sink.";

    // Defaults
    private static final String DEFAULT_SOURCE = "HTTP";
    private static final String DEFAULT_SINK = "LOG";
    private static final String DEFAULT_DLQ = "LOG";

    private static final PluginCatalog CATALOG = new PluginCatalog(resolveClassLoader());

    private PipelineFactory() {}

    // --- FACTORY METHODS ---

    public static EventSource createSource(PluginContext context) {
        Objects.requireNonNull(context, "context");

        final String id = normalizeId(context.config().getString(KEY_SOURCE_TYPE, DEFAULT_SOURCE), DEFAULT_SOURCE);
        final SourcePlugin plugin = CATALOG.sources().require(id, KEY_SOURCE_TYPE);
        return createSafe(plugin, context, "Source");
    }

    public static EventSink createSink(PluginContext context) {
        Objects.requireNonNull(context, "context");

        final String id = normalizeId(context.config().getString(KEY_SINK_TYPE, DEFAULT_SINK), DEFAULT_SINK);
        final SinkPlugin plugin = CATALOG.sinks().require(id, KEY_SINK_TYPE);
        return createSafe(plugin, context, "Sink");
    }

    public static EventSink createDlq(PluginContext context) {
        Objects.requireNonNull(context, "context");

        final String id = normalizeId(context.config().getString(KEY_DLQ_TYPE, DEFAULT_DLQ), DEFAULT_DLQ);
        final SinkPlugin plugin = CATALOG.sinks().require(id, KEY_DLQ_TYPE);
        return createSafe(plugin, dlqContext(context), "DLQ");
    }

    /**
     * Sink plugins read {@code sink.*} keys. For the dead-letter sink every {@code dlq.<rest>}
     * key overrides {@code sink.<rest>}, e.g. {@code dlq.kafka.topic} replaces {@code sink.kafka.topic}.
     */
    static PluginContext dlqContext(PluginContext context) {
        final PipelineConfig config = context.config();
        final Map<String, String> overrides = config.subset(DLQ_PREFIX);
        overrides.remove("type");
        if (overrides.isEmpty()) return context;

        final Properties merged = new Properties();
        config.asMap().forEach((k, v) -> merged.setProperty(k, String.valueOf(v)));
        overrides.forEach((k, v) -> merged.setProperty(SINK_PREFIX + k, v));
        return new PluginContext(PipelineConfig.fromProperties(merged), context.metrics(), context.lookupClient());
    }

    /**
     * Builds the units listed in {@code chain.units}, in that order.
     * The same id may appear twice; each occurrence gets its own instance.
     */
    public static List<TransformUnit> createUnits(PluginContext context) {
        Objects.requireNonNull(context, "context");

        final List<String> ids = context.config().getList(KEY_CHAIN_UNITS, List.of());
        if (ids.isEmpty()) {
            log.warn("'{}' is empty: every record will be forwarded unchanged", KEY_CHAIN_UNITS);
        }

        final List<TransformUnit> units = new ArrayList<>(ids.size());
        for (String id : ids) {
            final UnitPlugin plugin = CATALOG.units().require(id, KEY_CHAIN_UNITS);
            units.add(createSafe(plugin, context, "Unit"));
        }
        return units;
    }

    // --- UTILITIES ---

    public static void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        log.info("  Sources: {}", CATALOG.sources().availableIds());
        log.info("  Units:   {}", CATALOG.units().availableIds());
        log.info("  Sinks:   {}", CATALOG.sinks().availableIds());
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : PipelineFactory.class.getClassLoader();
    }

    private static <T> T createSafe(PipelinePlugin<T> plugin, PluginContext context, String typeName) {
        Objects.requireNonNull(plugin, "plugin");
        try {
            return plugin.create(context);
        } catch (Exception e) {
            throw new IllegalStateException("Failed creating " + typeName + " [" + plugin.id() + "]", e);
        }
    }
}
