/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.app;

import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.config.PipelineFactory;
import com.intuitivedesigns.telemetrykernel.core.ChainOrchestrator;
import com.intuitivedesigns.telemetrykernel.core.EventSink;
import com.intuitivedesigns.telemetrykernel.core.EventSource;
import com.intuitivedesigns.telemetrykernel.core.FailurePolicy;
import com.intuitivedesigns.telemetrykernel.core.ProcessorChain;
import com.intuitivedesigns.telemetrykernel.core.TransformUnit;
import com.intuitivedesigns.telemetrykernel.lookup.HttpLookupClient;
import com.intuitivedesigns.telemetrykernel.lookup.LookupClient;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsFactory;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsSettings;
import com.intuitivedesigns.telemetrykernel.spi.PluginContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One assembled pipeline: metrics, the shared lookup client, source, chain and sinks.
 *
 * <p>This is the only place the lookup client is created; every unit receives the same
 * instance through its {@link PluginContext}. Closing the kernel stops the orchestrator
 * and then releases the client and the metrics runtime.</p>
 */
public final class TelemetryKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TelemetryKernel.class);

    // --- Config Keys ---
    public static final String CFG_PARALLELISM = "pipeline.parallelism";
    public static final String CFG_POLL_TIMEOUT_MS = "pipeline.poll.timeout.ms";
    public static final String CFG_STOP_TIMEOUT_MS = "pipeline.stop.timeout.ms";
    public static final String CFG_FAILURE_POLICY = "pipeline.failure.policy";

    // --- Defaults ---
    private static final int DEFAULT_PARALLELISM = 4;
    private static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);
    private static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(15);

    private final MetricsRuntime metrics;
    private final LookupClient lookupClient;
    private final EventSource source;
    private final EventSink sink;
    private final ChainOrchestrator orchestrator;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private TelemetryKernel(MetricsRuntime metrics,
                            LookupClient lookupClient,
                            EventSource source,
                            EventSink sink,
                            ChainOrchestrator orchestrator) {
        this.metrics = metrics;
        this.lookupClient = lookupClient;
        this.source = source;
        this.sink = sink;
        this.orchestrator = orchestrator;
    }

    /**
     * Builds every component from config. Nothing is started yet.
     * Whatever was created before a failure is closed again.
     */
    public static TelemetryKernel assemble(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        MetricsRuntime metrics = null;
        LookupClient lookupClient = null;
        EventSource source = null;
        EventSink sink = null;
        EventSink dlq = null;
        List<TransformUnit> units = List.of();

        try {
            metrics = MetricsFactory.init(MetricsSettings.from(config));
            lookupClient = HttpLookupClient.fromConfig(config, metrics);

            final PluginContext context = new PluginContext(config, metrics, lookupClient);

            final int parallelism = Math.max(1, config.getInt(CFG_PARALLELISM, DEFAULT_PARALLELISM));
            final Duration pollTimeout = config.getDurationMs(CFG_POLL_TIMEOUT_MS, DEFAULT_POLL_TIMEOUT);
            final Duration stopTimeout = config.getDurationMs(CFG_STOP_TIMEOUT_MS, DEFAULT_STOP_TIMEOUT);
            final FailurePolicy policy = FailurePolicy.parse(config.getString(CFG_FAILURE_POLICY, null));

            source = PipelineFactory.createSource(context);
            sink = PipelineFactory.createSink(context);
            dlq = PipelineFactory.createDlq(context);
            units = PipelineFactory.createUnits(context);

            log.info("CONFIG: Parallelism={} | PollTimeout={}ms | FailurePolicy={} | Source={} | Sink={} | DLQ={}",
                    parallelism, pollTimeout.toMillis(), policy,
                    source.getClass().getSimpleName(), sink.id(), dlq.id());

            final ProcessorChain chain = new ProcessorChain(units, metrics);
            final ChainOrchestrator orchestrator = new ChainOrchestrator(
                    source, chain, sink, dlq, policy, parallelism, pollTimeout, stopTimeout, metrics);

            return new TelemetryKernel(metrics, lookupClient, source, sink, orchestrator);

        } catch (RuntimeException e) {
            for (TransformUnit u : units) closeQuietly(u);
            closeQuietly(source);
            closeQuietly(sink);
            closeQuietly(dlq);
            closeQuietly(lookupClient);
            closeQuietly(metrics);
            throw e;
        }
    }

    public void start() throws Exception {
        orchestrator.start();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            orchestrator.stop();
        } finally {
            closeQuietly(lookupClient);
            closeQuietly(metrics);
        }
    }

    public EventSource source() {
        return source;
    }

    public EventSink sink() {
        return sink;
    }

    public ChainOrchestrator orchestrator() {
        return orchestrator;
    }

    public MetricsRuntime metrics() {
        return metrics;
    }

    static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.debug("Error closing {}", resource.getClass().getSimpleName(), e);
        }
    }
}
