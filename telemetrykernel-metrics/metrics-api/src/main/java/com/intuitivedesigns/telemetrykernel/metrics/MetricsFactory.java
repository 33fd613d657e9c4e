/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Picks the metrics runtime named by {@code metrics.provider}.
 *
 * <ul>
 * <li>{@code NONE} (default): {@link NoopMetricsRuntime}.</li>
 * <li>{@code MICROMETER}: in-memory {@link MicrometerMetricsRuntime}.</li>
 * <li>anything else: the first {@link MetricsProvider} on the classpath that accepts it.</li>
 * </ul>
 */
public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    public static final String PROVIDER_NONE = "NONE";
    public static final String PROVIDER_MICROMETER = "MICROMETER";

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");

        if (PROVIDER_NONE.equals(settings.providerId)) {
            log.info("Metrics disabled (NOOP active).");
            return NoopMetricsRuntime.INSTANCE;
        }

        if (PROVIDER_MICROMETER.equals(settings.providerId)) {
            final MicrometerMetricsRuntime rt = new MicrometerMetricsRuntime();
            if (rt.registry() instanceof MeterRegistry mr) {
                mr.config().commonTags(settings.micrometerTags());
            }
            return rt;
        }

        final ServiceLoader<MetricsProvider> loader = ServiceLoader.load(MetricsProvider.class, resolveClassLoader());
        for (MetricsProvider p : loader) {
            try {
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics runtime initialized: {}", p.getClass().getName());
                    return rt;
                }
            } catch (LinkageError | RuntimeException e) {
                // A provider with missing dependencies must not take the pipeline down
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), e.getMessage());
                log.debug("Provider init stack trace:", e);
            }
        }

        log.warn("No metrics provider accepted '{}' (NOOP active).", settings.providerId);
        return NoopMetricsRuntime.INSTANCE;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
