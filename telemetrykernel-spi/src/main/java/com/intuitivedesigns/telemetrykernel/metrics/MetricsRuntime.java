/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.metrics;

/**
 * The vendor-agnostic contract for observability.
 *
 * Decouples the chain and the plugins from a specific metrics library.
 * Every method has a NOOP default so a runtime without metrics needs no overrides.
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     */
    Object registry();

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    // --- Standard Instrumentation Methods (with NOOP defaults) ---

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    /**
     * Counter with dimension tags given as alternating key/value pairs.
     */
    default void counter(String name, double increment, String... tags) {}

    default void timer(String name, long durationMillis) {}

    default void timer(String name, long durationMillis, String... tags) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }
}
