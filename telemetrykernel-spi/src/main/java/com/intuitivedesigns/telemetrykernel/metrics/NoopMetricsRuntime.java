/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.metrics;

/**
 * Metrics disabled. Used when {@code metrics.enabled=false} and in tests.
 */
public final class NoopMetricsRuntime implements MetricsRuntime {

    public static final NoopMetricsRuntime INSTANCE = new NoopMetricsRuntime();

    private NoopMetricsRuntime() {}

    @Override
    public Object registry() {
        return null;
    }
}
