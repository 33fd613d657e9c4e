/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.spi;

import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.lookup.LookupClient;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;

import java.util.Objects;

/**
 * Shared collaborators handed to every plugin factory by the composition root.
 * The lookup client is owned by the caller; plugins must not close it.
 */
public record PluginContext(PipelineConfig config, MetricsRuntime metrics, LookupClient lookupClient) {

    public PluginContext {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(lookupClient, "lookupClient");
    }
}
