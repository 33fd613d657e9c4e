/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.spi;

/**
 * Base contract for everything discovered through {@link java.util.ServiceLoader}.
 *
 * @param <T> the runtime component this plugin builds
 */
public interface PipelinePlugin<T> {

    String id();          // e.g. "ASSET_ENRICHER", "HTTP", "KAFKA"

    PluginKind kind();

    T create(PluginContext context) throws Exception;
}
