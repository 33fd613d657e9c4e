/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.spi;

import com.intuitivedesigns.telemetrykernel.core.EventSource;

/**
 * SPI Definition for event sources.
 */
public interface SourcePlugin extends PipelinePlugin<EventSource> {

    @Override
    default PluginKind kind() {
        return PluginKind.SOURCE;
    }

    @Override
    EventSource create(PluginContext context) throws Exception;
}
