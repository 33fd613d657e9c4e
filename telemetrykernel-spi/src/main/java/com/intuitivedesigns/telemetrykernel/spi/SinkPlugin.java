/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.spi;

import com.intuitivedesigns.telemetrykernel.core.EventSink;

/**
 * SPI Definition for sinks, used both for forwarded records and for the dead-letter path.
 */
public interface SinkPlugin extends PipelinePlugin<EventSink> {

    String id(); // e.g. "KAFKA", "LOG"

    @Override
    default PluginKind kind() {
        return PluginKind.SINK;
    }

    @Override
    EventSink create(PluginContext context) throws Exception;
}
