/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins;

import com.intuitivedesigns.telemetrykernel.core.EventSink;
import com.intuitivedesigns.telemetrykernel.output.KafkaEventSink;
import com.intuitivedesigns.telemetrykernel.spi.PluginContext;
import com.intuitivedesigns.telemetrykernel.spi.SinkPlugin;

/**
 * ID: KAFKA. Usable as the primary sink ({@code sink.type}) or the dead-letter sink ({@code dlq.type}).
 */
public final class KafkaSinkPlugin implements SinkPlugin {

    public static final String ID = "KAFKA";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventSink create(PluginContext context) {
        return KafkaEventSink.fromConfig(context.config(), context.metrics());
    }
}
