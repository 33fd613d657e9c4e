/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.app;

import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.core.EventSink;
import com.intuitivedesigns.telemetrykernel.spi.PluginContext;
import com.intuitivedesigns.telemetrykernel.spi.SinkPlugin;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Test sink that hands every written record to a shared queue.
 * Used as both primary sink and DLQ; records written as DLQ carry the chain failure metadata.
 */
public final class CollectingSinkPlugin implements SinkPlugin {

    public static final String ID = "COLLECT";

    static final BlockingQueue<EventRecord> RECORDS = new LinkedBlockingQueue<>();

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventSink create(PluginContext context) {
        return new EventSink() {
            @Override
            public void write(EventRecord record) {
                RECORDS.add(record);
            }

            @Override
            public String id() {
                return ID;
            }
        };
    }
}
