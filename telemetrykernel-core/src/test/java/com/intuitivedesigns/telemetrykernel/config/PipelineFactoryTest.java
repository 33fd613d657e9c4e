/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.config;

import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.core.EventSink;
import com.intuitivedesigns.telemetrykernel.core.JsonSupport;
import com.intuitivedesigns.telemetrykernel.lookup.LookupException;
import com.intuitivedesigns.telemetrykernel.metrics.NoopMetricsRuntime;
import com.intuitivedesigns.telemetrykernel.spi.PluginContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineFactoryTest {

    private static PluginContext context(Map<String, String> props) {
        return new PluginContext(PipelineConfig.fromMap(props), NoopMetricsRuntime.INSTANCE,
                (baseUrl, key, timeout) -> { throw new LookupException("offline"); });
    }

    @Test
    void defaultSinkAndDlqAreLogSinks() throws Exception {
        EventSink sink = PipelineFactory.createSink(context(Map.of()));
        EventSink dlq = PipelineFactory.createDlq(context(Map.of("dlq.type", "log")));

        assertEquals("LOG", sink.id());
        assertEquals("LOG", dlq.id());
        assertNotSame(sink, dlq);

        sink.write(EventRecord.of(JsonSupport.MAPPER.createObjectNode().put("class_uid", 2004)));
        sink.close();
    }

    @Test
    void unknownUnitNamesAvailableOptions() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PipelineFactory.createUnits(context(Map.of("chain.units", "no_such_unit"))));

        assertTrue(e.getMessage().contains("Unknown unit 'no_such_unit' in 'chain.units'"), e.getMessage());
    }

    @Test
    void emptyChainIsAllowed() {
        assertTrue(PipelineFactory.createUnits(context(Map.of())).isEmpty());
    }

    @Test
    void dlqKeysOverrideSinkKeysForTheDeadLetterSink() {
        final PluginContext base = context(Map.of(
                "sink.kafka.topic", "ocsf-events",
                "dlq.type", "KAFKA",
                "dlq.kafka.topic", "ocsf-dlq"));

        final PluginContext dlq = PipelineFactory.dlqContext(base);

        assertEquals("ocsf-dlq", dlq.config().getString("sink.kafka.topic", null));
        assertEquals("ocsf-events", base.config().getString("sink.kafka.topic", null));
        assertSame(base.lookupClient(), dlq.lookupClient());
    }

    @Test
    void dlqTypeAloneLeavesContextUntouched() {
        final PluginContext base = context(Map.of("dlq.type", "LOG"));
        assertSame(base, PipelineFactory.dlqContext(base));
    }
}
