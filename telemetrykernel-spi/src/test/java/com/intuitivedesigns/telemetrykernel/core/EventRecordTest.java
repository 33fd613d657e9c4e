/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventRecordTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void idComesFromMetadataUid() {
        EventRecord record = EventRecord.fromBytes(bytes("{\"metadata\":{\"uid\":\"evt-1\"},\"class_uid\":2004}"));

        assertTrue(record.isWellFormed());
        assertEquals("evt-1", record.id());
        assertEquals(2004L, record.integral("class_uid").get());
    }

    @Test
    void idIsGeneratedWithoutUid() {
        EventRecord a = EventRecord.of(JsonSupport.MAPPER.createObjectNode());
        EventRecord b = EventRecord.of(JsonSupport.MAPPER.createObjectNode());

        assertNotNull(a.id());
        assertNotEquals(a.id(), b.id());
    }

    @Test
    void nonObjectBytesFailOnBodyAccess() {
        EventRecord array = EventRecord.fromBytes(bytes("[1,2]"));
        EventRecord garbage = EventRecord.fromBytes(bytes("{not json"));
        EventRecord empty = EventRecord.fromBytes(new byte[0]);

        for (EventRecord r : List.of(array, garbage, empty)) {
            assertFalse(r.isWellFormed());
            assertThrows(RecordFormatException.class, r::body);
            assertThrows(RecordFormatException.class, () -> r.text("category"));
        }
    }

    @Test
    void metadataKeepsInsertionOrderAndOverwrites() {
        EventRecord record = EventRecord.of(JsonSupport.MAPPER.createObjectNode(), Map.of("origin", "test"));

        record.putMetadata("tag.a", "1").putMetadata("tag.b", "2").putMetadata("tag.a", "3");

        assertEquals(List.of("origin", "tag.a", "tag.b"), List.copyOf(record.metadata().keySet()));
        assertEquals("3", record.metadata("tag.a").orElseThrow());
        assertThrows(UnsupportedOperationException.class, () -> record.metadata().put("x", "y"));
    }

    @Test
    void bodyIsLiveAndSerializes() {
        ObjectNode body = JsonSupport.MAPPER.createObjectNode().put("category", "security");
        EventRecord record = EventRecord.of(body);

        record.body().put("severity_id", 5);

        assertEquals("{\"category\":\"security\",\"severity_id\":5}",
                new String(record.toJsonBytes(), StandardCharsets.UTF_8));
    }
}
