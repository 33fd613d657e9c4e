/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins.transform;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.core.FieldPath;
import com.intuitivedesigns.telemetrykernel.metrics.NoopMetricsRuntime;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.intuitivedesigns.telemetrykernel.plugins.transform.RecordingLookupClient.json;
import static org.junit.jupiter.api.Assertions.*;

class UserEnricherTest {

    private final RecordingLookupClient client = new RecordingLookupClient()
            .respond("u-100", "{\"name\":\"alice\",\"department\":\"finance\"}");

    private UserEnricher enricher() {
        return new UserEnricher("user_enricher", "http://idp/users/", FieldPath.parse("user_id"),
                Duration.ofSeconds(1), client, NoopMetricsRuntime.INSTANCE);
    }

    @Test
    void attachesUserObject() {
        final EventRecord record = EventRecord.of(json("{\"user_id\":\"u-100\"}"));

        assertTrue(enricher().apply(record).isContinue());

        assertEquals("alice", record.body().get("user").get("name").asText());
        assertFalse(record.body().has("tags"));
    }

    @Test
    void unknownUserGetsMarkerNotFailure() {
        final ObjectNode body = json("{\"user_id\":\"ghost\"}");
        final EventRecord record = EventRecord.of(body);

        assertTrue(enricher().apply(record).isContinue());

        assertEquals(List.of("http://idp/users//ghost"), client.calls);
        assertFalse(record.body().has("user"));
        assertTrue(record.metadata(UserEnricher.MARKER_KEY).orElseThrow().startsWith("http status 404"));
    }

    @Test
    void absentIdDoesNotCallService() {
        final EventRecord record = EventRecord.of(json("{\"other\":1}"));

        enricher().apply(record);

        assertTrue(client.calls.isEmpty());
        assertEquals("field 'user_id' not found", record.metadata(UserEnricher.MARKER_KEY).orElseThrow());
    }
}
