/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.core.FieldPath;
import com.intuitivedesigns.telemetrykernel.core.Outcome;
import com.intuitivedesigns.telemetrykernel.lookup.LookupException;
import com.intuitivedesigns.telemetrykernel.metrics.NoopMetricsRuntime;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.intuitivedesigns.telemetrykernel.plugins.transform.RecordingLookupClient.json;
import static org.junit.jupiter.api.Assertions.*;

class AssetEnricherTest {

    private static final String ENDPOINT = "http://assets/asset";

    private final RecordingLookupClient client = new RecordingLookupClient()
            .respond("host-1", "{\"hostname\":\"web-01\",\"owner\":\"IT\",\"criticality\":\"high\"}")
            .respond("host-2", "{\"hostname\":\"lab-07\",\"owner\":\"R&D\",\"criticality\":\"low\"}");

    private AssetEnricher enricher(String idField) {
        return new AssetEnricher("asset_enricher", ENDPOINT, FieldPath.parse(idField), Duration.ofSeconds(1),
                client, NoopMetricsRuntime.INSTANCE);
    }

    private static List<String> tags(EventRecord record) {
        final List<String> out = new ArrayList<>();
        for (JsonNode t : record.body().get("tags")) out.add(t.asText());
        return out;
    }

    @Test
    void attachesAssetFromNestedKey() {
        final EventRecord record = EventRecord.of(json("{\"device\":{\"uid\":\"host-2\"}}"));

        final Outcome outcome = enricher("device.uid").apply(record);

        assertTrue(outcome.isContinue());
        assertEquals(List.of(ENDPOINT + "/host-2"), client.calls);
        assertEquals("lab-07", record.body().get("asset").get("hostname").asText());
        assertTrue(record.metadata(AssetEnricher.MARKER_KEY).isEmpty());
    }

    @Test
    void detectionFindingGetsClassificationAndAssetTags() {
        final EventRecord record = EventRecord.of(json(
                "{\"asset_id\":\"host-1\",\"class_uid\":2004,\"severity_id\":5,"
                        + "\"finding\":{\"title\":\"Mimikatz\"},\"observables\":[{\"name\":\"x\",\"type_id\":7}]}"));

        enricher("asset_id").apply(record);

        assertEquals(List.of("ocsf_detection_finding", "high_severity", "critical_severity",
                "has_finding_title", "has_observables", "it_asset", "critical_asset"), tags(record));
    }

    @Test
    void processActivityIsTaggedAsEdr() {
        final EventRecord record = EventRecord.of(json("{\"asset_id\":\"host-2\",\"class_uid\":1007,\"severity_id\":4}"));

        enricher("asset_id").apply(record);

        assertEquals(List.of("ocsf_process_activity", "edr_event"), tags(record));
    }

    @Test
    void severityFourIsHighButNotCritical() {
        final EventRecord record = EventRecord.of(json("{\"asset_id\":\"host-2\",\"class_uid\":2004,\"severity_id\":4}"));

        enricher("asset_id").apply(record);

        assertEquals(List.of("ocsf_detection_finding", "high_severity"), tags(record));
    }

    @Test
    void existingTagsAreKeptAndNotRepeated() {
        final EventRecord record = EventRecord.of(json(
                "{\"asset_id\":\"host-1\",\"tags\":[\"upstream\",\"it_asset\"]}"));

        enricher("asset_id").apply(record);

        assertEquals(List.of("upstream", "it_asset", "critical_asset"), tags(record));
    }

    @Test
    void nonArrayTagsFieldIsLeftAlone() {
        final EventRecord record = EventRecord.of(json("{\"asset_id\":\"host-1\",\"tags\":\"legacy\"}"));

        enricher("asset_id").apply(record);

        assertEquals("legacy", record.body().get("tags").asText());
        assertTrue(record.body().has("asset"));
    }

    @Test
    void missingKeyLeavesBodyUntouchedAndSkipsLookup() {
        final ObjectNode body = json("{\"class_uid\":2004,\"device\":{\"name\":\"x\"}}");
        final ObjectNode before = body.deepCopy();
        final EventRecord record = EventRecord.of(body);

        final AssetEnricher enricher = enricher("device.uid");
        assertTrue(enricher.apply(record).isContinue());

        assertEquals(before, record.body());
        assertTrue(client.calls.isEmpty());
        assertEquals("field 'device.uid' not found", record.metadata(AssetEnricher.MARKER_KEY).orElseThrow());
        assertEquals(1, enricher.skippedTotal());
    }

    @Test
    void nonStringOrEmptyKeyIsTreatedAsMissing() {
        for (String body : List.of("{\"asset_id\":42}", "{\"asset_id\":\"\"}", "{\"asset_id\":null}", "{\"asset_id\":{\"a\":1}}")) {
            final ObjectNode node = json(body);
            final ObjectNode before = node.deepCopy();
            final EventRecord record = EventRecord.of(node);

            enricher("asset_id").apply(record);

            assertEquals(before, record.body(), body);
            assertTrue(record.metadata(AssetEnricher.MARKER_KEY).isPresent(), body);
        }
        assertTrue(client.calls.isEmpty());
    }

    @Test
    void intermediateNonObjectIsNotFound() {
        final EventRecord record = EventRecord.of(json("{\"device\":\"flat\"}"));

        enricher("device.uid").apply(record);

        assertTrue(client.calls.isEmpty());
        assertFalse(record.body().has("asset"));
    }

    @Test
    void lookupFailureMarksAndContinues() {
        client.fail("host-9", new LookupException("timed out after 1000ms"));
        final ObjectNode body = json("{\"asset_id\":\"host-9\",\"class_uid\":2004}");
        final ObjectNode before = body.deepCopy();
        final EventRecord record = EventRecord.of(body);

        final AssetEnricher enricher = enricher("asset_id");
        final Outcome outcome = enricher.apply(record);

        assertTrue(outcome.isContinue());
        assertEquals(before, record.body());
        assertEquals("timed out after 1000ms", record.metadata(AssetEnricher.MARKER_KEY).orElseThrow());
        assertEquals(1, enricher.failedTotal());
        assertEquals(0, enricher.enrichedTotal());
    }

    @Test
    void emptyPathIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> enricher(".."));
    }
}
