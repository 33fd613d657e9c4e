/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.core.ChainOrchestrator;
import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.sources.http.HttpIngestionGateway;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryKernelTest {

    private static final String EVENT =
            "{\"class_uid\":2004,\"severity_id\":5,\"category\":\"security\","
                    + "\"observables\":[{\"name\":\"evil.exe\",\"type_id\":7}]}";

    private HttpServer lookupServer;
    private String lookupBase;
    private final List<String> lookupPaths = new CopyOnWriteArrayList<>();
    private TelemetryKernel kernel;

    @BeforeEach
    void startLookupServer() throws IOException {
        CollectingSinkPlugin.RECORDS.clear();

        lookupServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        lookupServer.createContext("/", this::route);
        lookupServer.start();
        lookupBase = "http://127.0.0.1:" + lookupServer.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        if (kernel != null) kernel.close();
        lookupServer.stop(0);
    }

    private void route(HttpExchange exchange) throws IOException {
        final String path = exchange.getRequestURI().getRawPath();
        lookupPaths.add(path);
        if (path.equals("/intel/evil.exe")) {
            respond(exchange, 200, "{\"severity\":\"high\"}");
        } else {
            respond(exchange, 404, "not found");
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private Map<String, String> baseConfig() {
        final Map<String, String> cfg = new HashMap<>();
        cfg.put("source.type", "HTTP");
        cfg.put("ingest.http.host", "127.0.0.1");
        cfg.put("ingest.http.port", "0");
        cfg.put("ingest.http.shutdown.grace.ms", "0");
        cfg.put("ingest.drain.timeout.ms", "2000");
        cfg.put("sink.type", CollectingSinkPlugin.ID);
        cfg.put("dlq.type", CollectingSinkPlugin.ID);
        cfg.put("pipeline.parallelism", "2");
        cfg.put("pipeline.poll.timeout.ms", "50");
        cfg.put("chain.units", "THREAT_INTEL_ENRICHER,ASSET_ENRICHER,USER_ENRICHER,CATEGORY_FILTER,PAYLOAD_TAGGER");
        cfg.put("unit.threat_intel_enricher.endpoint", lookupBase + "/intel");
        cfg.put("unit.asset_enricher.endpoint", lookupBase + "/assets");
        cfg.put("unit.user_enricher.endpoint", lookupBase + "/users");
        cfg.put("unit.category_filter.include", "security");
        return cfg;
    }

    private HttpResponse<String> post(HttpIngestionGateway gateway, String body) throws Exception {
        final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        final HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + gateway.boundPort() + "/events"))
                .timeout(Duration.ofSeconds(5))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void submittedEventIsEnrichedFilteredAndTagged() throws Exception {
        kernel = TelemetryKernel.assemble(PipelineConfig.fromMap(baseConfig()));
        kernel.start();

        final HttpIngestionGateway gateway = (HttpIngestionGateway) kernel.source();
        final HttpResponse<String> response = post(gateway, EVENT);
        assertEquals(202, response.statusCode());

        final EventRecord out = CollectingSinkPlugin.RECORDS.poll(5, TimeUnit.SECONDS);
        assertNotNull(out, "record should reach the sink");
        assertFalse(out.metadata().containsKey(ChainOrchestrator.META_FAILED_UNIT));

        final ObjectNode body = out.body();
        assertEquals(2004, body.get("class_uid").asInt());
        assertEquals(5, body.get("severity_id").asInt());
        assertEquals("security", body.get("category").asText());

        final JsonNode observable = body.get("observables").get(0);
        assertEquals("evil.exe", observable.get("name").asText());
        assertEquals(7, observable.get("type_id").asInt());
        assertEquals("high", observable.get("threat_intel").get("severity").asText());

        // No asset_id / user_id: no lookup, a marker instead
        assertFalse(body.has("asset"));
        assertFalse(body.has("user"));
        assertFalse(body.has("asset_enrich_error"));
        assertTrue(out.metadata("asset_enrich_error").orElseThrow().contains("asset_id"));
        assertTrue(out.metadata("user_enrich_error").orElseThrow().contains("user_id"));
        assertEquals(List.of("/intel/evil.exe"), lookupPaths);

        assertTrue(out.metadata().containsKey("tag.ingested_at"));
        assertTrue(out.metadata().containsKey(HttpIngestionGateway.META_RECEIVED_AT));
    }

    @Test
    void eventOutsideIncludeListNeverReachesTheSink() throws Exception {
        kernel = TelemetryKernel.assemble(PipelineConfig.fromMap(baseConfig()));
        kernel.start();

        final HttpIngestionGateway gateway = (HttpIngestionGateway) kernel.source();
        final String batch = "[" + EVENT.replace("\"security\"", "\"finance\"") + "," + EVENT + "]";
        assertEquals(202, post(gateway, batch).statusCode());

        final EventRecord out = CollectingSinkPlugin.RECORDS.poll(5, TimeUnit.SECONDS);
        assertNotNull(out);
        assertEquals("security", out.body().get("category").asText());

        // finance record is dropped, never dead-lettered
        assertNull(CollectingSinkPlugin.RECORDS.poll(300, TimeUnit.MILLISECONDS));
        assertEquals(0, kernel.orchestrator().deadLetteredTotal());
    }

    @Test
    void failedLookupStillForwardsWithMarker() throws Exception {
        kernel = TelemetryKernel.assemble(PipelineConfig.fromMap(baseConfig()));
        kernel.start();

        final HttpIngestionGateway gateway = (HttpIngestionGateway) kernel.source();
        final String event = "{\"category\":\"security\",\"asset_id\":\"host-9\","
                + "\"observables\":[{\"name\":\"10.0.0.1\",\"type_id\":2}]}";
        assertEquals(202, post(gateway, event).statusCode());

        final EventRecord out = CollectingSinkPlugin.RECORDS.poll(5, TimeUnit.SECONDS);
        assertNotNull(out);
        final ObjectNode body = out.body();
        assertFalse(body.has("asset"));
        assertEquals("host-9", body.get("asset_id").asText());
        assertTrue(out.metadata("asset_enrich_error").orElseThrow().contains("404"));
        assertTrue(out.metadata("threat_intel_error").orElseThrow().startsWith("10.0.0.1: "));
        assertFalse(body.get("observables").get(0).has("threat_intel"));
    }

    @Test
    void closeStopsTheGatewayAndIsIdempotent() throws Exception {
        kernel = TelemetryKernel.assemble(PipelineConfig.fromMap(baseConfig()));
        kernel.start();
        final HttpIngestionGateway gateway = (HttpIngestionGateway) kernel.source();

        kernel.close();
        kernel.close();

        assertTrue(gateway.isClosed());
        assertFalse(kernel.orchestrator().isRunning());
    }

    @Test
    void unknownUnitFailsAssembly() {
        final Map<String, String> cfg = baseConfig();
        cfg.put("chain.units", "NOPE");
        assertThrows(IllegalArgumentException.class,
                () -> TelemetryKernel.assemble(PipelineConfig.fromMap(cfg)));
    }
}
