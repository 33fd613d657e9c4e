/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.sources.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.telemetrykernel.core.JsonSupport;
import com.intuitivedesigns.telemetrykernel.metrics.NoopMetricsRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.OffsetDateTime;

import static org.junit.jupiter.api.Assertions.*;

class IngestHttpHandlerTest {

    private HttpIngestionGateway gateway;
    private HttpClient http;
    private String base;

    @BeforeEach
    void start() {
        final GatewaySettings settings = new GatewaySettings("127.0.0.1", 0, "/events", 3, 2, 1024,
                Duration.ofMillis(100), Duration.ZERO, 2);
        gateway = new HttpIngestionGateway(settings, NoopMetricsRuntime.INSTANCE);
        gateway.connect();
        base = "http://127.0.0.1:" + gateway.boundPort();
        http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stop() {
        gateway.disconnect();
    }

    private HttpResponse<String> post(String body) throws Exception {
        final HttpRequest req = HttpRequest.newBuilder(URI.create(base + "/events"))
                .timeout(Duration.ofSeconds(5))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void acceptedSubmissionReturns202WithCount() throws Exception {
        final HttpResponse<String> resp = post("[{\"a\":1},{\"a\":2}]");

        assertEquals(202, resp.statusCode());
        assertEquals("application/json", resp.headers().firstValue("Content-Type").orElse(""));

        final JsonNode body = JsonSupport.MAPPER.readTree(resp.body());
        assertEquals("accepted", body.get("status").asText());
        assertEquals(2, body.get("count").asInt());
        assertNotNull(OffsetDateTime.parse(body.get("received").asText()));
        assertEquals(2, gateway.depth());
    }

    @Test
    void invalidJsonReturns400() throws Exception {
        final HttpResponse<String> resp = post("{nope");
        assertEquals(400, resp.statusCode());
        assertEquals("Invalid JSON", resp.body().trim());
    }

    @Test
    void oversizedBatchReturns413() throws Exception {
        final HttpResponse<String> resp = post("[{},{},{}]");
        assertEquals(413, resp.statusCode());
        assertEquals("Batch size exceeds maximum of 2", resp.body().trim());
        assertEquals(0, gateway.depth());
    }

    @Test
    void oversizedBodyReturns413() throws Exception {
        final HttpResponse<String> resp = post("{\"pad\":\"" + "x".repeat(2048) + "\"}");
        assertEquals(413, resp.statusCode());
    }

    @Test
    void fullQueueReturns503() throws Exception {
        assertEquals(202, post("[{},{}]").statusCode());
        assertEquals(202, post("{}").statusCode());

        final HttpResponse<String> resp = post("{}");
        assertEquals(503, resp.statusCode());
        assertEquals("Event queue full, try again later", resp.body().trim());
        assertEquals(3, gateway.depth());
    }

    @Test
    void nonPostReturns405() throws Exception {
        final HttpRequest req = HttpRequest.newBuilder(URI.create(base + "/events")).GET().build();
        final HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        assertEquals(405, resp.statusCode());
        assertEquals("Method not allowed", resp.body().trim());
    }

    @Test
    void healthReportsOk() throws Exception {
        final HttpRequest req = HttpRequest.newBuilder(URI.create(base + "/health")).GET().build();
        final HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, resp.statusCode());
        assertEquals("ok", JsonSupport.MAPPER.readTree(resp.body()).get("status").asText());
    }

    @Test
    void readBodyEnforcesLimit() {
        assertThrows(RequestTooLargeException.class,
                () -> IngestHttpHandler.readBody(new ByteArrayInputStream(new byte[11]), 10));
    }

    @Test
    void readBodyReturnsEverythingUnderLimit() throws Exception {
        assertEquals(10, IngestHttpHandler.readBody(new ByteArrayInputStream(new byte[10]), 10).length);
    }
}
