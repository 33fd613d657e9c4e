/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.sources.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrykernel.core.JsonSupport;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Maps HTTP requests on the events path onto {@link HttpIngestionGateway#submit(byte[])}.
 *
 * <ul>
 * <li>202 with {@code {"status":"accepted","count":N,"received":"<RFC3339>"}} on success</li>
 * <li>400 / 413 / 503 with a plain-text reason from the {@link IngestionException}</li>
 * <li>405 for anything but POST</li>
 * </ul>
 */
final class IngestHttpHandler implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(IngestHttpHandler.class);

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    private static final String APPLICATION_JSON = "application/json";

    private final HttpIngestionGateway gateway;
    private final long maxBodyBytes;

    IngestHttpHandler(HttpIngestionGateway gateway, long maxBodyBytes) {
        this.gateway = gateway;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "POST");
                sendText(exchange, 405, "Method not allowed");
                return;
            }

            try {
                final byte[] body = readBody(exchange.getRequestBody(), maxBodyBytes);
                final SubmissionResult result = gateway.submit(body);

                final ObjectNode response = JsonSupport.MAPPER.createObjectNode();
                response.put("status", "accepted");
                response.put("count", result.accepted());
                response.put("received", HttpIngestionGateway.formatRfc3339(result.received()));
                sendJson(exchange, 202, response);

            } catch (QueueFullException e) {
                log.warn("Rejected submission from {}: queue full after {}/{} events",
                        exchange.getRemoteAddress(), e.accepted(), e.requested());
                sendText(exchange, e.httpStatus(), e.getMessage());
            } catch (MalformedInputException e) {
                log.debug("Rejected malformed submission from {}: {}", exchange.getRemoteAddress(), e.detail());
                sendText(exchange, e.httpStatus(), e.getMessage());
            } catch (IngestionException e) {
                log.debug("Rejected submission from {}: {}", exchange.getRemoteAddress(), e.getMessage());
                sendText(exchange, e.httpStatus(), e.getMessage());
            }
        } finally {
            exchange.close();
        }
    }

    /**
     * Reads the whole request body, refusing anything larger than {@code limit} bytes.
     */
    static byte[] readBody(InputStream in, long limit) throws IOException, RequestTooLargeException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream(8192);
        final byte[] chunk = new byte[8192];
        long total = 0;
        int n;
        while ((n = in.read(chunk)) != -1) {
            total += n;
            if (total > limit) {
                throw new RequestTooLargeException(limit);
            }
            out.write(chunk, 0, n);
        }
        return out.toByteArray();
    }

    static void sendText(HttpExchange exchange, int status, String message) throws IOException {
        final byte[] bytes = (message + "\n").getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set(CONTENT_TYPE, TEXT_PLAIN);
        send(exchange, status, bytes);
    }

    static void sendJson(HttpExchange exchange, int status, ObjectNode body) throws IOException {
        exchange.getResponseHeaders().set(CONTENT_TYPE, APPLICATION_JSON);
        send(exchange, status, JsonSupport.toBytes(body));
    }

    private static void send(HttpExchange exchange, int status, byte[] bytes) throws IOException {
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    /** Liveness check: always {@code {"status":"ok"}}. */
    static final class Health implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                final ObjectNode body = JsonSupport.MAPPER.createObjectNode();
                body.put("status", "ok");
                sendJson(exchange, 200, body);
            } finally {
                exchange.close();
            }
        }
    }
}
