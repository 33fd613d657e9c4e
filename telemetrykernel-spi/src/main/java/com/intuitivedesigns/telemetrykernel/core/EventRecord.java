/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * The in-flight representation of one security event.
 *
 * <p>Holds the mutable JSON body plus a metadata sidecar (string key/value annotations
 * that travel with the event but are not part of its body, like message headers).</p>
 *
 * <p><b>Threading:</b> a record is not thread-safe. It has exactly one owner at a time
 * (gateway, then one chain worker, then the sink) and is handed over through a
 * {@link java.util.concurrent.BlockingQueue}, which provides the happens-before edge.</p>
 */
public final class EventRecord {

    public static final String FIELD_METADATA_UID = "metadata.uid";
    private static final FieldPath UID_PATH = FieldPath.parse(FIELD_METADATA_UID);

    private final String id;
    private final Instant timestamp;
    private final Map<String, String> metadata;

    // Exactly one of body / formatError is set
    private final ObjectNode body;
    private final String formatError;

    private EventRecord(String id, Instant timestamp, ObjectNode body, String formatError, Map<String, String> metadata) {
        this.id = id;
        this.timestamp = timestamp;
        this.body = body;
        this.formatError = formatError;
        this.metadata = new LinkedHashMap<>(metadata);
    }

    // -----------------------------------------------------------------------
    // FACTORY METHODS
    // -----------------------------------------------------------------------

    public static EventRecord of(ObjectNode body) {
        return of(body, Map.of());
    }

    public static EventRecord of(ObjectNode body, Map<String, String> metadata) {
        Objects.requireNonNull(body, "body");
        return new EventRecord(deriveId(body), Instant.now(), body, null, metadata);
    }

    /**
     * Builds a record from raw bytes handed over by a transport.
     * <p>
     * This is the entry point for sources that pass payloads through without
     * validating them, such as a message-queue consumer. The HTTP gateway
     * validates each request up front and uses {@link #of(ObjectNode)} instead.
     * Bytes that do not decode to a JSON object still produce a record;
     * {@link #body()} then throws {@link RecordFormatException}, and the chain
     * records a failure for that record alone.
     */
    public static EventRecord fromBytes(byte[] raw) {
        Objects.requireNonNull(raw, "raw");

        final JsonNode node;
        try {
            node = JsonSupport.parse(raw);
        } catch (JsonProcessingException e) {
            return new EventRecord(UUID.randomUUID().toString(), Instant.now(), null,
                    "invalid json: " + e.getOriginalMessage(), Map.of());
        } catch (IOException e) {
            return new EventRecord(UUID.randomUUID().toString(), Instant.now(), null,
                    "invalid json: " + e.getMessage(), Map.of());
        }

        if (node == null || !node.isObject()) {
            final String kind = (node == null || node.isMissingNode()) ? "empty input" : node.getNodeType().toString();
            return new EventRecord(UUID.randomUUID().toString(), Instant.now(), null,
                    "event is not a JSON object: " + kind, Map.of());
        }
        return of((ObjectNode) node);
    }

    private static String deriveId(ObjectNode body) {
        return UID_PATH.resolve(body)
                .flatMap(FieldLookup::ofText)
                .toOptional()
                .filter(s -> !s.isEmpty())
                .orElseGet(() -> UUID.randomUUID().toString());
    }

    // -----------------------------------------------------------------------
    // BODY
    // -----------------------------------------------------------------------

    /**
     * @return the live, mutable body
     * @throws RecordFormatException if the record was built from bytes that are not a JSON object
     */
    public ObjectNode body() {
        if (body == null) {
            throw new RecordFormatException(formatError);
        }
        return body;
    }

    public boolean isWellFormed() {
        return body != null;
    }

    public FieldLookup<JsonNode> field(String path) {
        return FieldPath.parse(path).resolve(body());
    }

    public FieldLookup<JsonNode> field(FieldPath path) {
        return path.resolve(body());
    }

    public FieldLookup<String> text(String path) {
        return field(path).flatMap(FieldLookup::ofText);
    }

    public FieldLookup<String> text(FieldPath path) {
        return field(path).flatMap(FieldLookup::ofText);
    }

    public FieldLookup<Long> integral(String path) {
        return field(path).flatMap(FieldLookup::ofIntegral);
    }

    public FieldLookup<ObjectNode> object(String path) {
        return field(path).flatMap(FieldLookup::ofObject);
    }

    public FieldLookup<ArrayNode> array(String path) {
        return field(path).flatMap(FieldLookup::ofArray);
    }

    public byte[] toJsonBytes() {
        return JsonSupport.toBytes(body());
    }

    // -----------------------------------------------------------------------
    // METADATA SIDECAR
    // -----------------------------------------------------------------------

    public Map<String, String> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Optional<String> metadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    /** Writes overwrite; insertion order of first write is kept. */
    public EventRecord putMetadata(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        metadata.put(key, value);
        return this;
    }

    // -----------------------------------------------------------------------
    // PROVENANCE
    // -----------------------------------------------------------------------

    /** {@code metadata.uid} when the body carries one, otherwise a generated UUID. */
    public String id() {
        return id;
    }

    /** When this record object was created. */
    public Instant timestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "EventRecord{id='" + id + "', wellFormed=" + isWellFormed() + ", metadata=" + metadata + '}';
    }
}
