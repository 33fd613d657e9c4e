/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.core.FieldLookup;
import com.intuitivedesigns.telemetrykernel.core.FieldPath;
import com.intuitivedesigns.telemetrykernel.core.JsonSupport;
import com.intuitivedesigns.telemetrykernel.core.Outcome;
import com.intuitivedesigns.telemetrykernel.core.TransformUnit;

import java.util.List;
import java.util.Objects;

/**
 * Derives {@code tag.*} metadata from classifier fields and record shape.
 *
 * <p>Reads the body, writes only metadata. Every tag is a plain overwrite, so running
 * the unit again on the same record yields the same tags.</p>
 */
public final class PayloadTagger implements TransformUnit {

    public static final String TAG_PREFIX = "tag.";
    public static final String META_RECEIVED_AT = "http.received_at";

    private static final FieldPath EVENT_UID = FieldPath.parse("metadata.uid");

    private final String name;
    private final List<String> tagFields;
    private final boolean addTimestampTag;
    private final boolean addSourceTag;
    private final String sourceName;

    public PayloadTagger(String name,
                         List<String> tagFields,
                         boolean addTimestampTag,
                         boolean addSourceTag,
                         String sourceName) {
        this.name = Objects.requireNonNull(name, "name");
        this.tagFields = List.copyOf(tagFields);
        this.addTimestampTag = addTimestampTag;
        this.addSourceTag = addSourceTag;
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Outcome apply(EventRecord record) {
        final ObjectNode body = record.body();

        if (addSourceTag) {
            record.putMetadata(TAG_PREFIX + "source", sourceName);
        }
        if (addTimestampTag) {
            record.metadata(META_RECEIVED_AT).ifPresent(at -> record.putMetadata(TAG_PREFIX + "ingested_at", at));
        }

        for (String field : tagFields) {
            final JsonNode value = body.get(field);
            if (value == null) continue;

            record.putMetadata(TAG_PREFIX + field, render(value));
            addSemanticTags(record, field, value);
        }

        addShapeTags(record, body);
        return Outcome.proceed();
    }

    private static void addSemanticTags(EventRecord record, String field, JsonNode value) {
        final FieldLookup<Long> code = FieldLookup.ofIntegral(value);
        if (!code.isPresent()) return;

        switch (field) {
            case "class_uid" -> OcsfLabels.forClass(code.get()).ifPresent(label -> {
                record.putMetadata(TAG_PREFIX + "category", label.category());
                if (label.type() != null) record.putMetadata(TAG_PREFIX + "type", label.type());
            });
            case "severity_id" -> OcsfLabels.forSeverity(code.get()).ifPresent(label -> {
                record.putMetadata(TAG_PREFIX + "severity", label.severity());
                record.putMetadata(TAG_PREFIX + "priority", label.priority());
            });
            case "category_uid" -> OcsfLabels.forCategory(code.get())
                    .ifPresent(domain -> record.putMetadata(TAG_PREFIX + "domain", domain));
            default -> {
                // raw tag only
            }
        }
    }

    private static void addShapeTags(EventRecord record, ObjectNode body) {
        final FieldLookup<ArrayNode> observables = FieldLookup.ofArray(body.get("observables"));
        if (observables.isPresent() && !observables.get().isEmpty()) {
            record.putMetadata(TAG_PREFIX + "has_observables", "true");
            record.putMetadata(TAG_PREFIX + "observable_count", Integer.toString(observables.get().size()));

            for (JsonNode obs : observables.get()) {
                if (obs.isObject() && obs.has("threat_intel")) {
                    record.putMetadata(TAG_PREFIX + "has_threat_intel", "true");
                    record.putMetadata(TAG_PREFIX + "threat_detected", "true");
                    break;
                }
            }
        }

        if (body.has("asset")) {
            record.putMetadata(TAG_PREFIX + "enriched", "asset");
        }

        final FieldLookup<Long> status = FieldLookup.ofIntegral(body.get("status_id"));
        if (status.isPresent()) {
            record.putMetadata(TAG_PREFIX + "status", status.get() == 1L ? "success" : "failure");
        }

        EVENT_UID.resolve(body).flatMap(FieldLookup::ofText).toOptional()
                .ifPresent(uid -> record.putMetadata(TAG_PREFIX + "event_id", uid));
    }

    /**
     * Strings verbatim, whole numbers without a fraction, everything else as compact JSON.
     */
    static String render(JsonNode value) {
        if (value.isTextual()) return value.textValue();
        if (value.isNumber()) {
            final FieldLookup<Long> whole = FieldLookup.ofIntegral(value);
            if (whole.isPresent()) return Long.toString(whole.get());
        }
        return JsonSupport.toCompactString(value);
    }

    public List<String> tagFields() {
        return tagFields;
    }
}
