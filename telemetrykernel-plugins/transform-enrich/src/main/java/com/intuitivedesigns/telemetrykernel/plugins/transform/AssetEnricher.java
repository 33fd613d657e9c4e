/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrykernel.core.FieldLookup;
import com.intuitivedesigns.telemetrykernel.core.FieldPath;
import com.intuitivedesigns.telemetrykernel.lookup.LookupClient;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Attaches the inventory record for the event's asset id under {@code asset}, then appends
 * contextual tags to the body's {@code tags} array.
 *
 * <p>Tags come from the event classifiers and from the fetched asset:</p>
 * <ul>
 * <li>detection findings (class 2004): {@code ocsf_detection_finding}, plus
 *     {@code high_severity} (severity 4+), {@code critical_severity} (severity 5),
 *     {@code has_finding_title}</li>
 * <li>process activity (class 1007): {@code ocsf_process_activity}, {@code edr_event}</li>
 * <li>{@code has_observables} for a non-empty observables array</li>
 * <li>{@code it_asset} when the asset owner is IT, {@code critical_asset} for high criticality</li>
 * </ul>
 */
public final class AssetEnricher extends KeyedLookupEnricher {

    public static final String OUTPUT_FIELD = "asset";
    public static final String MARKER_KEY = "asset_enrich_error";
    public static final String TAGS_FIELD = "tags";

    static final long CLASS_DETECTION_FINDING = 2004L;
    static final long CLASS_PROCESS_ACTIVITY = 1007L;

    private static final FieldPath CLASS_UID = FieldPath.parse("class_uid");
    private static final FieldPath SEVERITY_ID = FieldPath.parse("severity_id");
    private static final FieldPath FINDING_TITLE = FieldPath.parse("finding.title");
    private static final FieldPath OBSERVABLES = FieldPath.parse("observables");

    public AssetEnricher(String name,
                         String endpoint,
                         FieldPath idPath,
                         Duration timeout,
                         LookupClient lookupClient,
                         MetricsRuntime metrics) {
        super(name, endpoint, idPath, timeout, lookupClient, metrics);
    }

    @Override
    protected String outputField() {
        return OUTPUT_FIELD;
    }

    @Override
    protected String markerKey() {
        return MARKER_KEY;
    }

    @Override
    protected void afterEnrich(ObjectNode body, ObjectNode fetched) {
        final JsonNode existing = body.get(TAGS_FIELD);
        if (existing != null && !existing.isArray()) {
            // someone else's tags field; leave it alone
            return;
        }

        final List<String> derived = deriveTags(body, fetched);
        if (derived.isEmpty() && existing == null) return;

        final ArrayNode tags = (existing == null) ? body.putArray(TAGS_FIELD) : (ArrayNode) existing;
        final Set<String> present = new LinkedHashSet<>();
        for (JsonNode t : tags) {
            if (t.isTextual()) present.add(t.textValue());
        }
        for (String tag : derived) {
            if (present.add(tag)) tags.add(tag);
        }
    }

    /**
     * Tags implied by the event and the fetched asset, in a fixed order.
     */
    static List<String> deriveTags(ObjectNode body, ObjectNode asset) {
        final List<String> out = new ArrayList<>(8);

        final FieldLookup<Long> classUid = CLASS_UID.resolve(body).flatMap(FieldLookup::ofIntegral);
        final FieldLookup<Long> severity = SEVERITY_ID.resolve(body).flatMap(FieldLookup::ofIntegral);

        if (classUid.isPresent() && classUid.get() == CLASS_DETECTION_FINDING) {
            out.add("ocsf_detection_finding");
            if (severity.isPresent()) {
                if (severity.get() >= 4) out.add("high_severity");
                if (severity.get() == 5) out.add("critical_severity");
            }
            final String title = FINDING_TITLE.resolve(body).flatMap(FieldLookup::ofText).orElse("");
            if (!title.isEmpty()) out.add("has_finding_title");
        }

        if (classUid.isPresent() && classUid.get() == CLASS_PROCESS_ACTIVITY) {
            out.add("ocsf_process_activity");
            out.add("edr_event");
        }

        final FieldLookup<ArrayNode> observables = OBSERVABLES.resolve(body).flatMap(FieldLookup::ofArray);
        if (observables.isPresent() && !observables.get().isEmpty()) {
            out.add("has_observables");
        }

        if ("IT".equals(FieldLookup.ofText(asset.get("owner")).orElse(null))) {
            out.add("it_asset");
        }
        if ("high".equals(FieldLookup.ofText(asset.get("criticality")).orElse(null))) {
            out.add("critical_asset");
        }
        return out;
    }
}
