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
import com.intuitivedesigns.telemetrykernel.core.Outcome;
import com.intuitivedesigns.telemetrykernel.core.TransformUnit;
import com.intuitivedesigns.telemetrykernel.lookup.LookupClient;
import com.intuitivedesigns.telemetrykernel.lookup.LookupException;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

/**
 * Looks up each eligible observable by its {@code name} and attaches the verdict to that
 * observable as {@code threat_intel}. Sibling observables and their order are untouched.
 *
 * <p>A failed lookup is logged, noted under {@link #MARKER_KEY} and skipped; the next
 * observable is still processed. The unit always continues.</p>
 */
public final class ThreatIntelEnricher implements TransformUnit {

    private static final Logger log = LoggerFactory.getLogger(ThreatIntelEnricher.class);

    public static final String OBSERVABLES_FIELD = "observables";
    public static final String OUTPUT_FIELD = "threat_intel";
    public static final String MARKER_KEY = "threat_intel_error";

    private final String name;
    private final String endpoint;
    private final Duration timeout;
    private final Set<Long> eligibleTypeIds;
    private final LookupClient lookupClient;
    private final MetricsRuntime metrics;

    private final LongAdder lookups = new LongAdder();
    private final LongAdder enriched = new LongAdder();
    private final LongAdder failed = new LongAdder();

    public ThreatIntelEnricher(String name,
                               String endpoint,
                               Duration timeout,
                               Set<Long> eligibleTypeIds,
                               LookupClient lookupClient,
                               MetricsRuntime metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.eligibleTypeIds = Set.copyOf(eligibleTypeIds);
        this.lookupClient = Objects.requireNonNull(lookupClient, "lookupClient");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Outcome apply(EventRecord record) {
        final int count = enrich(record);
        if (count > 0) {
            log.debug("{} enriched {} observables on record {}", name, count, record.id());
        }
        return Outcome.proceed();
    }

    /**
     * Enriches the record's observables in place.
     *
     * @return how many observables gained a {@code threat_intel} field
     */
    public int enrich(EventRecord record) {
        final FieldLookup<ArrayNode> observables = FieldLookup.ofArray(record.body().get(OBSERVABLES_FIELD));
        if (!observables.isPresent() || observables.get().isEmpty()) {
            return 0;
        }

        int count = 0;
        final ArrayNode items = observables.get();
        for (int i = 0; i < items.size(); i++) {
            final JsonNode item = items.get(i);
            if (!item.isObject()) {
                log.debug("{}: observable #{} is not an object, skipping", name, i);
                continue;
            }
            final ObjectNode observable = (ObjectNode) item;

            final FieldLookup<Long> typeId = FieldLookup.ofIntegral(observable.get("type_id"));
            if (!typeId.isPresent() || !eligibleTypeIds.contains(typeId.get())) {
                continue;
            }

            final String indicator = FieldLookup.ofText(observable.get("name")).orElse("");
            if (indicator.isEmpty()) {
                continue;
            }

            lookups.increment();
            try {
                final ObjectNode verdict = lookupClient.fetch(endpoint, indicator, timeout);
                observable.set(OUTPUT_FIELD, verdict);
                count++;
            } catch (LookupException e) {
                failed.increment();
                metrics.counter("enrich.lookup.failed", 1.0, "unit", name);
                log.warn("{} lookup failed for {}: {}", name, indicator, e.getMessage());
                record.putMetadata(MARKER_KEY, indicator + ": " + e.getMessage());
            }
        }

        if (count > 0) {
            enriched.add(count);
            metrics.counter("enrich.observables.enriched", count, "unit", name);
        }
        return count;
    }

    public Set<Long> eligibleTypeIds() {
        return eligibleTypeIds;
    }

    public long lookupsTotal() {
        return lookups.sum();
    }

    public long enrichedTotal() {
        return enriched.sum();
    }

    public long failedTotal() {
        return failed.sum();
    }
}
