/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins.transform;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.core.FieldLookup;
import com.intuitivedesigns.telemetrykernel.core.FieldPath;
import com.intuitivedesigns.telemetrykernel.core.Outcome;
import com.intuitivedesigns.telemetrykernel.core.TransformUnit;
import com.intuitivedesigns.telemetrykernel.lookup.LookupClient;
import com.intuitivedesigns.telemetrykernel.lookup.LookupException;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * Shared flow of the asset and user enrichers: read one key from the body, look it up,
 * attach the result under a fixed output field.
 *
 * <p>Never fails a record on account of the key or the lookup. A missing key, a key of the
 * wrong type or a failed lookup leaves the body as it was and writes {@link #markerKey()}
 * into the metadata sidecar.</p>
 */
public abstract class KeyedLookupEnricher implements TransformUnit {

    private static final Logger log = LoggerFactory.getLogger(KeyedLookupEnricher.class);

    private final String name;
    private final String endpoint;
    private final FieldPath idPath;
    private final Duration timeout;
    private final LookupClient lookupClient;
    private final MetricsRuntime metrics;

    private final LongAdder enriched = new LongAdder();
    private final LongAdder skipped = new LongAdder();
    private final LongAdder failed = new LongAdder();

    protected KeyedLookupEnricher(String name,
                                  String endpoint,
                                  FieldPath idPath,
                                  Duration timeout,
                                  LookupClient lookupClient,
                                  MetricsRuntime metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.idPath = Objects.requireNonNull(idPath, "idPath");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.lookupClient = Objects.requireNonNull(lookupClient, "lookupClient");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (idPath.isEmpty()) {
            throw new IllegalArgumentException(name + ": id field path is empty");
        }
    }

    /** Body field the fetched object is written to. */
    protected abstract String outputField();

    /** Metadata key for the error marker. */
    protected abstract String markerKey();

    /**
     * Hook run after the fetched object has been attached.
     */
    protected void afterEnrich(ObjectNode body, ObjectNode fetched) {
        // nothing by default
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Outcome apply(EventRecord record) {
        final ObjectNode body = record.body();

        final FieldLookup<String> key = idPath.resolve(body).flatMap(FieldLookup::ofText);
        if (!key.isPresent()) {
            skip(record, key.describe(idPath.toString()));
            return Outcome.proceed();
        }
        final String id = key.get();
        if (id.isEmpty()) {
            skip(record, "field '" + idPath + "' is empty");
            return Outcome.proceed();
        }

        final ObjectNode fetched;
        try {
            fetched = lookupClient.fetch(endpoint, id, timeout);
        } catch (LookupException e) {
            failed.increment();
            metrics.counter("enrich.lookup.failed", 1.0, "unit", name);
            log.warn("{} lookup failed for {}: {}", name, id, e.getMessage());
            record.putMetadata(markerKey(), e.getMessage());
            return Outcome.proceed();
        }

        body.set(outputField(), fetched);
        afterEnrich(body, fetched);

        enriched.increment();
        metrics.counter("enrich.enriched", 1.0, "unit", name);
        return Outcome.proceed();
    }

    private void skip(EventRecord record, String reason) {
        skipped.increment();
        metrics.counter("enrich.skipped", 1.0, "unit", name);
        log.debug("{} skipped record {}: {}", name, record.id(), reason);
        record.putMetadata(markerKey(), reason);
    }

    public String endpoint() {
        return endpoint;
    }

    public FieldPath idPath() {
        return idPath;
    }

    public Duration timeout() {
        return timeout;
    }

    public long enrichedTotal() {
        return enriched.sum();
    }

    public long skippedTotal() {
        return skipped.sum();
    }

    public long failedTotal() {
        return failed.sum();
    }
}
