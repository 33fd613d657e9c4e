/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins.transform;

import com.intuitivedesigns.telemetrykernel.core.FieldPath;
import com.intuitivedesigns.telemetrykernel.lookup.LookupClient;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;

import java.time.Duration;

/**
 * Attaches the identity record for the event's user id under {@code user}.
 */
public final class UserEnricher extends KeyedLookupEnricher {

    public static final String OUTPUT_FIELD = "user";
    public static final String MARKER_KEY = "user_enrich_error";

    public UserEnricher(String name,
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
}
