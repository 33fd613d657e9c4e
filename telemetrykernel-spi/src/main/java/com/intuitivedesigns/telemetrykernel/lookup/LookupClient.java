/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.lookup;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;

/**
 * Fetch-and-decode client for enrichment services.
 *
 * <p>One instance is built by the composition root and shared by every unit and worker,
 * so implementations must be thread-safe.</p>
 */
public interface LookupClient extends AutoCloseable {

    /**
     * Issues {@code GET <baseUrl>/<key>} and decodes the response.
     *
     * @param baseUrl service endpoint, with or without a trailing slash
     * @param key     lookup key, sent as one path segment
     * @param timeout per-call bound; the call is abandoned when it elapses
     * @return the decoded JSON object, never {@code null}
     * @throws LookupException on any transport, status, timeout or decoding failure
     */
    ObjectNode fetch(String baseUrl, String key, Duration timeout) throws LookupException;

    @Override
    default void close() {
        // no-op by default
    }
}
