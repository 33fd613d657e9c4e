/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.sources.http;

/**
 * The request body is larger than {@code ingest.http.max.body.bytes}. It was not decoded.
 */
public final class RequestTooLargeException extends IngestionException {

    public RequestTooLargeException(long maxBodyBytes) {
        super("Request body exceeds maximum of " + maxBodyBytes + " bytes", 413);
    }
}
