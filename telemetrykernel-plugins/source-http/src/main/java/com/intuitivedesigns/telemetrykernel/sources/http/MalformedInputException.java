/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.sources.http;

/**
 * The body is not a JSON object or an array of JSON objects. Nothing was enqueued.
 */
public final class MalformedInputException extends IngestionException {

    private final String detail;

    public MalformedInputException(String detail) {
        this(detail, null);
    }

    public MalformedInputException(String detail, Throwable cause) {
        super("Invalid JSON", 400, cause);
        this.detail = detail;
    }

    /** What exactly was wrong, for logs. */
    public String detail() {
        return detail;
    }
}
