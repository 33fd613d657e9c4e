/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.lookup;

import java.util.OptionalInt;

/**
 * A lookup errored, timed out, or returned a malformed or empty body.
 * Enrichment units record it as a metadata marker and never escalate it.
 */
public class LookupException extends Exception {

    private final int statusCode;

    public LookupException(String message) {
        this(message, -1, null);
    }

    public LookupException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public LookupException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status when the service answered with an error status. */
    public OptionalInt statusCode() {
        return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
