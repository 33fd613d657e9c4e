/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.sources.http;

/**
 * A submission was rejected before (or while) entering the buffer.
 * The message is the plain-text body returned to the HTTP client.
 */
public abstract class IngestionException extends Exception {

    private final int httpStatus;

    protected IngestionException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    protected IngestionException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
