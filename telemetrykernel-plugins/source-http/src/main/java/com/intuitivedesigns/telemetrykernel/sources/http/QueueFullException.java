/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.sources.http;

/**
 * The buffer ran out of capacity part way through a submission.
 * The first {@link #accepted()} events stay enqueued; the rest were refused.
 */
public final class QueueFullException extends IngestionException {

    private final int accepted;
    private final int requested;

    public QueueFullException(int accepted, int requested) {
        super("Event queue full, try again later", 503);
        this.accepted = accepted;
        this.requested = requested;
    }

    public int accepted() {
        return accepted;
    }

    public int requested() {
        return requested;
    }
}
