/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.sources.http;

/**
 * More events in one submission than the configured maximum. Nothing was enqueued.
 */
public final class BatchTooLargeException extends IngestionException {

    private final int count;
    private final int maxBatchSize;

    public BatchTooLargeException(int count, int maxBatchSize) {
        super("Batch size exceeds maximum of " + maxBatchSize, 413);
        this.count = count;
        this.maxBatchSize = maxBatchSize;
    }

    public int count() {
        return count;
    }

    public int maxBatchSize() {
        return maxBatchSize;
    }
}
