/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pluggable pull source of event records for the chain workers.
 */
public interface EventSource extends AutoCloseable {

    void connect() throws Exception;

    /**
     * Stops accepting new events and releases resources.
     * Implementations should give consumers a bounded chance to drain what is already buffered.
     */
    void disconnect();

    /**
     * Blocks until an event is available, the timeout elapses ({@code EMPTY}),
     * or the calling thread is interrupted ({@code CANCELLED}, interrupt flag restored).
     */
    PollResult poll(Duration timeout);

    /**
     * Waits for the first event, then takes up to {@code maxBatchSize - 1} more without blocking.
     */
    default List<EventRecord> pollBatch(int maxBatchSize, Duration timeout) {
        if (maxBatchSize <= 0) return Collections.emptyList();

        PollResult first = poll(timeout);
        if (!first.hasEvent()) return Collections.emptyList();

        List<EventRecord> batch = new ArrayList<>(maxBatchSize);
        batch.add(first.record());

        for (int i = 1; i < maxBatchSize; i++) {
            PollResult next = poll(Duration.ZERO);
            if (!next.hasEvent()) break;
            batch.add(next.record());
        }
        return batch;
    }

    @Override
    default void close() {
        disconnect();
    }
}
