/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

/**
 * Destination for records that left the chain.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #write(EventRecord)} takes ownership of the record, body and metadata sidecar.</li>
 * <li>Throw if the record cannot be written; the orchestrator routes it to the dead-letter sink.</li>
 * <li>Implementations must be thread-safe: every chain worker writes to the same instance.</li>
 * </ul>
 */
public interface EventSink extends AutoCloseable {

    void write(EventRecord record) throws Exception;

    default void flush() throws Exception {
        // no-op by default
    }

    /**
     * Identifier for logging and metrics tagging.
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {
        flush();
    }
}
