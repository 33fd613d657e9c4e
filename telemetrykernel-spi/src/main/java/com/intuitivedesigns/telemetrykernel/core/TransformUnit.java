/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

/**
 * One step of the processor chain.
 *
 * Capabilities:
 * - Enrichment: mutate the record body in place (call lookups from {@link #apply}).
 * - Tagging: write metadata sidecar entries.
 * - Filtering: return {@link Outcome#drop(String)}.
 * - Failure: return {@link Outcome#fail(Throwable)} or throw.
 *
 * <p><b>Threading Contract:</b> a unit instance is shared by all chain workers, so
 * {@link #apply} may run concurrently for different records. It is never invoked
 * concurrently for the same record. Units holding state guard it themselves.</p>
 */
public interface TransformUnit extends AutoCloseable {

    /**
     * Stable name used in logs, metrics tags and failure annotations.
     */
    String name();

    /**
     * Called once before the first record.
     */
    default void init() throws Exception {
        // no-op by default
    }

    /**
     * Processes one record.
     *
     * <p>Throwing is equivalent to returning {@code Outcome.fail(e)}; the chain converts it.</p>
     *
     * @param record the record, exclusively owned by the caller for the duration of the call
     * @return the decision for this record, never {@code null}
     */
    Outcome apply(EventRecord record) throws Exception;

    @Override
    default void close() throws Exception {
        // no-op by default
    }
}
