/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import java.util.Objects;

/**
 * Result of a blocking {@link EventSource#poll}.
 * {@link Kind#EMPTY} means the deadline elapsed and is a normal retry signal, not an error.
 */
public final class PollResult {

    public enum Kind { EVENT, EMPTY, CANCELLED }

    private static final PollResult EMPTY = new PollResult(Kind.EMPTY, null);
    private static final PollResult CANCELLED = new PollResult(Kind.CANCELLED, null);

    private final Kind kind;
    private final EventRecord record;

    private PollResult(Kind kind, EventRecord record) {
        this.kind = kind;
        this.record = record;
    }

    public static PollResult event(EventRecord record) {
        return new PollResult(Kind.EVENT, Objects.requireNonNull(record, "record"));
    }

    public static PollResult empty() {
        return EMPTY;
    }

    public static PollResult cancelled() {
        return CANCELLED;
    }

    public Kind kind() {
        return kind;
    }

    public boolean hasEvent() {
        return kind == Kind.EVENT;
    }

    /**
     * @throws IllegalStateException unless this is an EVENT result
     */
    public EventRecord record() {
        if (kind != Kind.EVENT) {
            throw new IllegalStateException("No record in " + kind + " poll result");
        }
        return record;
    }

    @Override
    public String toString() {
        return kind == Kind.EVENT ? "EVENT(" + record.id() + ")" : kind.name();
    }
}
