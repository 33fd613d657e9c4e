/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import java.util.Objects;

/**
 * Terminal state of one record's chain traversal.
 *
 * @param status what happened
 * @param record the record, mutated in place by every unit that ran
 * @param unit   name of the unit that dropped or failed the record; {@code null} when forwarded
 * @param reason drop reason or failure message; {@code null} when forwarded
 * @param error  failure cause; {@code null} unless FAILED
 */
public record ChainResult(Status status, EventRecord record, String unit, String reason, Throwable error) {

    public enum Status { FORWARDED, DROPPED, FAILED }

    public ChainResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(record, "record");
    }

    public static ChainResult forwarded(EventRecord record) {
        return new ChainResult(Status.FORWARDED, record, null, null, null);
    }

    public static ChainResult dropped(EventRecord record, String unit, String reason) {
        return new ChainResult(Status.DROPPED, record, unit, reason, null);
    }

    public static ChainResult failed(EventRecord record, String unit, Throwable error) {
        return new ChainResult(Status.FAILED, record, unit, String.valueOf(error.getMessage()), error);
    }

    public boolean isForwarded() {
        return status == Status.FORWARDED;
    }
}
