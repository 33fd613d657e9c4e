/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import java.util.Locale;

/**
 * What the orchestrator does with a record the chain failed.
 */
public enum FailurePolicy {

    /** Annotate with the failing unit and error, then write to the dead-letter sink. */
    DEAD_LETTER,

    /** Log at WARN and discard. */
    LOG_AND_DROP;

    public static FailurePolicy parse(String raw) {
        if (raw == null || raw.isBlank()) return DEAD_LETTER;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown failure policy '" + raw + "'. Options: DEAD_LETTER, LOG_AND_DROP", e);
        }
    }
}
