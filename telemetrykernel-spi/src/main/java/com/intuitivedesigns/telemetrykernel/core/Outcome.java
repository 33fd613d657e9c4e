/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import java.util.Objects;

/**
 * What a {@link TransformUnit} decided for one record.
 *
 * <ul>
 * <li>{@link Kind#CONTINUE}: the (possibly mutated) record goes to the next unit.</li>
 * <li>{@link Kind#DROP}: traversal stops and the record is discarded silently.</li>
 * <li>{@link Kind#FAIL}: traversal stops and the error is handed to the chain caller.</li>
 * </ul>
 */
public final class Outcome {

    public enum Kind { CONTINUE, DROP, FAIL }

    private static final Outcome CONTINUE = new Outcome(Kind.CONTINUE, null, null);

    private final Kind kind;
    private final String reason;
    private final Throwable error;

    private Outcome(Kind kind, String reason, Throwable error) {
        this.kind = kind;
        this.reason = reason;
        this.error = error;
    }

    public static Outcome proceed() {
        return CONTINUE;
    }

    public static Outcome drop(String reason) {
        return new Outcome(Kind.DROP, Objects.requireNonNull(reason, "reason"), null);
    }

    public static Outcome fail(Throwable error) {
        Objects.requireNonNull(error, "error");
        return new Outcome(Kind.FAIL, String.valueOf(error.getMessage()), error);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isContinue() {
        return kind == Kind.CONTINUE;
    }

    /** Drop reason or failure message; {@code null} for CONTINUE. */
    public String reason() {
        return reason;
    }

    /** The failure cause; {@code null} unless FAIL. */
    public Throwable error() {
        return error;
    }

    @Override
    public String toString() {
        return kind == Kind.CONTINUE ? "CONTINUE" : kind + "(" + reason + ")";
    }
}
