/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of reading one field out of a semi-structured event body.
 *
 * <p>Unlike {@link JsonNode#asText()} and friends, a lookup never invents a zero value.
 * It is exactly one of:</p>
 * <ul>
 * <li>{@link Status#PRESENT}: the field exists and has the requested type.</li>
 * <li>{@link Status#ABSENT}: a path segment is missing or an intermediate value is not an object.</li>
 * <li>{@link Status#TYPE_MISMATCH}: the field exists but holds a different JSON type (including {@code null}).</li>
 * </ul>
 *
 * @param <T> the typed value carried when present
 */
public final class FieldLookup<T> {

    public enum Status { PRESENT, ABSENT, TYPE_MISMATCH }

    private static final FieldLookup<?> ABSENT = new FieldLookup<>(Status.ABSENT, null, null);

    private final Status status;
    private final T value;
    private final JsonNodeType actualType;

    private FieldLookup(Status status, T value, JsonNodeType actualType) {
        this.status = status;
        this.value = value;
        this.actualType = actualType;
    }

    public static <T> FieldLookup<T> present(T value) {
        return new FieldLookup<>(Status.PRESENT, Objects.requireNonNull(value, "value"), null);
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldLookup<T> absent() {
        return (FieldLookup<T>) ABSENT;
    }

    public static <T> FieldLookup<T> mismatch(JsonNodeType actualType) {
        return new FieldLookup<>(Status.TYPE_MISMATCH, null, Objects.requireNonNull(actualType, "actualType"));
    }

    // --- Typed views over a single node (null node == absent) ---

    public static FieldLookup<String> ofText(JsonNode node) {
        if (node == null || node.isMissingNode()) return absent();
        return node.isTextual() ? present(node.textValue()) : mismatch(node.getNodeType());
    }

    /**
     * Integral view. Floating values with no fractional part are accepted because
     * some producers serialise every number as a double ({@code 2004.0}).
     */
    public static FieldLookup<Long> ofIntegral(JsonNode node) {
        if (node == null || node.isMissingNode()) return absent();
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return present(node.longValue());
        }
        if (node.isFloatingPointNumber()) {
            final double d = node.doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d)) {
                return present((long) d);
            }
        }
        return mismatch(node.getNodeType());
    }

    public static FieldLookup<ObjectNode> ofObject(JsonNode node) {
        if (node == null || node.isMissingNode()) return absent();
        return node.isObject() ? present((ObjectNode) node) : mismatch(node.getNodeType());
    }

    public static FieldLookup<ArrayNode> ofArray(JsonNode node) {
        if (node == null || node.isMissingNode()) return absent();
        return node.isArray() ? present((ArrayNode) node) : mismatch(node.getNodeType());
    }

    // --- Accessors ---

    public Status status() {
        return status;
    }

    public boolean isPresent() {
        return status == Status.PRESENT;
    }

    public boolean isAbsent() {
        return status == Status.ABSENT;
    }

    public boolean isTypeMismatch() {
        return status == Status.TYPE_MISMATCH;
    }

    public T get() {
        if (status != Status.PRESENT) {
            throw new NoSuchElementException("No value: " + status);
        }
        return value;
    }

    public T orElse(T fallback) {
        return (status == Status.PRESENT) ? value : fallback;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public Optional<JsonNodeType> actualType() {
        return Optional.ofNullable(actualType);
    }

    @SuppressWarnings("unchecked")
    public <R> FieldLookup<R> flatMap(Function<? super T, FieldLookup<R>> next) {
        if (status != Status.PRESENT) return (FieldLookup<R>) this;
        return next.apply(value);
    }

    /**
     * Human readable reason for a non-present lookup, used in error markers.
     */
    public String describe(String path) {
        return switch (status) {
            case PRESENT -> "field '" + path + "' present";
            case ABSENT -> "field '" + path + "' not found";
            case TYPE_MISMATCH -> "field '" + path + "' has unexpected type " + actualType;
        };
    }

    @Override
    public String toString() {
        return switch (status) {
            case PRESENT -> "PRESENT(" + value + ")";
            case ABSENT -> "ABSENT";
            case TYPE_MISMATCH -> "TYPE_MISMATCH(" + actualType + ")";
        };
    }
}
