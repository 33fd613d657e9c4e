/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dotted path into a JSON object, e.g. {@code device.uid}.
 *
 * <p>Empty segments are ignored, so {@code "a..b"} and {@code ".a.b"} both address {@code a -> b}.
 * A path with no segments never resolves.</p>
 */
public final class FieldPath {

    private final String expression;
    private final List<String> segments;

    private FieldPath(String expression, List<String> segments) {
        this.expression = expression;
        this.segments = segments;
    }

    public static FieldPath parse(String expression) {
        Objects.requireNonNull(expression, "expression");

        final List<String> parts = new ArrayList<>(4);
        int start = 0;
        final int len = expression.length();
        for (int i = 0; i <= len; i++) {
            if (i == len || expression.charAt(i) == '.') {
                if (i > start) parts.add(expression.substring(start, i));
                start = i + 1;
            }
        }
        return new FieldPath(expression, Collections.unmodifiableList(parts));
    }

    /**
     * Descends one object level per segment.
     * Returns ABSENT when a segment is missing or an intermediate value is not an object.
     * The leaf may be any node type, including JSON null.
     */
    public FieldLookup<JsonNode> resolve(JsonNode root) {
        if (segments.isEmpty() || root == null) return FieldLookup.absent();

        JsonNode current = root;
        for (String segment : segments) {
            if (!current.isObject()) return FieldLookup.absent();
            current = current.get(segment);
            if (current == null) return FieldLookup.absent();
        }
        return FieldLookup.present(current);
    }

    public List<String> segments() {
        return segments;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPath other)) return false;
        return segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
