/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldPathTest {

    private static JsonNode json(String s) throws Exception {
        return JsonSupport.MAPPER.readTree(s);
    }

    @Test
    void parseSkipsEmptySegments() {
        assertEquals(List.of("a", "b"), FieldPath.parse("a..b").segments());
        assertEquals(List.of("a", "b"), FieldPath.parse(".a.b.").segments());
        assertTrue(FieldPath.parse("").isEmpty());
        assertTrue(FieldPath.parse("...").isEmpty());
    }

    @Test
    void resolvesNestedObjects() throws Exception {
        JsonNode root = json("{\"device\":{\"uid\":\"host-1\"}}");

        FieldLookup<String> uid = FieldPath.parse("device.uid").resolve(root).flatMap(FieldLookup::ofText);

        assertTrue(uid.isPresent());
        assertEquals("host-1", uid.get());
    }

    @Test
    void nonObjectIntermediateIsAbsent() throws Exception {
        JsonNode root = json("{\"device\":\"flat-string\"}");

        assertTrue(FieldPath.parse("device.uid").resolve(root).isAbsent());
    }

    @Test
    void missingSegmentIsAbsent() throws Exception {
        JsonNode root = json("{\"device\":{}}");

        assertTrue(FieldPath.parse("device.uid").resolve(root).isAbsent());
        assertTrue(FieldPath.parse("user.uid").resolve(root).isAbsent());
    }

    @Test
    void emptyPathNeverResolves() throws Exception {
        assertTrue(FieldPath.parse("").resolve(json("{\"a\":1}")).isAbsent());
    }

    @Test
    void textViewReportsMismatch() throws Exception {
        JsonNode root = json("{\"asset_id\":42,\"nothing\":null}");

        FieldLookup<String> number = FieldPath.parse("asset_id").resolve(root).flatMap(FieldLookup::ofText);
        assertTrue(number.isTypeMismatch());
        assertEquals(JsonNodeType.NUMBER, number.actualType().orElseThrow());
        assertEquals("field 'asset_id' has unexpected type NUMBER", number.describe("asset_id"));

        FieldLookup<String> nul = FieldPath.parse("nothing").resolve(root).flatMap(FieldLookup::ofText);
        assertTrue(nul.isTypeMismatch());
        assertEquals(JsonNodeType.NULL, nul.actualType().orElseThrow());
    }

    @Test
    void integralViewAcceptsWholeDoubles() throws Exception {
        JsonNode root = json("{\"a\":2004,\"b\":2004.0,\"c\":2004.5,\"d\":\"2004\"}");

        assertEquals(2004L, FieldLookup.ofIntegral(root.get("a")).get());
        assertEquals(2004L, FieldLookup.ofIntegral(root.get("b")).get());
        assertTrue(FieldLookup.ofIntegral(root.get("c")).isTypeMismatch());
        assertTrue(FieldLookup.ofIntegral(root.get("d")).isTypeMismatch());
        assertTrue(FieldLookup.ofIntegral(root.get("e")).isAbsent());
    }

    @Test
    void absentLookupDescribesMiss() {
        FieldLookup<String> miss = FieldLookup.absent();

        assertEquals("field 'user_id' not found", miss.describe("user_id"));
        assertEquals("fallback", miss.orElse("fallback"));
        assertTrue(miss.toOptional().isEmpty());
        assertThrows(java.util.NoSuchElementException.class, miss::get);
    }
}
