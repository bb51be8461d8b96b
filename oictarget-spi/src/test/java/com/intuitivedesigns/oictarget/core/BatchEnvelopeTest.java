/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchEnvelopeTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void testImmutability() throws Exception {
        List<JsonNode> records = new ArrayList<>();
        records.add(JSON.readTree("{\"id\":\"u1\"}"));

        BatchEnvelope batch = BatchEnvelope.of("users", 1, records, Instant.EPOCH);
        records.add(JSON.readTree("{\"id\":\"u2\"}"));

        assertEquals(1, batch.size());
        assertThrows(UnsupportedOperationException.class, () -> batch.records().add(JSON.createObjectNode()));
    }

    @Test
    void testFactoryAssignsDistinctIds() {
        BatchEnvelope a = BatchEnvelope.of("users", 1, List.of(), null);
        BatchEnvelope b = BatchEnvelope.of("users", 2, List.of(), null);

        assertNotEquals(a.batchId(), b.batchId());
        assertNotNull(a.createdAt());
        assertTrue(a.isEmpty());
    }

    @Test
    void testRejectsInvalidSequence() {
        assertThrows(IllegalArgumentException.class, () -> BatchEnvelope.of("users", 0, List.of(), null));
        assertThrows(NullPointerException.class, () -> BatchEnvelope.of(null, 1, List.of(), null));
    }
}
