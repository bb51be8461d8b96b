/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * The unit submitted to OIC: one stream, an ordered run of transformed records.
 *
 * <ul>
 * <li>Immutability: records are copied into an unmodifiable list at construction.</li>
 * <li>Idempotency: {@code batchId} is fixed for the life of the envelope, so every retry carries the same id.</li>
 * <li>Ordering: {@code sequence} increases by one per drained batch of the same stream.</li>
 * </ul>
 *
 * @param batchId   unique id, reused across retries
 * @param stream    Singer stream name
 * @param sequence  per-stream drain counter, starting at 1
 * @param records   transformed records in arrival order
 * @param createdAt drain time
 */
public record BatchEnvelope(
        String batchId,
        String stream,
        long sequence,
        List<JsonNode> records,
        Instant createdAt
) {

    public BatchEnvelope {
        Objects.requireNonNull(batchId, "BatchEnvelope batchId cannot be null");
        Objects.requireNonNull(stream, "BatchEnvelope stream cannot be null");
        if (sequence <= 0) throw new IllegalArgumentException("sequence must be > 0");
        records = (records == null) ? List.of() : List.copyOf(records);
        if (createdAt == null) createdAt = Instant.now();
    }

    public static BatchEnvelope of(String stream, long sequence, List<JsonNode> records, Instant createdAt) {
        return new BatchEnvelope(UUID.randomUUID().toString(), stream, sequence, records, createdAt);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
