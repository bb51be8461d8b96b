/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.buffer;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.oictarget.core.BatchEnvelope;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-stream record accumulator with a size-or-age flush trigger.
 *
 * <p>The message loop calls {@link #add} while the flush ticker and shutdown call {@link #drain};
 * both hold the same lock, so a racing record lands in exactly one batch.
 */
public final class StreamBuffer {

    private final String stream;
    private final int batchSize;
    private final Duration maxBatchAge;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private List<JsonNode> records;
    private Instant lastFlush;
    private long sequence;

    public StreamBuffer(String stream, int batchSize, Duration maxBatchAge, Clock clock) {
        this.stream = Objects.requireNonNull(stream, "stream");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        this.batchSize = batchSize;
        this.maxBatchAge = Objects.requireNonNull(maxBatchAge, "maxBatchAge");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.records = new ArrayList<>(batchSize);
        this.lastFlush = clock.instant();
    }

    public String stream() {
        return stream;
    }

    public void add(JsonNode record) {
        Objects.requireNonNull(record, "record");
        lock.lock();
        try {
            records.add(record);
        } finally {
            lock.unlock();
        }
    }

    public boolean shouldFlush() {
        lock.lock();
        try {
            return isDue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands every buffered record to the caller and resets the age clock.
     *
     * @return the drained batch, empty if nothing was buffered
     */
    public Optional<BatchEnvelope> drain() {
        lock.lock();
        try {
            return drainLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Check-and-drain in one step, for the periodic ticker.
     */
    public Optional<BatchEnvelope> drainIfDue() {
        lock.lock();
        try {
            return isDue() ? drainLocked() : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    private boolean isDue() {
        int count = records.size();
        if (count >= batchSize) return true;
        if (count == 0) return false;
        return !clock.instant().isBefore(lastFlush.plus(maxBatchAge));
    }

    private Optional<BatchEnvelope> drainLocked() {
        final Instant now = clock.instant();
        lastFlush = now;
        if (records.isEmpty()) return Optional.empty();

        List<JsonNode> captured = records;
        records = new ArrayList<>(batchSize);
        return Optional.of(BatchEnvelope.of(stream, ++sequence, captured, now));
    }
}
