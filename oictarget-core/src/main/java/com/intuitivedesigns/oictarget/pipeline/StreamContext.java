/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.pipeline;

import com.intuitivedesigns.oictarget.buffer.StreamBuffer;
import com.intuitivedesigns.oictarget.transform.CompiledSchema;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable per-stream state owned by {@link PipelineOrchestrator}.
 *
 * <p>{@code lock} orders drains against lane appends so batches reach the sink in drain order.
 */
final class StreamContext {

    final String stream;
    final StreamBuffer buffer;
    final ReentrantLock lock = new ReentrantLock();

    /** Records accepted into the buffer. */
    final AtomicLong accepted = new AtomicLong();
    /** Records in batches the sink confirmed. */
    final AtomicLong delivered = new AtomicLong();

    volatile CompiledSchema schema;
    volatile StreamState state = StreamState.SCHEMA_RECEIVED;

    // Guarded by lock
    CompletableFuture<Void> lane = CompletableFuture.completedFuture(null);

    StreamContext(String stream, CompiledSchema schema, StreamBuffer buffer) {
        this.stream = stream;
        this.schema = schema;
        this.buffer = buffer;
    }

    long undelivered() {
        return Math.max(0L, accepted.get() - delivered.get());
    }

    CompletableFuture<Void> lane() {
        lock.lock();
        try {
            return lane;
        } finally {
            lock.unlock();
        }
    }
}
