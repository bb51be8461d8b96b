/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.buffer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.intuitivedesigns.oictarget.core.BatchEnvelope;
import com.intuitivedesigns.oictarget.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class StreamBufferTest {

    private final MutableClock clock = MutableClock.atEpoch();

    @Test
    void testSizeTriggerFlushesExactlyOnce() {
        StreamBuffer buffer = new StreamBuffer("users", 5, Duration.ofSeconds(10), clock);

        for (int i = 0; i < 5; i++) buffer.add(IntNode.valueOf(i));

        assertTrue(buffer.shouldFlush());
        Optional<BatchEnvelope> batch = buffer.drainIfDue();
        assertTrue(batch.isPresent());
        assertEquals(5, batch.get().size());
        assertFalse(buffer.shouldFlush());
        assertTrue(buffer.drainIfDue().isEmpty());
    }

    @Test
    void testBelowBatchSizeWaitsForMaxAge() {
        StreamBuffer buffer = new StreamBuffer("users", 5, Duration.ofSeconds(10), clock);

        for (int i = 0; i < 4; i++) buffer.add(IntNode.valueOf(i));
        assertFalse(buffer.shouldFlush());

        clock.advance(Duration.ofSeconds(9));
        assertFalse(buffer.shouldFlush());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(buffer.shouldFlush());
        assertEquals(4, buffer.drainIfDue().orElseThrow().size());
    }

    @Test
    void testEmptyBufferNeverDue() {
        StreamBuffer buffer = new StreamBuffer("users", 5, Duration.ofSeconds(1), clock);
        clock.advance(Duration.ofHours(1));

        assertFalse(buffer.shouldFlush());
        assertTrue(buffer.drain().isEmpty());
    }

    @Test
    void testDrainHandsOffRecordsAndResetsAge() {
        StreamBuffer buffer = new StreamBuffer("users", 10, Duration.ofSeconds(10), clock);
        buffer.add(IntNode.valueOf(1));
        buffer.add(IntNode.valueOf(2));
        clock.advance(Duration.ofSeconds(10));

        BatchEnvelope first = buffer.drain().orElseThrow();
        buffer.add(IntNode.valueOf(3));

        assertEquals(List.of(IntNode.valueOf(1), IntNode.valueOf(2)), first.records());
        assertEquals(1, first.sequence());
        assertEquals("users", first.stream());
        assertEquals(1, buffer.size());
        assertFalse(buffer.shouldFlush());

        BatchEnvelope second = buffer.drain().orElseThrow();
        assertEquals(2, second.sequence());
        assertNotEquals(first.batchId(), second.batchId());
    }

    @Test
    void testConcurrentAddAndDrainNeitherLoseNorDuplicate() throws Exception {
        StreamBuffer buffer = new StreamBuffer("events", 1000, Duration.ofSeconds(10), clock);
        ConcurrentLinkedQueue<BatchEnvelope> drained = new ConcurrentLinkedQueue<>();
        AtomicBoolean done = new AtomicBoolean();
        CountDownLatch drainerStopped = new CountDownLatch(1);
        int total = 20_000;

        Thread drainer = new Thread(() -> {
            while (!done.get()) buffer.drain().ifPresent(drained::add);
            drainerStopped.countDown();
        });
        drainer.start();

        for (int i = 0; i < total; i++) buffer.add(IntNode.valueOf(i));
        done.set(true);
        drainerStopped.await();
        buffer.drain().ifPresent(drained::add);

        Set<Integer> seen = new HashSet<>();
        int count = 0;
        for (BatchEnvelope b : drained) {
            for (JsonNode n : b.records()) {
                assertTrue(seen.add(n.intValue()), "duplicate " + n);
                count++;
            }
        }
        assertEquals(total, count);
    }
}
