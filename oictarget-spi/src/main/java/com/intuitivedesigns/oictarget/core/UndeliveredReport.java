/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.core;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-stream count of records that were accepted but never confirmed delivered.
 * Printed for operators on every fatal exit so they know what to reconcile.
 */
public final class UndeliveredReport {

    private static final UndeliveredReport EMPTY = new UndeliveredReport(Map.of());

    private final Map<String, Long> byStream;

    private UndeliveredReport(Map<String, Long> byStream) {
        this.byStream = byStream;
    }

    public static UndeliveredReport empty() {
        return EMPTY;
    }

    public static UndeliveredReport of(Map<String, Long> counts) {
        if (counts == null || counts.isEmpty()) return EMPTY;
        TreeMap<String, Long> sorted = new TreeMap<>();
        counts.forEach((stream, n) -> {
            if (stream != null && n != null && n > 0) sorted.put(stream, n);
        });
        return sorted.isEmpty() ? EMPTY : new UndeliveredReport(Collections.unmodifiableMap(sorted));
    }

    public Map<String, Long> byStream() {
        return byStream;
    }

    public long count(String stream) {
        return byStream.getOrDefault(stream, 0L);
    }

    public long total() {
        long sum = 0;
        for (long n : byStream.values()) sum += n;
        return sum;
    }

    public boolean isEmpty() {
        return byStream.isEmpty();
    }

    @Override
    public String toString() {
        if (byStream.isEmpty()) return "none";
        StringBuilder sb = new StringBuilder();
        byStream.forEach((s, n) -> {
            if (sb.length() > 0) sb.append(", ");
            sb.append(s).append('=').append(n);
        });
        return sb.toString();
    }
}
