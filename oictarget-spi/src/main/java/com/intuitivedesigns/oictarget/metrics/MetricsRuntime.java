/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.metrics;

/**
 * The vendor-agnostic contract for target observability.
 *
 * <p>Pipeline components only see this interface, so the core runs unchanged whether metrics go to
 * Prometheus, an in-memory registry or nowhere (NOOP defaults).</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     * Returns Object to avoid forcing a compile-time dependency on Micrometer for callers.
     */
    Object registry();

    /**
     * @return true if metrics are actually being recorded.
     */
    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER", "NOOP").
     */
    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }
}
