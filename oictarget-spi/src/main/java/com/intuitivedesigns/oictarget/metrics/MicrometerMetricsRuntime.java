/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics bridge for Micrometer.
 *
 * Features:
 * - Composite Registry (an in-memory registry plus whatever backend a provider adds)
 * - Stateful "Push" Gauges (maps generic gauge calls to atomic state holders)
 * - Optional close hook for provider-owned resources (e.g. the Prometheus scrape server)
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;
    private final String type;
    private final AutoCloseable onClose;

    // Micrometer gauges are pull-based; keep the last pushed value here
    private final Map<String, AtomicDouble> gaugeState = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this("MICROMETER", null);
    }

    public MicrometerMetricsRuntime(String type, AutoCloseable onClose) {
        this.registry = new CompositeMeterRegistry();
        this.registry.add(new SimpleMeterRegistry());
        this.type = (type == null || type.isBlank()) ? "MICROMETER" : type;
        this.onClose = onClose;
    }

    /**
     * Adds a backend registry (e.g., Prometheus) to the composite.
     */
    public MicrometerMetricsRuntime addRegistry(MeterRegistry specificRegistry) {
        this.registry.add(specificRegistry);
        return this;
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(Math.max(0L, durationMillis), TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        AtomicDouble state = gaugeState.computeIfAbsent(name, key -> {
            AtomicDouble newState = new AtomicDouble(value);
            Gauge.builder(key, newState, AtomicDouble::get).register(registry);
            return newState;
        });
        state.set(value);
    }

    /**
     * Current value of a counter, 0 if it was never incremented.
     */
    public double count(String name) {
        var c = registry.find(name).counter();
        return (c == null) ? 0.0 : c.count();
    }

    /**
     * Last value pushed to a gauge, NaN if it was never set.
     */
    public double gaugeValue(String name) {
        var g = registry.find(name).gauge();
        return (g == null) ? Double.NaN : g.value();
    }

    @Override
    public void close() {
        if (onClose != null) {
            try {
                onClose.close();
            } catch (Exception e) {
                log.warn("Metrics backend close failed: {}", e.getMessage());
            }
        }
        registry.close();
        log.info("Metrics Runtime Closed ({}).", type);
    }

    /**
     * Lightweight Mutable Double for Gauge State.
     */
    private static final class AtomicDouble extends Number {
        private final AtomicLong bits;

        AtomicDouble(double initialValue) {
            this.bits = new AtomicLong(Double.doubleToLongBits(initialValue));
        }

        void set(double newValue) {
            bits.set(Double.doubleToLongBits(newValue));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }

        @Override public int intValue() { return (int) get(); }
        @Override public long longValue() { return (long) get(); }
        @Override public float floatValue() { return (float) get(); }
        @Override public double doubleValue() { return get(); }
    }
}
