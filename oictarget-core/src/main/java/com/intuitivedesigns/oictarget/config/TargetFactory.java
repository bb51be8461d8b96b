/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.config;

import com.intuitivedesigns.oictarget.core.BatchSink;
import com.intuitivedesigns.oictarget.core.StateSink;
import com.intuitivedesigns.oictarget.error.ConfigurationException;
import com.intuitivedesigns.oictarget.error.TargetException;
import com.intuitivedesigns.oictarget.metrics.MetricsRuntime;
import com.intuitivedesigns.oictarget.pipeline.PipelineOrchestrator;
import com.intuitivedesigns.oictarget.spi.ServicePluginRegistry;
import com.intuitivedesigns.oictarget.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Wires the sink selected by {@code sink.type} into a {@link PipelineOrchestrator}.
 */
public final class TargetFactory {

    private static final Logger log = LoggerFactory.getLogger(TargetFactory.class);

    private final ServicePluginRegistry<SinkPlugin> sinks;

    public TargetFactory() {
        this(new ServicePluginRegistry<>(SinkPlugin.class));
    }

    public TargetFactory(ServicePluginRegistry<SinkPlugin> sinks) {
        this.sinks = Objects.requireNonNull(sinks, "sinks");
    }

    public BatchSink createSink(TargetSettings settings, MetricsRuntime metrics) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(metrics, "metrics");

        final SinkPlugin plugin;
        try {
            plugin = sinks.require(settings.sinkType, TargetSettings.KEY_SINK_TYPE);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        try {
            return plugin.create(settings, metrics);
        } catch (TargetException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigurationException("Failed creating sink [" + plugin.id() + "]", e);
        }
    }

    public PipelineOrchestrator createOrchestrator(TargetSettings settings, StateSink states, MetricsRuntime metrics) {
        BatchSink sink = createSink(settings, metrics);
        log.info("Target configured: {}", settings);
        return new PipelineOrchestrator(settings, sink, states, metrics, Clock.systemUTC());
    }

    public void logAvailableSinks() {
        log.info("Sinks available: {}", sinks.availableIds());
    }
}
