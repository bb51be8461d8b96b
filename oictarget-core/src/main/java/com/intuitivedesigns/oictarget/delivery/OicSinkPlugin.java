/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.delivery;

import com.intuitivedesigns.oictarget.config.TargetSettings;
import com.intuitivedesigns.oictarget.core.BatchSink;
import com.intuitivedesigns.oictarget.metrics.MetricsRuntime;
import com.intuitivedesigns.oictarget.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public final class OicSinkPlugin implements SinkPlugin {

    private static final Logger log = LoggerFactory.getLogger(OicSinkPlugin.class);

    @Override
    public String id() {
        return TargetSettings.SINK_OIC;
    }

    @Override
    public BatchSink create(TargetSettings settings, MetricsRuntime metrics) {
        Objects.requireNonNull(settings, "settings");
        log.info("Initialized OIC sink (baseUrl={}, tokenUrl={}, timeout={}s, maxRetries={})",
                settings.baseUrl, settings.tokenUrl, settings.requestTimeout.toSeconds(), settings.maxRetries);
        return OicDeliveryClient.create(settings, metrics);
    }
}
