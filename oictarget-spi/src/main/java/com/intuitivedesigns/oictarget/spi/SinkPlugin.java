/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.spi;

import com.intuitivedesigns.oictarget.config.TargetSettings;
import com.intuitivedesigns.oictarget.core.BatchSink;
import com.intuitivedesigns.oictarget.metrics.MetricsRuntime;

/**
 * SPI Definition for batch destinations, selected by {@code sink.type}.
 */
public interface SinkPlugin extends PipelinePlugin<BatchSink> {

    @Override
    String id(); // e.g. "OIC", "DRY_RUN"

    @Override
    BatchSink create(TargetSettings settings, MetricsRuntime metrics) throws Exception;
}
