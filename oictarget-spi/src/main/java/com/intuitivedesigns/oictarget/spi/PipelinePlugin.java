/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.spi;

import com.intuitivedesigns.oictarget.config.TargetSettings;
import com.intuitivedesigns.oictarget.metrics.MetricsRuntime;

/**
 * Base contract for everything discovered through {@link java.util.ServiceLoader}.
 *
 * @param <T> the component type the plugin builds
 */
public interface PipelinePlugin<T> {

    String id();

    T create(TargetSettings settings, MetricsRuntime metrics) throws Exception;
}
