/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.metrics;

import java.util.Locale;
import java.util.Set;

/**
 * Selected when metrics are switched off: {@code metrics.provider} set to NOOP, NONE or left blank.
 */
public final class NoopMetricsProvider implements MetricsProvider {

    private static final Set<String> DISABLED_IDS = Set.of("NOOP", "NONE", "");

    @Override
    public String id() {
        return "NOOP";
    }

    @Override
    public boolean matches(String configuredId) {
        return configuredId == null || DISABLED_IDS.contains(configuredId.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        return (s == null || matches(s.providerId)) ? MetricsFactory.noop() : null;
    }
}
