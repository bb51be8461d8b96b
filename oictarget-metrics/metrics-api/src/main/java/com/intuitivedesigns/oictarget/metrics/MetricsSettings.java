/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.metrics;

import com.intuitivedesigns.oictarget.config.TargetConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for Metrics Runtime.
 */
public final class MetricsSettings {

    // ---- Config keys ----
    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_STEP_SECONDS = "metrics.step.seconds";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PROM_PORT = "metrics.prometheus.port";

    // ---- Defaults ----
    private static final String DEFAULT_PROVIDER = "NONE";
    private static final int DEFAULT_STEP_SECONDS = 10;
    private static final int DEFAULT_PROM_PORT = 9090;

    // ---- Public Immutable Fields ----
    public final String providerId;
    public final Map<String, String> commonTags;
    public final Duration step;
    public final int prometheusPort;

    private MetricsSettings(String providerId, Map<String, String> commonTags, Duration step, int prometheusPort) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.step = step;
        this.prometheusPort = prometheusPort;
    }

    public static MetricsSettings from(TargetConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));
        final int stepSec = clampInt(config.getInt(KEY_STEP_SECONDS, DEFAULT_STEP_SECONDS), 1, 3_600);

        // metrics.tag.<name>=<value> becomes a common tag on every meter
        final Map<String, String> tags = new HashMap<>();
        for (Map.Entry<String, Object> entry : config.asMap().entrySet()) {
            final String k = entry.getKey();
            if (k == null || !k.startsWith(KEY_TAG_PREFIX)) continue;

            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            final String valStr = (entry.getValue() == null) ? "" : String.valueOf(entry.getValue()).trim();
            if (tagKey.isEmpty() || valStr.isEmpty()) continue;

            tags.put(tagKey, valStr);
        }

        final int promPort = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 0, 65_535);

        return new MetricsSettings(provider, Collections.unmodifiableMap(tags), Duration.ofSeconds(stepSec), promPort);
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", step=" + step +
                ", prometheusPort=" + prometheusPort +
                '}';
    }

    private static String normalizeUpper(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t.toUpperCase(Locale.ROOT);
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
