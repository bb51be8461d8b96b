/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tag helpers shared by the metrics backends.
 */
public final class MetricsUtil {

    /** Tag identifying this loader in a shared Prometheus or dashboard. */
    public static final String TARGET_TAG = "target";
    public static final String TARGET_NAME = "target-oracle-oic";

    private MetricsUtil() {}

    /**
     * Tags every meter with {@code target=target-oracle-oic} plus the configured {@code metrics.tag.*} entries.
     * A configured {@code target} tag replaces the default.
     */
    public static void applyCommonTags(MeterRegistry registry, MetricsSettings settings) {
        if (registry == null || settings == null) return;
        Tags tags = Tags.of(TARGET_TAG, TARGET_NAME).and(toTags(settings.commonTags));
        registry.config().commonTags(tags);
    }

    /**
     * Keys are lower-cased; entries with a blank key or value are dropped.
     */
    public static Tags toTags(Map<String, String> input) {
        if (input == null || input.isEmpty()) return Tags.empty();

        final List<Tag> out = new ArrayList<>(input.size());
        input.forEach((key, value) -> {
            if (key == null || value == null || key.isBlank() || value.isBlank()) return;
            out.add(Tag.of(key.trim().toLowerCase(Locale.ROOT), value.trim()));
        });
        return Tags.of(out);
    }
}
