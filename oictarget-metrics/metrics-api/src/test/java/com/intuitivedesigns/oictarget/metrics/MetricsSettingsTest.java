/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.metrics;

import com.intuitivedesigns.oictarget.config.TargetConfig;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsSettingsTest {

    @Test
    void testProviderAndTagsParsed() {
        MetricsSettings s = MetricsSettings.from(TargetConfig.of(Map.of(
                "metrics.provider", " prometheus ",
                "metrics.tag.env", "prod",
                "metrics.tag.blank", " ",
                "metrics.prometheus.port", "9464")));

        assertEquals("PROMETHEUS", s.providerId);
        assertEquals(Map.of("env", "prod"), s.commonTags);
        assertEquals(9464, s.prometheusPort);
    }

    @Test
    void testFactoryFallsBackToNoop() {
        MetricsRuntime rt = MetricsFactory.init(MetricsSettings.from(TargetConfig.of(Map.of())));

        assertFalse(rt.enabled());
        assertSame(MetricsFactory.noop(), rt);
        assertDoesNotThrow(() -> rt.counter("oic.records.received", 3));
    }

    @Test
    void testToTagsSkipsBlankEntries() {
        Tags tags = MetricsUtil.toTags(Map.of("stream", "users", "", "x"));

        assertEquals(1, tags.stream().count());
    }

    @Test
    void testCommonTagsCarryTargetName() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsSettings s = MetricsSettings.from(TargetConfig.of(Map.of("metrics.tag.Env", "prod")));

        MetricsUtil.applyCommonTags(registry, s);
        registry.counter("oic.records.received").increment();

        var counter = registry.get("oic.records.received").counter();
        assertEquals(MetricsUtil.TARGET_NAME, counter.getId().getTag(MetricsUtil.TARGET_TAG));
        assertEquals("prod", counter.getId().getTag("env"));
    }
}
