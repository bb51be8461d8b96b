/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private static final MetricsRuntime NOOP = new NoopMetricsRuntime();

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");

        final ServiceLoader<MetricsProvider> loader = ServiceLoader.load(MetricsProvider.class, resolveClassLoader());

        for (MetricsProvider p : loader) {
            try {
                // Providers return null when metrics.provider names someone else
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics Runtime initialized: {} ({})", p.id(), p.getClass().getName());
                    return rt;
                }
            } catch (Throwable t) {
                // Throwable: a provider with missing dependencies fails with LinkageError
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), t.getMessage());
                log.debug("Provider init stack trace:", t);
            }
        }

        log.info("Metrics disabled or no suitable provider found for '{}' (NOOP active).", settings.providerId);
        return NOOP;
    }

    /**
     * Shared no-op runtime for components created without metrics.
     */
    public static MetricsRuntime noop() {
        return NOOP;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }

    private static final class NoopMetricsRuntime implements MetricsRuntime {
        // Sentinel instead of null so "instanceof" checks downstream stay NPE-free
        private final Object sentinelRegistry = new Object();

        @Override
        public Object registry() {
            return sentinelRegistry;
        }
    }
}
