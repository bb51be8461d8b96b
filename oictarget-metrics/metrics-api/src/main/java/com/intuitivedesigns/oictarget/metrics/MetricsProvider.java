/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.metrics;

/**
 * A metrics backend the target can report delivery counters to.
 *
 * <p>Backends ship in their own module and register themselves in
 * {@code META-INF/services/com.intuitivedesigns.oictarget.metrics.MetricsProvider}; {@link MetricsFactory}
 * asks each one in turn and keeps the first runtime returned.</p>
 */
public interface MetricsProvider {

    /** Value of {@code metrics.provider} that selects this backend. */
    String id();

    /**
     * @return the runtime, or {@code null} when {@code metrics.provider} names another backend
     */
    MetricsRuntime create(MetricsSettings settings);

    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
