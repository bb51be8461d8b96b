/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.oictarget.spi;

import java.util.*;

/**
 * Registry for SPI discovery.
 *
 * <p>The {@link ServiceLoader} scan runs once in the constructor; lookups afterwards are map reads.</p>
 *
 * @param <T> The SPI interface type (e.g., SinkPlugin.class)
 */
public final class ServicePluginRegistry<T extends PipelinePlugin<?>> {
    private final Map<String, T> byId;

    public ServicePluginRegistry(Class<T> spiType) {
        this(spiType, resolveClassLoader());
    }

    public ServicePluginRegistry(Class<T> spiType, ClassLoader cl) {
        this(spiType.getSimpleName(), ServiceLoader.load(spiType, cl));
    }

    public ServicePluginRegistry(String spiName, Iterable<? extends T> plugins) {
        Map<String, T> tmp = new LinkedHashMap<>();
        for (T plugin : plugins) {
            String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException("Plugin id() must not be blank for " + plugin.getClass().getName());
            }
            if (tmp.containsKey(id)) {
                throw new IllegalStateException("Duplicate plugin ID '" + id + "' for SPI " + spiName + ". Conflict between: " + tmp.get(id).getClass().getName() + " and " + plugin.getClass().getName());
            }
            tmp.put(id, plugin);
        }
        this.byId = Collections.unmodifiableMap(tmp);
    }

    public T require(String id, String configKeyName) {
        String key = PluginIds.normalize(id);
        T plugin = byId.get(key);
        if (plugin == null) {
            throw new IllegalArgumentException("No plugin found for '" + configKeyName + "=" + id + "'. " + "Available options: " + byId.keySet());
        }
        return plugin;
    }

    public Set<String> availableIds() {
        return byId.keySet();
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : ServicePluginRegistry.class.getClassLoader();
    }
}
