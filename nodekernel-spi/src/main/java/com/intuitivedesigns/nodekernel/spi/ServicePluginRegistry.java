/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.nodekernel.spi;

import com.intuitivedesigns.nodekernel.config.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Id-keyed registry of plugins for one SPI.
 *
 * <p><b>Performance Note:</b> The ServiceLoader classpath scan runs <b>once</b>, when the
 * registry is built, and the result is frozen. Subsequent lookups are O(1).</p>
 *
 * @param <T> The SPI interface type (e.g., DatasetPlugin.class)
 */
public final class ServicePluginRegistry<T extends ServicePlugin> {

    private final Class<T> spiType;
    private final Map<String, T> byId;

    public ServicePluginRegistry(Class<T> spiType) {
        // Use the thread's context classloader (standard for frameworks)
        this(spiType, Thread.currentThread().getContextClassLoader());
    }

    public ServicePluginRegistry(Class<T> spiType, ClassLoader cl) {
        this(spiType, ServiceLoader.load(spiType, cl));
    }

    private ServicePluginRegistry(Class<T> spiType, Iterable<T> plugins) {
        this.spiType = Objects.requireNonNull(spiType, "spiType");
        Map<String, T> tmp = new LinkedHashMap<>();
        for (T plugin : plugins) {
            String id = plugin.normalizedId();
            if (id.isEmpty()) {
                throw new IllegalStateException("Plugin id() must not be blank for " + plugin.getClass().getName());
            }
            if (tmp.containsKey(id)) {
                throw new IllegalStateException("Duplicate plugin ID '" + id + "' for SPI " + spiType.getSimpleName() + ". Conflict between: " + tmp.get(id).getClass().getName() + " and " + plugin.getClass().getName());
            }
            tmp.put(id, plugin);
        }
        this.byId = Collections.unmodifiableMap(tmp);
    }

    /**
     * Builds a registry from an explicit plugin list instead of a classpath scan.
     */
    public static <T extends ServicePlugin> ServicePluginRegistry<T> of(Class<T> spiType, Collection<? extends T> plugins) {
        Objects.requireNonNull(plugins, "plugins");
        List<T> copy = new ArrayList<>(plugins);
        return new ServicePluginRegistry<>(spiType, copy);
    }

    /**
     * @throws ConfigurationException if no plugin is registered under {@code id}
     */
    public T require(String id, String configKeyName) {
        String key = ServicePlugin.normalizeId(id);
        T plugin = byId.get(key);
        if (plugin == null) {
            throw new ConfigurationException("No " + spiType.getSimpleName() + " found for '" + configKeyName + "=" + id + "'. " + "Available options: " + byId.keySet());
        }
        return plugin;
    }

    public Set<String> availableIds() {
        return byId.keySet();
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(ServicePlugin.normalizeId(id)));
    }
}
