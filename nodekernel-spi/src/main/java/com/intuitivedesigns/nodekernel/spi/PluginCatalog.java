/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.spi;

import java.util.Collection;
import java.util.List;

/**
 * The central registry for all loaded plugins.
 * Holds typed registries for blocking and non-blocking dataset backends.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<DatasetPlugin> datasets;
    private final ServicePluginRegistry<AsyncDatasetPlugin> asyncDatasets;

    public PluginCatalog(ClassLoader cl) {
        this.datasets = new ServicePluginRegistry<>(DatasetPlugin.class, cl);
        this.asyncDatasets = new ServicePluginRegistry<>(AsyncDatasetPlugin.class, cl);
    }

    public PluginCatalog(ServicePluginRegistry<DatasetPlugin> datasets,
                         ServicePluginRegistry<AsyncDatasetPlugin> asyncDatasets) {
        this.datasets = datasets;
        this.asyncDatasets = asyncDatasets;
    }

    /**
     * Classpath scan using the context class loader, falling back to this class's loader.
     */
    public static PluginCatalog load() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return new PluginCatalog((ctx != null) ? ctx : PluginCatalog.class.getClassLoader());
    }

    public static PluginCatalog of(Collection<? extends DatasetPlugin> datasets) {
        return of(datasets, List.of());
    }

    public static PluginCatalog of(Collection<? extends DatasetPlugin> datasets,
                                   Collection<? extends AsyncDatasetPlugin> asyncDatasets) {
        return new PluginCatalog(
                ServicePluginRegistry.of(DatasetPlugin.class, datasets),
                ServicePluginRegistry.of(AsyncDatasetPlugin.class, asyncDatasets));
    }

    public ServicePluginRegistry<DatasetPlugin> datasets() {
        return datasets;
    }

    public ServicePluginRegistry<AsyncDatasetPlugin> asyncDatasets() {
        return asyncDatasets;
    }
}
