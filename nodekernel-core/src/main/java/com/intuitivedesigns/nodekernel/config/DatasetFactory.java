/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.config;

import com.intuitivedesigns.nodekernel.dataset.AsyncDataset;
import com.intuitivedesigns.nodekernel.dataset.Dataset;
import com.intuitivedesigns.nodekernel.dataset.DatasetConfig;
import com.intuitivedesigns.nodekernel.spi.AsyncDatasetPlugin;
import com.intuitivedesigns.nodekernel.spi.DatasetPlugin;
import com.intuitivedesigns.nodekernel.spi.PluginCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Builds dataset handles from configuration records.
 *
 * <p>The record's {@code type} is looked up in the {@link PluginCatalog}; an unregistered type
 * fails fast with a {@link ConfigurationException}. Whatever the backend's factory throws is
 * propagated unchanged.</p>
 */
public final class DatasetFactory {

    private static final Logger log = LoggerFactory.getLogger(DatasetFactory.class);

    private static final String KEY_TYPE = "type";

    private static volatile DatasetFactory defaultInstance;

    private final PluginCatalog catalog;
    private final PipelineConfig config;

    public DatasetFactory(PluginCatalog catalog, PipelineConfig config) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Factory backed by a classpath scan and the process-wide {@link PipelineConfig}.
     */
    public static DatasetFactory defaults() {
        DatasetFactory local = defaultInstance;
        if (local == null) {
            synchronized (DatasetFactory.class) {
                local = defaultInstance;
                if (local == null) {
                    local = new DatasetFactory(PluginCatalog.load(), PipelineConfig.get());
                    local.logAvailablePlugins();
                    defaultInstance = local;
                }
            }
        }
        return local;
    }

    @SuppressWarnings("unchecked")
    public Dataset<Object> fromConfig(String name, DatasetConfig datasetConfig) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(datasetConfig, "datasetConfig");

        final DatasetPlugin plugin = catalog.datasets().require(datasetConfig.type(), KEY_TYPE);
        final Dataset<?> dataset = plugin.create(name, datasetConfig.target(), datasetConfig.params(), config);
        if (dataset == null) {
            throw new ConfigurationException("Dataset plugin '" + plugin.id() + "' returned no dataset for '" + name + "'");
        }
        log.debug("Created dataset '{}' (type={}, target={})", name, plugin.id(), datasetConfig.target());
        return (Dataset<Object>) dataset;
    }

    public Dataset<Object> fromConfig(String name, Map<String, ?> rawConfig) {
        return fromConfig(name, DatasetConfig.fromMap(rawConfig));
    }

    @SuppressWarnings("unchecked")
    public AsyncDataset<Object> asyncFromConfig(String name, DatasetConfig datasetConfig) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(datasetConfig, "datasetConfig");

        final AsyncDatasetPlugin plugin = catalog.asyncDatasets().require(datasetConfig.type(), KEY_TYPE);
        final AsyncDataset<?> dataset = plugin.create(name, datasetConfig.target(), datasetConfig.params(), config);
        if (dataset == null) {
            throw new ConfigurationException("Async dataset plugin '" + plugin.id() + "' returned no dataset for '" + name + "'");
        }
        return (AsyncDataset<Object>) dataset;
    }

    public AsyncDataset<Object> asyncFromConfig(String name, Map<String, ?> rawConfig) {
        return asyncFromConfig(name, DatasetConfig.fromMap(rawConfig));
    }

    public PipelineConfig config() {
        return config;
    }

    public void logAvailablePlugins() {
        log.info("Dataset Catalog Loaded:");
        log.info("  Datasets:       {}", catalog.datasets().availableIds());
        log.info("  Async Datasets: {}", catalog.asyncDatasets().availableIds());
    }
}
