/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.spi;

import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import com.intuitivedesigns.nodekernel.dataset.AsyncDataset;

import java.util.Map;

/**
 * SPI Definition for non-blocking dataset backends. Kept apart from {@link DatasetPlugin} so a
 * backend id can resolve to a different implementation in each hierarchy.
 */
public interface AsyncDatasetPlugin extends ServicePlugin {

    String id();

    @Override
    default PluginKind kind() {
        return PluginKind.ASYNC_DATASET;
    }

    AsyncDataset<?> create(String name, String target, Map<String, Object> params, PipelineConfig config);
}
