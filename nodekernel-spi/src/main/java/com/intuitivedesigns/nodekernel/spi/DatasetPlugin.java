/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.spi;

import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import com.intuitivedesigns.nodekernel.dataset.Dataset;

import java.util.Map;

/**
 * SPI Definition for blocking dataset backends.
 *
 * <p>Implementations are registered in
 * {@code META-INF/services/com.intuitivedesigns.nodekernel.spi.DatasetPlugin} and looked up by
 * {@link #id()}, which is matched case-insensitively against the {@code type} of a dataset
 * config record.</p>
 */
public interface DatasetPlugin extends ServicePlugin {

    String id(); // e.g. "KAFKA", "MEMORY"

    @Override
    default PluginKind kind() {
        return PluginKind.DATASET;
    }

    /**
     * Builds an uninitialized dataset handle. Failures propagate to the caller unchanged.
     */
    Dataset<?> create(String name, String target, Map<String, Object> params, PipelineConfig config);
}
