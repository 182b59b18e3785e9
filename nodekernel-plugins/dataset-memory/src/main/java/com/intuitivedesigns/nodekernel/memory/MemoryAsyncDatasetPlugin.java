/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.memory;

import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import com.intuitivedesigns.nodekernel.dataset.AsyncDataset;
import com.intuitivedesigns.nodekernel.spi.AsyncDatasetPlugin;

import java.util.Map;

/**
 * Async twin of {@link MemoryDatasetPlugin}. ID: MEMORY.
 */
public final class MemoryAsyncDatasetPlugin implements AsyncDatasetPlugin {

    @Override
    public String id() {
        return MemoryDatasetPlugin.ID;
    }

    @Override
    public AsyncDataset<?> create(String name, String target, Map<String, Object> params, PipelineConfig config) {
        return new MemoryAsyncDataset(name, target, MemoryDatasetPlugin.maxMessages(name, params), MemoryTopicStore.shared());
    }
}
