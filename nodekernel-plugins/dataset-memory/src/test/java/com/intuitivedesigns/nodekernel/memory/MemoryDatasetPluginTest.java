/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.memory;

import com.intuitivedesigns.nodekernel.config.ConfigurationException;
import com.intuitivedesigns.nodekernel.config.DatasetFactory;
import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import com.intuitivedesigns.nodekernel.dataset.AsyncDataset;
import com.intuitivedesigns.nodekernel.dataset.Dataset;
import com.intuitivedesigns.nodekernel.dataset.DatasetConfig;
import com.intuitivedesigns.nodekernel.spi.PluginCatalog;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryDatasetPluginTest {

    private final DatasetFactory factory = new DatasetFactory(PluginCatalog.load(), PipelineConfig.empty());

    @Test
    void discoveredThroughServiceLoader() {
        Dataset<Object> ds = factory.fromConfig("quotes", new DatasetConfig("memory", "plugin_test_quotes"));
        MemoryDataset memory = assertInstanceOf(MemoryDataset.class, ds);
        assertEquals("plugin_test_quotes", memory.topicName());
        assertEquals(MemoryDataset.KIND, ds.kind());

        AsyncDataset<Object> async = factory.asyncFromConfig("quotes", new DatasetConfig("MEMORY", ""));
        assertInstanceOf(MemoryAsyncDataset.class, async);
    }

    @Test
    void rejectsInvalidBound() {
        DatasetConfig config = new DatasetConfig("memory", "t", Map.of(MemoryDatasetPlugin.PARAM_MAX_MESSAGES, "lots"));
        assertThrows(ConfigurationException.class, () -> factory.fromConfig("quotes", config));
    }
}
