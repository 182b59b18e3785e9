/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.kafka;

import com.intuitivedesigns.nodekernel.config.ConfigurationException;
import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import com.intuitivedesigns.nodekernel.dataset.Dataset;
import com.intuitivedesigns.nodekernel.spi.DatasetPlugin;
import com.intuitivedesigns.nodekernel.spi.PluginCatalog;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KafkaDatasetPluginTest {

    private final KafkaDatasetPlugin plugin = new KafkaDatasetPlugin();

    @Test
    void registeredUnderKafkaId() {
        DatasetPlugin found = PluginCatalog.load().datasets().require("kafka", "type");
        assertInstanceOf(KafkaDatasetPlugin.class, found);
    }

    @Test
    void targetIsTheBootstrapServerList() {
        Dataset<?> ds = plugin.create("prices", "broker-1:9092", Map.of(), PipelineConfig.empty());
        assertEquals(KafkaDataset.KIND, ds.kind());
        assertTrue(ds.connectionRequired());
        assertTrue(ds.describe().contains("broker-1:9092"));
    }

    @Test
    void blankTargetFallsBackToPipelineConfig() {
        PipelineConfig config = PipelineConfig.of(Map.of(KafkaDatasetPlugin.KEY_BOOTSTRAP_SERVERS, "cfg:9092"));
        Dataset<?> ds = plugin.create("prices", "", Map.of(), config);
        assertTrue(ds.describe().contains("cfg:9092"));
    }

    @Test
    void missingServersIsAConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> plugin.create("prices", " ", Map.of(), PipelineConfig.empty()));
    }
}
