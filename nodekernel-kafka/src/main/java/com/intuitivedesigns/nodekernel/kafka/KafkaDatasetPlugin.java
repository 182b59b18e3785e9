/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.kafka;

import com.intuitivedesigns.nodekernel.config.ConfigurationException;
import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import com.intuitivedesigns.nodekernel.dataset.Dataset;
import com.intuitivedesigns.nodekernel.spi.DatasetPlugin;

import java.util.Map;
import java.util.Objects;

/**
 * Kafka topic dataset.
 * <p>
 * ID: KAFKA. {@code target} is the bootstrap server list; when blank it falls back to
 * {@code kafka.bootstrap.servers} in the pipeline config.
 */
public final class KafkaDatasetPlugin implements DatasetPlugin {

    public static final String ID = "KAFKA";
    static final String KEY_BOOTSTRAP_SERVERS = "kafka.bootstrap.servers";

    private final KafkaClients clients;

    public KafkaDatasetPlugin() {
        this(KafkaClients.defaults());
    }

    public KafkaDatasetPlugin(KafkaClients clients) {
        this.clients = Objects.requireNonNull(clients, "clients");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Dataset<?> create(String name, String target, Map<String, Object> params, PipelineConfig config) {
        Objects.requireNonNull(config, "config");
        String servers = (target == null || target.isBlank())
                ? config.getString(KEY_BOOTSTRAP_SERVERS, null)
                : target.trim();
        if (servers == null || servers.isBlank()) {
            throw new ConfigurationException("Kafka dataset '" + name + "' has no target and '"
                    + KEY_BOOTSTRAP_SERVERS + "' is not set");
        }
        return new KafkaDataset(name, servers, params, config, clients);
    }
}
